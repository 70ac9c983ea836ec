/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.pilealign.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * Parses a {@code main} argument list of the form:
 * </p>
 *
 * <pre>
 *     java MyClass unoptionedvalue -option1 value1 -flag -option2 value2
 * </pre>
 *
 * <p>
 * into a map of option name to value. An option that isn't followed by a value (because it's last
 * or because the next argument also starts with a '-') is a flag and maps to {@code "true"}.
 * Arguments not associated with an option are available from {@link #getNonOptionArgs()} in the
 * order they were given.
 * </p>
 */
public class CommandLineParser {
    private final Map<String, String> options = new HashMap<>();
    private final List<String> nonOptionArgs = new ArrayList<>();
    private final int totalArgCount;

    /**
     * A null argument list results in no options.
     */
    public CommandLineParser(final String[] args) {
        totalArgCount = args == null ? 0 : args.length;
        if(args != null)
            parse(args);
    }

    public int getTotalArgCount() {
        return totalArgCount;
    }

    public int getOptionCount() {
        return options.size();
    }

    public List<String> getNonOptionArgs() {
        return Collections.unmodifiableList(nonOptionArgs);
    }

    public boolean hasOption(final String name) {
        return options.containsKey(name);
    }

    /**
     * Returns the value of the option or null if it wasn't supplied.
     */
    public String getProperty(final String name) {
        return options.get(name);
    }

    public String getString(final String name, final String defaultValue) {
        final String ret = options.get(name);
        return ret == null ? defaultValue : ret;
    }

    public int getInt(final String name, final int defaultValue) {
        final String val = options.get(name);
        try {
            return val == null ? defaultValue : Integer.parseInt(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The option -" + name + " requires an integer but was given \"" + val + "\"", nfe);
        }
    }

    public long getLong(final String name, final long defaultValue) {
        final String val = options.get(name);
        try {
            return val == null ? defaultValue : Long.parseLong(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The option -" + name + " requires an integer but was given \"" + val + "\"", nfe);
        }
    }

    public double getDouble(final String name, final double defaultValue) {
        final String val = options.get(name);
        try {
            return val == null ? defaultValue : Double.parseDouble(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The option -" + name + " requires a number but was given \"" + val + "\"", nfe);
        }
    }

    private void parse(final String[] args) {
        for(int i = 0; i < args.length; i++) {
            final String cur = args[i].trim();

            if(cur.length() > 1 && cur.charAt(0) == '-') {
                final String name = cur.substring(1);
                String val = null;
                if(i + 1 < args.length && !isOption(args[i + 1]))
                    val = args[++i];

                options.put(name, val == null ? "true" : val);
            } else
                nonOptionArgs.add(cur);
        }
    }

    // a lone "-" or a negative number is a value, not an option
    private static boolean isOption(final String arg) {
        final String trimmed = arg.trim();
        if(trimmed.length() < 2 || trimmed.charAt(0) != '-')
            return false;
        final char next = trimmed.charAt(1);
        return !(Character.isDigit(next) || next == '.');
    }
}
