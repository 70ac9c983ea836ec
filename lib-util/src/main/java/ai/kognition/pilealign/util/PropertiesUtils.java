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

import java.io.BufferedInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    /**
     * Extract all of the properties whose keys start with {@code sectionName + "."}. If
     * {@code removeSectionName} is set then the section prefix is stripped from the keys.
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();
        final String prefix = sectionName + separator;

        for(final String key: props.stringPropertyNames()) {
            if(key.startsWith(prefix))
                ret.setProperty(removeSectionName ? key.substring(prefix.length()) : key, props.getProperty(key));
            else if(key.equals(sectionName) && !removeSectionName)
                ret.setProperty(key, props.getProperty(key));
        }

        return ret;
    }

    /**
     * Load the file into the given properties, overwriting existing keys.
     */
    public static Properties load(final Properties props, final String fname) throws IOException {
        try(InputStream is = new BufferedInputStream(new FileInputStream(fname));) {
            props.load(is);
        }
        LOGGER.debug("Loaded properties from {}", fname);
        return props;
    }

    /**
     * Load a classpath resource into the given properties. Returns false if the resource isn't there.
     */
    public static boolean loadResource(final Properties props, final String resource) throws IOException {
        try(InputStream is = PropertiesUtils.class.getClassLoader().getResourceAsStream(resource);) {
            if(is == null) {
                LOGGER.warn("Couldn't find the properties resource {} on the classpath", resource);
                return false;
            }
            props.load(is);
        }
        return true;
    }

    public static double getDouble(final Properties props, final String key, final double defaultValue) {
        final String val = props.getProperty(key);
        try {
            return val == null ? defaultValue : Double.parseDouble(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" must be a number but is \"" + val + "\"", nfe);
        }
    }

    public static int getInt(final Properties props, final String key, final int defaultValue) {
        final String val = props.getProperty(key);
        try {
            return val == null ? defaultValue : Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" must be an integer but is \"" + val + "\"", nfe);
        }
    }

    public static long getLong(final Properties props, final String key, final long defaultValue) {
        final String val = props.getProperty(key);
        try {
            return val == null ? defaultValue : Long.parseLong(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" must be an integer but is \"" + val + "\"", nfe);
        }
    }
}
