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

import java.util.Locale;

/**
 * Wall clock stopwatch for logging how long pipeline stages take.
 * <pre>
 * final Timer timer = Timer.started();
 * ...
 * LOGGER.debug("took {} seconds", timer.stop());
 * </pre>
 */
public final class Timer {
    public static final long nanoSecondsPerSecond = 1000000000L;
    public static final double secondsPerNanosecond = 1.0D / nanoSecondsPerSecond;

    private long startTime;
    private long endTime;
    private boolean running = false;

    public static Timer started() {
        final Timer ret = new Timer();
        ret.start();
        return ret;
    }

    public final Timer start() {
        startTime = System.nanoTime();
        running = true;
        return this;
    }

    /**
     * Stop the timer and return the elapsed seconds formatted to the millisecond.
     */
    public final String stop() {
        endTime = System.nanoTime();
        running = false;
        return toString();
    }

    /**
     * Elapsed time between start and stop, or until now if the timer is still running.
     */
    public final long getNanos() {
        return (running ? System.nanoTime() : endTime) - startTime;
    }

    public final float getSeconds() {
        return (float)(getNanos() * secondsPerNanosecond);
    }

    @Override
    public final String toString() {
        return String.format(Locale.ROOT, "%.3f", getSeconds());
    }
}
