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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Locale;

import org.junit.Test;

public class TestTimer {

    @Test
    public void testFormatIgnoresDefaultLocale() throws Exception {
        final Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            final Timer timer = Timer.started();
            final String elapsed = timer.stop();
            assertTrue(elapsed, elapsed.matches("\\d+\\.\\d{3}"));
            assertEquals(elapsed, timer.toString());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void testStoppedTimerKeepsItsTime() throws Exception {
        final Timer timer = Timer.started();
        Thread.sleep(5);
        timer.stop();
        final long nanos = timer.getNanos();
        assertTrue(nanos >= 5_000_000L);
        Thread.sleep(5);
        assertEquals(nanos, timer.getNanos());
    }
}
