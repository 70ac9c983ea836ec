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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestPropertiesUtils {

    @Rule public TemporaryFolder tempDir = new TemporaryFolder();

    @Test
    public void testGetSection() throws Exception {
        final Properties props = new Properties();
        props.setProperty("harris.k", "0.04");
        props.setProperty("harris.threshold", "1000");
        props.setProperty("harris", "on");
        props.setProperty("ransac.threshold", "0.001");

        final Properties stripped = PropertiesUtils.getSection(props, "harris", true);
        assertEquals(2, stripped.size());
        assertEquals("0.04", stripped.getProperty("k"));
        assertEquals("1000", stripped.getProperty("threshold"));

        final Properties kept = PropertiesUtils.getSection(props, "harris", false);
        assertEquals(3, kept.size());
        assertEquals("on", kept.getProperty("harris"));
        assertNull(kept.getProperty("ransac.threshold"));
    }

    @Test
    public void testLoadAndTypedAccess() throws Exception {
        final Properties toSave = new Properties();
        toSave.setProperty("ransac.seed", "42");
        toSave.setProperty("ransac.probability", " 0.99 ");
        toSave.setProperty("correlation.window", "9");
        toSave.setProperty("bad", "x");

        final File file = tempDir.newFile("test.properties");
        try(OutputStream os = new FileOutputStream(file);) {
            toSave.store(os, "test");
        }

        final Properties props = PropertiesUtils.load(new Properties(), file.getAbsolutePath());
        assertEquals(42L, PropertiesUtils.getLong(props, "ransac.seed", 0L));
        assertEquals(0.99, PropertiesUtils.getDouble(props, "ransac.probability", 0.0), 0.0);
        assertEquals(9, PropertiesUtils.getInt(props, "correlation.window", 0));
        assertEquals(7, PropertiesUtils.getInt(props, "missing", 7));
        assertThrows(IllegalArgumentException.class, () -> PropertiesUtils.getDouble(props, "bad", 0.0));
    }

    @Test
    public void testMissingResource() throws Exception {
        assertFalse(PropertiesUtils.loadResource(new Properties(), "does-not-exist.properties"));
    }
}
