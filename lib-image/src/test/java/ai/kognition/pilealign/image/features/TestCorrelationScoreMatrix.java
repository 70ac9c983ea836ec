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

package ai.kognition.pilealign.image.features;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

public class TestCorrelationScoreMatrix {

    @Test
    public void testMaximumSkipsNaN() throws Exception {
        final CorrelationScoreMatrix matrix = new CorrelationScoreMatrix(3, 3);
        matrix.set(0, 0, Double.NaN);
        matrix.set(0, 1, 0.25);
        matrix.set(0, 2, 0.75);
        matrix.set(1, 0, 0.5);
        matrix.set(2, 0, Double.NaN);

        final Pair<Integer, Double> row = matrix.rowMaximum(0);
        assertEquals(2, row.getLeft().intValue());
        assertEquals(0.75, row.getRight(), 0.0);

        final Pair<Integer, Double> col = matrix.columnMaximum(0);
        assertEquals(1, col.getLeft().intValue());
        assertEquals(0.5, col.getRight(), 0.0);
    }

    @Test
    public void testFirstMaximumWinsTies() throws Exception {
        final CorrelationScoreMatrix matrix = new CorrelationScoreMatrix(2, 3);
        matrix.set(1, 0, 0.5);
        matrix.set(1, 1, 0.9);
        matrix.set(1, 2, 0.9);

        assertEquals(1, matrix.rowMaximum(1).getLeft().intValue());
        // unscored everywhere
        assertEquals(0, matrix.rowMaximum(0).getLeft().intValue());
        assertFalse(matrix.isScored(0, 0));
        assertTrue(matrix.isScored(1, 0));
    }

    @Test
    public void testEmpty() throws Exception {
        assertNull(new CorrelationScoreMatrix(2, 0).rowMaximum(0));
        assertNull(new CorrelationScoreMatrix(0, 2).columnMaximum(0));
    }
}
