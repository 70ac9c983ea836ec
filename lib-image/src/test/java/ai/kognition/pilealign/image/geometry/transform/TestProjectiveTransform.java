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

package ai.kognition.pilealign.image.geometry.transform;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.pilealign.image.geometry.HomogeneousPoint;
import ai.kognition.pilealign.image.geometry.Point;
import ai.kognition.pilealign.image.geometry.SimplePoint;
import ai.kognition.pilealign.nr.NumericSingularityException;

public class TestProjectiveTransform {
    private static final ProjectiveTransform PERSPECTIVE = new ProjectiveTransform(
        1.1f, 0.05f, 10.0f,
        -0.03f, 0.95f, -5.0f,
        0.0002f, 0.0001f);

    private static final ProjectiveTransform SIMILARITY = new ProjectiveTransform(
        0.8f, -0.6f, 25.0f,
        0.6f, 0.8f, 40.0f,
        0.0f, 0.0f);

    private static void assertClose(final ProjectiveTransform expected, final ProjectiveTransform actual) {
        final float[] e = expected.elements();
        final float[] a = actual.elements();
        for(int i = 0; i < 8; i++)
            assertEquals("element " + i + " of " + actual, e[i], a[i], 1e-4 * Math.max(1.0, Math.abs(e[i])));
    }

    @Test
    public void testInvertTwiceIsOriginal() throws Exception {
        assertClose(PERSPECTIVE, PERSPECTIVE.invert().invert());
        assertClose(SIMILARITY, SIMILARITY.invert().invert());
    }

    @Test
    public void testTransformThenInverseIsOriginalPoint() throws Exception {
        for(final ProjectiveTransform m: new ProjectiveTransform[] {PERSPECTIVE,SIMILARITY}) {
            final ProjectiveTransform inv = m.invert();
            for(int x = 0; x <= 300; x += 50) {
                for(int y = 0; y <= 200; y += 40) {
                    final Point p = new SimplePoint(x, y);
                    final Point back = inv.transform(m.transform(p));
                    assertEquals(x, back.x(), 1e-2);
                    assertEquals(y, back.y(), 1e-2);
                }
            }
        }
    }

    @Test
    public void testInverseTimesOriginalIsIdentity() throws Exception {
        final float[] e = PERSPECTIVE.multiply(PERSPECTIVE.invert()).elements();
        final float[] identity = ProjectiveTransform.IDENTITY.elements();
        for(int i = 0; i < 8; i++)
            assertEquals(identity[i], e[i], 1e-4);
    }

    @Test
    public void testIdentity() throws Exception {
        assertTrue(ProjectiveTransform.IDENTITY.isIdentity());
        assertTrue(ProjectiveTransform.IDENTITY.isAffine());
        assertTrue(ProjectiveTransform.IDENTITY.isInvertible());
        assertEquals(1.0f, ProjectiveTransform.IDENTITY.determinant(), 0.0f);
        assertEquals(PERSPECTIVE, PERSPECTIVE.multiply(ProjectiveTransform.IDENTITY));
        assertEquals(PERSPECTIVE, ProjectiveTransform.IDENTITY.multiply(PERSPECTIVE));
        assertFalse(PERSPECTIVE.isIdentity());
    }

    @Test
    public void testAffine() throws Exception {
        assertTrue(SIMILARITY.isAffine());
        assertFalse(PERSPECTIVE.isAffine());
        assertEquals(25.0f, SIMILARITY.offsetX(), 0.0f);
        assertEquals(40.0f, SIMILARITY.offsetY(), 0.0f);
    }

    @Test
    public void testNineElementsAreNormalized() throws Exception {
        final ProjectiveTransform t = new ProjectiveTransform(2, 4, 6, 8, 10, 12, 0, 2, 2);
        assertArrayEquals(new float[] {1,2,3,4,5,6,0,1}, t.elements(), 0.0f);
        assertEquals(t, new ProjectiveTransform(new double[][] {{2,4,6},{8,10,12},{0,2,2}}));
        assertEquals(1.0, t.toArray()[2][2], 0.0);
        assertThrows(NumericSingularityException.class, () -> new ProjectiveTransform(1, 0, 0, 0, 1, 0, 0, 0, 0));
        assertThrows(NumericSingularityException.class, () -> new ProjectiveTransform(new double[][] {{1,0,0},{0,1,0},{0,0,0}}));
    }

    @Test
    public void testInvertibleRequiresPositiveDeterminant() throws Exception {
        final ProjectiveTransform mirror = new ProjectiveTransform(-1, 0, 0, 0, 1, 0, 0, 0);
        assertEquals(-1.0f, mirror.determinant(), 0.0f);
        assertFalse(mirror.isInvertible());

        // invert() still works on a negative determinant
        final ProjectiveTransform inv = mirror.invert();
        assertEquals(mirror, inv);

        final ProjectiveTransform singular = new ProjectiveTransform(1, 2, 0, 2, 4, 0, 0, 0);
        assertEquals(0.0f, singular.determinant(), 0.0f);
        assertFalse(singular.isInvertible());
        assertThrows(NumericSingularityException.class, () -> singular.invert());
    }

    @Test
    public void testHomogeneousTransformDoesNotDivide() throws Exception {
        final ProjectiveTransform t = new ProjectiveTransform(1, 0, 0, 0, 1, 0, 1, 0);
        final HomogeneousPoint[] result = t.transformPoints(new HomogeneousPoint(2, 3), new HomogeneousPoint(-1, 5));

        assertArrayEquals(new float[] {2,3,3}, result[0].toArray(), 0.0f);
        assertTrue(result[1].isAtInfinity());

        final Point[] divided = t.transformPoints(new SimplePoint(2, 3));
        assertEquals(2.0 / 3.0, divided[0].x(), 1e-6);
        assertEquals(1.0, divided[0].y(), 1e-6);

        assertThrows(NumericSingularityException.class, () -> t.transformPoints(new SimplePoint(-1, 5)));
        assertThrows(NumericSingularityException.class, () -> result[1].toPoint());
    }

    @Test
    public void testMultiplyComposes() throws Exception {
        final ProjectiveTransform composed = PERSPECTIVE.multiply(SIMILARITY);
        final Point p = new SimplePoint(12, 34);
        final Point expected = PERSPECTIVE.transform(SIMILARITY.transform(p));
        final Point actual = composed.transform(p);
        assertEquals(expected.x(), actual.x(), 1e-3);
        assertEquals(expected.y(), actual.y(), 1e-3);
    }

    @Test
    public void testEquality() throws Exception {
        assertEquals(SIMILARITY, new ProjectiveTransform(0.8f, -0.6f, 25.0f, 0.6f, 0.8f, 40.0f, 0.0f, 0.0f));
        assertEquals(SIMILARITY.hashCode(), new ProjectiveTransform(0.8f, -0.6f, 25.0f, 0.6f, 0.8f, 40.0f, 0.0f, 0.0f).hashCode());
        assertNotEquals(SIMILARITY, PERSPECTIVE);
    }
}
