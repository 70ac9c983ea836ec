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

import static ai.kognition.pilealign.image.geometry.transform.TestHomographyFitter.GENERATOR;
import static ai.kognition.pilealign.image.geometry.transform.TestHomographyFitter.assertSameTransform;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.junit.Test;

import ai.kognition.pilealign.image.ArgumentMismatchException;
import ai.kognition.pilealign.image.geometry.IntPoint;
import ai.kognition.pilealign.image.geometry.Point;
import ai.kognition.pilealign.image.geometry.SimplePoint;
import ai.kognition.pilealign.image.geometry.transform.HomographyEstimate.Outcome;
import ai.kognition.pilealign.nr.Ransac;

public class TestRansacHomographyEstimator {

    private static final int[][] INLIERS = {
        {12,18},{45,190},{88,35},{150,160},{190,20},{30,110},{120,95},{175,130},
        {60,60},{140,10},{10,170},{100,150},{165,75},{75,125},{195,195},{50,5}
    };

    // source and (wildly wrong) destination for each outlier
    private static final int[][] OUTLIERS = {
        {20,80,5,5},{130,45,190,190},{85,185,5,190},{180,100,190,5}
    };

    private static final int[] OUTLIER_INDICES = {3,8,13,18};

    private final Point[] points1 = new Point[20];
    private final Point[] points2 = new Point[20];

    public TestRansacHomographyEstimator() {
        int in = 0, out = 0;
        for(int i = 0; i < 20; i++) {
            if(Arrays.binarySearch(OUTLIER_INDICES, i) >= 0) {
                final int[] o = OUTLIERS[out++];
                points1[i] = new SimplePoint(o[0], o[1]);
                points2[i] = new SimplePoint(o[2], o[3]);
            } else {
                final int[] p = INLIERS[in++];
                points1[i] = new SimplePoint(p[0], p[1]);
                points2[i] = GENERATOR.transform(points1[i]);
            }
        }
    }

    private static int[] expectedInliers() {
        return IntStream.range(0, 20).filter(i -> Arrays.binarySearch(OUTLIER_INDICES, i) < 0).toArray();
    }

    @Test
    public void testRecoversInliersAndTransform() throws Exception {
        final HomographyEstimate estimate = new RansacHomographyEstimator(0.001, 0.99, 7L).estimate(points1, points2);

        assertEquals(Outcome.CONSENSUS, estimate.outcome);
        assertTrue(estimate.hasConsensus());
        assertArrayEquals(expectedInliers(), estimate.inliers);
        assertTrue(estimate.trials >= 1 && estimate.trials <= Ransac.DEFAULT_MAX_EVALUATIONS);
        assertSameTransform(GENERATOR, estimate.transform);
    }

    @Test
    public void testSameSeedSameResult() throws Exception {
        final RansacHomographyEstimator estimator = new RansacHomographyEstimator(0.001, 0.99, 1234L);
        final HomographyEstimate first = estimator.estimate(points1, points2);
        final HomographyEstimate second = estimator.estimate(points1, points2);

        assertEquals(first.transform, second.transform);
        assertEquals(first.trials, second.trials);
        assertArrayEquals(first.inliers, second.inliers);
    }

    @Test
    public void testIntegerCorrespondences() throws Exception {
        // a pure translation is exact in integer coordinates
        final IntPoint[] p1 = new IntPoint[INLIERS.length];
        final IntPoint[] p2 = new IntPoint[INLIERS.length];
        for(int i = 0; i < INLIERS.length; i++) {
            p1[i] = new IntPoint(INLIERS[i][0], INLIERS[i][1]);
            p2[i] = new IntPoint(INLIERS[i][0] - 13, INLIERS[i][1] + 21);
        }
        // one bad match
        p2[5] = new IntPoint(150, 12);

        final HomographyEstimate estimate = new RansacHomographyEstimator().estimate(new Correspondences(p1, p2));
        assertTrue(estimate.hasConsensus());
        assertEquals(INLIERS.length - 1, estimate.inliers.length);
        assertFalse(Arrays.stream(estimate.inliers).anyMatch(i -> i == 5));
        assertSameTransform(new ProjectiveTransform(1, 0, -13, 0, 1, 21, 0, 0), estimate.transform);
    }

    @Test
    public void testFewerThanFourIsInsufficientConsensus() throws Exception {
        final RansacHomographyEstimator estimator = new RansacHomographyEstimator();
        for(int n = 0; n < 4; n++) {
            final HomographyEstimate estimate = estimator.estimate(Arrays.copyOf(points1, n), Arrays.copyOf(points2, n));
            assertEquals(Outcome.INSUFFICIENT_CONSENSUS, estimate.outcome);
            assertNull(estimate.transform);
            assertEquals(0, estimate.inliers.length);
        }
    }

    @Test
    public void testCollinearPointsAreInsufficientConsensus() throws Exception {
        final Point[] line1 = new Point[10];
        final Point[] line2 = new Point[10];
        for(int i = 0; i < 10; i++) {
            line1[i] = new SimplePoint(i * 10 + 3, 5);
            line2[i] = new SimplePoint(i * 10 + 20, 40);
        }
        final HomographyEstimate estimate = new RansacHomographyEstimator().estimate(line1, line2);
        assertEquals(Outcome.INSUFFICIENT_CONSENSUS, estimate.outcome);
        assertEquals(0, estimate.trials);
    }

    @Test
    public void testCoincidentPointsAreInsufficientConsensus() throws Exception {
        final Point[] same = new Point[6];
        Arrays.fill(same, new SimplePoint(4, 4));
        assertFalse(new RansacHomographyEstimator().estimate(same, Arrays.copyOf(points2, 6)).hasConsensus());
    }

    @Test
    public void testMismatchedLengths() throws Exception {
        final RansacHomographyEstimator estimator = new RansacHomographyEstimator();
        assertThrows(ArgumentMismatchException.class, () -> estimator.estimate(points1, Arrays.copyOf(points2, 19)));
        assertThrows(ArgumentMismatchException.class, () -> estimator.estimate(new IntPoint[2], new IntPoint[3]));
        assertThrows(IllegalArgumentException.class, () -> new RansacHomographyEstimator(0.001, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new RansacHomographyEstimator(-1.0, 0.99));
    }
}
