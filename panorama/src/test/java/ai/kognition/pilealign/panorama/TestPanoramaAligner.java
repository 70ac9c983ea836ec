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

package ai.kognition.pilealign.panorama;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.pilealign.image.ByteRaster;
import ai.kognition.pilealign.image.geometry.IntPoint;
import ai.kognition.pilealign.image.geometry.Point;
import ai.kognition.pilealign.image.geometry.transform.ControlPoint;
import ai.kognition.pilealign.image.geometry.transform.Correspondences;
import ai.kognition.pilealign.image.geometry.transform.HomographyEstimate.Outcome;
import ai.kognition.pilealign.image.geometry.transform.ProjectiveTransform;

public class TestPanoramaAligner {
    private static final int SHIFT_X = 7;
    private static final int SHIFT_Y = 4;

    @Test
    public void testRecoversTranslation() throws Exception {
        final ByteRaster image1 = BlockPattern.image(0, 0);
        final ByteRaster image2 = BlockPattern.image(SHIFT_X, SHIFT_Y);

        final Alignment alignment = new PanoramaAligner(AlignerConfig.defaults()).align(image1, image2);

        assertFalse(alignment.corners1.isEmpty());
        assertFalse(alignment.corners2.isEmpty());
        assertTrue(alignment.correspondences.size() >= 4);

        // every match should be the same physical corner
        for(int i = 0; i < alignment.correspondences.size(); i++) {
            final ControlPoint cp = alignment.correspondences.get(i);
            assertEquals(cp.originalPoint.x - SHIFT_X, cp.transformedPoint.x);
            assertEquals(cp.originalPoint.y - SHIFT_Y, cp.transformedPoint.y);
        }

        assertTrue(alignment.isAligned());
        assertEquals(Outcome.CONSENSUS, alignment.estimate.outcome);
        assertEquals(alignment.correspondences.size(), alignment.estimate.inliers.length);

        final ProjectiveTransform transform = alignment.transform();
        assertEquals(-SHIFT_X, transform.offsetX(), 1e-2);
        assertEquals(-SHIFT_Y, transform.offsetY(), 1e-2);
        final float[] e = transform.elements();
        assertEquals(1.0, e[0], 1e-3);
        assertEquals(0.0, e[1], 1e-3);
        assertEquals(0.0, e[3], 1e-3);
        assertEquals(1.0, e[4], 1e-3);
        assertEquals(0.0, e[6], 1e-4);
        assertEquals(0.0, e[7], 1e-4);

        final Correspondences inliers = alignment.inliers();
        assertEquals(alignment.correspondences, inliers);

        final IntPoint p = alignment.corners1.get(0);
        final Point q = transform.transform(p.toPoint());
        final IntPoint mapped = new IntPoint((int)Math.round(q.x()), (int)Math.round(q.y()));
        assertEquals(new IntPoint(p.x - SHIFT_X, p.y - SHIFT_Y), mapped);
    }

    @Test
    public void testSameSeedSameAlignment() throws Exception {
        final ByteRaster image1 = BlockPattern.image(0, 0);
        final ByteRaster image2 = BlockPattern.image(SHIFT_X, SHIFT_Y);
        final AlignerConfig config = AlignerConfig.defaults().withSeed(99L);

        final Alignment first = new PanoramaAligner(config).align(image1, image2);
        final Alignment second = new PanoramaAligner(config).align(image1, image2);

        assertEquals(first.transform(), second.transform());
        assertEquals(first.estimate.trials, second.estimate.trials);
    }

    @Test
    public void testFeaturelessImagesHaveNoConsensus() throws Exception {
        final Alignment alignment = new PanoramaAligner(AlignerConfig.defaults()).align(BlockPattern.uniform(128), BlockPattern.uniform(128));

        assertTrue(alignment.corners1.isEmpty());
        assertTrue(alignment.correspondences.isEmpty());
        assertFalse(alignment.isAligned());
        assertEquals(Outcome.INSUFFICIENT_CONSENSUS, alignment.estimate.outcome);
        assertNull(alignment.transform());
    }
}
