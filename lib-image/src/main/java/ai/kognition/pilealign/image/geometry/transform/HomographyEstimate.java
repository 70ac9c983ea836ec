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

import java.util.Arrays;

/**
 * The result of a robust homography estimation. Not finding a consensus isn't an error: it's
 * reported as {@link Outcome#INSUFFICIENT_CONSENSUS} with no transform and no inliers.
 */
public class HomographyEstimate {
    public static enum Outcome {
        CONSENSUS,
        INSUFFICIENT_CONSENSUS
    }

    public final Outcome outcome;

    /**
     * null unless the outcome is {@link Outcome#CONSENSUS}
     */
    public final ProjectiveTransform transform;

    /**
     * Sorted indices of the correspondences that agree with the transform.
     */
    public final int[] inliers;

    /**
     * The number of models that were fit and scored.
     */
    public final int trials;

    private HomographyEstimate(final Outcome outcome, final ProjectiveTransform transform, final int[] inliers, final int trials) {
        this.outcome = outcome;
        this.transform = transform;
        this.inliers = inliers;
        this.trials = trials;
    }

    public static HomographyEstimate consensus(final ProjectiveTransform transform, final int[] inliers, final int trials) {
        return new HomographyEstimate(Outcome.CONSENSUS, transform, inliers, trials);
    }

    public static HomographyEstimate insufficientConsensus(final int trials) {
        return new HomographyEstimate(Outcome.INSUFFICIENT_CONSENSUS, null, new int[0], trials);
    }

    public boolean hasConsensus() {
        return outcome == Outcome.CONSENSUS;
    }

    @Override
    public String toString() {
        return "HomographyEstimate [outcome=" + outcome + ", transform=" + transform + ", inliers=" + Arrays.toString(inliers) + ", trials=" + trials + "]";
    }
}
