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

import java.util.List;

import ai.kognition.pilealign.image.geometry.IntPoint;
import ai.kognition.pilealign.image.geometry.transform.Correspondences;
import ai.kognition.pilealign.image.geometry.transform.HomographyEstimate;
import ai.kognition.pilealign.image.geometry.transform.ProjectiveTransform;

/**
 * Everything a {@link PanoramaAligner} found: the corners of each image, the matches between them and
 * the estimated homography mapping the first image onto the second.
 */
public class Alignment {
    public final List<IntPoint> corners1;
    public final List<IntPoint> corners2;
    public final Correspondences correspondences;
    public final HomographyEstimate estimate;

    public Alignment(final List<IntPoint> corners1, final List<IntPoint> corners2, final Correspondences correspondences,
        final HomographyEstimate estimate) {
        this.corners1 = corners1;
        this.corners2 = corners2;
        this.correspondences = correspondences;
        this.estimate = estimate;
    }

    public boolean isAligned() {
        return estimate.hasConsensus();
    }

    /**
     * null if there was no consensus
     */
    public ProjectiveTransform transform() {
        return estimate.transform;
    }

    /**
     * The correspondences that agree with the estimated transform.
     */
    public Correspondences inliers() {
        return correspondences.subset(estimate.inliers);
    }

    @Override
    public String toString() {
        return "Alignment [corners1=" + corners1.size() + ", corners2=" + corners2.size() + ", correspondences=" + correspondences.size()
            + ", estimate=" + estimate + "]";
    }
}
