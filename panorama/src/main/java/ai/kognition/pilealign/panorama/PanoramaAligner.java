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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilealign.image.ImageRaster;
import ai.kognition.pilealign.image.features.CorrelationMatcher;
import ai.kognition.pilealign.image.features.HarrisCornerDetector;
import ai.kognition.pilealign.image.geometry.IntPoint;
import ai.kognition.pilealign.image.geometry.transform.Correspondences;
import ai.kognition.pilealign.image.geometry.transform.HomographyEstimate;
import ai.kognition.pilealign.image.geometry.transform.RansacHomographyEstimator;
import ai.kognition.pilealign.util.Timer;

/**
 * Aligns two overlapping images: Harris corners are detected in each, matched by correlation and
 * the matches are fed to a RANSAC homography estimate.
 */
public class PanoramaAligner {
    private static final Logger LOGGER = LoggerFactory.getLogger(PanoramaAligner.class);

    private final HarrisCornerDetector detector;
    private final CorrelationMatcher matcher;
    private final RansacHomographyEstimator estimator;

    public PanoramaAligner(final AlignerConfig config) {
        this(new HarrisCornerDetector(config.harrisK, config.harrisThreshold, config.harrisSigma, config.harrisSuppression),
            new CorrelationMatcher(config.correlationWindow, config.correlationMaxDistance),
            new RansacHomographyEstimator(config.ransacThreshold, config.ransacProbability, config.ransacSeed, config.ransacMaxEvaluations));
    }

    public PanoramaAligner(final HarrisCornerDetector detector, final CorrelationMatcher matcher, final RansacHomographyEstimator estimator) {
        this.detector = detector;
        this.matcher = matcher;
        this.estimator = estimator;
    }

    public Alignment align(final ImageRaster image1, final ImageRaster image2) {
        final Timer timer = Timer.started();

        final List<IntPoint> corners1 = detector.detect(image1);
        final List<IntPoint> corners2 = detector.detect(image2);
        LOGGER.debug("Detected {} and {} corners in {} seconds", corners1.size(), corners2.size(), timer);

        final Correspondences correspondences = matcher.match(image1, image2, corners1, corners2);
        LOGGER.debug("Matched {} correspondences at {} seconds", correspondences.size(), timer);

        final HomographyEstimate estimate = estimator.estimate(correspondences);
        final String elapsed = timer.stop();

        if(estimate.hasConsensus())
            LOGGER.info("Aligned with {} of {} correspondences in {} seconds", estimate.inliers.length, correspondences.size(), elapsed);
        else
            LOGGER.info("No consensus among {} correspondences after {} trials ({} seconds)", correspondences.size(), estimate.trials, elapsed);

        return new Alignment(corners1, corners2, correspondences, estimate);
    }
}
