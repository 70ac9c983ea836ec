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

import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilealign.image.ArgumentMismatchException;
import ai.kognition.pilealign.image.geometry.HomogeneousPoint;
import ai.kognition.pilealign.image.geometry.IntPoint;
import ai.kognition.pilealign.image.geometry.Point;
import ai.kognition.pilealign.nr.NumericSingularityException;
import ai.kognition.pilealign.nr.Ransac;
import ai.kognition.pilealign.nr.RansacResult;

/**
 * <p>
 * Robustly estimates the homography between two sets of corresponding points in the presence of
 * outliers. {@link Ransac} repeatedly fits a {@link ProjectiveTransform} to 4 randomly chosen
 * correspondences with the {@link HomographyFitter} and keeps the one that the most
 * correspondences agree with. The final transform is refit to all of those inliers.
 * </p>
 *
 * <p>
 * Both point sets are normalized (see {@link PointNormalization}) before the search so the
 * {@code threshold} applies to the squared symmetric transfer error measured in normalized
 * coordinates:
 * </p>
 *
 * <pre>
 * d² = |x1 - inv(H) x2|² + |x2 - H x1|²
 * </pre>
 *
 * <p>
 * The random sequence is seeded from {@code seed} at the start of every call to
 * {@code estimate} so results are reproducible. Instances hold no mutable state.
 * </p>
 */
public class RansacHomographyEstimator {
    private static final Logger LOGGER = LoggerFactory.getLogger(RansacHomographyEstimator.class);

    public static final double DEFAULT_THRESHOLD = 0.001;
    public static final double DEFAULT_PROBABILITY = 0.99;
    public static final long DEFAULT_SEED = 0L;

    private static final int SAMPLE_SIZE = HomographyFitter.MINIMUM_POINTS;

    private final double threshold;
    private final double probability;
    private final long seed;
    private final int maxEvaluations;

    public RansacHomographyEstimator() {
        this(DEFAULT_THRESHOLD, DEFAULT_PROBABILITY);
    }

    public RansacHomographyEstimator(final double threshold, final double probability) {
        this(threshold, probability, DEFAULT_SEED);
    }

    public RansacHomographyEstimator(final double threshold, final double probability, final long seed) {
        this(threshold, probability, seed, Ransac.DEFAULT_MAX_EVALUATIONS);
    }

    /**
     * @param threshold the squared symmetric transfer error, in normalized coordinates, below which
     *     a correspondence is an inlier.
     * @param probability the desired probability that at least one sample is free of outliers.
     * @param seed seeds the sampling sequence.
     * @param maxEvaluations the hard cap on the number of candidate transforms evaluated.
     */
    public RansacHomographyEstimator(final double threshold, final double probability, final long seed, final int maxEvaluations) {
        if(threshold < 0.0)
            throw new IllegalArgumentException("The threshold can't be negative. It's " + threshold);
        if(!(probability > 0.0 && probability < 1.0))
            throw new IllegalArgumentException("The probability must be in the open interval (0, 1). It's " + probability);
        if(maxEvaluations < 1)
            throw new IllegalArgumentException("maxEvaluations must be positive. It's " + maxEvaluations);

        this.threshold = threshold;
        this.probability = probability;
        this.seed = seed;
        this.maxEvaluations = maxEvaluations;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getProbability() {
        return probability;
    }

    public long getSeed() {
        return seed;
    }

    public HomographyEstimate estimate(final Correspondences correspondences) {
        return estimate(correspondences.points1, correspondences.points2);
    }

    public HomographyEstimate estimate(final IntPoint[] points1, final IntPoint[] points2) {
        if(points1.length != points2.length)
            throw new ArgumentMismatchException("The number of points should be equal but there are " + points1.length + " and " + points2.length);

        final Point[] p1 = new Point[points1.length];
        final Point[] p2 = new Point[points2.length];
        for(int i = 0; i < points1.length; i++) {
            p1[i] = points1[i].toPoint();
            p2[i] = points2[i].toPoint();
        }
        return estimate(p1, p2);
    }

    /**
     * @throws ArgumentMismatchException if the arrays differ in length.
     */
    public HomographyEstimate estimate(final Point[] points1, final Point[] points2) {
        if(points1.length != points2.length)
            throw new ArgumentMismatchException("The number of points should be equal but there are " + points1.length + " and " + points2.length);

        if(points1.length < SAMPLE_SIZE) {
            LOGGER.debug("Only {} correspondences. At least {} are needed to estimate a homography.", points1.length, SAMPLE_SIZE);
            return HomographyEstimate.insufficientConsensus(0);
        }

        final PointNormalization norm1;
        final PointNormalization norm2;
        try {
            norm1 = PointNormalization.normalize(points1);
            norm2 = PointNormalization.normalize(points2);
        } catch(final NumericSingularityException nse) {
            LOGGER.debug("The correspondences can't be normalized: {}", nse.getMessage());
            return HomographyEstimate.insufficientConsensus(0);
        }

        final Point[] set1 = norm1.points;
        final Point[] set2 = norm2.points;

        final Ransac<ProjectiveTransform> ransac = new Ransac<>(SAMPLE_SIZE, threshold, probability, maxEvaluations, Ransac.DEFAULT_MAX_SAMPLINGS,
            sample -> fit(set1, set2, sample),
            sample -> degenerate(set1, set2, sample),
            (h, t) -> inliers(set1, set2, h, t));

        final RansacResult<ProjectiveTransform> result = ransac.compute(set1.length, new Random(seed));
        if(!result.hasModel() || result.inliers.length < SAMPLE_SIZE)
            return HomographyEstimate.insufficientConsensus(result.trials);

        final ProjectiveTransform h = HomographyFitter.fit(subset(set1, result.inliers), subset(set2, result.inliers));
        final ProjectiveTransform ret = norm2.transform.invert().multiply(h.multiply(norm1.transform));

        LOGGER.debug("Estimated {} from {} of {} correspondences", ret, result.inliers.length, set1.length);
        return HomographyEstimate.consensus(ret, result.inliers, result.trials);
    }

    private static ProjectiveTransform fit(final Point[] set1, final Point[] set2, final int[] sample) {
        try {
            return HomographyFitter.fit(subset(set1, sample), subset(set2, sample));
        } catch(final NumericSingularityException nse) {
            LOGGER.trace("Couldn't fit a homography to the sample: {}", nse.getMessage());
            return null;
        }
    }

    // If any 3 of the 4 points in either set are collinear the homography is degenerate
    private static boolean degenerate(final Point[] set1, final Point[] set2, final int[] sample) {
        return anyThreeCollinear(subset(set1, sample)) || anyThreeCollinear(subset(set2, sample));
    }

    private static boolean anyThreeCollinear(final Point[] x) {
        return Point.collinear(x[0], x[1], x[2]) ||
            Point.collinear(x[0], x[1], x[3]) ||
            Point.collinear(x[0], x[2], x[3]) ||
            Point.collinear(x[1], x[2], x[3]);
    }

    /**
     * A correspondence that either direction maps to infinity is an outlier. A candidate without
     * an inverse has no inliers.
     */
    private static int[] inliers(final Point[] set1, final Point[] set2, final ProjectiveTransform h, final double t) {
        final ProjectiveTransform inverse;
        try {
            inverse = h.invert();
        } catch(final NumericSingularityException nse) {
            LOGGER.trace("Candidate {} isn't invertible", h);
            return new int[0];
        }

        final int n = set1.length;
        final int[] found = new int[n];
        int count = 0;
        for(int i = 0; i < n; i++) {
            final HomogeneousPoint forward = h.transform(HomogeneousPoint.of(set1[i]));
            final HomogeneousPoint backward = inverse.transform(HomogeneousPoint.of(set2[i]));
            if(forward.isAtInfinity() || backward.isAtInfinity())
                continue;

            final float ax = (float)set1[i].x() - (backward.x / backward.w);
            final float ay = (float)set1[i].y() - (backward.y / backward.w);
            final float bx = (float)set2[i].x() - (forward.x / forward.w);
            final float by = (float)set2[i].y() - (forward.y / forward.w);
            final double d2 = (ax * ax) + (ay * ay) + (bx * bx) + (by * by);
            if(d2 < t)
                found[count++] = i;
        }

        final int[] ret = new int[count];
        System.arraycopy(found, 0, ret, 0, count);
        return ret;
    }

    private static Point[] subset(final Point[] points, final int[] indices) {
        final Point[] ret = new Point[indices.length];
        for(int i = 0; i < indices.length; i++)
            ret[i] = points[indices[i]];
        return ret;
    }
}
