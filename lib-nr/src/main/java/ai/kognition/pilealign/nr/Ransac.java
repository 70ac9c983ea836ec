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

package ai.kognition.pilealign.nr;

import java.util.Arrays;
import java.util.Random;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * A generic <a href="https://en.wikipedia.org/wiki/Random_sample_consensus">RANSAC</a> driver. It
 * knows nothing about the model being fit. The model specific parts are supplied at construction
 * as three functions:
 * </p>
 *
 * <ul>
 * <li>{@link Fitting} builds a model from a minimal sample of data indices.</li>
 * <li>{@link Degeneracy} rejects samples that can't produce a meaningful model.</li>
 * <li>{@link Distances} returns the indices of the data consistent with a model.</li>
 * </ul>
 *
 * <p>
 * Each trial draws {@code sampleSize} distinct indices, fits a model and counts its inliers. The
 * first model to reach the largest inlier count is kept. After every improvement the number of
 * trials required to have drawn an outlier free sample with the requested {@code probability} is
 * recomputed as {@code log(1 - p) / log(1 - w^s)} where {@code w} is the best inlier fraction.
 * </p>
 *
 * <p>
 * Randomness comes entirely from the {@link Random} passed to {@link #compute(int, Random)} so a
 * fixed seed gives a fixed sequence of draws.
 * </p>
 */
public class Ransac<M> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Ransac.class);

    public static final int DEFAULT_MAX_EVALUATIONS = 1000;
    public static final int DEFAULT_MAX_SAMPLINGS = 100;

    /**
     * Fit a model to the data at the given indices. Return null if no model can be fit.
     */
    @FunctionalInterface
    public interface Fitting<M> {
        public M fit(int[] sample);
    }

    /**
     * Return true if the data at the given indices would produce a degenerate model.
     */
    @FunctionalInterface
    public interface Degeneracy {
        public boolean degenerate(int[] sample);
    }

    /**
     * Return the indices of all of the data whose distance to the model is within the threshold.
     */
    @FunctionalInterface
    public interface Distances<M> {
        public int[] inliers(M model, double threshold);
    }

    private final int sampleSize;
    private final double threshold;
    private final double probability;
    private final int maxEvaluations;
    private final int maxSamplings;

    private final Fitting<M> fitting;
    private final Degeneracy degeneracy;
    private final Distances<M> distances;

    public Ransac(final int sampleSize, final double threshold, final double probability, final Fitting<M> fitting,
        final Degeneracy degeneracy, final Distances<M> distances) {
        this(sampleSize, threshold, probability, DEFAULT_MAX_EVALUATIONS, DEFAULT_MAX_SAMPLINGS, fitting, degeneracy, distances);
    }

    /**
     * @param maxEvaluations the hard cap on the number of models evaluated.
     * @param maxSamplings the number of consecutive draws that may be rejected (degenerate or unfittable)
     *     before the search gives up.
     */
    public Ransac(final int sampleSize, final double threshold, final double probability, final int maxEvaluations, final int maxSamplings,
        final Fitting<M> fitting, final Degeneracy degeneracy, final Distances<M> distances) {
        if(sampleSize < 1)
            throw new IllegalArgumentException("The sample size must be positive. It's " + sampleSize);
        if(!(probability > 0.0 && probability < 1.0))
            throw new IllegalArgumentException("The probability must be in the open interval (0, 1). It's " + probability);
        if(threshold < 0.0)
            throw new IllegalArgumentException("The threshold can't be negative. It's " + threshold);
        if(maxEvaluations < 1 || maxSamplings < 1)
            throw new IllegalArgumentException("maxEvaluations (" + maxEvaluations + ") and maxSamplings (" + maxSamplings + ") must be positive.");
        if(fitting == null || degeneracy == null || distances == null)
            throw new NullPointerException("Cannot pass a null function to " + Ransac.class.getSimpleName());

        this.sampleSize = sampleSize;
        this.threshold = threshold;
        this.probability = probability;
        this.maxEvaluations = maxEvaluations;
        this.maxSamplings = maxSamplings;
        this.fitting = fitting;
        this.degeneracy = degeneracy;
        this.distances = distances;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getProbability() {
        return probability;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    /**
     * Run the search over data indexed {@code 0} to {@code size - 1}.
     */
    public RansacResult<M> compute(final int size, final Random random) {
        if(size < sampleSize) {
            LOGGER.debug("Only {} data points. At least {} are needed to fit a model.", size, sampleSize);
            return RansacResult.noConsensus(0);
        }

        final int[] pool = IntStream.range(0, size).toArray();

        M bestModel = null;
        int[] bestInliers = null;
        int maxInliers = 0;

        int trials = 0;
        double required = maxEvaluations;

        search: while(required > trials) {
            M model = null;
            int samplings = 0;
            while(model == null) {
                if(samplings >= maxSamplings) {
                    LOGGER.debug("Gave up after {} consecutive rejected samples on trial {}", samplings, trials);
                    break search;
                }
                samplings++;

                final int[] sample = draw(pool, random);
                if(degeneracy.degenerate(sample)) {
                    LOGGER.trace("Sample {} is degenerate", sample);
                    continue;
                }
                model = fitting.fit(sample);
            }

            final int[] inliers = distances.inliers(model, threshold);
            trials++;

            if(inliers.length > maxInliers) {
                bestModel = model;
                bestInliers = inliers;
                maxInliers = inliers.length;

                final double w = (double)maxInliers / size;
                required = Math.log(1.0 - probability) / Math.log(1.0 - Math.pow(w, sampleSize));
                LOGGER.trace("Trial {} found {} inliers. Now requiring {} trials.", trials, maxInliers, required);
            }

            if(trials >= maxEvaluations)
                break;
        }

        if(bestModel == null || maxInliers < sampleSize) {
            LOGGER.debug("No consensus after {} trials. The best model had {} inliers.", trials, maxInliers);
            return RansacResult.noConsensus(trials);
        }

        LOGGER.debug("Consensus of {} out of {} after {} trials", maxInliers, size, trials);
        return RansacResult.consensus(bestModel, bestInliers, trials);
    }

    // partial Fisher-Yates shuffle of the first sampleSize entries of the pool
    private int[] draw(final int[] pool, final Random random) {
        final int n = pool.length;
        for(int i = 0; i < sampleSize; i++) {
            final int j = i + random.nextInt(n - i);
            final int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        return Arrays.copyOf(pool, sampleSize);
    }
}
