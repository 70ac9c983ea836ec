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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilealign.image.ArgumentMismatchException;
import ai.kognition.pilealign.image.Grayscale;
import ai.kognition.pilealign.image.ImageRaster;
import ai.kognition.pilealign.image.UnsupportedFormatException;
import ai.kognition.pilealign.image.geometry.IntPoint;
import ai.kognition.pilealign.image.geometry.transform.Correspondences;

/**
 * <p>
 * Matches feature points between two images by the normalized correlation of the square windows
 * around them. A pair is kept only when each point is the other's best match.
 * </p>
 *
 * <p>
 * Points closer than half a window to their image's border can't have a full window and are
 * never matched. When a maximum distance is set, only pairs closer than that distance (in pixel
 * coordinates) are compared.
 * </p>
 */
public class CorrelationMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationMatcher.class);

    private final int windowSize;
    private final double maxDistance;

    public CorrelationMatcher(final int windowSize) {
        this(windowSize, 0.0);
    }

    /**
     * @param windowSize the width and height of the correlation window. Must be odd.
     * @param maxDistance pairs at least this far apart aren't compared. 0 compares every pair.
     * @throws ArgumentMismatchException if the window size is even.
     */
    public CorrelationMatcher(final int windowSize, final double maxDistance) {
        if(windowSize % 2 == 0)
            throw new ArgumentMismatchException("The correlation window size must be odd but was " + windowSize);
        if(windowSize < 1)
            throw new IllegalArgumentException("The correlation window size must be positive but was " + windowSize);
        if(maxDistance < 0.0 || Double.isNaN(maxDistance))
            throw new IllegalArgumentException("The maximum distance can't be negative but was " + maxDistance);
        this.windowSize = windowSize;
        this.maxDistance = maxDistance;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getMaxDistance() {
        return maxDistance;
    }

    /**
     * @throws UnsupportedFormatException if either image doesn't have 1, 3 or 4 channels.
     */
    public Correspondences match(final ImageRaster image1, final ImageRaster image2, final IntPoint[] points1, final IntPoint[] points2) {
        final CorrelationScoreMatrix matrix = correlationMatrix(image1, points1, image2, points2);

        final List<IntPoint> m1 = new ArrayList<>();
        final List<IntPoint> m2 = new ArrayList<>();

        for(int i = 0; i < matrix.rows(); i++) {
            final Pair<Integer, Double> best = matrix.rowMaximum(i);
            if(best == null)
                break;

            final int j = best.getLeft();
            if(matrix.columnMaximum(j).getLeft() == i && Double.isFinite(best.getRight())) {
                m1.add(points1[i]);
                m2.add(points2[j]);
            }
        }

        LOGGER.debug("Matched {} of {} and {} points", m1.size(), points1.length, points2.length);
        return new Correspondences(m1.toArray(new IntPoint[m1.size()]), m2.toArray(new IntPoint[m2.size()]));
    }

    public Correspondences match(final ImageRaster image1, final ImageRaster image2, final List<IntPoint> points1, final List<IntPoint> points2) {
        return match(image1, image2, points1.toArray(new IntPoint[points1.size()]), points2.toArray(new IntPoint[points2.size()]));
    }

    /**
     * Score every eligible pair of points.
     *
     * @throws UnsupportedFormatException if either image doesn't have 1, 3 or 4 channels.
     */
    public CorrelationScoreMatrix correlationMatrix(final ImageRaster image1, final IntPoint[] points1, final ImageRaster image2,
        final IntPoint[] points2) {
        Grayscale.checkSupported(image1);
        Grayscale.checkSupported(image2);
        final ImageRaster gray1 = Grayscale.toGray(image1);
        final ImageRaster gray2 = Grayscale.toGray(image2);

        final CorrelationScoreMatrix matrix = new CorrelationScoreMatrix(points1.length, points2.length);

        final int r = (windowSize - 1) / 2;
        final double m = maxDistance * maxDistance;
        final double[] w1 = new double[windowSize * windowSize];
        final double[] w2 = new double[windowSize * windowSize];

        final int[] idx1 = eligible(points1, gray1, r);
        final int[] idx2 = eligible(points2, gray2, r);

        for(final int n1: idx1) {
            final IntPoint p1 = points1[n1];
            window(gray1, p1, r, w1);

            double sum = 0;
            for(final double v: w1)
                sum += v * v;
            // a flat black window has no direction and can't be scored
            if(sum == 0.0)
                continue;
            sum = Math.sqrt(sum);
            for(int i = 0; i < w1.length; i++)
                w1[i] /= sum;

            for(final int n2: idx2) {
                final IntPoint p2 = points2[n2];
                if(maxDistance != 0.0) {
                    final double dx = p1.x - p2.x;
                    final double dy = p1.y - p2.y;
                    if(!((dx * dx) + (dy * dy) < m))
                        continue;
                }

                window(gray2, p2, r, w2);
                double sum1 = 0, sum2 = 0;
                for(int i = 0; i < w2.length; i++) {
                    sum1 += w1[i] * w2[i];
                    sum2 += w2[i] * w2[i];
                }
                if(sum2 != 0.0)
                    matrix.set(n1, n2, sum1 / Math.sqrt(sum2));
            }
        }

        if(LOGGER.isTraceEnabled())
            LOGGER.trace("Scored {} of {} points against {} of {} points", idx1.length, points1.length, idx2.length, points2.length);
        return matrix;
    }

    private static int[] eligible(final IntPoint[] points, final ImageRaster image, final int r) {
        final int width = image.width();
        final int height = image.height();
        return IntStream.range(0, points.length)
            .filter(i -> points[i].x >= r && points[i].x < width - r && points[i].y >= r && points[i].y < height - r)
            .toArray();
    }

    private static void window(final ImageRaster image, final IntPoint center, final int r, final double[] window) {
        int index = 0;
        for(int y = center.y - r; y <= center.y + r; y++) {
            for(int x = center.x - r; x <= center.x + r; x++)
                window[index++] = image.get(x, y);
        }
    }
}
