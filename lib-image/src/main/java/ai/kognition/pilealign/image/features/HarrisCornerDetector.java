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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilealign.image.Grayscale;
import ai.kognition.pilealign.image.ImageRaster;
import ai.kognition.pilealign.image.UnsupportedFormatException;
import ai.kognition.pilealign.image.filter.GaussianBlur;
import ai.kognition.pilealign.image.geometry.IntPoint;

/**
 * <p>
 * Harris corner detector.
 * </p>
 *
 * <p>
 * Gradient images dx and dy are computed with 3x3 Prewitt-like stencils and a cross term dxy by
 * applying the vertical stencil to dx. All three are clamped to the 8-bit range and optionally
 * smoothed with a {@link GaussianBlur}. The corner response at each pixel is
 * </p>
 *
 * <pre>
 * M = (A B - C²) - k (A + B)²
 * </pre>
 *
 * <p>
 * where A, B and C are the smoothed dx, dy and dxy. Responses not strictly above the
 * threshold are dropped and the remainder are thinned by non-maximum suppression within a
 * (2r+1)x(2r+1) window. Corners are returned in raster order.
 * </p>
 */
public class HarrisCornerDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(HarrisCornerDetector.class);

    public static final float DEFAULT_K = 0.04f;
    public static final float DEFAULT_THRESHOLD = 1000f;
    public static final double DEFAULT_SIGMA = 1.4;
    public static final int DEFAULT_SUPPRESSION = 3;

    private float k = DEFAULT_K;
    private float threshold = DEFAULT_THRESHOLD;
    private double sigma = DEFAULT_SIGMA;
    private int r = DEFAULT_SUPPRESSION;

    public HarrisCornerDetector() {}

    public HarrisCornerDetector(final float k, final float threshold) {
        k(k).threshold(threshold);
    }

    public HarrisCornerDetector(final float k, final float threshold, final double sigma, final int suppression) {
        k(k).threshold(threshold).sigma(sigma).suppression(suppression);
    }

    /**
     * The weight of the trace term in the corner response.
     */
    public HarrisCornerDetector k(final float k) {
        this.k = k;
        return this;
    }

    public HarrisCornerDetector threshold(final float threshold) {
        this.threshold = threshold;
        return this;
    }

    /**
     * The standard deviation of the Gaussian smoothing of the gradients. 0 disables smoothing.
     */
    public HarrisCornerDetector sigma(final double sigma) {
        if(sigma < 0.0 || Double.isNaN(sigma))
            throw new IllegalArgumentException("Sigma can't be negative. It was " + sigma);
        this.sigma = sigma;
        return this;
    }

    /**
     * The non-maximum suppression radius.
     */
    public HarrisCornerDetector suppression(final int r) {
        if(r < 0)
            throw new IllegalArgumentException("The suppression radius can't be negative. It was " + r);
        this.r = r;
        return this;
    }

    public float getK() {
        return k;
    }

    public float getThreshold() {
        return threshold;
    }

    public double getSigma() {
        return sigma;
    }

    public int getSuppression() {
        return r;
    }

    /**
     * Find the corners in the image.
     *
     * @throws UnsupportedFormatException if the image doesn't have 1, 3 or 4 channels.
     */
    public List<IntPoint> detect(final ImageRaster image) {
        final float[][] h = response(image);

        final int height = h.length;
        final int width = height == 0 ? 0 : h[0].length;
        final List<IntPoint> corners = new ArrayList<>();

        for(int y = r, maxY = height - r; y < maxY; y++) {
            for(int x = r, maxX = width - r; x < maxX; x++) {
                float currentValue = h[y][x];

                // only a strictly greater neighbor suppresses
                for(int i = -r; (currentValue != 0) && (i <= r); i++) {
                    for(int j = -r; j <= r; j++) {
                        if(h[y + i][x + j] > currentValue) {
                            currentValue = 0;
                            break;
                        }
                    }
                }

                if(currentValue != 0)
                    corners.add(new IntPoint(x, y));
            }
        }

        LOGGER.debug("Found {} corners in a {}x{} image", corners.size(), width, height);
        return corners;
    }

    /**
     * The thresholded corner response indexed [row][column]. Pixels whose response isn't above
     * the threshold are 0.
     *
     * @throws UnsupportedFormatException if the image doesn't have 1, 3 or 4 channels.
     */
    public float[][] response(final ImageRaster image) {
        Grayscale.checkSupported(image);
        final ImageRaster gray = Grayscale.toGray(image);

        final int width = gray.width();
        final int height = gray.height();

        final byte[] dx = new byte[width * height];
        final byte[] dy = new byte[width * height];
        final byte[] dxy = new byte[width * height];

        // 1. partial differences. Border pixels stay 0.
        for(int y = 1; y < height - 1; y++) {
            for(int x = 1; x < width - 1; x++) {
                final int h = -(gray.get(x - 1, y - 1) + gray.get(x - 1, y) + gray.get(x - 1, y + 1)) +
                    (gray.get(x + 1, y - 1) + gray.get(x + 1, y) + gray.get(x + 1, y + 1));
                dx[(y * width) + x] = clamp(h);

                final int v = -(gray.get(x - 1, y - 1) + gray.get(x, y - 1) + gray.get(x + 1, y - 1)) +
                    (gray.get(x - 1, y + 1) + gray.get(x, y + 1) + gray.get(x + 1, y + 1));
                dy[(y * width) + x] = clamp(v);
            }
        }

        // the cross term is the vertical stencil over the clamped dx
        for(int y = 1; y < height - 1; y++) {
            final int above = (y - 1) * width;
            final int below = (y + 1) * width;
            for(int x = 1; x < width - 1; x++) {
                final int v = -((dx[above + x - 1] & 0xff) + (dx[above + x] & 0xff) + (dx[above + x + 1] & 0xff)) +
                    ((dx[below + x - 1] & 0xff) + (dx[below + x] & 0xff) + (dx[below + x + 1] & 0xff));
                dxy[(y * width) + x] = clamp(v);
            }
        }

        // 2. smoothing
        if(sigma > 0.0) {
            final GaussianBlur blur = new GaussianBlur(sigma);
            blur.applyInPlace(dx, width, height);
            blur.applyInPlace(dy, width, height);
            blur.applyInPlace(dxy, width, height);
        }

        // 3. response
        final float[][] ret = new float[height][width];
        for(int y = 0; y < height; y++) {
            final float[] row = ret[y];
            for(int x = 0; x < width; x++) {
                final int index = (y * width) + x;
                final float a = dx[index] & 0xff;
                final float b = dy[index] & 0xff;
                final float c = dxy[index] & 0xff;

                final float m = (a * b - c * c) - (k * ((a + b) * (a + b)));
                row[x] = m > threshold ? m : 0;
            }
        }
        return ret;
    }

    private static byte clamp(final int v) {
        return (byte)(v > 255 ? 255 : (v < 0 ? 0 : v));
    }
}
