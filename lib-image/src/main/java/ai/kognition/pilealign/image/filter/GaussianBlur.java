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

package ai.kognition.pilealign.image.filter;

import java.util.Arrays;

/**
 * <p>
 * A Gaussian blur is a low-pass filter. It makes changes in intensity more gradual by replacing
 * every pixel with an average of its neighborhood weighted by a two dimensional
 * <a href="http://mathworld.wolfram.com/GaussianFunction.html">Gaussian function</a>.
 * </p>
 *
 * <p>
 * The kernel is quantized to integers by dividing every weight by the weight in the corner of the
 * kernel (the smallest) and truncating. The divisor for each pixel is the sum of the kernel weights
 * that actually fall inside the image so the image's edges aren't darkened.
 * </p>
 */
public class GaussianBlur {
    public static final int DEFAULT_KERNEL_SIZE = 5;

    private final double sigma;
    private final int kernelSize;
    private final int[][] kernel;

    public GaussianBlur(final double sigma) {
        this(sigma, DEFAULT_KERNEL_SIZE);
    }

    /**
     * @param sigma the standard deviation of the Gaussian function. Must be positive.
     * @param kernelSize the width and height of the kernel. Must be odd and at least 3.
     */
    public GaussianBlur(final double sigma, final int kernelSize) {
        if(!(sigma > 0.0) || Double.isInfinite(sigma))
            throw new IllegalArgumentException("The sigma of a Gaussian blur must be positive but was " + sigma);
        if(kernelSize < 3 || (kernelSize & 1) == 0)
            throw new IllegalArgumentException("The kernel size of a Gaussian blur must be odd and at least 3 but was " + kernelSize);

        this.sigma = sigma;
        this.kernelSize = kernelSize;
        this.kernel = kernel(sigma, kernelSize);
    }

    public double getSigma() {
        return sigma;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    /**
     * A copy of the integer kernel, indexed [row][column].
     */
    public int[][] getKernel() {
        final int[][] ret = new int[kernelSize][];
        for(int i = 0; i < kernelSize; i++)
            ret[i] = Arrays.copyOf(kernel[i], kernelSize);
        return ret;
    }

    /**
     * Blur a single channel, tightly packed, 8-bit image in place.
     */
    public void applyInPlace(final byte[] image, final int width, final int height) {
        if(image.length < width * height)
            throw new IllegalArgumentException("An image buffer of " + image.length + " bytes can't be " + width + "x" + height);

        final byte[] src = Arrays.copyOf(image, width * height);
        final int r = kernelSize >> 1;

        for(int y = 0; y < height; y++) {
            for(int x = 0; x < width; x++) {
                long sum = 0;
                long div = 0;
                for(int i = -r; i <= r; i++) {
                    final int ty = y + i;
                    if(ty < 0 || ty >= height)
                        continue;
                    final int[] krow = kernel[i + r];
                    final int rowStart = ty * width;
                    for(int j = -r; j <= r; j++) {
                        final int tx = x + j;
                        if(tx < 0 || tx >= width)
                            continue;
                        final int k = krow[j + r];
                        div += k;
                        sum += k * (src[rowStart + tx] & 0xff);
                    }
                }
                if(div != 0)
                    sum /= div;
                image[(y * width) + x] = (byte)(sum > 255 ? 255 : (sum < 0 ? 0 : sum));
            }
        }
    }

    private static int[][] kernel(final double sigma, final int size) {
        final int r = size >> 1;
        final double sqrSigma2 = 2.0 * sigma * sigma;
        final double norm = 1.0 / (Math.PI * sqrSigma2);

        final double[][] weights = new double[size][size];
        for(int i = 0; i < size; i++) {
            final int y = i - r;
            for(int j = 0; j < size; j++) {
                final int x = j - r;
                weights[i][j] = norm * Math.exp(-((x * x) + (y * y)) / sqrSigma2);
            }
        }

        final double min = weights[0][0];
        final int[][] ret = new int[size][size];
        for(int i = 0; i < size; i++) {
            for(int j = 0; j < size; j++)
                ret[i][j] = (int)(weights[i][j] / min);
        }
        return ret;
    }
}
