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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import Jama.Matrix;
import Jama.SingularValueDecomposition;

/**
 * <p>
 * Solves the homogeneous linear system {@code A x = 0} in the least squares sense subject to
 * {@code |x| = 1}. The solution is the right singular vector of {@code A} that's paired with
 * the smallest singular value.
 * </p>
 *
 * <p>
 * Jama's {@link SingularValueDecomposition} only supports matrices with at least as many rows
 * as columns. Systems with fewer rows are padded with rows of zeros which leaves the right
 * singular vectors unchanged.
 * </p>
 */
public class NullSpace {
    private static final Logger LOGGER = LoggerFactory.getLogger(NullSpace.class);

    /**
     * The result of a null space solve. {@code singularValue} is the singular value the
     * {@code vector} was paired with. It measures how well the system was satisfied.
     */
    public static class Solution {
        public final double[] vector;
        public final double singularValue;

        private Solution(final double[] vector, final double singularValue) {
            this.vector = vector;
            this.singularValue = singularValue;
        }
    }

    /**
     * Return the unit vector {@code x} minimizing {@code |A x|}.
     *
     * @param a row major coefficients. Every row must have the same length.
     */
    public static double[] solve(final double[][] a) {
        return decompose(a).vector;
    }

    public static Solution decompose(final double[][] a) {
        if(a == null || a.length == 0 || a[0] == null || a[0].length == 0)
            throw new IllegalArgumentException("Cannot solve an empty system.");

        final int cols = a[0].length;
        final int rows = Math.max(a.length, cols);
        final double[][] padded = new double[rows][cols];
        for(int r = 0; r < a.length; r++) {
            if(a[r].length != cols)
                throw new IllegalArgumentException("Row " + r + " has " + a[r].length + " coefficients but row 0 has " + cols);
            System.arraycopy(a[r], 0, padded[r], 0, cols);
        }

        if(rows != a.length)
            LOGGER.trace("Padded a {}x{} system with {} rows of zeros", a.length, cols, rows - a.length);

        final SingularValueDecomposition svd = new Matrix(padded, rows, cols).svd();

        // Jama orders the singular values largest first
        final double[] singularValues = svd.getSingularValues();
        final double[][] v = svd.getV().getArray();
        final double[] ret = new double[cols];
        for(int i = 0; i < cols; i++)
            ret[i] = v[i][cols - 1];

        return new Solution(ret, singularValues[cols - 1]);
    }
}
