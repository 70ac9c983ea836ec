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

import java.util.Arrays;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Normalized correlation scores between the points of two images. Rows are the points of the
 * first image and columns the points of the second. Pairs that were never compared hold
 * {@link #UNSCORED}.
 */
public class CorrelationScoreMatrix {
    public static final double UNSCORED = Double.NEGATIVE_INFINITY;

    private final double[][] scores;
    private final int rows;
    private final int cols;

    public CorrelationScoreMatrix(final int rows, final int cols) {
        this.rows = rows;
        this.cols = cols;
        scores = new double[rows][cols];
        for(final double[] row: scores)
            Arrays.fill(row, UNSCORED);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double get(final int row, final int col) {
        return scores[row][col];
    }

    void set(final int row, final int col, final double score) {
        scores[row][col] = score;
    }

    public boolean isScored(final int row, final int col) {
        return scores[row][col] != UNSCORED;
    }

    /**
     * The column with the maximum score in the row and that score. The first maximum wins a tie
     * and NaN scores never win over a number.
     * Returns null if there are no columns.
     */
    public Pair<Integer, Double> rowMaximum(final int row) {
        if(cols == 0)
            return null;
        final double[] r = scores[row];
        int index = 0;
        double max = r[0];
        for(int j = 1; j < cols; j++) {
            if(r[j] > max || (Double.isNaN(max) && !Double.isNaN(r[j]))) {
                max = r[j];
                index = j;
            }
        }
        return Pair.of(index, max);
    }

    /**
     * The row with the maximum score in the column and that score. The first maximum wins a tie
     * and NaN scores never win over a number.
     * Returns null if there are no rows.
     */
    public Pair<Integer, Double> columnMaximum(final int col) {
        if(rows == 0)
            return null;
        int index = 0;
        double max = scores[0][col];
        for(int i = 1; i < rows; i++) {
            if(scores[i][col] > max || (Double.isNaN(max) && !Double.isNaN(scores[i][col]))) {
                max = scores[i][col];
                index = i;
            }
        }
        return Pair.of(index, max);
    }

    /**
     * A copy of the scores indexed [row][column].
     */
    public double[][] toArray() {
        final double[][] ret = new double[rows][];
        for(int i = 0; i < rows; i++)
            ret[i] = Arrays.copyOf(scores[i], cols);
        return ret;
    }

    @Override
    public String toString() {
        return "CorrelationScoreMatrix [rows=" + rows + ", cols=" + cols + "]";
    }
}
