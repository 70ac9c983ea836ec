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

import ai.kognition.pilealign.image.geometry.HomogeneousPoint;
import ai.kognition.pilealign.image.geometry.Point;
import ai.kognition.pilealign.image.geometry.SimplePoint;
import ai.kognition.pilealign.nr.NumericSingularityException;

/**
 * <p>
 * A 2D projective transform (homography) as a 3x3 matrix in homogeneous coordinates:
 * </p>
 *
 * <pre>
 *  | m11 m12 m13 |
 *  | m21 m22 m23 |
 *  | m31 m32  1  |
 * </pre>
 *
 * <p>
 * Only the 8 free elements are stored, row major. The bottom right element is always 1 which
 * every constructor guarantees by dividing through by it. Instances are immutable and all of the
 * arithmetic is done in single precision.
 * </p>
 */
public class ProjectiveTransform implements Transform2D {
    public static final ProjectiveTransform IDENTITY = new ProjectiveTransform(1, 0, 0, 0, 1, 0, 0, 0);

    private final float[] elements;

    public ProjectiveTransform(final float m11, final float m12, final float m13,
        final float m21, final float m22, final float m23,
        final float m31, final float m32) {
        elements = new float[] {m11,m12,m13,m21,m22,m23,m31,m32};
    }

    /**
     * The elements are divided by {@code m33}.
     *
     * @throws NumericSingularityException if {@code m33} is zero.
     */
    public ProjectiveTransform(final float m11, final float m12, final float m13,
        final float m21, final float m22, final float m23,
        final float m31, final float m32, final float m33) {
        this(m11, m12, m13, m21, m22, m23, m31, m32);
        if(m33 == 0.0f)
            throw new NumericSingularityException("A projective transform can't be normalized when its [2,2] element is zero.");
        for(int i = 0; i < 8; i++)
            elements[i] /= m33;
    }

    /**
     * From a full 3x3 matrix indexed [row][column]. The elements are divided by {@code m[2][2]}.
     *
     * @throws NumericSingularityException if {@code m[2][2]} is zero.
     */
    public ProjectiveTransform(final double[][] m) {
        if(m.length != 3 || m[0].length != 3 || m[1].length != 3 || m[2].length != 3)
            throw new IllegalArgumentException("A projective transform requires a 3x3 matrix.");
        if(m[2][2] == 0.0)
            throw new NumericSingularityException("A projective transform can't be normalized when its [2,2] element is zero.");

        elements = new float[8];
        for(int i = 0, k = 0; i < 3; i++) {
            for(int j = 0; j < 3 && k < 8; j++, k++)
                elements[k] = (float)(m[i][j] / m[2][2]);
        }
    }

    /**
     * A copy of the 8 stored elements, row major.
     */
    public float[] elements() {
        return Arrays.copyOf(elements, 8);
    }

    /**
     * The full matrix indexed [row][column].
     */
    public double[][] toArray() {
        return new double[][] {
            {elements[0],elements[1],elements[2]},
            {elements[3],elements[4],elements[5]},
            {elements[6],elements[7],1.0}
        };
    }

    public float offsetX() {
        return elements[2];
    }

    public float offsetY() {
        return elements[5];
    }

    public float determinant() {
        final float a = elements[0], b = elements[1], c = elements[2];
        final float d = elements[3], e = elements[4], f = elements[5];
        final float g = elements[6], h = elements[7];
        return a * (e - f * h) - b * (d - f * g) + c * (d * h - e * g);
    }

    /**
     * True only when the determinant is strictly positive. Orientation reversing transforms
     * (negative determinant) are reported as not invertible even though {@link #invert()}
     * will compute their inverse.
     */
    public boolean isInvertible() {
        return determinant() > 0.0f;
    }

    public boolean isAffine() {
        return elements[6] == 0.0f && elements[7] == 0.0f;
    }

    public boolean isIdentity() {
        return elements[0] == 1.0f && elements[1] == 0.0f && elements[2] == 0.0f &&
            elements[3] == 0.0f && elements[4] == 1.0f && elements[5] == 0.0f &&
            elements[6] == 0.0f && elements[7] == 0.0f;
    }

    /**
     * Closed form inverse using the cofactors:
     *
     * <pre>
     *                 | (ei-fh) (ch-bi) (bf-ce) |
     *  inv = 1/det x  | (fg-di) (ai-cg) (cd-af) |
     *                 | (dh-eg) (bg-ah) (ae-bd) |
     * </pre>
     *
     * with i == 1.
     *
     * @throws NumericSingularityException if the determinant is zero.
     */
    public ProjectiveTransform invert() {
        final float a = elements[0], b = elements[1], c = elements[2];
        final float d = elements[3], e = elements[4], f = elements[5];
        final float g = elements[6], h = elements[7];

        final float det = a * (e - f * h) - b * (d - f * g) + c * (d * h - e * g);
        if(det == 0.0f || Float.isNaN(det))
            throw new NumericSingularityException("The projective transform " + this + " has a determinant of " + det + " and can't be inverted.");

        final float m = 1.0f / det;
        return new ProjectiveTransform(
            m * (e - f * h), m * (c * h - b), m * (b * f - c * e),
            m * (f * g - d), m * (a - c * g), m * (c * d - a * f),
            m * (d * h - e * g), m * (b * g - a * h), m * (a * e - b * d));
    }

    /**
     * The matrix product {@code this x other}, normalized.
     *
     * @throws NumericSingularityException if the product's [2,2] element is zero.
     */
    public ProjectiveTransform multiply(final ProjectiveTransform other) {
        final float[] l = elements;
        final float[] r = other.elements;
        return new ProjectiveTransform(
            l[0] * r[0] + l[1] * r[3] + l[2] * r[6],
            l[0] * r[1] + l[1] * r[4] + l[2] * r[7],
            l[0] * r[2] + l[1] * r[5] + l[2],
            l[3] * r[0] + l[4] * r[3] + l[5] * r[6],
            l[3] * r[1] + l[4] * r[4] + l[5] * r[7],
            l[3] * r[2] + l[4] * r[5] + l[5],
            l[6] * r[0] + l[7] * r[3] + r[6],
            l[6] * r[1] + l[7] * r[4] + r[7],
            l[6] * r[2] + l[7] * r[5] + 1.0f);
    }

    /**
     * Transforms without the perspective divide. The results may be points at infinity.
     */
    public HomogeneousPoint[] transformPoints(final HomogeneousPoint... points) {
        final HomogeneousPoint[] ret = new HomogeneousPoint[points.length];
        for(int i = 0; i < points.length; i++)
            ret[i] = transform(points[i]);
        return ret;
    }

    /**
     * Transforms and perspective divides.
     *
     * @throws NumericSingularityException if any point maps to infinity.
     */
    public Point[] transformPoints(final Point... points) {
        final Point[] ret = new Point[points.length];
        for(int i = 0; i < points.length; i++)
            ret[i] = transform(points[i]);
        return ret;
    }

    public HomogeneousPoint transform(final HomogeneousPoint p) {
        return new HomogeneousPoint(
            elements[0] * p.x + elements[1] * p.y + elements[2] * p.w,
            elements[3] * p.x + elements[4] * p.y + elements[5] * p.w,
            elements[6] * p.x + elements[7] * p.y + p.w);
    }

    /**
     * @throws NumericSingularityException if the point maps to infinity.
     */
    @Override
    public Point transform(final Point point) {
        final float x = (float)point.x();
        final float y = (float)point.y();
        final float w = elements[6] * x + elements[7] * y + 1.0f;
        return SimplePoint.divide(elements[0] * x + elements[1] * y + elements[2], elements[3] * x + elements[4] * y + elements[5], w);
    }

    @Override
    public String toString() {
        return "ProjectiveTransform [ " + elements[0] + ", " + elements[1] + ", " + elements[2] + "; "
            + elements[3] + ", " + elements[4] + ", " + elements[5] + "; "
            + elements[6] + ", " + elements[7] + ", 1.0 ]";
    }

    @Override
    public int hashCode() {
        int result = 1;
        for(final float e: elements)
            result = 31 * result + Float.floatToIntBits(e + 0.0f);
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final ProjectiveTransform other = (ProjectiveTransform)obj;
        // compared numerically so 0.0 and -0.0 are the same element
        for(int i = 0; i < 8; i++) {
            if(elements[i] != other.elements[i])
                return false;
        }
        return true;
    }
}
