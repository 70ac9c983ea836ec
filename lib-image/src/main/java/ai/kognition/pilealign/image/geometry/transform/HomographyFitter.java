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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilealign.image.ArgumentMismatchException;
import ai.kognition.pilealign.image.geometry.HomogeneousPoint;
import ai.kognition.pilealign.image.geometry.Point;
import ai.kognition.pilealign.nr.NullSpace;
import ai.kognition.pilealign.nr.NumericSingularityException;

/**
 * <p>
 * Fits a {@link ProjectiveTransform} to four or more point correspondences using the normalized
 * direct linear transform.
 * </p>
 *
 * <p>
 * Both point sets are first normalized (see {@link PointNormalization}). Each correspondence
 * {@code x1 -> x2} contributes the rows of the cross product constraint {@code x2 × (H x1) = 0}
 * to a linear system in the 9 elements of H. The solution is the null vector of that system
 * (see {@link NullSpace}) which is then mapped back out of normalized coordinates:
 * {@code H = inv(T2) H' T1}.
 * </p>
 */
public class HomographyFitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(HomographyFitter.class);

    public static final int MINIMUM_POINTS = 4;

    /**
     * All three rows of the cross product constraint are used for each correspondence even though
     * only two of them are linearly independent.
     *
     * @throws ArgumentMismatchException if the arrays differ in length or have fewer than 4 points.
     * @throws NumericSingularityException if either point set can't be normalized or the
     *     solution can't be normalized.
     */
    public static ProjectiveTransform fit(final HomogeneousPoint[] points1, final HomogeneousPoint[] points2) {
        checkArguments(points1.length, points2.length);

        final int n = points1.length;
        final PointNormalization norm1 = PointNormalization.normalize(points1);
        final PointNormalization norm2 = PointNormalization.normalize(points2);
        final HomogeneousPoint[] x1s = norm1.homogeneous();
        final HomogeneousPoint[] x2s = norm2.homogeneous();

        final double[][] a = new double[3 * n][];
        for(int i = 0; i < n; i++) {
            final HomogeneousPoint p = x1s[i];
            final double x = x2s[i].x;
            final double y = x2s[i].y;
            final double w = x2s[i].w;

            int r = 3 * i;
            a[r++] = new double[] {0,0,0,-w * p.x,-w * p.y,-w * p.w,y * p.x,y * p.y,y * p.w};
            a[r++] = new double[] {w * p.x,w * p.y,w * p.w,0,0,0,-x * p.x,-x * p.y,-x * p.w};
            a[r] = new double[] {-y * p.x,-y * p.y,-y * p.w,x * p.x,x * p.y,x * p.w,0,0,0};
        }

        return solve(a, norm1.transform, norm2.transform);
    }

    /**
     * Two rows per correspondence.
     *
     * @throws ArgumentMismatchException if the arrays differ in length or have fewer than 4 points.
     * @throws NumericSingularityException if either point set can't be normalized or the
     *     solution can't be normalized.
     */
    public static ProjectiveTransform fit(final Point[] points1, final Point[] points2) {
        checkArguments(points1.length, points2.length);

        final int n = points1.length;
        final PointNormalization norm1 = PointNormalization.normalize(points1);
        final PointNormalization norm2 = PointNormalization.normalize(points2);

        final double[][] a = new double[2 * n][];
        for(int i = 0; i < n; i++) {
            final double px = norm1.points[i].x();
            final double py = norm1.points[i].y();
            final double x = norm2.points[i].x();
            final double y = norm2.points[i].y();

            a[2 * i] = new double[] {0,0,0,-px,-py,-1,y * px,y * py,y};
            a[2 * i + 1] = new double[] {px,py,1,0,0,0,-x * px,-x * py,-x};
        }

        return solve(a, norm1.transform, norm2.transform);
    }

    private static void checkArguments(final int n1, final int n2) {
        if(n1 != n2)
            throw new ArgumentMismatchException("The number of points should be equal but there are " + n1 + " and " + n2);
        if(n1 < MINIMUM_POINTS)
            throw new ArgumentMismatchException("At least " + MINIMUM_POINTS + " points are required to fit a homography but there are " + n1);
    }

    private static ProjectiveTransform solve(final double[][] a, final ProjectiveTransform t1, final ProjectiveTransform t2) {
        final NullSpace.Solution solution = NullSpace.decompose(a);
        final double[] v = solution.vector;

        if(LOGGER.isTraceEnabled())
            LOGGER.trace("Fit a homography from a {}x9 system with a residual singular value of {}", a.length, solution.singularValue);

        final ProjectiveTransform normalized = new ProjectiveTransform(
            (float)v[0], (float)v[1], (float)v[2],
            (float)v[3], (float)v[4], (float)v[5],
            (float)v[6], (float)v[7], (float)v[8]);

        return t2.invert().multiply(normalized.multiply(t1));
    }
}
