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

import ai.kognition.pilealign.image.geometry.HomogeneousPoint;
import ai.kognition.pilealign.image.geometry.Point;
import ai.kognition.pilealign.nr.NumericSingularityException;

/**
 * <p>
 * Conditions a point set for the direct linear transform. The points are translated so their
 * centroid is at the origin and scaled so their mean distance from the origin is √2. The
 * transform {@link #transform} that does this is kept so a model fit in normalized coordinates
 * can be mapped back.
 * </p>
 */
public class PointNormalization {
    private static final double SQRT2 = Math.sqrt(2.0);

    public final ProjectiveTransform transform;
    public final Point[] points;

    private PointNormalization(final ProjectiveTransform transform, final Point[] points) {
        this.transform = transform;
        this.points = points;
    }

    /**
     * @throws NumericSingularityException if every point is the same (the scale is undefined).
     */
    public static PointNormalization normalize(final Point[] points) {
        final float n = points.length;
        float xmean = 0.0f, ymean = 0.0f;
        for(final Point p: points) {
            xmean += (float)p.x();
            ymean += (float)p.y();
        }
        xmean /= n;
        ymean /= n;

        final ProjectiveTransform t = normalizingTransform(points, xmean, ymean, n);
        return new PointNormalization(t, t.transformPoints(points));
    }

    /**
     * Normalizes the homogeneous points. Each point is perspective divided first.
     *
     * @throws NumericSingularityException if every point is the same or any point is at
     *     infinity.
     */
    public static PointNormalization normalize(final HomogeneousPoint[] points) {
        final Point[] divided = new Point[points.length];
        for(int i = 0; i < points.length; i++)
            divided[i] = points[i].toPoint();
        return normalize(divided);
    }

    /**
     * The normalized points with w == 1.
     */
    public HomogeneousPoint[] homogeneous() {
        final HomogeneousPoint[] ret = new HomogeneousPoint[points.length];
        for(int i = 0; i < points.length; i++)
            ret[i] = HomogeneousPoint.of(points[i]);
        return ret;
    }

    private static ProjectiveTransform normalizingTransform(final Point[] points, final float xmean, final float ymean, final float n) {
        float sumDist = 0.0f;
        for(final Point p: points) {
            final float x = (float)p.x() - xmean;
            final float y = (float)p.y() - ymean;
            sumDist += (float)Math.sqrt(x * x + y * y);
        }

        final float scale = (float)(SQRT2 * n / sumDist);
        if(!Float.isFinite(scale) || scale == 0.0f)
            throw new NumericSingularityException("Can't normalize " + points.length + " points that are all coincident.");

        return new ProjectiveTransform(
            scale, 0.0f, -scale * xmean,
            0.0f, scale, -scale * ymean,
            0.0f, 0.0f);
    }
}
