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

package ai.kognition.pilealign.image.geometry;

/**
 * A perspective divided 2D point.
 */
public interface Point {
    /**
     * The distance from 1.0f to the next larger float. Used as the area below which three points
     * are considered collinear.
     */
    public static final float FLOAT_EPSILON = Math.ulp(1.0f);

    public static String toString(final Point p) {
        return p.getClass().getSimpleName() + "[ x=" + p.x() + ", y=" + p.y() + " ]";
    }

    public double x();

    public double y();

    /**
     * Three points are collinear when the (doubled) signed area of the triangle they form is
     * smaller in magnitude than {@link #FLOAT_EPSILON}. Computed in single precision.
     */
    public static boolean collinear(final Point p1, final Point p2, final Point p3) {
        final float x1 = (float)p1.x(), y1 = (float)p1.y();
        final float x2 = (float)p2.x(), y2 = (float)p2.y();
        final float x3 = (float)p3.x(), y3 = (float)p3.y();
        return Math.abs(((y1 - y2) * x3) + ((x2 - x1) * y3) + ((x1 * y2) - (y1 * x2))) < FLOAT_EPSILON;
    }
}
