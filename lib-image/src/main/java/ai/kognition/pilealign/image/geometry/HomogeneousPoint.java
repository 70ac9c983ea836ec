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

import ai.kognition.pilealign.nr.NumericSingularityException;

/**
 * <p>
 * A 2D point in homogeneous coordinates (x, y, w). The perspective divided point is
 * (x/w, y/w). A point with w == 0 is a point at infinity and has no perspective divided form.
 * </p>
 *
 * <p>
 * Two homogeneous points are equal when their perspective divided coordinates are equal, so
 * (1, 2, 1) equals (2, 4, 2). Points at infinity are equal when they have the same direction,
 * so (1, 2, 0) equals (-2, -4, 0).
 * </p>
 */
public class HomogeneousPoint {
    public static final HomogeneousPoint EMPTY = new HomogeneousPoint(0, 0, 1);

    public final float x;
    public final float y;
    public final float w;

    public HomogeneousPoint(final float x, final float y, final float w) {
        this.x = x;
        this.y = y;
        this.w = w;
    }

    public HomogeneousPoint(final float x, final float y) {
        this(x, y, 1.0f);
    }

    public static HomogeneousPoint of(final Point p) {
        return new HomogeneousPoint((float)p.x(), (float)p.y());
    }

    public static HomogeneousPoint of(final IntPoint p) {
        return new HomogeneousPoint(p.x, p.y);
    }

    /**
     * The perspective divide.
     *
     * @throws NumericSingularityException if this is a point at infinity.
     */
    public Point toPoint() {
        return SimplePoint.divide(x, y, w);
    }

    /**
     * The equivalent point with w == 1.
     *
     * @throws NumericSingularityException if this is a point at infinity.
     */
    public HomogeneousPoint normalize() {
        if(isAtInfinity())
            throw new NumericSingularityException("Can't normalize the point at infinity " + this);
        return isNormalized() ? this : new HomogeneousPoint(x / w, y / w, 1.0f);
    }

    public boolean isNormalized() {
        return w == 1.0f;
    }

    public boolean isAtInfinity() {
        return w == 0.0f;
    }

    public boolean isEmpty() {
        return x == 0.0f && y == 0.0f;
    }

    public float[] toArray() {
        return new float[] {x,y,w};
    }

    /**
     * Scales all three coordinates. The result is equal to this point for any non-zero scale.
     */
    public HomogeneousPoint multiply(final float scale) {
        return new HomogeneousPoint(x * scale, y * scale, w * scale);
    }

    public HomogeneousPoint add(final HomogeneousPoint other) {
        return new HomogeneousPoint(x + other.x, y + other.y, w + other.w);
    }

    public HomogeneousPoint subtract(final HomogeneousPoint other) {
        return new HomogeneousPoint(x - other.x, y - other.y, w - other.w);
    }

    public IntPoint ceiling() {
        return new IntPoint((int)Math.ceil(x / w), (int)Math.ceil(y / w));
    }

    /**
     * Rounds half to even.
     */
    public IntPoint round() {
        return new IntPoint((int)Math.rint(x / w), (int)Math.rint(y / w));
    }

    public IntPoint truncate() {
        return new IntPoint((int)(x / w), (int)(y / w));
    }

    /**
     * Homogeneous form of {@link Point#collinear(Point, Point, Point)}.
     */
    public static boolean collinear(final HomogeneousPoint p1, final HomogeneousPoint p2, final HomogeneousPoint p3) {
        return Math.abs(((p1.y * p2.w) - (p1.w * p2.y)) * p3.x +
            ((p1.w * p2.x) - (p1.x * p2.w)) * p3.y +
            ((p1.x * p2.y) - (p1.y * p2.x)) * p3.w) < Point.FLOAT_EPSILON;
    }

    @Override
    public String toString() {
        return "HomogeneousPoint[ x=" + x + ", y=" + y + ", w=" + w + " ]";
    }

    @Override
    public int hashCode() {
        final float[] key = equivalenceKey();
        // + 0.0f folds -0.0f into 0.0f so the hash agrees with equals
        final int prime = 31;
        int result = isAtInfinity() ? 1 : 0;
        result = prime * result + Float.floatToIntBits(key[0] + 0.0f);
        result = prime * result + Float.floatToIntBits(key[1] + 0.0f);
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final HomogeneousPoint other = (HomogeneousPoint)obj;
        if(isAtInfinity() != other.isAtInfinity())
            return false;
        final float[] key = equivalenceKey();
        final float[] otherKey = other.equivalenceKey();
        return key[0] == otherKey[0] && key[1] == otherKey[1];
    }

    /**
     * (x/w, y/w) for a finite point. A point at infinity is a direction, so its (x, y) is divided
     * by whichever of x and y is larger in magnitude.
     */
    private float[] equivalenceKey() {
        if(!isAtInfinity())
            return new float[] {x / w,y / w};
        final float m = Math.abs(x) >= Math.abs(y) ? x : y;
        return m == 0.0f ? new float[] {0.0f,0.0f} : new float[] {x / m,y / m};
    }
}
