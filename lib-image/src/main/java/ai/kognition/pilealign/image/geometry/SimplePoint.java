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
 * An immutable single precision {@link Point}.
 */
public class SimplePoint implements Point {
    private final float x;
    private final float y;

    public SimplePoint(final float x, final float y) {
        this.x = x;
        this.y = y;
    }

    /**
     * The perspective divide of the homogeneous coordinate (x, y, w).
     *
     * @throws NumericSingularityException if w is 0 since the coordinate is then a point at infinity.
     */
    public static SimplePoint divide(final float x, final float y, final float w) {
        if(w == 0.0f)
            throw new NumericSingularityException("Can't perspective divide the point at infinity (" + x + ", " + y + ", 0)");
        return new SimplePoint(x / w, y / w);
    }

    @Override
    public double x() {
        return x;
    }

    @Override
    public double y() {
        return y;
    }

    @Override
    public String toString() {
        return Point.toString(this);
    }

    @Override
    public int hashCode() {
        // -0.0f and 0.0f are the same point
        return 31 * Float.hashCode(x + 0.0f) + Float.hashCode(y + 0.0f);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final SimplePoint other = (SimplePoint)obj;
        return x == other.x && y == other.y;
    }
}
