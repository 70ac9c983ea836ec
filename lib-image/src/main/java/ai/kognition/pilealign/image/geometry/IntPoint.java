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
 * An integer pixel coordinate. {@code x} is the column and {@code y} is the row.
 */
public class IntPoint {
    public final int x;
    public final int y;

    public IntPoint(final int x, final int y) {
        this.x = x;
        this.y = y;
    }

    public int distanceSquared(final IntPoint other) {
        final int dx = x - other.x;
        final int dy = y - other.y;
        return (dx * dx) + (dy * dy);
    }

    public Point toPoint() {
        return new SimplePoint(x, y);
    }

    @Override
    public String toString() {
        return "IntPoint[ x=" + x + ", y=" + y + " ]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + x;
        result = prime * result + y;
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final IntPoint other = (IntPoint)obj;
        if(x != other.x) return false;
        if(y != other.y) return false;
        return true;
    }
}
