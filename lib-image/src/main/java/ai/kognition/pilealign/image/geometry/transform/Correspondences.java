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

import ai.kognition.pilealign.image.ArgumentMismatchException;
import ai.kognition.pilealign.image.geometry.IntPoint;

/**
 * Index aligned points from two images. {@code points1[i]} matches {@code points2[i]}.
 */
public class Correspondences {
    public static final Correspondences EMPTY = new Correspondences(new IntPoint[0], new IntPoint[0]);

    public final IntPoint[] points1;
    public final IntPoint[] points2;

    /**
     * @throws ArgumentMismatchException if the arrays differ in length.
     */
    public Correspondences(final IntPoint[] points1, final IntPoint[] points2) {
        if(points1.length != points2.length)
            throw new ArgumentMismatchException("The number of points should be equal but there are " + points1.length + " and " + points2.length);
        this.points1 = points1;
        this.points2 = points2;
    }

    public int size() {
        return points1.length;
    }

    public boolean isEmpty() {
        return points1.length == 0;
    }

    public ControlPoint get(final int index) {
        return new ControlPoint(points1[index], points2[index]);
    }

    /**
     * The correspondences at the given indices, in the order given.
     */
    public Correspondences subset(final int[] indices) {
        final IntPoint[] p1 = new IntPoint[indices.length];
        final IntPoint[] p2 = new IntPoint[indices.length];
        for(int i = 0; i < indices.length; i++) {
            p1[i] = points1[indices[i]];
            p2[i] = points2[indices[i]];
        }
        return new Correspondences(p1, p2);
    }

    @Override
    public String toString() {
        return "Correspondences [size=" + points1.length + "]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + Arrays.hashCode(points1);
        result = prime * result + Arrays.hashCode(points2);
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final Correspondences other = (Correspondences)obj;
        return Arrays.equals(points1, other.points1) && Arrays.equals(points2, other.points2);
    }
}
