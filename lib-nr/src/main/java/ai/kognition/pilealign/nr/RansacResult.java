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

import java.util.Arrays;

/**
 * What a {@link Ransac} run found. When no sample reached the minimum number of inliers
 * then {@link #hasModel()} is false, the {@code model} is null and the {@code inliers} are empty.
 */
public class RansacResult<M> {
    private static final int[] NONE = new int[0];

    public final M model;
    public final int[] inliers;
    public final int trials;

    private RansacResult(final M model, final int[] inliers, final int trials) {
        this.model = model;
        this.inliers = inliers;
        this.trials = trials;
    }

    public static <M> RansacResult<M> consensus(final M model, final int[] inliers, final int trials) {
        return new RansacResult<>(model, inliers, trials);
    }

    public static <M> RansacResult<M> noConsensus(final int trials) {
        return new RansacResult<>(null, NONE, trials);
    }

    public boolean hasModel() {
        return model != null;
    }

    @Override
    public String toString() {
        return "RansacResult [model=" + model + ", inliers=" + Arrays.toString(inliers) + ", trials=" + trials + "]";
    }
}
