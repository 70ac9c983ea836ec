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

package ai.kognition.pilealign.image;

/**
 * Read-only access to an 8-bit-per-channel image. Pixels are packed in rows of {@link #stride()}
 * bytes, which may be more than {@code width() * channels()}. Multi-channel pixels are stored in
 * BGR (or BGRA) order.
 */
public interface ImageRaster {

    public int width();

    public int height();

    /**
     * Number of bytes from the start of one row to the start of the next.
     */
    public int stride();

    /**
     * Bytes per pixel.
     */
    public int channels();

    /**
     * The unsigned (0-255) value of the given channel of the pixel at column x, row y.
     */
    public int get(int x, int y, int channel);

    default public int get(final int x, final int y) {
        return get(x, y, 0);
    }
}
