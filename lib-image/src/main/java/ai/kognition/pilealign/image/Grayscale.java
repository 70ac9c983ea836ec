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
 * Reduces a BGR or BGRA raster to a single channel using the ITU-R BT.709 luma weights. Alpha is
 * ignored.
 */
public class Grayscale {
    public static final double RED = 0.2125;
    public static final double GREEN = 0.7154;
    public static final double BLUE = 0.0721;

    /**
     * Returns {@code image} itself if it's already single channel.
     *
     * @throws UnsupportedFormatException if the image doesn't have 1, 3 or 4 channels.
     */
    public static ImageRaster toGray(final ImageRaster image) {
        final int channels = image.channels();
        if(channels == 1)
            return image;
        if(channels != 3 && channels != 4)
            throw new UnsupportedFormatException("Can't convert an image with " + channels + " channels per pixel to grayscale.");

        final int width = image.width();
        final int height = image.height();
        final ByteRaster ret = ByteRaster.create(width, height, 1);
        for(int y = 0; y < height; y++) {
            for(int x = 0; x < width; x++) {
                ret.set(x, y, (int)(RED * image.get(x, y, 2) + GREEN * image.get(x, y, 1) + BLUE * image.get(x, y, 0)));
            }
        }
        return ret;
    }

    /**
     * Fails with {@link UnsupportedFormatException} unless the image has 1, 3 or 4 channels.
     */
    public static void checkSupported(final ImageRaster image) {
        final int channels = image.channels();
        if(channels != 1 && channels != 3 && channels != 4)
            throw new UnsupportedFormatException("Images with " + channels + " channels per pixel are not supported. Only 1, 3 or 4 are.");
    }
}
