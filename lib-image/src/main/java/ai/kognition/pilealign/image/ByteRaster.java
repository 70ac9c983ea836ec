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

import java.util.Arrays;

/**
 * An {@link ImageRaster} backed by a byte array.
 */
public class ByteRaster implements ImageRaster {
    private final byte[] data;
    private final int width;
    private final int height;
    private final int stride;
    private final int channels;

    public ByteRaster(final byte[] data, final int width, final int height, final int stride, final int channels) {
        if(width < 0 || height < 0)
            throw new IllegalArgumentException("Invalid raster dimensions " + width + "x" + height);
        if(channels < 1)
            throw new IllegalArgumentException("A raster needs at least one channel but " + channels + " were given");
        if(stride < width * channels)
            throw new IllegalArgumentException("The stride " + stride + " can't hold " + width + " pixels of " + channels + " bytes");
        if(data.length < stride * height)
            throw new IllegalArgumentException("Raster data of " + data.length + " bytes is too small for " + height + " rows of " + stride + " bytes");

        this.data = data;
        this.width = width;
        this.height = height;
        this.stride = stride;
        this.channels = channels;
    }

    /**
     * A tightly packed raster.
     */
    public ByteRaster(final byte[] data, final int width, final int height, final int channels) {
        this(data, width, height, width * channels, channels);
    }

    /**
     * A zeroed, tightly packed raster.
     */
    public static ByteRaster create(final int width, final int height, final int channels) {
        return new ByteRaster(new byte[width * height * channels], width, height, channels);
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int stride() {
        return stride;
    }

    @Override
    public int channels() {
        return channels;
    }

    @Override
    public int get(final int x, final int y, final int channel) {
        return data[(y * stride) + (x * channels) + channel] & 0xff;
    }

    public void set(final int x, final int y, final int channel, final int value) {
        data[(y * stride) + (x * channels) + channel] = (byte)value;
    }

    public void set(final int x, final int y, final int value) {
        set(x, y, 0, value);
    }

    /**
     * The backing array. Changes write through to the raster.
     */
    public byte[] data() {
        return data;
    }

    @Override
    public String toString() {
        return "ByteRaster [width=" + width + ", height=" + height + ", stride=" + stride + ", channels=" + channels + "]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + channels;
        result = prime * result + height;
        result = prime * result + width;
        return result;
    }

    /**
     * Two rasters are equal when they have the same dimensions and pixels. Row padding is ignored.
     */
    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final ByteRaster other = (ByteRaster)obj;
        if(channels != other.channels || height != other.height || width != other.width) return false;
        final int rowBytes = width * channels;
        for(int y = 0; y < height; y++) {
            if(!Arrays.equals(data, y * stride, y * stride + rowBytes, other.data, y * other.stride, y * other.stride + rowBytes))
                return false;
        }
        return true;
    }
}
