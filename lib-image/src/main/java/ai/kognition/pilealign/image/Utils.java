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

import static java.awt.image.BufferedImage.TYPE_3BYTE_BGR;
import static java.awt.image.BufferedImage.TYPE_4BYTE_ABGR;
import static java.awt.image.BufferedImage.TYPE_4BYTE_ABGR_PRE;
import static java.awt.image.BufferedImage.TYPE_BYTE_GRAY;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Utils {
    private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

    /**
     * <p>
     * Copy the pixels of a {@link BufferedImage} into a tightly packed {@link ByteRaster}.
     * </p>
     *
     * <p>
     * {@link BufferedImage#TYPE_BYTE_GRAY} results in a single channel raster,
     * {@link BufferedImage#TYPE_4BYTE_ABGR} (and its premultiplied variant) in a 4 channel BGRA
     * raster. Everything else is converted to a 3 channel BGR raster.
     * </p>
     */
    public static ByteRaster img2Raster(final BufferedImage bufferedImage) {
        final int w = bufferedImage.getWidth();
        final int h = bufferedImage.getHeight();
        final int type = bufferedImage.getType();

        final DataBuffer dataBuffer = bufferedImage.getRaster().getDataBuffer();
        final boolean direct = dataBuffer instanceof DataBufferByte && bufferedImage.getRaster().getParent() == null;

        switch(type) {
            case TYPE_BYTE_GRAY: {
                final ByteRaster ret = ByteRaster.create(w, h, 1);
                if(direct)
                    System.arraycopy(((DataBufferByte)dataBuffer).getData(), 0, ret.data(), 0, w * h);
                else
                    bufferedImage.getRaster().getDataElements(0, 0, w, h, ret.data());
                return ret;
            }
            case TYPE_3BYTE_BGR:
                if(direct) {
                    final ByteRaster ret = ByteRaster.create(w, h, 3);
                    System.arraycopy(((DataBufferByte)dataBuffer).getData(), 0, ret.data(), 0, w * h * 3);
                    return ret;
                }
                break;
            case TYPE_4BYTE_ABGR:
            case TYPE_4BYTE_ABGR_PRE:
                if(direct) {
                    // ABGR -> BGRA
                    final byte[] src = ((DataBufferByte)dataBuffer).getData();
                    final ByteRaster ret = ByteRaster.create(w, h, 4);
                    final byte[] dst = ret.data();
                    for(int i = 0; i < w * h * 4; i += 4) {
                        dst[i] = src[i + 1];
                        dst[i + 1] = src[i + 2];
                        dst[i + 2] = src[i + 3];
                        dst[i + 3] = src[i];
                    }
                    return ret;
                }
                break;
            default:
                break;
        }

        LOGGER.trace("Converting a BufferedImage of type {} through its RGB color model", type);
        final ByteRaster ret = ByteRaster.create(w, h, 3);
        for(int y = 0; y < h; y++) {
            for(int x = 0; x < w; x++) {
                final int rgb = bufferedImage.getRGB(x, y);
                ret.set(x, y, 0, rgb & 0xff);
                ret.set(x, y, 1, (rgb >> 8) & 0xff);
                ret.set(x, y, 2, (rgb >> 16) & 0xff);
            }
        }
        return ret;
    }

    /**
     * Copy a 1, 3 or 4 channel raster into a {@link BufferedImage} of type
     * {@link BufferedImage#TYPE_BYTE_GRAY}, {@link BufferedImage#TYPE_3BYTE_BGR} or
     * {@link BufferedImage#TYPE_4BYTE_ABGR}.
     */
    public static BufferedImage raster2Img(final ImageRaster raster) {
        final int w = raster.width();
        final int h = raster.height();
        final int channels = raster.channels();
        final BufferedImage out;
        switch(channels) {
            case 1:
                out = new BufferedImage(w, h, TYPE_BYTE_GRAY);
                break;
            case 3:
                out = new BufferedImage(w, h, TYPE_3BYTE_BGR);
                break;
            case 4:
                out = new BufferedImage(w, h, TYPE_4BYTE_ABGR);
                break;
            default:
                throw new UnsupportedFormatException("Can't create a BufferedImage from a raster with " + channels + " channels per pixel.");
        }

        final byte[] dst = ((DataBufferByte)out.getRaster().getDataBuffer()).getData();
        int index = 0;
        for(int y = 0; y < h; y++) {
            for(int x = 0; x < w; x++) {
                if(channels == 4) {
                    dst[index++] = (byte)raster.get(x, y, 3);
                    for(int c = 0; c < 3; c++)
                        dst[index++] = (byte)raster.get(x, y, c);
                } else {
                    for(int c = 0; c < channels; c++)
                        dst[index++] = (byte)raster.get(x, y, c);
                }
            }
        }
        return out;
    }
}
