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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import java.awt.image.BufferedImage;

import org.junit.Test;

public class TestUtils {

    private static ByteRaster pattern(final int width, final int height, final int channels) {
        final ByteRaster ret = ByteRaster.create(width, height, channels);
        for(int y = 0; y < height; y++) {
            for(int x = 0; x < width; x++) {
                for(int c = 0; c < channels; c++)
                    ret.set(x, y, c, (x * 31 + y * 17 + c * 71) & 0xff);
            }
        }
        return ret;
    }

    @Test
    public void testRasterToImageAndBack() throws Exception {
        for(final int channels: new int[] {1,3,4}) {
            final ByteRaster raster = pattern(13, 7, channels);
            final BufferedImage img = Utils.raster2Img(raster);
            assertEquals(13, img.getWidth());
            assertEquals(7, img.getHeight());
            assertEquals(raster, Utils.img2Raster(img));
        }
    }

    @Test
    public void testBgrChannelOrder() throws Exception {
        final BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        img.setRGB(0, 0, 0x102030);
        img.setRGB(1, 0, 0xff0080);

        final ByteRaster raster = Utils.img2Raster(img);
        assertEquals(3, raster.channels());
        assertEquals(0x30, raster.get(0, 0, 0));
        assertEquals(0x20, raster.get(0, 0, 1));
        assertEquals(0x10, raster.get(0, 0, 2));
        assertEquals(0x80, raster.get(1, 0, 0));
        assertEquals(0xff, raster.get(1, 0, 2));
    }

    @Test
    public void testSubimage() throws Exception {
        final ByteRaster raster = pattern(10, 10, 1);
        final BufferedImage sub = Utils.raster2Img(raster).getSubimage(2, 3, 4, 5);
        final ByteRaster subRaster = Utils.img2Raster(sub);
        assertEquals(4, subRaster.width());
        assertEquals(5, subRaster.height());
        assertEquals(raster.get(2, 3), subRaster.get(0, 0));
        assertEquals(raster.get(5, 7), subRaster.get(3, 4));
    }

    @Test
    public void testGrayscale() throws Exception {
        final ByteRaster color = ByteRaster.create(1, 1, 3);
        color.set(0, 0, 0, 10);
        color.set(0, 0, 1, 100);
        color.set(0, 0, 2, 200);

        final ImageRaster gray = Grayscale.toGray(color);
        assertEquals(1, gray.channels());
        assertEquals((int)(Grayscale.RED * 200 + Grayscale.GREEN * 100 + Grayscale.BLUE * 10), gray.get(0, 0));

        final ByteRaster alreadyGray = ByteRaster.create(3, 3, 1);
        assertSame(alreadyGray, Grayscale.toGray(alreadyGray));
        assertThrows(UnsupportedFormatException.class, () -> Grayscale.toGray(ByteRaster.create(3, 3, 2)));
    }

    @Test
    public void testByteRaster() throws Exception {
        final byte[] data = new byte[3 * 10];
        // row 1, column 1, channel 1
        data[10 + 2 + 1] = (byte)200;
        final ByteRaster raster = new ByteRaster(data, 2, 3, 10, 2);
        assertEquals(200, raster.get(1, 1, 1));
        assertEquals(0, raster.get(1, 1, 0));
        assertEquals(10, raster.stride());
        assertEquals(raster, new ByteRaster(data.clone(), 2, 3, 10, 2));

        assertThrows(IllegalArgumentException.class, () -> new ByteRaster(new byte[5], 2, 3, 10, 2));
        assertThrows(IllegalArgumentException.class, () -> new ByteRaster(new byte[60], 6, 3, 10, 2));
        assertThrows(IllegalArgumentException.class, () -> new ByteRaster(new byte[60], 2, 3, 10, 0));
    }
}
