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

package ai.kognition.pixelfilter.image;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import org.junit.Test;

public class GreyscaleConverterTest {

    @Test
    public void testWhiteAndBlack() {
        for(final PixelFormat format: PixelFormat.supportedFormats()) {
            final GreyscaleImage white = GreyscaleConverter.toGrey(ImageFixtures.uniform(5, 4, format, 255, 255, 255));
            final GreyscaleImage black = GreyscaleConverter.toGrey(ImageFixtures.uniform(5, 4, format, 0, 0, 0));
            assertEquals(20, white.underlying().length);
            for(final byte b: white.underlying())
                assertEquals(format.name(), 255, b & 0xff);
            for(final byte b: black.underlying())
                assertEquals(format.name(), 0, b);
        }
    }

    @Test
    public void testLuma() {
        // 1.1 + 11.8 + 9.0
        assertEquals(22, GreyscaleConverter.luma(10, 20, 30));
        // 28.05
        assertEquals(28, GreyscaleConverter.luma(255, 0, 0));
        // 150.45
        assertEquals(150, GreyscaleConverter.luma(0, 255, 0));
        assertEquals(60, GreyscaleConverter.luma(0, 0, 200));
    }

    @Test
    public void testChannelOrderAndPadding() {
        final PixelBuffer b = PixelBuffer.allocate(2, 2, 11, PixelFormat.BGRA32);
        // garbage in the padding and the alpha
        for(int i = 0; i < b.getNumBytes(); i++)
            b.underlying()[i] = (byte)0x5a;
        b.setChannel(0, 0, 0, 255);
        b.setChannel(0, 0, 1, 0);
        b.setChannel(0, 0, 2, 0);
        b.setChannel(1, 1, 0, 10);
        b.setChannel(1, 1, 1, 20);
        b.setChannel(1, 1, 2, 30);
        b.setChannel(1, 1, 3, 0);

        final GreyscaleImage grey = GreyscaleConverter.toGrey(b);
        assertEquals(28, grey.get(0, 0));
        assertEquals(22, grey.get(1, 1));
        assertEquals(GreyscaleConverter.luma(0x5a, 0x5a, 0x5a), grey.get(1, 0));
    }

    @Test(expected = UnsupportedPixelFormatException.class)
    public void testUnsupportedFormat() {
        GreyscaleConverter.toGrey(PixelBuffer.allocate(2, 2, PixelFormat.BGR565));
    }

    @Test
    public void testToPixelBuffer() {
        final GreyscaleImage grey = ImageFixtures.grey(new int[][] {{0,128},{255,7}});
        final PixelBuffer b = GreyscaleConverter.toPixelBuffer(grey, PixelFormat.BGR32);
        for(int c = 0; c < 3; c++) {
            assertEquals(128, b.channel(1, 0, c));
            assertEquals(255, b.channel(0, 1, c));
        }
        assertEquals(255, b.channel(0, 0, 3));
        assertEquals(grey, GreyscaleConverter.toGrey(b));
    }

    @Test
    public void testPaint() {
        final MemoryImage image = new MemoryImage(ImageFixtures.random(3, 2, 0, PixelFormat.BGR24, 5L));
        final GreyscaleImage grey = GreyscaleConverter.toGrey(image);
        assertFalse(image.isLocked());

        GreyscaleConverter.paint(image, grey);
        assertFalse(image.isLocked());
        assertEquals(grey, GreyscaleConverter.toGrey(image));
        final byte[] bytes = image.bytes();
        final int pixel = image.stride() + 3;
        assertEquals(bytes[pixel], bytes[pixel + 1]);
        assertEquals(bytes[pixel], bytes[pixel + 2]);
        assertEquals(grey.get(1, 1), bytes[pixel] & 0xff);
    }

    @Test
    public void testPaintMismatch() {
        final MemoryImage image = new MemoryImage(3, 3, PixelFormat.BGR24);
        try {
            GreyscaleConverter.paint(image, GreyscaleImage.allocate(2, 3));
            fail("painting a mismatched image should fail");
        } catch(final PixelOutOfBoundsException expected) {
            // expected
        }
        assertFalse(image.isLocked());
    }
}
