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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class PixelBufferTest {

    @Test
    public void testGeometry() {
        final PixelBuffer b = PixelBuffer.allocate(5, 3, 16, PixelFormat.BGR24);
        assertEquals(5, b.width());
        assertEquals(3, b.height());
        assertEquals(16, b.stride());
        assertEquals(3, b.bytesPerPixel());
        assertEquals(48, b.getNumBytes());
        assertEquals(16 + 6, b.offset(2, 1));
        assertTrue(b.contains(4, 2));
        assertFalse(b.contains(5, 2));
    }

    @Test(expected = PixelOutOfBoundsException.class)
    public void testStrideTooSmall() {
        new PixelBuffer(5, 3, 14, PixelFormat.BGR24, new byte[14 * 3]);
    }

    @Test(expected = PixelOutOfBoundsException.class)
    public void testBackingArrayTooShort() {
        new PixelBuffer(5, 3, 15, PixelFormat.BGR24, new byte[(15 * 3) - 1]);
    }

    @Test(expected = PixelOutOfBoundsException.class)
    public void testZeroWidth() {
        PixelBuffer.allocate(0, 3, PixelFormat.BGR24);
    }

    @Test(expected = NullPointerException.class)
    public void testNullFormat() {
        new PixelBuffer(1, 1, 3, null, new byte[3]);
    }

    @Test
    public void testAccessorsAreBoundsChecked() {
        final PixelBuffer b = PixelBuffer.allocate(4, 4, PixelFormat.BGR24);
        checkOutOfBounds(() -> b.channel(-1, 0, 0));
        checkOutOfBounds(() -> b.channel(4, 0, 0));
        checkOutOfBounds(() -> b.channel(0, 4, 0));
        checkOutOfBounds(() -> b.channel(0, 0, 3));
        checkOutOfBounds(() -> b.setChannel(0, 0, -1, 0));
        checkOutOfBounds(() -> b.offset(0, -1));
    }

    @Test
    public void testSetChannelClamps() {
        final PixelBuffer b = PixelBuffer.allocate(2, 2, PixelFormat.BGRA32);
        b.setChannel(1, 1, 3, 300);
        b.setChannel(1, 1, 0, -5);
        b.setChannel(1, 1, 1, 128);
        assertEquals(255, b.channel(1, 1, 3));
        assertEquals(0, b.channel(1, 1, 0));
        assertEquals(128, b.channel(1, 1, 1));
    }

    @Test
    public void testEqualityIgnoresPadding() {
        final PixelBuffer padded = ImageFixtures.random(7, 5, 3, PixelFormat.BGR24, 42L);
        final PixelBuffer tight = PixelBuffer.allocate(7, 5, PixelFormat.BGR24);
        for(int y = 0; y < 5; y++)
            for(int x = 0; x < 7; x++)
                for(int c = 0; c < 3; c++)
                    tight.setChannel(x, y, c, padded.channel(x, y, c));

        assertEquals(padded, tight);
        assertEquals(padded.hashCode(), tight.hashCode());

        tight.setChannel(6, 4, 2, tight.channel(6, 4, 2) ^ 0x01);
        assertNotEquals(padded, tight);
    }

    @Test
    public void testFourthByteEquality() {
        final PixelBuffer bgr32 = ImageFixtures.uniform(2, 2, PixelFormat.BGR32, 10, 20, 30);
        final PixelBuffer unused = bgr32.copy();
        unused.setChannel(1, 1, 3, 0);
        assertEquals(bgr32, unused);
        unused.setChannel(1, 1, 2, 31);
        assertNotEquals(bgr32, unused);

        // the fourth byte of BGRA32 is alpha and does count
        final PixelBuffer bgra32 = ImageFixtures.uniform(2, 2, PixelFormat.BGRA32, 10, 20, 30);
        final PixelBuffer alpha = bgra32.copy();
        alpha.setChannel(1, 1, 3, 0);
        assertNotEquals(bgra32, alpha);
    }

    @Test
    public void testCopyIsIndependent() {
        final PixelBuffer b = ImageFixtures.random(3, 3, 1, PixelFormat.BGR32, 7L);
        final PixelBuffer copy = b.copy();
        assertEquals(b, copy);
        copy.setChannel(0, 0, 0, b.channel(0, 0, 0) ^ 0xff);
        assertNotEquals(b, copy);
    }

    @Test
    public void testFormats() {
        assertEquals(PixelFormat.BGR24, PixelFormat.fromBitsPerPixel(24));
        assertEquals(PixelFormat.BGRA32, PixelFormat.fromBitsPerPixel(32));
        assertEquals(3, PixelFormat.supportedFormats().size());
        assertTrue(PixelFormat.BGR32.hasFourthByte());
        assertFalse(PixelFormat.BGR24.hasFourthByte());
        assertFalse(PixelFormat.GRAY8.isSupported());
        assertFalse(PixelFormat.BGRA64.isSupported());
        try {
            PixelFormat.fromBitsPerPixel(16);
            fail("16 bits per pixel shouldn't be supported");
        } catch(final UnsupportedPixelFormatException upfe) {
            // expected
        }
        try {
            PixelFormat.requireSupported(PixelFormat.BGR565);
            fail("BGR565 shouldn't be supported");
        } catch(final UnsupportedPixelFormatException upfe) {
            assertEquals(PixelFormat.BGR565, upfe.format);
        }
    }

    private static void checkOutOfBounds(final Runnable r) {
        try {
            r.run();
            fail("Expected a " + PixelOutOfBoundsException.class.getSimpleName());
        } catch(final PixelOutOfBoundsException expected) {
            // expected
        }
    }
}
