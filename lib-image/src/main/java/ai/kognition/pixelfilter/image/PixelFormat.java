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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Describes the layout of one pixel in a {@link PixelBuffer}. Color channels are always stored in B,G,R
 * order. Only the {@link #isSupported() supported} formats can be handed to the engine. The others exist so
 * that an {@link ImageSource} can describe what it holds and be rejected at the boundary.
 */
public enum PixelFormat {
    /**
     * One byte of grey per pixel.
     */
    GRAY8(8, 1, false, false),
    /**
     * 16-bit packed 5-6-5 color.
     */
    BGR565(16, 3, false, false),
    /**
     * 3 bytes per pixel, B,G,R.
     */
    BGR24(24, 3, false, true),
    /**
     * 4 bytes per pixel, B,G,R and an unused byte.
     */
    BGR32(32, 3, false, true),
    /**
     * 4 bytes per pixel, B,G,R,A.
     */
    BGRA32(32, 3, true, true),
    /**
     * 16 bits per channel B,G,R,A.
     */
    BGRA64(64, 3, true, false);

    public final int bitsPerPixel;
    public final int bytesPerPixel;
    public final int colorChannels;
    public final boolean hasAlpha;
    private final boolean supported;

    private PixelFormat(final int bitsPerPixel, final int colorChannels, final boolean hasAlpha, final boolean supported) {
        this.bitsPerPixel = bitsPerPixel;
        this.bytesPerPixel = bitsPerPixel / 8;
        this.colorChannels = colorChannels;
        this.hasAlpha = hasAlpha;
        this.supported = supported;
    }

    public boolean isSupported() {
        return supported;
    }

    /**
     * Whether or not pixels have a fourth byte after B,G,R. Any engine stage that writes such a
     * pixel sets that byte to 255.
     */
    public boolean hasFourthByte() {
        return supported && bytesPerPixel == 4;
    }

    /**
     * Throws an {@link UnsupportedPixelFormatException} unless the format can be processed.
     */
    public static PixelFormat requireSupported(final PixelFormat format) {
        if(format == null || !format.supported)
            throw new UnsupportedPixelFormatException(format);
        return format;
    }

    /**
     * Map a bits-per-pixel value to the supported format with that depth. 32 bits maps to {@link #BGRA32}.
     */
    public static PixelFormat fromBitsPerPixel(final int bitsPerPixel) {
        switch(bitsPerPixel) {
            case 24:
                return BGR24;
            case 32:
                return BGRA32;
            default:
                throw new UnsupportedPixelFormatException(null, "Pixel format with " + bitsPerPixel + " bits per pixel is not supported.");
        }
    }

    public static List<PixelFormat> supportedFormats() {
        return Arrays.stream(values())
            .filter(PixelFormat::isSupported)
            .collect(Collectors.toList());
    }
}
