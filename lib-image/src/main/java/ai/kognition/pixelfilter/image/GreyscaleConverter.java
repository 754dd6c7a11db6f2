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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces color pixels to a single luma byte using {@code round(B * 0.11 + G * 0.59 + R * 0.30)}. These
 * weights are part of the contract and aren't the more common 0.114/0.587/0.299.
 */
public class GreyscaleConverter {
    private static final Logger LOGGER = LoggerFactory.getLogger(GreyscaleConverter.class);

    public static final double BLUE_WEIGHT = 0.11;
    public static final double GREEN_WEIGHT = 0.59;
    public static final double RED_WEIGHT = 0.30;

    public static int luma(final int b, final int g, final int r) {
        final int ret = (int)Math.floor((b * BLUE_WEIGHT) + (g * GREEN_WEIGHT) + (r * RED_WEIGHT) + 0.5);
        return ret > 0xff ? 0xff : ret;
    }

    /**
     * @throws UnsupportedPixelFormatException if the buffer isn't one of the supported formats.
     */
    public static GreyscaleImage toGrey(final PixelBuffer buffer) {
        final PixelFormat format = PixelFormat.requireSupported(buffer.format());
        LOGGER.debug("converting {} to greyscale", buffer);

        final int width = buffer.width();
        final int height = buffer.height();
        final int stride = buffer.stride();
        final int bpp = format.bytesPerPixel;
        final byte[] src = buffer.underlying();
        final byte[] dst = new byte[width * height];

        for(int y = 0; y < height; y++) {
            final int row = y * stride;
            for(int x = 0; x < width; x++) {
                final int pixel = row + (x * bpp);
                // BGR order
                dst[(y * width) + x] = (byte)luma(src[pixel] & 0xff, src[pixel + 1] & 0xff, src[pixel + 2] & 0xff);
            }
        }

        return new GreyscaleImage(width, height, dst);
    }

    /**
     * Convert the pixels of an image. They're acquired read only for the duration of the conversion.
     */
    public static GreyscaleImage toGrey(final ImageSource image) {
        PixelFormat.requireSupported(image.pixelFormat());
        return PixelAccess.read(image, GreyscaleConverter::toGrey);
    }

    /**
     * Expand a single channel image into a color buffer by copying each value into B, G and R. The fourth
     * byte of a 32 bit format is set to 255.
     */
    public static PixelBuffer toPixelBuffer(final SingleChannelImage image, final PixelFormat format) {
        PixelFormat.requireSupported(format);
        final PixelBuffer ret = PixelBuffer.allocate(image.width(), image.height(), format);
        fill(image, ret);
        return ret;
    }

    /**
     * Replace the pixels of an image with the values of a single channel image of the same dimensions.
     * Useful to write a greyscale conversion or an {@link EdgeMap} back into the image it came from.
     */
    public static void paint(final ImageSource image, final SingleChannelImage values) {
        PixelFormat.requireSupported(image.pixelFormat());
        if(image.width() != values.width() || image.height() != values.height())
            throw new PixelOutOfBoundsException("Can't paint a " + values.width() + "x" + values.height() + " image into a " + image.width() + "x"
                + image.height() + " image");
        PixelAccess.readWrite(image, dest -> fill(values, dest));
    }

    private static void fill(final SingleChannelImage image, final PixelBuffer dest) {
        final PixelFormat format = dest.format();
        final int bpp = format.bytesPerPixel;
        final boolean fourthByte = format.hasFourthByte();
        final int width = image.width();
        final byte[] src = image.underlying();
        final byte[] dst = dest.underlying();

        for(int y = 0; y < image.height(); y++) {
            final int row = y * dest.stride();
            for(int x = 0; x < width; x++) {
                final byte v = src[(y * width) + x];
                final int pixel = row + (x * bpp);
                dst[pixel] = v;
                dst[pixel + 1] = v;
                dst[pixel + 2] = v;
                if(fourthByte)
                    dst[pixel + 3] = (byte)0xff;
            }
        }
    }
}
