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
 * <p>
 * Applies an odd sized square {@link Kernel} to a multi-channel {@link PixelBuffer} or a single channel
 * {@link GreyscaleImage}. The output has the same dimensions, format and stride as the input.
 * </p>
 *
 * <p>
 * For each output pixel (x, y) and each color channel the engine accumulates
 * {@code kernel(u, v) * pixel(x + u - radius, y + v - radius)} over the taps that land inside the buffer.
 * Taps that fall off the buffer are skipped and the result is normalized by the sum of only the weights that
 * were actually used, so pixels near the border are normalized against a partial kernel. When the weights used
 * sum to zero (as with the Sobel kernels) the accumulated value is used as is. The result is rounded
 * ({@code floor(value + 0.5)}) and clamped to [0, 255].
 * </p>
 *
 * <p>
 * Alpha (or the unused fourth byte of a 32 bit format) is never convolved. It's set to 255 in the output.
 * </p>
 */
public class ConvolutionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConvolutionEngine.class);

    /**
     * Convolve using the kernel's own radius, which centers the kernel on each output pixel.
     */
    public static PixelBuffer convolve(final PixelBuffer buffer, final Kernel kernel) {
        return convolve(buffer, kernel, kernel.radius());
    }

    /**
     * Validates {@code weights} and convolves with them.
     *
     * @throws InvalidKernelException if {@code weights} isn't square or has an even side length. This is
     *     checked before any pixel is touched.
     */
    public static PixelBuffer convolve(final PixelBuffer buffer, final double[][] weights, final int radius) {
        return convolve(buffer, new Kernel(weights), radius);
    }

    /**
     * Convolve where {@code radius} is the offset subtracted from the tap indices. Using anything other than
     * {@code kernel.radius()} shifts the kernel off center.
     *
     * @throws InvalidKernelException if the radius is negative.
     * @throws UnsupportedPixelFormatException if the buffer isn't one of the supported formats.
     */
    public static PixelBuffer convolve(final PixelBuffer buffer, final Kernel kernel, final int radius) {
        checkRadius(kernel, radius);
        final PixelFormat format = PixelFormat.requireSupported(buffer.format());
        LOGGER.debug("convolving {} with a {}x{} kernel at radius {}", buffer, kernel.size(), kernel.size(), radius);

        final PixelBuffer ret = PixelBuffer.allocate(buffer.width(), buffer.height(), buffer.stride(), format);
        convolve(buffer.underlying(), buffer.stride(), buffer.width(), buffer.height(), format.bytesPerPixel, format.colorChannels,
            format.hasFourthByte(), kernel, radius, ret.underlying());
        return ret;
    }

    public static GreyscaleImage convolve(final GreyscaleImage image, final Kernel kernel) {
        return convolve(image, kernel, kernel.radius());
    }

    public static GreyscaleImage convolve(final GreyscaleImage image, final Kernel kernel, final int radius) {
        checkRadius(kernel, radius);
        LOGGER.debug("convolving {} with a {}x{} kernel at radius {}", image, kernel.size(), kernel.size(), radius);

        final GreyscaleImage ret = GreyscaleImage.allocate(image.width(), image.height());
        convolve(image.underlying(), image.width(), image.width(), image.height(), 1, 1, false, kernel, radius, ret.underlying());
        return ret;
    }

    /**
     * Convolve the pixels of an image. They're acquired read only for the duration of the convolution.
     */
    public static PixelBuffer convolve(final ImageSource image, final Kernel kernel) {
        PixelFormat.requireSupported(image.pixelFormat());
        return PixelAccess.read(image, buffer -> convolve(buffer, kernel));
    }

    /**
     * Convolve the pixels of an image and write the result back into it.
     */
    public static void convolveInPlace(final ImageSource image, final Kernel kernel) {
        final PixelBuffer result = convolve(image, kernel);
        PixelAccess.write(image, result);
    }

    private static void checkRadius(final Kernel kernel, final int radius) {
        if(kernel == null)
            throw new NullPointerException("Can't convolve without a kernel");
        if(radius < 0)
            throw new InvalidKernelException("The kernel radius can't be negative (" + radius + ")");
    }

    private static void convolve(final byte[] src, final int stride, final int width, final int height, final int bytesPerPixel,
        final int colorChannels, final boolean fourthByte, final Kernel kernel, final int radius, final byte[] dst) {
        final int kernelSize = kernel.size();
        final double[] totals = new double[colorChannels];

        for(int y = 0; y < height; y++) {
            for(int x = 0; x < width; x++) {
                for(int c = 0; c < colorChannels; c++)
                    totals[c] = 0.0;
                double kernelTotal = 0.0;

                for(int v = 0; v < kernelSize; v++) {
                    final int cY = y + v - radius;
                    if(cY < 0 || cY > height - 1)
                        continue;
                    for(int u = 0; u < kernelSize; u++) {
                        final int cX = x + u - radius;
                        // taps off of the image don't participate, including in the normalizer
                        if(cX < 0 || cX > width - 1)
                            continue;

                        final double w = kernel.weight(u, v);
                        final int pixel = (cY * stride) + (cX * bytesPerPixel);
                        for(int c = 0; c < colorChannels; c++)
                            totals[c] += (src[pixel + c] & 0xff) * w;
                        kernelTotal += w;
                    }
                }

                final int location = (y * stride) + (x * bytesPerPixel);
                for(int c = 0; c < colorChannels; c++)
                    dst[location + c] = round(totals[c], kernelTotal);
                if(fourthByte)
                    dst[location + 3] = (byte)0xff;
            }
        }
    }

    static byte round(final double total, final double kernelTotal) {
        final double value = (kernelTotal == 0.0) ? total : (total / kernelTotal);
        return PixelBuffer.clampToByte((int)Math.floor(value + 0.5));
    }
}
