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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Computes a {@link GradientField} from a {@link GreyscaleImage} using the fixed 3x3 Sobel pair. For the
 * neighborhood {@code n[0..8]} of an interior pixel, in row-major order with {@code n[4]} at the center:
 * </p>
 *
 * <pre>
 * dx = n2 + 2*n5 + n8 - n0 - 2*n3 - n6
 * dy = n6 + 2*n7 + n8 - n0 - 2*n1 - n2
 * </pre>
 *
 * <p>
 * Only interior pixels are evaluated so a neighborhood never runs off of the image.
 * </p>
 */
public class GradientOperator {
    private static final Logger LOGGER = LoggerFactory.getLogger(GradientOperator.class);

    public static GradientField gradient(final GreyscaleImage image) {
        final int width = image.width();
        final int height = image.height();
        final int numPixels = width * height;
        final byte[] src = image.underlying();
        LOGGER.debug("calculating the gradient of {}", image);

        final int[] dxs = new int[numPixels];
        final int[] dys = new int[numPixels];
        final double[] magnitude = new double[numPixels];
        final double[] orientation = new double[numPixels];
        Arrays.fill(orientation, Double.NaN);

        for(int y = 1; y < height - 1; y++) {
            for(int x = 1; x < width - 1; x++) {
                final int above = ((y - 1) * width) + x;
                final int center = (y * width) + x;
                final int below = ((y + 1) * width) + x;

                final int n0 = src[above - 1] & 0xff;
                final int n1 = src[above] & 0xff;
                final int n2 = src[above + 1] & 0xff;
                final int n3 = src[center - 1] & 0xff;
                final int n5 = src[center + 1] & 0xff;
                final int n6 = src[below - 1] & 0xff;
                final int n7 = src[below] & 0xff;
                final int n8 = src[below + 1] & 0xff;

                final int dx = n2 + (2 * n5) + n8 - n0 - (2 * n3) - n6;
                final int dy = n6 + (2 * n7) + n8 - n0 - (2 * n1) - n2;

                dxs[center] = dx;
                dys[center] = dy;
                magnitude[center] = Math.sqrt((double)(dx * dx) + (double)(dy * dy));
                orientation[center] = Math.atan2(dy, dx) + Math.PI;
            }
        }

        return new GradientField(width, height, dxs, dys, magnitude, orientation);
    }

    /**
     * The Sobel edge image of a color buffer: greyscale, gradient, then the magnitude as a byte per pixel.
     */
    public static GreyscaleImage sobel(final PixelBuffer buffer) {
        return gradient(GreyscaleConverter.toGrey(buffer)).magnitudeImage();
    }

    public static GreyscaleImage sobel(final ImageSource image) {
        return gradient(GreyscaleConverter.toGrey(image)).magnitudeImage();
    }
}
