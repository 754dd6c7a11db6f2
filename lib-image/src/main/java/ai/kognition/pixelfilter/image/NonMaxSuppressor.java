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
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Thins a gradient magnitude field down to ridges one pixel wide. Each interior pixel's orientation is
 * quantized to the nearest of the labeled {@link #directions()} (in degrees) and the pixel is kept
 * only when its magnitude is strictly greater than both neighbors compared for that direction:
 * </p>
 *
 * <ul>
 * <li>0, 180, 360: east (n5) and west (n3)</li>
 * <li>45, 225: north-east (n2) and south-west (n6)</li>
 * <li>90, 270: north (n1) and south (n7)</li>
 * <li>135, 315: north-west (n0) and south-east (n8)</li>
 * </ul>
 *
 * <p>
 * A kept pixel holds its magnitude rounded and clamped to a byte. Everything else, including the border, is 0.
 * Orientations are radians everywhere else in the engine and are only converted to degrees here.
 * </p>
 */
public class NonMaxSuppressor {
    private static final Logger LOGGER = LoggerFactory.getLogger(NonMaxSuppressor.class);

    private static final int[] DIRECTIONS = {0,45,90,135,180,225,270,315,360};

    private static final List<Integer> DIRECTION_LABELS = Collections.unmodifiableList(
        Arrays.stream(DIRECTIONS).boxed().collect(Collectors.toList()));

    /**
     * Returned by {@link #quantize(double)} for an unset ({@code NaN}) orientation.
     */
    public static final int NO_DIRECTION = -1;

    /**
     * The direction labels, in degrees, that orientations are quantized to.
     */
    public static List<Integer> directions() {
        return DIRECTION_LABELS;
    }

    public static EdgeMap suppress(final GradientField gradient) {
        return suppress(gradient.magnitudes(), gradient.orientations(), gradient.width, gradient.height);
    }

    /**
     * @param magnitude row-major gradient magnitudes, {@code width * height} of them
     * @param orientation row-major gradient orientations in radians, {@code width * height} of them
     * @throws PixelOutOfBoundsException if either array isn't {@code width * height} long.
     */
    public static EdgeMap suppress(final double[] magnitude, final double[] orientation, final int width, final int height) {
        if(width <= 0 || height <= 0)
            throw new PixelOutOfBoundsException("Invalid dimensions " + width + "x" + height);
        final long numPixels = (long)width * height;
        if(magnitude.length != numPixels)
            throw new PixelOutOfBoundsException("There are " + magnitude.length + " magnitudes for a " + width + "x" + height + " image");
        if(orientation.length != numPixels)
            throw new PixelOutOfBoundsException("There are " + orientation.length + " orientations for a " + width + "x" + height + " image");
        LOGGER.debug("suppressing non-maxima in a {}x{} gradient", width, height);

        final EdgeMap ret = EdgeMap.allocate(width, height);
        final byte[] dst = ret.underlying();

        for(int y = 1; y < height - 1; y++) {
            for(int x = 1; x < width - 1; x++) {
                final int center = (y * width) + x;
                final int above = center - width;
                final int below = center + width;

                final double a;
                final double b;
                switch(quantize(orientation[center])) {
                    case 0:
                    case 180:
                    case 360:
                        a = magnitude[center + 1];
                        b = magnitude[center - 1];
                        break;
                    case 45:
                    case 225:
                        a = magnitude[above + 1];
                        b = magnitude[below - 1];
                        break;
                    case 90:
                    case 270:
                        a = magnitude[above];
                        b = magnitude[below];
                        break;
                    case 135:
                    case 315:
                        a = magnitude[above - 1];
                        b = magnitude[below + 1];
                        break;
                    default:
                        continue;
                }

                final double m = magnitude[center];
                if(m > a && m > b)
                    dst[center] = GradientField.toByte(m);
            }
        }

        return ret;
    }

    /**
     * Quantize an orientation in radians to the nearest of {@link #directions()}.
     *
     * @return the direction in degrees or {@link #NO_DIRECTION} if the orientation is {@code NaN}.
     */
    public static int quantize(final double orientation) {
        if(Double.isNaN(orientation))
            return NO_DIRECTION;
        return quantizeDegrees(Math.toDegrees(orientation));
    }

    /**
     * The nearest of {@link #directions()} to the given angle in degrees. When two directions are equally near
     * the smaller one wins.
     */
    public static int quantizeDegrees(final double degrees) {
        int ret = DIRECTIONS[0];
        double best = Math.abs(degrees - DIRECTIONS[0]);
        for(int i = 1; i < DIRECTIONS.length; i++) {
            final double diff = Math.abs(degrees - DIRECTIONS[i]);
            if(diff < best) {
                best = diff;
                ret = DIRECTIONS[i];
            }
        }
        return ret;
    }
}
