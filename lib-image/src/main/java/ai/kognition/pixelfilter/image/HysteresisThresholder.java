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
 * Classifies the pixels of a suppressed {@link EdgeMap} using a low and a high threshold. For each interior
 * pixel with strength {@code m}:
 * </p>
 *
 * <ul>
 * <li>{@code m < low}: not an edge.</li>
 * <li>{@code m > high}: a strong edge, kept.</li>
 * <li>otherwise a weak edge, kept only if at least one of its 8 immediate neighbors is strong.</li>
 * </ul>
 *
 * <p>
 * Kept pixels retain their strength. Border pixels are always 0.
 * </p>
 *
 * <p>
 * <b>Note:</b> this is a single hop approximation of hysteresis. A weak pixel is promoted only by a strong
 * pixel right next to it. A chain of weak pixels leading back to a strong one is not traced, so weak pixels two
 * or more steps from any strong pixel are dropped even when connected to it through other weak pixels.
 * </p>
 */
public class HysteresisThresholder {
    private static final Logger LOGGER = LoggerFactory.getLogger(HysteresisThresholder.class);

    public static final double DEFAULT_LOW_RATIO = 0.67;
    public static final double DEFAULT_HIGH_RATIO = 1.33;

    public static EdgeMap threshold(final EdgeMap edges, final Thresholds thresholds) {
        return threshold(edges, edges.width(), edges.height(), thresholds.low, thresholds.high);
    }

    /**
     * @throws PixelOutOfBoundsException if {@code width} and {@code height} don't match the map.
     * @throws IllegalArgumentException if either threshold is {@code NaN} or {@code low > high}.
     */
    public static EdgeMap threshold(final EdgeMap edges, final int width, final int height, final double low, final double high) {
        if(edges.width() != width || edges.height() != height)
            throw new PixelOutOfBoundsException("The edge map is " + edges.width() + "x" + edges.height() + " and not " + width + "x" + height);
        if(Double.isNaN(low) || Double.isNaN(high))
            throw new IllegalArgumentException("Thresholds must be numbers (low=" + low + ", high=" + high + ")");
        if(low > high)
            throw new IllegalArgumentException("The low threshold (" + low + ") can't be greater than the high threshold (" + high + ")");
        LOGGER.debug("thresholding {} with low={} and high={}", edges, low, high);

        final byte[] src = edges.underlying();
        final EdgeMap ret = EdgeMap.allocate(width, height);
        final byte[] dst = ret.underlying();

        for(int y = 1; y < height - 1; y++) {
            for(int x = 1; x < width - 1; x++) {
                final int center = (y * width) + x;
                final int m = src[center] & 0xff;
                if(m < low)
                    continue;
                if(m > high || hasStrongNeighbor(src, center, width, high))
                    dst[center] = src[center];
            }
        }

        return ret;
    }

    private static boolean hasStrongNeighbor(final byte[] src, final int center, final int width, final double high) {
        for(int dr = -width; dr <= width; dr += width) {
            for(int dc = -1; dc <= 1; dc++) {
                if(dr == 0 && dc == 0)
                    continue;
                if((src[center + dr + dc] & 0xff) > high)
                    return true;
            }
        }
        return false;
    }

    public static Thresholds deriveThresholds(final EdgeMap edges) {
        return deriveThresholds(edges, DEFAULT_LOW_RATIO, DEFAULT_HIGH_RATIO);
    }

    /**
     * Derive thresholds from the median {@code M} of all of the non-zero values in the map:
     * {@code low = clamp(lowRatio * M, 0, 255)} and {@code high = clamp(highRatio * M, 0, 255)}.
     */
    public static Thresholds deriveThresholds(final EdgeMap edges, final double lowRatio, final double highRatio) {
        if(lowRatio > highRatio)
            throw new IllegalArgumentException("The low ratio (" + lowRatio + ") can't be greater than the high ratio (" + highRatio + ")");
        final double median = nonZeroMedian(edges);
        final Thresholds ret = new Thresholds(clamp(lowRatio * median), clamp(highRatio * median));
        LOGGER.debug("median non-zero edge strength of {} is {} giving {}", edges, median, ret);
        return ret;
    }

    /**
     * The median of the non-zero values in the map. With an even number of them it's the mean of the two in the
     * middle. If there are none it's 0.
     */
    public static double nonZeroMedian(final EdgeMap edges) {
        final byte[] src = edges.underlying();
        final int[] values = new int[src.length];
        int count = 0;
        for(final byte b: src) {
            if(b != EdgeMap.NOEDGE)
                values[count++] = b & 0xff;
        }
        if(count == 0)
            return 0.0;

        Arrays.sort(values, 0, count);
        final int mid = count / 2;
        return ((count & 0x01) == 1) ? values[mid] : ((values[mid - 1] + values[mid]) / 2.0);
    }

    private static double clamp(final double v) {
        return v < 0.0 ? 0.0 : (v > 255.0 ? 255.0 : v);
    }
}
