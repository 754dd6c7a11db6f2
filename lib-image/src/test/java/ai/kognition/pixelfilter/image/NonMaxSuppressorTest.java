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
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class NonMaxSuppressorTest {

    private static double[] orientations(final int numPixels, final double value) {
        final double[] ret = new double[numPixels];
        Arrays.fill(ret, value);
        return ret;
    }

    private static double[] magnitudes(final int[][] rows) {
        final int width = rows[0].length;
        final double[] ret = new double[rows.length * width];
        for(int y = 0; y < rows.length; y++)
            for(int x = 0; x < width; x++)
                ret[(y * width) + x] = rows[y][x];
        return ret;
    }

    @Test
    public void testPeakSurvivesAndNeighborsDont() {
        final double[] m = magnitudes(new int[][] {
            {10,10,10,10,10},
            {10,10,10,10,10},
            {10,50,100,50,10},
            {10,10,10,10,10},
            {10,10,10,10,10}
        });
        final EdgeMap out = NonMaxSuppressor.suppress(m, orientations(25, Math.PI), 5, 5);
        assertEquals(100, out.get(2, 2));
        assertEquals(0, out.get(1, 2));
        assertEquals(0, out.get(3, 2));
    }

    @Test
    public void testOnlyTheGradientDirectionMatters() {
        // bigger neighbors above and below don't matter when the gradient is horizontal
        final double[] m = magnitudes(new int[][] {
            {0,0,0},
            {0,200,0},
            {5,100,5},
            {0,200,0},
            {0,0,0}
        });
        final EdgeMap horizontal = NonMaxSuppressor.suppress(m, orientations(15, Math.PI), 3, 5);
        assertEquals(100, horizontal.get(1, 2));

        final EdgeMap vertical = NonMaxSuppressor.suppress(m, orientations(15, Math.PI / 2.0), 3, 5);
        assertEquals(0, vertical.get(1, 2));
    }

    @Test
    public void testDiagonal() {
        final double[] m = magnitudes(new int[][] {
            {0,0,90},
            {0,80,0},
            {70,0,0}
        });
        // 45 degrees compares up-right and down-left
        assertEquals(0, NonMaxSuppressor.suppress(m, orientations(9, Math.PI / 4.0), 3, 3).get(1, 1));
        // 135 degrees compares up-left and down-right
        assertEquals(80, NonMaxSuppressor.suppress(m, orientations(9, 3.0 * Math.PI / 4.0), 3, 3).get(1, 1));
    }

    @Test
    public void testPlateauIsSuppressed() {
        final double[] m = magnitudes(new int[][] {
            {0,0,0},
            {60,60,60},
            {0,0,0}
        });
        assertEquals(0, NonMaxSuppressor.suppress(m, orientations(9, 0.0), 3, 3).get(1, 1));
    }

    @Test
    public void testUnsetOrientationIsSuppressed() {
        final double[] m = magnitudes(new int[][] {
            {0,0,0},
            {0,60,0},
            {0,0,0}
        });
        assertEquals(0, NonMaxSuppressor.suppress(m, orientations(9, Double.NaN), 3, 3).get(1, 1));
    }

    @Test
    public void testKeptValueIsClamped() {
        final double[] m = magnitudes(new int[][] {
            {0,0,0},
            {0,1020,0},
            {0,0,0}
        });
        final EdgeMap out = NonMaxSuppressor.suppress(m, orientations(9, Math.PI), 3, 3);
        assertEquals(255, out.get(1, 1));
        assertEquals(1, out.countEdges());
    }

    @Test
    public void testQuantize() {
        assertEquals(0, NonMaxSuppressor.quantizeDegrees(0.0));
        assertEquals(0, NonMaxSuppressor.quantizeDegrees(22.5));
        assertEquals(45, NonMaxSuppressor.quantizeDegrees(22.6));
        assertEquals(90, NonMaxSuppressor.quantizeDegrees(100.0));
        assertEquals(315, NonMaxSuppressor.quantizeDegrees(337.5));
        assertEquals(360, NonMaxSuppressor.quantizeDegrees(359.0));
        assertEquals(180, NonMaxSuppressor.quantize(Math.PI));
        assertEquals(360, NonMaxSuppressor.quantize(2.0 * Math.PI));
        assertEquals(NonMaxSuppressor.NO_DIRECTION, NonMaxSuppressor.quantize(Double.NaN));
    }

    @Test
    public void testDirectionsCantBeChanged() {
        final List<Integer> directions = NonMaxSuppressor.directions();
        assertEquals(Arrays.asList(0, 45, 90, 135, 180, 225, 270, 315, 360), directions);
        try {
            directions.set(4, 9999);
            fail("The direction labels should be unmodifiable");
        } catch(final UnsupportedOperationException uoe) {
            // expected
        }
        assertEquals(180, NonMaxSuppressor.quantize(Math.PI));
        assertEquals(180, NonMaxSuppressor.directions().get(4).intValue());
    }

    @Test
    public void testFromGradient() {
        final GradientField g = GradientOperator.gradient(ImageFixtures.columns(5, 0, 0, 0, 20, 40, 40, 40));
        final EdgeMap out = NonMaxSuppressor.suppress(g);
        for(int y = 1; y < 4; y++) {
            assertEquals(160, out.get(3, y));
            assertEquals(0, out.get(2, y));
            assertEquals(0, out.get(4, y));
        }
        assertEquals(3, out.countEdges());
    }

    @Test(expected = PixelOutOfBoundsException.class)
    public void testLengthMismatch() {
        NonMaxSuppressor.suppress(new double[9], new double[8], 3, 3);
    }
}
