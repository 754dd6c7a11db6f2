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

import org.junit.Test;

public class HysteresisThresholderTest {

    private static EdgeMap background(final int width, final int height, final int value) {
        return ImageFixtures.edgeMap(ImageFixtures.filled(width, height, value));
    }

    private static EdgeMap with(final EdgeMap map, final int x, final int y, final int value) {
        map.underlying()[map.index(x, y)] = (byte)value;
        return map;
    }

    @Test
    public void testAllZero() {
        final EdgeMap out = HysteresisThresholder.threshold(background(6, 6, 0), new Thresholds(50, 100));
        assertEquals(0, out.countEdges());
    }

    @Test
    public void testEverythingBelowLowIsDropped() {
        final EdgeMap out = HysteresisThresholder.threshold(background(6, 6, 49), new Thresholds(50, 100));
        assertEquals(0, out.countEdges());
    }

    @Test
    public void testIsolatedStrongPixelIsKept() {
        final EdgeMap out = HysteresisThresholder.threshold(with(background(5, 5, 10), 2, 2, 200), new Thresholds(50, 100));
        assertEquals(200, out.get(2, 2));
        assertEquals(1, out.countEdges());
    }

    @Test
    public void testWeakNextToStrongIsKept() {
        final EdgeMap in = with(with(background(5, 5, 0), 2, 2, 200), 3, 3, 70);
        final EdgeMap out = HysteresisThresholder.threshold(in, new Thresholds(50, 100));
        assertEquals(200, out.get(2, 2));
        assertEquals(70, out.get(3, 3));
    }

    @Test
    public void testWeakAloneIsDropped() {
        final EdgeMap out = HysteresisThresholder.threshold(with(background(5, 5, 0), 2, 2, 70), new Thresholds(50, 100));
        assertEquals(0, out.get(2, 2));
    }

    @Test
    public void testOnlyOneHop() {
        final EdgeMap in = background(7, 7, 0);
        with(in, 1, 3, 200);
        with(in, 2, 3, 70);
        with(in, 3, 3, 70);
        final EdgeMap out = HysteresisThresholder.threshold(in, new Thresholds(50, 100));
        assertEquals(200, out.get(1, 3));
        assertEquals(70, out.get(2, 3));
        // connected through a weak pixel but not adjacent to a strong one
        assertEquals(0, out.get(3, 3));
    }

    @Test
    public void testThresholdsAreExclusive() {
        final EdgeMap in = background(5, 5, 0);
        with(in, 3, 1, 101);
        with(in, 2, 1, 100);
        with(in, 3, 2, 50);
        with(in, 1, 3, 49);
        final EdgeMap out = HysteresisThresholder.threshold(in, new Thresholds(50, 100));
        assertEquals(101, out.get(3, 1));
        // exactly high and exactly low are both weak
        assertEquals(100, out.get(2, 1));
        assertEquals(50, out.get(3, 2));
        assertEquals(0, out.get(1, 3));

        final EdgeMap lone = with(background(5, 5, 0), 2, 2, 100);
        assertEquals(0, HysteresisThresholder.threshold(lone, new Thresholds(50, 100)).get(2, 2));
    }

    @Test
    public void testBorderIsAlwaysZero() {
        final EdgeMap out = HysteresisThresholder.threshold(background(4, 4, 255), new Thresholds(50, 100));
        assertEquals(0, out.get(0, 0));
        assertEquals(0, out.get(3, 2));
        assertEquals(255, out.get(1, 1));
        assertEquals(4, out.countEdges());
    }

    @Test(expected = PixelOutOfBoundsException.class)
    public void testSizeMismatch() {
        HysteresisThresholder.threshold(background(4, 4, 0), 4, 5, 10, 20);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLowAboveHigh() {
        HysteresisThresholder.threshold(background(4, 4, 0), 4, 4, 30, 20);
    }

    @Test
    public void testNaNThresholds() {
        final EdgeMap in = with(background(3, 3, 0), 1, 1, 200);
        for(final double[] t: new double[][] {{Double.NaN,Double.NaN},{Double.NaN,100},{50,Double.NaN}}) {
            try {
                HysteresisThresholder.threshold(in, 3, 3, t[0], t[1]);
                fail("NaN thresholds should be rejected");
            } catch(final IllegalArgumentException iae) {
                // expected
            }
        }
    }

    @Test
    public void testMedian() {
        final EdgeMap odd = background(5, 5, 0);
        with(odd, 0, 0, 30);
        with(odd, 2, 2, 10);
        with(odd, 4, 4, 20);
        assertEquals(20.0, HysteresisThresholder.nonZeroMedian(odd), 0.0);

        final Thresholds t = HysteresisThresholder.deriveThresholds(odd);
        assertEquals(13.4, t.low, 1e-9);
        assertEquals(26.6, t.high, 1e-9);

        with(odd, 1, 0, 40);
        assertEquals(25.0, HysteresisThresholder.nonZeroMedian(odd), 0.0);
        final Thresholds even = HysteresisThresholder.deriveThresholds(odd);
        assertEquals(16.75, even.low, 1e-9);
        assertEquals(33.25, even.high, 1e-9);
    }

    @Test
    public void testDerivedThresholdsAreClamped() {
        final Thresholds t = HysteresisThresholder.deriveThresholds(with(background(3, 3, 0), 1, 1, 200));
        assertEquals(134.0, t.low, 1e-9);
        assertEquals(255.0, t.high, 0.0);
    }

    @Test
    public void testNoEdges() {
        assertEquals(0.0, HysteresisThresholder.nonZeroMedian(background(3, 3, 0)), 0.0);
        assertEquals(new Thresholds(0.0, 0.0), HysteresisThresholder.deriveThresholds(background(3, 3, 0)));
    }

    @Test
    public void testCustomRatios() {
        final Thresholds t = HysteresisThresholder.deriveThresholds(with(background(3, 3, 0), 1, 1, 100), 0.5, 1.5);
        assertEquals(50.0, t.low, 1e-9);
        assertEquals(150.0, t.high, 1e-9);
    }
}
