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

/**
 * <p>
 * The per-pixel output of the {@link GradientOperator}: the Sobel responses {@code dx} and {@code dy}, the
 * gradient magnitude {@code sqrt(dx^2 + dy^2)} and the gradient orientation {@code atan2(dy, dx) + pi} in
 * radians, which lies in [0, 2pi].
 * </p>
 *
 * <p>
 * Pixels in the first and last row and column have no full 3x3 neighborhood and are never evaluated. They
 * have a magnitude of 0 and an orientation of {@code NaN}.
 * </p>
 */
public final class GradientField {
    public final int width;
    public final int height;

    private final int[] dx;
    private final int[] dy;
    private final double[] magnitude;
    private final double[] orientation;

    public GradientField(final int width, final int height, final int[] dx, final int[] dy, final double[] magnitude, final double[] orientation) {
        if(width <= 0 || height <= 0)
            throw new PixelOutOfBoundsException("Invalid gradient dimensions " + width + "x" + height);
        final long numPixels = (long)width * height;
        if(dx.length != numPixels || dy.length != numPixels || magnitude.length != numPixels || orientation.length != numPixels)
            throw new PixelOutOfBoundsException("Every array in a " + width + "x" + height + " gradient needs " + numPixels + " entries");
        this.width = width;
        this.height = height;
        this.dx = dx;
        this.dy = dy;
        this.magnitude = magnitude;
        this.orientation = orientation;
    }

    public boolean isInterior(final int x, final int y) {
        return x >= 1 && x <= width - 2 && y >= 1 && y <= height - 2;
    }

    public double magnitude(final int x, final int y) {
        return magnitude[index(x, y)];
    }

    /**
     * The orientation in radians, or {@code NaN} for border pixels.
     */
    public double orientation(final int x, final int y) {
        return orientation[index(x, y)];
    }

    public int dx(final int x, final int y) {
        return dx[index(x, y)];
    }

    public int dy(final int x, final int y) {
        return dy[index(x, y)];
    }

    /**
     * Direct access to the row-major magnitude array.
     */
    public double[] magnitudes() {
        return magnitude;
    }

    /**
     * Direct access to the row-major orientation array.
     */
    public double[] orientations() {
        return orientation;
    }

    /**
     * The magnitude rounded and clamped to a byte per pixel. This is the classic Sobel edge image.
     */
    public GreyscaleImage magnitudeImage() {
        final byte[] ret = new byte[magnitude.length];
        for(int pos = 0; pos < magnitude.length; pos++)
            ret[pos] = toByte(magnitude[pos]);
        return new GreyscaleImage(width, height, ret);
    }

    static byte toByte(final double magnitude) {
        final double rounded = Math.floor(magnitude + 0.5);
        return (byte)(rounded >= 255.0 ? 0xff : (rounded <= 0.0 ? 0 : (int)rounded));
    }

    private int index(final int x, final int y) {
        if(x < 0 || x >= width || y < 0 || y >= height)
            throw PixelOutOfBoundsException.coordinate(x, y, width, height);
        return (y * width) + x;
    }

    @Override
    public String toString() {
        return GradientField.class.getSimpleName() + " [" + width + "x" + height + "]";
    }
}
