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

/**
 * <p>
 * A rectangular view of raw pixel bytes: {@code height} rows of {@code stride} bytes each, where the first
 * {@code width * format.bytesPerPixel} bytes of every row are pixels and anything after that is padding.
 * </p>
 *
 * <p>
 * The geometry is validated when the buffer is constructed so that stride aligned row access can never
 * run off the end of the backing array, and every accessor is bounds checked. Any violation results in a
 * {@link PixelOutOfBoundsException}.
 * </p>
 *
 * <p>
 * The backing array is not copied. The engine never writes into a buffer it was handed as input, it
 * always allocates a new one for its output.
 * </p>
 */
public final class PixelBuffer {
    private final int width;
    private final int height;
    private final int stride;
    private final PixelFormat format;
    private final byte[] data;

    public PixelBuffer(final int width, final int height, final int stride, final PixelFormat format, final byte[] data) {
        if(format == null)
            throw new NullPointerException("A " + PixelBuffer.class.getSimpleName() + " requires a " + PixelFormat.class.getSimpleName());
        if(data == null)
            throw new NullPointerException("A " + PixelBuffer.class.getSimpleName() + " requires a backing array");
        if(width <= 0 || height <= 0)
            throw new PixelOutOfBoundsException("Invalid buffer dimensions " + width + "x" + height);
        final long minStride = (long)width * format.bytesPerPixel;
        if(stride < minStride)
            throw new PixelOutOfBoundsException("The stride " + stride + " is too small for " + width + " pixels of " + format + ". It needs to be at least "
                + minStride);
        final long required = (long)stride * height;
        if(data.length != required)
            throw new PixelOutOfBoundsException("A " + width + "x" + height + " buffer with a stride of " + stride + " requires exactly " + required
                + " bytes but the backing array has " + data.length);

        this.width = width;
        this.height = height;
        this.stride = stride;
        this.format = format;
        this.data = data;
    }

    /**
     * Allocate a zeroed buffer with no row padding.
     */
    public static PixelBuffer allocate(final int width, final int height, final PixelFormat format) {
        if(format == null)
            throw new NullPointerException("A " + PixelBuffer.class.getSimpleName() + " requires a " + PixelFormat.class.getSimpleName());
        return allocate(width, height, width * format.bytesPerPixel, format);
    }

    /**
     * Allocate a zeroed buffer with the given stride.
     */
    public static PixelBuffer allocate(final int width, final int height, final int stride, final PixelFormat format) {
        if(width <= 0 || height <= 0 || stride <= 0)
            throw new PixelOutOfBoundsException("Invalid buffer geometry " + width + "x" + height + " with a stride of " + stride);
        return new PixelBuffer(width, height, stride, format, new byte[Math.multiplyExact(stride, height)]);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int stride() {
        return stride;
    }

    public PixelFormat format() {
        return format;
    }

    public int bytesPerPixel() {
        return format.bytesPerPixel;
    }

    /**
     * The number of bytes in the backing array ({@code stride * height}).
     */
    public int getNumBytes() {
        return data.length;
    }

    /**
     * Direct access to the backing array.
     */
    public byte[] underlying() {
        return data;
    }

    public boolean contains(final int x, final int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * The offset into the backing array of the first byte of the pixel at (x, y).
     */
    public int offset(final int x, final int y) {
        if(!contains(x, y))
            throw PixelOutOfBoundsException.coordinate(x, y, width, height);
        return (y * stride) + (x * format.bytesPerPixel);
    }

    /**
     * The unsigned value of the byte {@code channel} of the pixel at (x, y).
     */
    public int channel(final int x, final int y, final int channel) {
        return data[offset(x, y) + checkChannel(channel)] & 0xff;
    }

    /**
     * Set the byte {@code channel} of the pixel at (x, y). The value is clamped to [0, 255].
     */
    public void setChannel(final int x, final int y, final int channel, final int value) {
        data[offset(x, y) + checkChannel(channel)] = clampToByte(value);
    }

    /**
     * A copy of the entire backing array, padding included.
     */
    public byte[] copyBytes() {
        return Arrays.copyOf(data, data.length);
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, stride, format, copyBytes());
    }

    static byte clampToByte(final int value) {
        return (byte)((value > 0xff) ? 0xff : (value < 0 ? 0 : value));
    }

    private int checkChannel(final int channel) {
        if(channel < 0 || channel >= format.bytesPerPixel)
            throw new PixelOutOfBoundsException("Channel " + channel + " doesn't exist in a " + format + " pixel");
        return channel;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + format.hashCode();
        result = prime * result + height;
        result = prime * result + width;
        return result;
    }

    /**
     * Two buffers are equal when they have the same dimensions and format and the same pixel bytes. The
     * stride, the content of any row padding and the unused fourth byte of a {@link PixelFormat#BGR32} pixel
     * don't participate.
     */
    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null)
            return false;
        if(getClass() != obj.getClass())
            return false;
        final PixelBuffer other = (PixelBuffer)obj;
        if(format != other.format)
            return false;
        if(height != other.height)
            return false;
        if(width != other.width)
            return false;
        return pixelsIdentical(this, other);
    }

    /**
     * Byte by byte comparison of the pixel data of two buffers with the same geometry. Bytes that carry
     * no pixel data, row padding and the unused fourth byte of {@link PixelFormat#BGR32}, are skipped.
     */
    public static boolean pixelsIdentical(final PixelBuffer b1, final PixelBuffer b2) {
        if(b1.width != b2.width || b1.height != b2.height || b1.format.bytesPerPixel != b2.format.bytesPerPixel)
            return false;
        final int bpp = b1.format.bytesPerPixel;
        final int significant = significantBytes(b1.format);
        if(significant != significantBytes(b2.format))
            return false;

        final int rowBytes = b1.width * bpp;
        for(int y = 0; y < b1.height; y++) {
            final int o1 = y * b1.stride;
            final int o2 = y * b2.stride;
            if(significant == bpp) {
                if(!Arrays.equals(b1.data, o1, o1 + rowBytes, b2.data, o2, o2 + rowBytes))
                    return false;
            } else {
                for(int x = 0; x < rowBytes; x += bpp) {
                    if(!Arrays.equals(b1.data, o1 + x, o1 + x + significant, b2.data, o2 + x, o2 + x + significant))
                        return false;
                }
            }
        }
        return true;
    }

    // the number of leading bytes of each pixel that hold pixel data
    private static int significantBytes(final PixelFormat format) {
        return (format.hasFourthByte() && !format.hasAlpha) ? format.colorChannels : format.bytesPerPixel;
    }

    @Override
    public String toString() {
        return PixelBuffer.class.getSimpleName() + " [" + width + "x" + height + ", stride=" + stride + ", format=" + format + "]";
    }
}
