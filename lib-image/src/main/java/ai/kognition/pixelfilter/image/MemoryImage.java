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
 * An {@link ImageSource} that keeps its pixels in a heap byte array. Rows are padded to a multiple of 4 bytes
 * unless a stride is given explicitly.
 * </p>
 *
 * <p>
 * Only one acquisition can be outstanding at a time. {@link #acquire(Region, ImageSource.AccessMode, PixelFormat)}
 * copies the region into a new unpadded {@link PixelBuffer} and {@link #release(PixelBuffer)} copies it back
 * when it was acquired {@link ImageSource.AccessMode#READ_WRITE}.
 * </p>
 */
public class MemoryImage implements ImageSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryImage.class);

    private final int width;
    private final int height;
    private final int stride;
    private final PixelFormat format;
    private final byte[] pixels;

    private PixelBuffer outstanding = null;
    private Region outstandingRegion = null;
    private AccessMode outstandingMode = null;

    public MemoryImage(final int width, final int height, final PixelFormat format) {
        this(width, height, alignedStride(width, format), format);
    }

    public MemoryImage(final int width, final int height, final int stride, final PixelFormat format) {
        // validates the geometry
        final PixelBuffer geometry = PixelBuffer.allocate(width, height, stride, format);
        this.width = width;
        this.height = height;
        this.stride = stride;
        this.format = format;
        this.pixels = geometry.underlying();
    }

    /**
     * An image holding a copy of the given buffer's pixels, geometry and format.
     */
    public MemoryImage(final PixelBuffer source) {
        this(source.width(), source.height(), source.stride(), source.format());
        System.arraycopy(source.underlying(), 0, pixels, 0, pixels.length);
    }

    public static int alignedStride(final int width, final PixelFormat format) {
        final int rowBytes = Math.multiplyExact(width, format.bytesPerPixel);
        return (rowBytes + 3) & ~3;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int stride() {
        return stride;
    }

    @Override
    public PixelFormat pixelFormat() {
        return format;
    }

    public boolean isLocked() {
        return outstanding != null;
    }

    /**
     * A copy of all of the image's bytes, row padding included.
     */
    public byte[] bytes() {
        return Arrays.copyOf(pixels, pixels.length);
    }

    @Override
    public PixelBuffer acquire(final Region region, final AccessMode mode, final PixelFormat requested) {
        if(region == null || mode == null || requested == null)
            throw new NullPointerException("acquire requires a region, an access mode and a pixel format");
        if(outstanding != null)
            throw new IllegalStateException("The image is already acquired (" + outstandingMode + " " + outstandingRegion + ")");
        if(!region.isInside(width, height))
            throw new PixelOutOfBoundsException(region + " is not inside of the " + width + "x" + height + " image");
        if(requested != format)
            throw new UnsupportedPixelFormatException(requested, "A " + format + " image can't provide its pixels as " + requested);

        final int bpp = format.bytesPerPixel;
        final int rowBytes = region.width * bpp;
        final PixelBuffer ret = PixelBuffer.allocate(region.width, region.height, rowBytes, format);
        final byte[] dst = ret.underlying();
        for(int r = 0; r < region.height; r++)
            System.arraycopy(pixels, ((region.y + r) * stride) + (region.x * bpp), dst, r * rowBytes, rowBytes);

        LOGGER.trace("acquired {} {} of {}", mode, region, this);
        outstanding = ret;
        outstandingRegion = region;
        outstandingMode = mode;
        return ret;
    }

    @Override
    public void release(final PixelBuffer buffer) {
        if(buffer == null || buffer != outstanding)
            throw new IllegalStateException("The buffer " + buffer + " isn't currently acquired from this image");

        if(outstandingMode == AccessMode.READ_WRITE) {
            final int bpp = format.bytesPerPixel;
            final int rowBytes = outstandingRegion.width * bpp;
            final byte[] src = buffer.underlying();
            for(int r = 0; r < outstandingRegion.height; r++)
                System.arraycopy(src, r * buffer.stride(), pixels, ((outstandingRegion.y + r) * stride) + (outstandingRegion.x * bpp), rowBytes);
        }

        LOGGER.trace("released {} {} of {}", outstandingMode, outstandingRegion, this);
        outstanding = null;
        outstandingRegion = null;
        outstandingMode = null;
    }

    @Override
    public String toString() {
        return MemoryImage.class.getSimpleName() + " [" + width + "x" + height + ", stride=" + stride + ", format=" + format + "]";
    }
}
