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
 * The image container the engine works against. The container owns the pixel memory. The engine only
 * ever borrows it through {@link #acquire(Region, AccessMode, PixelFormat)} and hands it back through
 * {@link #release(PixelBuffer)}, and it does that for no longer than one stage. Use a
 * {@link ScopedPixelBuffer} (or {@link PixelAccess}) rather than calling these directly so that release
 * happens on every exit path.
 * </p>
 *
 * <p>
 * Loading and saving images is the container's business and isn't part of this interface.
 * </p>
 */
public interface ImageSource {

    public static enum AccessMode {
        READ_ONLY,
        READ_WRITE
    }

    public int width();

    public int height();

    /**
     * The number of bytes in one row of pixels, including any padding.
     */
    public int stride();

    public default int bitsPerPixel() {
        return pixelFormat().bitsPerPixel;
    }

    public PixelFormat pixelFormat();

    /**
     * Acquire a contiguous view of the pixels in {@code region}. The memory behind the returned
     * {@link PixelBuffer} won't move or be freed until it's released.
     *
     * @throws PixelOutOfBoundsException if the region doesn't lie inside of the image.
     * @throws UnsupportedPixelFormatException if the image can't provide its pixels in {@code format}.
     * @throws IllegalStateException if the image can't be acquired right now.
     */
    public PixelBuffer acquire(Region region, AccessMode mode, PixelFormat format);

    /**
     * Give back a buffer obtained from {@link #acquire(Region, AccessMode, PixelFormat)}. If it was acquired
     * {@link AccessMode#READ_WRITE} any changes made to it are written back to the image. The buffer mustn't be
     * used afterward.
     *
     * @throws IllegalStateException if the buffer isn't currently acquired from this image.
     */
    public void release(PixelBuffer buffer);
}
