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

import ai.kognition.pixelfilter.image.ImageSource.AccessMode;

/**
 * <p>
 * Holds pixel memory acquired from an {@link ImageSource} and releases it on {@link #close()}. Meant to be
 * used in a <em>"try-with-resource"</em> so the memory is released on every exit path, including when a
 * stage throws.
 * </p>
 *
 * <pre>
 * <code>
 * try (ScopedPixelBuffer scoped = ScopedPixelBuffer.acquire(image, AccessMode.READ_ONLY)) {
 *     final GreyscaleImage grey = GreyscaleConverter.toGrey(scoped.buffer());
 *     ...
 * }
 * </code>
 * </pre>
 */
public class ScopedPixelBuffer implements AutoCloseable {
    private final ImageSource image;
    private final AccessMode mode;
    private PixelBuffer buffer;

    private ScopedPixelBuffer(final ImageSource image, final AccessMode mode, final PixelBuffer buffer) {
        this.image = image;
        this.mode = mode;
        this.buffer = buffer;
    }

    /**
     * Acquire the entire image in its own pixel format.
     */
    public static ScopedPixelBuffer acquire(final ImageSource image, final AccessMode mode) {
        return acquire(image, Region.of(image), mode, image.pixelFormat());
    }

    public static ScopedPixelBuffer acquire(final ImageSource image, final Region region, final AccessMode mode, final PixelFormat format) {
        return new ScopedPixelBuffer(image, mode, image.acquire(region, mode, format));
    }

    /**
     * The acquired buffer. Only valid until this is closed.
     */
    public PixelBuffer buffer() {
        if(buffer == null)
            throw new IllegalStateException("You cannot use the pixels of a " + ScopedPixelBuffer.class.getSimpleName() + " after it's been closed.");
        return buffer;
    }

    public AccessMode mode() {
        return mode;
    }

    public boolean isOpen() {
        return buffer != null;
    }

    @Override
    public void close() {
        if(buffer != null) {
            final PixelBuffer toRelease = buffer;
            buffer = null;
            image.release(toRelease);
        }
    }
}
