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

import java.util.function.Consumer;
import java.util.function.Function;

import ai.kognition.pixelfilter.image.ImageSource.AccessMode;

/**
 * Helpers for applying a lambda to the pixels of an {@link ImageSource} while they're acquired. The pixels
 * are released when the lambda returns or throws.
 */
public class PixelAccess {

    /**
     * Apply the given {@link Function} to a read only view of the entire image.
     *
     * @return the return value of the provided {@code function}
     */
    public static <T> T read(final ImageSource image, final Function<PixelBuffer, T> function) {
        try(final ScopedPixelBuffer scoped = ScopedPixelBuffer.acquire(image, AccessMode.READ_ONLY);) {
            return function.apply(scoped.buffer());
        }
    }

    /**
     * Apply the given {@link Consumer} to a writable view of the entire image. Whatever it writes into
     * the buffer is synchronized back to the image.
     */
    public static void readWrite(final ImageSource image, final Consumer<PixelBuffer> function) {
        try(final ScopedPixelBuffer scoped = ScopedPixelBuffer.acquire(image, AccessMode.READ_WRITE);) {
            function.accept(scoped.buffer());
        }
    }

    /**
     * Overwrite every pixel of the image with the pixels of {@code source}, which must have the same
     * dimensions and format. Row padding in the image is left alone.
     */
    public static void write(final ImageSource image, final PixelBuffer source) {
        readWrite(image, dest -> {
            if(dest.width() != source.width() || dest.height() != source.height())
                throw new PixelOutOfBoundsException("Can't write a " + source.width() + "x" + source.height() + " buffer into a " + dest.width() + "x"
                    + dest.height() + " image");
            if(dest.format() != source.format())
                throw new UnsupportedPixelFormatException(source.format(),
                    "Can't write a " + source.format() + " buffer into a " + dest.format() + " image");
            final int rowBytes = source.width() * source.bytesPerPixel();
            for(int y = 0; y < source.height(); y++)
                System.arraycopy(source.underlying(), y * source.stride(), dest.underlying(), y * dest.stride(), rowBytes);
        });
    }
}
