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
 * Thrown on any attempt to address pixel memory outside of a buffer, and when a buffer is
 * constructed with a geometry (width, height, stride, format) its backing array can't hold.
 */
public class PixelOutOfBoundsException extends PixelFilterException {
    private static final long serialVersionUID = -6160815095170251985L;

    public PixelOutOfBoundsException(final String msg) {
        super(msg);
    }

    public static PixelOutOfBoundsException coordinate(final int x, final int y, final int width, final int height) {
        return new PixelOutOfBoundsException("The pixel (" + x + ", " + y + ") is outside of the " + width + "x" + height + " buffer.");
    }
}
