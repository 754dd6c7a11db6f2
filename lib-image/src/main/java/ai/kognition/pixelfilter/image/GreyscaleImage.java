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
 * One luma byte per pixel. Produced by {@link GreyscaleConverter} and consumed by the
 * {@link GradientOperator}. It can also be blurred with the {@link ConvolutionEngine}.
 */
public final class GreyscaleImage extends SingleChannelImage {

    public GreyscaleImage(final int width, final int height, final byte[] data) {
        super(width, height, data);
    }

    public static GreyscaleImage allocate(final int width, final int height) {
        if(width <= 0 || height <= 0)
            throw new PixelOutOfBoundsException("Invalid image dimensions " + width + "x" + height);
        return new GreyscaleImage(width, height, new byte[Math.multiplyExact(width, height)]);
    }
}
