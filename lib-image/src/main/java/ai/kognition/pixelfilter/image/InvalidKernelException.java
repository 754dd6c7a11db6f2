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
 * Thrown when a convolution kernel isn't square, doesn't have an odd side length, or is applied
 * with a negative radius.
 */
public class InvalidKernelException extends PixelFilterException {
    private static final long serialVersionUID = -2270150405587613544L;

    public InvalidKernelException(final String msg) {
        super(msg);
    }
}
