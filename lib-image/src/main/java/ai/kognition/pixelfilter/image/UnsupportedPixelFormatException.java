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

public class UnsupportedPixelFormatException extends PixelFilterException {
    private static final long serialVersionUID = 7129873612001740528L;

    public final PixelFormat format;

    public UnsupportedPixelFormatException(final PixelFormat format) {
        super("The pixel format " + format + " is not supported. Only " + PixelFormat.supportedFormats() + " can be processed.");
        this.format = format;
    }

    public UnsupportedPixelFormatException(final PixelFormat format, final String msg) {
        super(msg);
        this.format = format;
    }
}
