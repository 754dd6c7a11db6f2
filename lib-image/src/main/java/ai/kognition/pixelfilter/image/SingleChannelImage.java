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
 * A row-major image of one unsigned byte per pixel with no row padding. The backing array is exactly
 * {@code width * height} bytes and every accessor is bounds checked.
 */
public abstract class SingleChannelImage {
    protected final int width;
    protected final int height;
    protected final byte[] data;

    protected SingleChannelImage(final int width, final int height, final byte[] data) {
        if(data == null)
            throw new NullPointerException("A " + getClass().getSimpleName() + " requires a backing array");
        if(width <= 0 || height <= 0)
            throw new PixelOutOfBoundsException("Invalid image dimensions " + width + "x" + height);
        if(data.length != (long)width * height)
            throw new PixelOutOfBoundsException("A " + width + "x" + height + " " + getClass().getSimpleName() + " requires exactly "
                + ((long)width * height) + " bytes but the backing array has " + data.length);
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Direct access to the backing array.
     */
    public byte[] underlying() {
        return data;
    }

    public byte[] copyBytes() {
        return Arrays.copyOf(data, data.length);
    }

    public boolean contains(final int x, final int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int index(final int x, final int y) {
        if(!contains(x, y))
            throw PixelOutOfBoundsException.coordinate(x, y, width, height);
        return (y * width) + x;
    }

    /**
     * The unsigned value of the pixel at (x, y).
     */
    public int get(final int x, final int y) {
        return data[index(x, y)] & 0xff;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + Arrays.hashCode(data);
        result = prime * result + height;
        result = prime * result + width;
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null)
            return false;
        if(getClass() != obj.getClass())
            return false;
        final SingleChannelImage other = (SingleChannelImage)obj;
        if(height != other.height)
            return false;
        if(width != other.width)
            return false;
        return Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [" + width + "x" + height + "]";
    }
}
