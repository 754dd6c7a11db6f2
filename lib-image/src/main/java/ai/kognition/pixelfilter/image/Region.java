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
 * A rectangle of pixels: origin ({@code x}, {@code y}) plus {@code width} and {@code height}.
 */
public final class Region {
    public final int x;
    public final int y;
    public final int width;
    public final int height;

    public Region(final int x, final int y, final int width, final int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * The region covering the entire image.
     */
    public static Region of(final ImageSource image) {
        return new Region(0, 0, image.width(), image.height());
    }

    /**
     * Whether or not this region is non-empty and lies completely inside of a {@code imageWidth x imageHeight} image.
     */
    public boolean isInside(final int imageWidth, final int imageHeight) {
        return x >= 0 && y >= 0 && width > 0 && height > 0
            && (long)x + width <= imageWidth
            && (long)y + height <= imageHeight;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + height;
        result = prime * result + width;
        result = prime * result + x;
        result = prime * result + y;
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
        final Region other = (Region)obj;
        return height == other.height && width == other.width && x == other.x && y == other.y;
    }

    @Override
    public String toString() {
        return "Region [x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "]";
    }
}
