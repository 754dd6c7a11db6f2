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
 * One byte per pixel where 0 means "not an edge." After non-maximum suppression and thresholding a
 * non-zero value is the edge strength. After {@link #binarize()} every edge is {@link #EDGE}.
 */
public final class EdgeMap extends SingleChannelImage {
    public static final byte EDGE = (byte)-1;
    public static final byte NOEDGE = (byte)0;

    public EdgeMap(final int width, final int height, final byte[] data) {
        super(width, height, data);
    }

    public static EdgeMap allocate(final int width, final int height) {
        if(width <= 0 || height <= 0)
            throw new PixelOutOfBoundsException("Invalid image dimensions " + width + "x" + height);
        return new EdgeMap(width, height, new byte[Math.multiplyExact(width, height)]);
    }

    public boolean isEdge(final int x, final int y) {
        return data[index(x, y)] != NOEDGE;
    }

    /**
     * The number of non-zero pixels.
     */
    public int countEdges() {
        int ret = 0;
        for(final byte b: data)
            if(b != NOEDGE)
                ret++;
        return ret;
    }

    /**
     * A new map where every non-zero pixel is {@link #EDGE} (255).
     */
    public EdgeMap binarize() {
        final byte[] ret = new byte[data.length];
        for(int pos = 0; pos < data.length; pos++)
            ret[pos] = (data[pos] == NOEDGE) ? NOEDGE : EDGE;
        return new EdgeMap(width, height, ret);
    }
}
