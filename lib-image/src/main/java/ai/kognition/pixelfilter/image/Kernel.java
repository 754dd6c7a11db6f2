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
import java.util.Locale;

/**
 * <p>
 * An immutable, square, odd sized matrix of convolution weights. A kernel of side {@code K} has a
 * radius of {@code (K - 1) / 2}, the offset from its center tap to its edge.
 * </p>
 *
 * <p>
 * Weights are addressed as {@code weight(u, v)} where {@code u} is the horizontal tap index and {@code v} is
 * the vertical tap index. That means the first index of the {@code double[][]} the kernel is built from
 * runs along x. For the symmetric kernels in the catalog this makes no difference.
 * </p>
 */
public final class Kernel {
    public static final Kernel MEAN_BLUR = new Kernel(new double[][] {
        {1,1,1,1,1},
        {1,1,1,1,1},
        {1,1,1,1,1},
        {1,1,1,1,1},
        {1,1,1,1,1}
    });

    public static final Kernel GAUSSIAN_BLUR = new Kernel(new double[][] {
        {1,2,1},
        {2,4,2},
        {1,2,1}
    });

    public static final Kernel SOBEL_X = new Kernel(new double[][] {
        {1,0,-1},
        {2,0,-2},
        {1,0,-1}
    });

    public static final Kernel SOBEL_Y = new Kernel(new double[][] {
        {1,2,1},
        {0,0,0},
        {-1,-2,-1}
    });

    public static final Kernel LENS_BLUR = new Kernel(new double[][] {
        {0,0,0,1,0,0,0},
        {0,1,1,1,1,1,0},
        {0,1,1,1,1,1,0},
        {1,1,1,1,1,1,1},
        {0,1,1,1,1,1,0},
        {0,1,1,1,1,1,0},
        {0,0,0,1,0,0,0}
    });

    private final double[][] weights;
    private final int size;
    private final int radius;
    private final double sum;

    /**
     * @throws InvalidKernelException if the matrix isn't square or its side length is even.
     */
    public Kernel(final double[][] weights) {
        this.weights = validatedCopy(weights);
        this.size = this.weights.length;
        this.radius = (size - 1) / 2;
        double total = 0.0;
        for(final double[] row: this.weights)
            for(final double w: row)
                total += w;
        this.sum = total;
    }

    /**
     * A kernel of the given odd side length that's 1 at the center and 0 everywhere else. Convolving
     * with it reproduces the input.
     */
    public static Kernel identity(final int size) {
        if(size < 1 || (size & 0x01) == 0)
            throw new InvalidKernelException("The identity kernel must have a positive, odd size, not " + size);
        final double[][] w = new double[size][size];
        w[size / 2][size / 2] = 1.0;
        return new Kernel(w);
    }

    /**
     * Look up one of the catalog kernels by its constant name (e.g. {@code "GAUSSIAN_BLUR"}).
     */
    public static Kernel named(final String name) {
        switch(name.trim().toUpperCase(Locale.ROOT)) {
            case "MEAN_BLUR":
                return MEAN_BLUR;
            case "GAUSSIAN_BLUR":
                return GAUSSIAN_BLUR;
            case "SOBEL_X":
                return SOBEL_X;
            case "SOBEL_Y":
                return SOBEL_Y;
            case "LENS_BLUR":
                return LENS_BLUR;
            case "IDENTITY":
                return identity(1);
            default:
                throw new IllegalArgumentException("There's no kernel named \"" + name + "\"");
        }
    }

    /**
     * Validate that the matrix can be used as a kernel without making a {@link Kernel} from it.
     *
     * @throws InvalidKernelException if the matrix isn't square or its side length is even.
     */
    public static void validate(final double[][] weights) {
        if(weights == null)
            throw new NullPointerException("Kernel weights can't be null");
        final int size = weights.length;
        if(size == 0)
            throw new InvalidKernelException("The kernel has no weights.");
        for(final double[] row: weights) {
            if(row == null || row.length != size)
                throw new InvalidKernelException("Convolution only works with square kernels. The kernel has " + size + " rows but a row with "
                    + (row == null ? 0 : row.length) + " weights.");
        }
        if((size & 0x01) == 0)
            throw new InvalidKernelException("The kernel must have an odd size, else there is no center pixel. This one is " + size + "x" + size);
    }

    public int size() {
        return size;
    }

    public int radius() {
        return radius;
    }

    /**
     * The weight at horizontal tap {@code u} and vertical tap {@code v}.
     */
    public double weight(final int u, final int v) {
        return weights[u][v];
    }

    /**
     * The sum of all of the weights.
     */
    public double sum() {
        return sum;
    }

    /**
     * A copy of the weights.
     */
    public double[][] toArray() {
        final double[][] ret = new double[size][];
        for(int i = 0; i < size; i++)
            ret[i] = Arrays.copyOf(weights[i], size);
        return ret;
    }

    private static double[][] validatedCopy(final double[][] weights) {
        validate(weights);
        final double[][] ret = new double[weights.length][];
        for(int i = 0; i < weights.length; i++)
            ret[i] = Arrays.copyOf(weights[i], weights.length);
        return ret;
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(weights);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null)
            return false;
        if(getClass() != obj.getClass())
            return false;
        return Arrays.deepEquals(weights, ((Kernel)obj).weights);
    }

    @Override
    public String toString() {
        return "Kernel " + size + "x" + size + " " + Arrays.deepToString(weights);
    }
}
