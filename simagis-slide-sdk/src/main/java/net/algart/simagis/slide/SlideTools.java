/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2014-2016 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.simagis.slide;

import net.algart.arrays.Arrays;
import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.UpdatablePArray;
import net.algart.external.awt.BufferedImageToMatrix;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

public class SlideTools {
    public static final int MIN_PYRAMID_LEVEL_SIDE = 256;

    private static final Logger LOGGER = Logger.getLogger(SlideTools.class.getName());

    private SlideTools() {
    }

    /**
     * Returns the number of levels in the pyramid with the level #0
     * <tt>dimX</tt>&nbsp;x&nbsp;<tt>dimY</tt>,
     * with given compression between neighbour levels and with the last level less than
     * <tt>minLevelSide</tt>&nbsp;x&nbsp;<tt>minLevelSide</tt>.
     * The result is never less than 1.
     *
     * @param dimX         width of the level #0.
     * @param dimY         height of the level #0.
     * @param compression  compression between neighbour levels, usually 2 or 4.
     * @param minLevelSide minimal size of resulting levels.
     * @return the number of levels in the resulting pyramid, always &ge;1.
     */
    public static int numberOfLevels(long dimX, long dimY, int compression, long minLevelSide) {
        if (dimX <= 0 || dimY <= 0) {
            throw new IllegalArgumentException("Illegal area dimensions " + dimX + "x" + dimY
                + " (must be positive)");
        }
        if (compression <= 1) {
            throw new IllegalArgumentException("Invalid compression " + compression + " (must be 2 or greater)");
        }
        if (minLevelSide <= 0) {
            throw new IllegalArgumentException("Minimal level side must be positive");
        }
        int count = 1;
        dimX /= compression;
        dimY /= compression;
        while (dimX >= minLevelSide && dimY >= minLevelSide) {
            dimX /= compression;
            dimY /= compression;
            count++;
        }
        return count;
    }

    public static List<Matrix<? extends PArray>> buildPyramid(
        Matrix<? extends PArray> matrix,
        int compression,
        long minLevelSide)
    {
        Objects.requireNonNull(matrix, "Null matrix");
        long t1 = System.nanoTime();
        final int numberOfLevels = numberOfLevels(
            matrix.dim(SlideBackend.DIM_WIDTH), matrix.dim(SlideBackend.DIM_HEIGHT), compression, minLevelSide);
        final List<Matrix<? extends PArray>> result = new ArrayList<Matrix<? extends PArray>>();
        result.add(matrix);
        for (int level = 1; level < numberOfLevels; level++) {
            final long dimX = matrix.dim(SlideBackend.DIM_WIDTH) / compression;
            final long dimY = matrix.dim(SlideBackend.DIM_HEIGHT) / compression;
            final Matrix<UpdatablePArray> compressed = Arrays.SMM.newMatrix(
                UpdatablePArray.class, matrix.elementType(), matrix.dim(SlideBackend.DIM_BAND), dimX, dimY);
            if (matrix.dim(SlideBackend.DIM_WIDTH) != dimX * compression
                || matrix.dim(SlideBackend.DIM_HEIGHT) != dimY * compression)
            {
                matrix = matrix.subMatr(0, 0, 0,
                    matrix.dim(SlideBackend.DIM_BAND), dimX * compression, dimY * compression);
                // we prefer to lose last pixels, but provide strict integer compression
            }
            Matrices.resize(null, Matrices.ResizingMethod.AVERAGING, compressed, matrix);
            matrix = compressed;
            result.add(matrix);
        }
        long t2 = System.nanoTime();
        if (SlideBackend.DEBUG_LEVEL >= 2) {
            LOGGER.info(String.format(Locale.US, "Building pyramid in memory from %d x %d until %d x %d: %.3f ms",
                result.get(0).dim(SlideBackend.DIM_WIDTH), result.get(0).dim(SlideBackend.DIM_HEIGHT),
                matrix.dim(SlideBackend.DIM_WIDTH), matrix.dim(SlideBackend.DIM_HEIGHT),
                (t2 - t1) * 1e-6));
        }
        return result;
    }

    /**
     * Returns the largest size <tt>{sizeX, sizeY}</tt>, fitting in <tt>maxDimX</tt>&nbsp;x&nbsp;<tt>maxDimY</tt>,
     * with the same aspect ratio as <tt>dimX</tt>&nbsp;x&nbsp;<tt>dimY</tt>, but not greater than these
     * dimensions. Every side of the result is at least 1.
     */
    public static long[] fitSize(long dimX, long dimY, long maxDimX, long maxDimY) {
        if (dimX <= 0 || dimY <= 0) {
            throw new IllegalArgumentException("Illegal dimensions " + dimX + "x" + dimY + " (must be positive)");
        }
        if (maxDimX <= 0 || maxDimY <= 0) {
            throw new IllegalArgumentException("Illegal bounding size " + maxDimX + "x" + maxDimY
                + " (must be positive)");
        }
        final double scale = Math.min(1.0, Math.min((double) maxDimX / dimX, (double) maxDimY / dimY));
        return new long[] {
            Math.max(1, Math.min(maxDimX, Math.round(dimX * scale))),
            Math.max(1, Math.min(maxDimY, Math.round(dimY * scale)))
        };
    }

    /**
     * Converts the image into packed matrix <tt>[band, x, y]</tt> with {@link BufferedImageToMatrix.ToInterleavedRGB}:
     * gray images have 1 band, color images 3 bands (RGB) or 4 bands (RGBA) if there is an alpha channel.
     * Component images keep their element type (bytes, shorts or ints); other images,
     * in particular indexed ones, are read via the color model into bytes.
     *
     * @param image some image.
     * @return new matrix with the same pixels.
     */
    public static Matrix<UpdatablePArray> toMatrix(BufferedImage image) {
        Objects.requireNonNull(image, "Null image");
        return new BufferedImageToMatrix.ToInterleavedRGB()
            .setEnableAlpha(true)
            .toMatrix(image);
    }
}
