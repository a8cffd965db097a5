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

package net.algart.simagis.slide.resampling;

import net.algart.arrays.Arrays;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.PFloatingArray;
import net.algart.arrays.UpdatablePArray;

import java.util.Objects;

/**
 * <p>Separable resizing of packed 3D matrices <tt>[band, x, y]</tt> with the given {@link ResamplingKernel}.</p>
 *
 * <p>The source area is specified by a real-valued box. Every resulting pixel <tt>i</tt> is centred at
 * <tt>from&nbsp;+&nbsp;(i&nbsp;+&nbsp;0.5)&nbsp;&middot;&nbsp;scale</tt> of the source, where
 * <tt>scale&nbsp;=&nbsp;(to&nbsp;&minus;&nbsp;from)&nbsp;/&nbsp;newDim</tt>; while downsampling, the kernel
 * is stretched by <tt>scale</tt>. Weights are normalized; source samples are never taken outside the matrix.
 * Results of integer element types are rounded and clipped to the range of the element type.</p>
 *
 * <p>This class is immutable and thread-safe.</p>
 */
public final class MatrixResampler {
    private static final int DIM_BAND = 0;
    private static final int DIM_WIDTH = 1;
    private static final int DIM_HEIGHT = 2;

    private final ResamplingKernel kernel;

    public MatrixResampler(ResamplingKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "Null resampling kernel");
    }

    public ResamplingKernel kernel() {
        return kernel;
    }

    /**
     * Resizes the whole matrix with the given scales; the new dimensions are
     * <tt>rint(dimX&nbsp;&middot;&nbsp;scaleX)</tt> and <tt>rint(dimY&nbsp;&middot;&nbsp;scaleY)</tt>.
     */
    public Matrix<UpdatablePArray> resize(Matrix<? extends PArray> source, double scaleX, double scaleY) {
        checkSource(source);
        if (!(scaleX > 0.0) || !(scaleY > 0.0) || Double.isInfinite(scaleX) || Double.isInfinite(scaleY)) {
            throw new IllegalArgumentException("Illegal scales " + scaleX + ", " + scaleY
                + " (must be positive and finite)");
        }
        final long dimX = source.dim(DIM_WIDTH);
        final long dimY = source.dim(DIM_HEIGHT);
        return resize(source,
            (long) Math.rint(dimX * scaleX), (long) Math.rint(dimY * scaleY),
            0.0, 0.0, dimX, dimY);
    }

    public Matrix<UpdatablePArray> resize(
        Matrix<? extends PArray> source,
        long newDimX, long newDimY,
        double fromX, double fromY, double toX, double toY)
    {
        checkSource(source);
        if (newDimX < 0 || newDimY < 0) {
            throw new IllegalArgumentException("Negative new dimensions " + newDimX + "x" + newDimY);
        }
        if (Double.isNaN(fromX) || Double.isNaN(fromY) || Double.isNaN(toX) || Double.isNaN(toY)) {
            throw new IllegalArgumentException("NaN in the source box");
        }
        final long bandCount = source.dim(DIM_BAND);
        final long dimX = source.dim(DIM_WIDTH);
        final long dimY = source.dim(DIM_HEIGHT);
        final Matrix<UpdatablePArray> result = Arrays.SMM.newMatrix(
            UpdatablePArray.class, source.elementType(), bandCount, newDimX, newDimY);
        if (newDimX == 0 || newDimY == 0 || bandCount == 0) {
            return result;
        }
        if (dimX == 0 || dimY == 0) {
            throw new IllegalArgumentException("Cannot resize empty matrix " + source
                + " into " + newDimX + "x" + newDimY);
        }
        final int bands = toInt(bandCount);
        final int newX = toInt(newDimX);
        final int newY = toInt(newDimY);
        final Coefficients horizontal = Coefficients.compute(kernel, toInt(dimX), newX, fromX, toX);
        final Coefficients vertical = Coefficients.compute(kernel, toInt(dimY), newY, fromY, toY);
        final int minRow = vertical.minIndex();
        final int rowCount = vertical.maxIndex() - minRow;

        final PArray src = source.array();
        final int lineLength = toInt(bandCount * dimX);
        final double[] line = new double[lineLength];
        final double[] work = new double[toInt((long) bands * newX * rowCount)];
        for (int r = 0; r < rowCount; r++) {
            final long rowOffset = (long) (minRow + r) * lineLength;
            for (int i = 0; i < lineLength; i++) {
                line[i] = src.getDouble(rowOffset + i);
            }
            int disp = r * newX * bands;
            for (int x = 0; x < newX; x++) {
                final int first = horizontal.first[x];
                final double[] weights = horizontal.weights[x];
                for (int b = 0; b < bands; b++, disp++) {
                    double sum = 0.0;
                    for (int k = 0, p = first * bands + b; k < weights.length; k++, p += bands) {
                        sum += weights[k] * line[p];
                    }
                    work[disp] = sum;
                }
            }
        }

        final UpdatablePArray dest = result.array();
        final boolean rounding = !(dest instanceof PFloatingArray);
        final double minValue = dest.minPossibleValue(0.0);
        final double maxValue = dest.maxPossibleValue(1.0);
        long destIndex = 0;
        for (int y = 0; y < newY; y++) {
            final int first = vertical.first[y] - minRow;
            final double[] weights = vertical.weights[y];
            for (int x = 0; x < newX; x++) {
                for (int b = 0; b < bands; b++, destIndex++) {
                    double sum = 0.0;
                    for (int k = 0, p = ((first * newX) + x) * bands + b; k < weights.length;
                         k++, p += newX * bands)
                    {
                        sum += weights[k] * work[p];
                    }
                    if (rounding) {
                        sum = Math.min(maxValue, Math.max(minValue, Math.rint(sum)));
                    }
                    dest.setDouble(destIndex, sum);
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "matrix resampler (" + kernel + ")";
    }

    private static void checkSource(Matrix<? extends PArray> source) {
        Objects.requireNonNull(source, "Null source matrix");
        if (source.dimCount() != 3) {
            throw new IllegalArgumentException("Illegal number of dimensions (" + source.dimCount()
                + ") of " + source + ": must be 3 (band, x, y)");
        }
    }

    private static int toInt(long value) {
        if (value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large matrix for resampling: " + value + " >= 2^31");
        }
        return (int) value;
    }

    static final class Coefficients {
        final int[] first;
        final double[][] weights;

        private Coefficients(int[] first, double[][] weights) {
            this.first = first;
            this.weights = weights;
        }

        int minIndex() {
            int result = Integer.MAX_VALUE;
            for (int k = 0; k < first.length; k++) {
                result = Math.min(result, first[k]);
            }
            return result;
        }

        int maxIndex() {
            int result = 0;
            for (int k = 0; k < first.length; k++) {
                result = Math.max(result, first[k] + weights[k].length);
            }
            return result;
        }

        static Coefficients compute(ResamplingKernel kernel, int inSize, int outSize, double from, double to) {
            assert inSize > 0 && outSize > 0;
            final double scale = (to - from) / outSize;
            final int[] first = new int[outSize];
            final double[][] weights = new double[outSize][];
            final double radius = kernel.radius();
            final double filterScale = Math.max(scale, 1.0);
            final double support = radius * filterScale;
            for (int i = 0; i < outSize; i++) {
                final double center = from + (i + 0.5) * scale;
                if (radius <= 0.0) {
                    first[i] = nearest(center, inSize);
                    weights[i] = new double[] {1.0};
                    continue;
                }
                int min = (int) (center - support + 0.5);
                if (min < 0) {
                    min = 0;
                }
                int max = (int) (center + support + 0.5);
                if (max > inSize) {
                    max = inSize;
                }
                final int count = max - min;
                double sum = 0.0;
                final double[] w = new double[Math.max(count, 0)];
                for (int k = 0; k < count; k++) {
                    w[k] = kernel.weight((k + min - center + 0.5) / filterScale);
                    sum += w[k];
                }
                if (count <= 0 || sum == 0.0) {
                    // the box lies outside the source: the nearest existing sample is the only one
                    first[i] = nearest(center, inSize);
                    weights[i] = new double[] {1.0};
                    continue;
                }
                for (int k = 0; k < count; k++) {
                    w[k] /= sum;
                }
                first[i] = min;
                weights[i] = w;
            }
            return new Coefficients(first, weights);
        }

        private static int nearest(double center, int inSize) {
            return (int) Math.max(0, Math.min((long) Math.floor(center), inSize - 1));
        }
    }
}
