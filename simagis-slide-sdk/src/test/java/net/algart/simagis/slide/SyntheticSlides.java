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
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.UpdatablePArray;
import net.algart.simagis.slide.sources.MemorySlideBackend;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class SyntheticSlides {
    static final double MPP = 0.25;

    private SyntheticSlides() {
    }

    static int value(int band, long x, long y) {
        return (int) ((x + 3 * y + 17 * band) % 251);
    }

    static Matrix<UpdatablePArray> gradient(int bandCount, long dimX, long dimY) {
        final Matrix<UpdatablePArray> result = Arrays.SMM.newMatrix(
            UpdatablePArray.class, byte.class, bandCount, dimX, dimY);
        final UpdatablePArray array = result.array();
        for (long y = 0; y < dimY; y++) {
            for (long x = 0; x < dimX; x++) {
                for (int b = 0; b < bandCount; b++) {
                    array.setDouble(result.index(b, x, y), value(b, x, y));
                }
            }
        }
        return result;
    }

    /**
     * Pyramid with strict compression 2: level #k has dimensions <tt>dimX/2^k</tt> x <tt>dimY/2^k</tt>.
     */
    static MemorySlideBackend backend(long dimX, long dimY, int numberOfLevels) {
        final List<Matrix<? extends PArray>> levels = new ArrayList<Matrix<? extends PArray>>();
        for (int k = 0; k < numberOfLevels; k++) {
            levels.add(gradient(3, dimX >> k, dimY >> k));
        }
        final MemorySlideBackend result = new MemorySlideBackend(levels);
        result.setSpacing(MPP, MPP);
        return result;
    }

    /**
     * Pyramid with arbitrary level dimensions; every level contains the horizontal float ramp <tt>10&middot;x</tt>
     * in its own pixels.
     */
    static MemorySlideBackend rampBackend(long[][] levelDimensions) {
        final List<Matrix<? extends PArray>> levels = new ArrayList<Matrix<? extends PArray>>();
        for (long[] dim : levelDimensions) {
            final Matrix<UpdatablePArray> m = Arrays.SMM.newMatrix(
                UpdatablePArray.class, float.class, 1, dim[0], dim[1]);
            for (long y = 0; y < dim[1]; y++) {
                for (long x = 0; x < dim[0]; x++) {
                    m.array().setDouble(m.index(0, x, y), 10.0 * x);
                }
            }
            levels.add(m);
        }
        final MemorySlideBackend result = new MemorySlideBackend(levels);
        result.setSpacing(MPP, MPP);
        return result;
    }

    static double get(Matrix<? extends PArray> m, int band, long x, long y) {
        return m.array().getDouble(m.index(band, x, y));
    }

    static final class CountingBackend extends AbstractSlideBackendWrapper {
        final SlideBackend parent;
        final AtomicInteger readCount = new AtomicInteger();
        final AtomicInteger closeCount = new AtomicInteger();
        volatile long[] lastRead = null;

        CountingBackend(SlideBackend parent) {
            this.parent = parent;
        }

        @Override
        protected SlideBackend parent() {
            return parent;
        }

        @Override
        public Matrix<? extends PArray> read(long levelZeroX, long levelZeroY, int level, long sizeX, long sizeY)
            throws IOException
        {
            readCount.incrementAndGet();
            lastRead = new long[] {levelZeroX, levelZeroY, level, sizeX, sizeY};
            return super.read(levelZeroX, levelZeroY, level, sizeX, sizeY);
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
            super.close();
        }
    }

    static final class FailingBackend extends AbstractSlideBackendWrapper {
        final SlideBackend parent;

        FailingBackend(SlideBackend parent) {
            this.parent = parent;
        }

        @Override
        protected SlideBackend parent() {
            return parent;
        }

        @Override
        public Matrix<? extends PArray> read(long levelZeroX, long levelZeroY, int level, long sizeX, long sizeY)
            throws IOException
        {
            throw new IOException("Corrupted tile at level #" + level);
        }
    }
}
