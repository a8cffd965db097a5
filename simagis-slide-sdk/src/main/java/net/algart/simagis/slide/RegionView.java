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
import net.algart.simagis.slide.geometry.RegionChecks;

import java.io.IOException;

/**
 * <p>Two-dimensional image with some physical resolution, which can be read by rectangular regions.</p>
 *
 * <p>{@link #readRegion readRegion} method resolves the regions, crossing the boundary of the view,
 * according to the {@link BoundaryMode} of this view, and reads the pixels by
 * {@link #readRegionImpl readRegionImpl}, which is called only for regions inside the view.</p>
 */
public abstract class RegionView {
    private final BoundaryMode boundaryMode;

    protected RegionView(BoundaryMode boundaryMode) {
        this.boundaryMode = boundaryMode;
    }

    // null means rejecting regions outside the view
    public BoundaryMode boundaryMode() {
        return boundaryMode;
    }

    // Microns per pixel of this view
    public abstract double mpp();

    public abstract long dimX();

    public abstract long dimY();

    /**
     * Reads the region <tt>x..x+sizeX</tt> x <tt>y..y+sizeY</tt> of this view.
     *
     * <p>If the region is not inside the view, the result depends on the boundary mode:
     * {@link BoundaryMode#CONSTANT} returns <tt>sizeX</tt>&nbsp;x&nbsp;<tt>sizeY</tt> matrix, where
     * the pixels outside the view are zero; {@link BoundaryMode#CROP} returns only the intersection
     * with the view; without boundary mode, {@link #readRegionImpl readRegionImpl} is called
     * with the original arguments and usually throws <tt>IndexOutOfBoundsException</tt>.
     *
     * @throws IndexOutOfBoundsException if the size is negative.
     * @throws IOException               in a case of I/O errors while reading.
     */
    public Matrix<? extends PArray> readRegion(double x, double y, long sizeX, long sizeY) throws IOException {
        RegionChecks.checkSize(sizeX, sizeY);
        if (Double.isNaN(x) || Double.isNaN(y)) {
            throw new IllegalArgumentException("NaN location (" + x + ", " + y + ")");
        }
        final long dimX = dimX();
        final long dimY = dimY();
        if (boundaryMode == null || (x >= 0 && y >= 0 && x + sizeX <= dimX && y + sizeY <= dimY)) {
            return readRegionImpl(x, y, sizeX, sizeY);
        }
        final double fromX = Math.min(Math.max(x, 0.0), dimX);
        final double fromY = Math.min(Math.max(y, 0.0), dimY);
        final double toX = Math.min(x + sizeX, dimX);
        final double toY = Math.min(y + sizeY, dimY);
        final long clippedSizeX = Math.max(0, (long) Math.floor(toX - fromX));
        final long clippedSizeY = Math.max(0, (long) Math.floor(toY - fromY));
        final Matrix<? extends PArray> clipped = readRegionImpl(fromX, fromY, clippedSizeX, clippedSizeY);
        switch (boundaryMode) {
            case CROP: {
                return clipped;
            }
            case CONSTANT: {
                final long bandCount = clipped.dim(SlideBackend.DIM_BAND);
                final Matrix<UpdatablePArray> result = Arrays.SMM.newMatrix(
                    UpdatablePArray.class, clipped.elementType(), bandCount, sizeX, sizeY);
                if (clippedSizeX > 0 && clippedSizeY > 0) {
                    final long offsetX = (long) Math.floor(fromX - x);
                    final long offsetY = (long) Math.floor(fromY - y);
                    Matrices.copy(null,
                        result.subMatr(0, offsetX, offsetY, bandCount, clippedSizeX, clippedSizeY),
                        clipped);
                }
                return result;
            }
            default: {
                throw new AssertionError("Unsupported boundary mode " + boundaryMode);
            }
        }
    }

    protected abstract Matrix<? extends PArray> readRegionImpl(double x, double y, long sizeX, long sizeY)
        throws IOException;
}
