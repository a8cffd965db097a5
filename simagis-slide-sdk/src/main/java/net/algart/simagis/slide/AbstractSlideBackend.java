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
import net.algart.simagis.slide.geometry.CoordinateMapper;
import net.algart.simagis.slide.geometry.LevelGeometry;
import org.json.JSONObject;

import java.awt.color.ICC_Profile;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * <p>Skeleton implementation of {@link SlideBackend}.</p>
 *
 * <p>Subclasses must implement {@link #numberOfLevels()}, {@link #bandCount()}, {@link #dimensions(int)},
 * {@link #elementType()} and {@link #readLevelRegion(int, long, long, long, long)}.
 * Downsample factors are calculated from the level dimensions, the best level is chosen in the same
 * way as OpenSlide does it. {@link #read read} method converts level #0 coordinates into the coordinates
 * of the level and checks all arguments before calling {@link #readLevelRegion readLevelRegion}.</p>
 */
public abstract class AbstractSlideBackend implements SlideBackend {
    private static final Logger LOGGER = Logger.getLogger(AbstractSlideBackend.class.getName());

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile double[] spacing = null;
    private volatile double[] downsamples = null;

    protected AbstractSlideBackend() {
    }

    @Override
    public double levelDownsample(int level) throws NoSuchElementException {
        checkLevel(level);
        return downsamples()[level];
    }

    @Override
    public int bestLevelForDownsample(double downsample) {
        return LevelGeometry.bestLevel(downsamples(), downsample);
    }

    @Override
    public double[] spacing() {
        final double[] spacing = this.spacing;
        return spacing == null ? null : spacing.clone();
    }

    @Override
    public void setSpacing(double mppX, double mppY) {
        if (!(mppX > 0.0) || !(mppY > 0.0) || Double.isInfinite(mppX) || Double.isInfinite(mppY)) {
            throw new IllegalArgumentException("Illegal spacing " + mppX + ", " + mppY
                + " (must be positive and finite)");
        }
        this.spacing = new double[] {mppX, mppY};
    }

    @Override
    public double[] levelSpacing(int level) throws NoSuchElementException {
        final double downsample = levelDownsample(level);
        final double[] spacing = this.spacing;
        return spacing == null ? null : new double[] {spacing[0] * downsample, spacing[1] * downsample};
    }

    @Override
    public String vendor() {
        return null;
    }

    @Override
    public Double magnification() {
        return null;
    }

    @Override
    public JSONObject properties() {
        return new JSONObject();
    }

    @Override
    public SlideBounds slideBounds() {
        final long[] dim = dimensions(0);
        return SlideBounds.valueOf(0, 0, dim[DIM_WIDTH], dim[DIM_HEIGHT]);
    }

    @Override
    public ICC_Profile colorProfile() {
        return null;
    }

    @Override
    public final Matrix<? extends PArray> read(
        long levelZeroX, long levelZeroY,
        int level,
        long sizeX, long sizeY)
        throws IOException
    {
        checkRead(levelZeroX, levelZeroY, level, sizeX, sizeY);
        final double downsample = levelDownsample(level);
        final long[] dim = dimensions(level);
        final long fromX = CoordinateMapper.levelOrigin(levelZeroX, downsample, dim[DIM_WIDTH]);
        final long fromY = CoordinateMapper.levelOrigin(levelZeroY, downsample, dim[DIM_HEIGHT]);
        final Matrix<? extends PArray> result = readLevelRegion(level, fromX, fromY, sizeX, sizeY);
        if (result == null) {
            throw new AssertionError("Invalid implementation of " + getClass() + ": null matrix");
        }
        if (result.dimCount() != 3 || result.dim(DIM_BAND) != bandCount()) {
            throw new AssertionError("Invalid implementation of " + getClass()
                + ": illegal dimensions of the returned matrix " + result);
        }
        return result;
    }

    @Override
    public Matrix<? extends PArray> thumbnail(long maxDimX, long maxDimY) throws IOException {
        final long[] dim0 = dimensions(0);
        final long[] size = SlideTools.fitSize(dim0[DIM_WIDTH], dim0[DIM_HEIGHT], maxDimX, maxDimY);
        final double downsample = Math.max(
            (double) dim0[DIM_WIDTH] / (double) maxDimX,
            (double) dim0[DIM_HEIGHT] / (double) maxDimY);
        final int level = bestLevelForDownsample(downsample);
        final long[] dim = dimensions(level);
        long t1 = System.nanoTime();
        final Matrix<? extends PArray> source = read(0, 0, level, dim[DIM_WIDTH], dim[DIM_HEIGHT]);
        final Matrix<UpdatablePArray> result = Arrays.SMM.newMatrix(
            UpdatablePArray.class, source.elementType(), source.dim(DIM_BAND), size[0], size[1]);
        Matrices.resize(null, Matrices.ResizingMethod.POLYLINEAR_AVERAGING, result, source);
        long t2 = System.nanoTime();
        if (DEBUG_LEVEL >= 2) {
            LOGGER.info(String.format(Locale.US, "%s: thumbnail %d x %d from level #%d (%d x %d), %.3f ms",
                getClass().getSimpleName(), size[0], size[1], level, dim[DIM_WIDTH], dim[DIM_HEIGHT],
                (t2 - t1) * 1e-6));
        }
        return result;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public final void close() {
        if (closed.compareAndSet(false, true)) {
            freeResources();
        }
    }

    /**
     * Reads the rectangle <tt>fromX..fromX+sizeX-1</tt> x <tt>fromY..fromY+sizeY-1</tt> of the given level.
     * Arguments are already checked: the level exists, the position is inside the level and the sizes
     * are not negative, but the rectangle can cross the level boundary.
     */
    protected abstract Matrix<? extends PArray> readLevelRegion(
        int level,
        long fromX, long fromY,
        long sizeX, long sizeY)
        throws IOException;

    /**
     * Called once by the first call of {@link #close()}. This implementation does nothing.
     */
    protected void freeResources() {
    }

    protected void checkRead(long levelZeroX, long levelZeroY, int level, long sizeX, long sizeY) {
        if (closed.get()) {
            throw new IllegalStateException("Cannot read from closed " + this);
        }
        checkLevel(level);
        if (levelZeroX < 0 || levelZeroY < 0) {
            throw new IndexOutOfBoundsException("Negative level #0 position " + levelZeroX + ", " + levelZeroY);
        }
        if (sizeX < 0 || sizeY < 0) {
            throw new IndexOutOfBoundsException("Negative size " + sizeX + "x" + sizeY);
        }
    }

    protected void checkLevel(int level) {
        if (level < 0 || level >= numberOfLevels()) {
            throw new NoSuchElementException("Level #" + level + " is absent (there are "
                + numberOfLevels() + " levels)");
        }
    }

    private double[] downsamples() {
        double[] result = this.downsamples;
        if (result == null) {
            final List<long[]> dimensions = new ArrayList<long[]>();
            for (int k = 0, n = numberOfLevels(); k < n; k++) {
                dimensions.add(dimensions(k));
            }
            this.downsamples = result = LevelGeometry.downsamplesOf(dimensions);
        }
        return result;
    }
}
