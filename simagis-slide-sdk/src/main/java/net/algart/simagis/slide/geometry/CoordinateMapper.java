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

package net.algart.simagis.slide.geometry;

import java.util.Objects;

/**
 * <p>Maps a region, requested at an arbitrary scaling relatively to the level #0,
 * to the window, which should be read from the best native level of the pyramid.</p>
 *
 * <p>The mapping is the following:</p>
 * <ol>
 * <li>the native level is the level with the largest downsample not exceeding <tt>1/scaling</tt>;</li>
 * <li>the requested region is projected to that level (real-valued);</li>
 * <li>{@link #INTERPOLATION_SUPPORT} samples of the interpolation kernel are added at every side
 * (more, measured in native pixels, when the native level must be downsampled),
 * and the window is clipped by the level boundaries;</li>
 * <li>the start of the window is converted to integer level #0 coordinates, because backends
 * are addressed by level #0 pixels; the backend converts them back to the integer level pixel
 * {@link #levelOrigin(long, double, long)}, and the requested region is positioned relatively to that pixel;</li>
 * <li>the end of the window is ceiled, so the window always covers the requested region.</li>
 * </ol>
 *
 * <p>This class is immutable and thread-safe, it performs no I/O.</p>
 */
public final class CoordinateMapper {
    /**
     * Number of samples at each side, required by Lanczos-3 basis functions at the border of the region.
     */
    public static final int INTERPOLATION_SUPPORT = 3;

    private final PyramidGeometry geometry;

    public CoordinateMapper(PyramidGeometry geometry) {
        this.geometry = Objects.requireNonNull(geometry, "Null pyramid geometry");
    }

    public PyramidGeometry geometry() {
        return geometry;
    }

    public static long scaledDim(long dim, double scaling) {
        return (long) (dim * scaling);
    }

    /**
     * Returns the first pixel of the given level, which corresponds to the given level #0 coordinate.
     * {@link net.algart.simagis.slide.AbstractSlideBackend} starts reading from this pixel,
     * and {@link NativeRegion#cropFromX()} is measured from it.
     *
     * @param levelZero  coordinate at level #0.
     * @param downsample downsample of the level.
     * @param levelDim   dimension of the level along the same axis.
     * @return <tt>round(levelZero/downsample)</tt>, but not greater than <tt>levelDim</tt>.
     */
    public static long levelOrigin(long levelZero, double downsample, long levelDim) {
        return Math.min(Math.round(levelZero / downsample), levelDim);
    }

    public long[] scaledSize(double scaling) {
        RegionChecks.checkScaling(scaling);
        final long[] dim = geometry.dimensions(0);
        return new long[] {
            scaledDim(dim[PyramidGeometry.DIM_WIDTH], scaling),
            scaledDim(dim[PyramidGeometry.DIM_HEIGHT], scaling)
        };
    }

    /**
     * Equivalent to {@link #map(double, double, double, long, long, long, long)}, where
     * the level boundaries are the dimensions of level #0, multiplied by <tt>scaling</tt> and truncated.
     */
    public NativeRegion map(double x, double y, double scaling, long sizeX, long sizeY) {
        final long[] levelSize = scaledSize(scaling);
        return map(x, y, scaling, sizeX, sizeY, levelSize[0], levelSize[1]);
    }

    /**
     * Maps the region <tt>x..x+sizeX</tt> x <tt>y..y+sizeY</tt>, specified at the given <tt>scaling</tt>,
     * to the native window.
     *
     * @param x         x-coordinate of the top left corner at the requested scaling.
     * @param y         y-coordinate of the top left corner at the requested scaling.
     * @param scaling   requested scaling relatively to level #0, must be positive.
     * @param sizeX     width of the resulting region.
     * @param sizeY     height of the resulting region.
     * @param levelDimX width of the level at the requested scaling, used for checking the region.
     * @param levelDimY height of the level at the requested scaling, used for checking the region.
     * @return the padded native window.
     * @throws IndexOutOfBoundsException if the sizes are negative or the region is outside the level.
     * @throws IllegalArgumentException  if the scaling is not positive.
     */
    public NativeRegion map(
        double x, double y,
        double scaling,
        long sizeX, long sizeY,
        long levelDimX, long levelDimY)
    {
        RegionChecks.checkScaling(scaling);
        RegionChecks.checkSizeAndLocation(x, y, sizeX, sizeY, levelDimX, levelDimY);

        final int level = geometry.bestLevelForDownsample(1.0 / scaling);
        final long[] nativeDim = geometry.dimensions(level);
        final long nativeDimX = nativeDim[PyramidGeometry.DIM_WIDTH];
        final long nativeDimY = nativeDim[PyramidGeometry.DIM_HEIGHT];
        final double downsample = geometry.levelDownsample(level);
        final double nativeScaling = scaling * downsample;
        final double nativeX = x / nativeScaling;
        final double nativeY = y / nativeScaling;
        final double nativeSizeX = sizeX / nativeScaling;
        final double nativeSizeY = sizeY / nativeScaling;

        // A wider kernel is used while downsampling: it maps to more native samples
        final double support = nativeScaling > 1.0 ?
            INTERPOLATION_SUPPORT :
            Math.ceil(INTERPOLATION_SUPPORT / nativeScaling);

        final long startX = clip((long) Math.floor(nativeX - support), nativeDimX);
        final long startY = clip((long) Math.floor(nativeY - support), nativeDimY);
        final long levelZeroX = (long) Math.floor(startX * downsample);
        final long levelZeroY = (long) Math.floor(startY * downsample);
        final double adaptedX = levelZeroX / downsample;
        final double adaptedY = levelZeroY / downsample;
        // adapted is in (start - 1, start], so the origin never exceeds start
        final long levelOriginX = levelOrigin(levelZeroX, downsample, nativeDimX);
        final long levelOriginY = levelOrigin(levelZeroY, downsample, nativeDimY);

        final long endX = clip((long) Math.ceil(nativeX + nativeSizeX + support), nativeDimX);
        final long endY = clip((long) Math.ceil(nativeY + nativeSizeY + support), nativeDimY);
        final long windowSizeX = endX - levelOriginX;
        final long windowSizeY = endY - levelOriginY;
        assert windowSizeX >= 0 && windowSizeY >= 0 : "negative window " + windowSizeX + "x" + windowSizeY;

        return new NativeRegion(level, downsample, nativeScaling,
            nativeX, nativeY, nativeSizeX, nativeSizeY,
            support, support,
            adaptedX, adaptedY,
            levelOriginX, levelOriginY,
            levelZeroX, levelZeroY,
            windowSizeX, windowSizeY);
    }

    private static long clip(long value, long max) {
        return Math.max(0, Math.min(value, max));
    }
}
