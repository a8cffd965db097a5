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

import java.util.Locale;

/**
 * <p>Result of {@link CoordinateMapper}: the padded window, which must be read from one native level
 * of the pyramid, and the fractional position of the requested region inside this window.</p>
 *
 * <p>The window is addressed in level #0 coordinates (<tt>levelZeroX</tt>, <tt>levelZeroY</tt>),
 * because backends are indexed by level #0, but its size is measured in pixels of the native level.
 * The backend starts the window at the integer level pixel {@link #levelOriginX()}, {@link #levelOriginY()};
 * the crop boxes are measured from it.</p>
 */
public final class NativeRegion {
    final int level;
    final double levelDownsample;
    final double nativeScaling;
    final double nativeX;
    final double nativeY;
    final double nativeSizeX;
    final double nativeSizeY;
    final double supportX;
    final double supportY;
    final double adaptedX;
    final double adaptedY;
    final long levelOriginX;
    final long levelOriginY;
    final long levelZeroX;
    final long levelZeroY;
    final long windowSizeX;
    final long windowSizeY;

    NativeRegion(
        int level,
        double levelDownsample,
        double nativeScaling,
        double nativeX, double nativeY,
        double nativeSizeX, double nativeSizeY,
        double supportX, double supportY,
        double adaptedX, double adaptedY,
        long levelOriginX, long levelOriginY,
        long levelZeroX, long levelZeroY,
        long windowSizeX, long windowSizeY)
    {
        this.level = level;
        this.levelDownsample = levelDownsample;
        this.nativeScaling = nativeScaling;
        this.nativeX = nativeX;
        this.nativeY = nativeY;
        this.nativeSizeX = nativeSizeX;
        this.nativeSizeY = nativeSizeY;
        this.supportX = supportX;
        this.supportY = supportY;
        this.adaptedX = adaptedX;
        this.adaptedY = adaptedY;
        this.levelOriginX = levelOriginX;
        this.levelOriginY = levelOriginY;
        this.levelZeroX = levelZeroX;
        this.levelZeroY = levelZeroY;
        this.windowSizeX = windowSizeX;
        this.windowSizeY = windowSizeY;
    }

    public int level() {
        return level;
    }

    public double levelDownsample() {
        return levelDownsample;
    }

    // scaling * levelDownsample: the scaling, which should be applied to the native level
    public double nativeScaling() {
        return nativeScaling;
    }

    public double nativeX() {
        return nativeX;
    }

    public double nativeY() {
        return nativeY;
    }

    public double nativeSizeX() {
        return nativeSizeX;
    }

    public double nativeSizeY() {
        return nativeSizeY;
    }

    public double supportX() {
        return supportX;
    }

    public double supportY() {
        return supportY;
    }

    // Real-valued re-projection of levelZeroX to the native level
    public double adaptedX() {
        return adaptedX;
    }

    public double adaptedY() {
        return adaptedY;
    }

    // First pixel of the window at the native level, see CoordinateMapper.levelOrigin
    public long levelOriginX() {
        return levelOriginX;
    }

    public long levelOriginY() {
        return levelOriginY;
    }

    public long levelZeroX() {
        return levelZeroX;
    }

    public long levelZeroY() {
        return levelZeroY;
    }

    public long windowSizeX() {
        return windowSizeX;
    }

    public long windowSizeY() {
        return windowSizeY;
    }

    public double cropFromX() {
        return nativeX - levelOriginX;
    }

    public double cropFromY() {
        return nativeY - levelOriginY;
    }

    /**
     * <p>Returns the real-valued crop box <tt>{fromX, fromY, toX, toY}</tt> of the requested region
     * inside the decoded window.</p>
     *
     * <p>The right and bottom bounds are clipped to the actual decoded buffer, which may be a little less than
     * {@link #windowSizeX()} x {@link #windowSizeY()} for some backends; they are never less than
     * the left and top bounds.</p>
     *
     * @param bufferDimX actual width of the decoded buffer.
     * @param bufferDimY actual height of the decoded buffer.
     * @return the continuous crop box.
     */
    public double[] continuousCropBox(long bufferDimX, long bufferDimY) {
        final double fromX = cropFromX();
        final double fromY = cropFromY();
        return new double[] {
            fromX,
            fromY,
            Math.max(fromX, clip(fromX + nativeSizeX, bufferDimX)),
            Math.max(fromY, clip(fromY + nativeSizeY, bufferDimY))
        };
    }

    /**
     * <p>Returns the integer crop box <tt>{fromX, fromY, toX, toY}</tt> inside the decoded window:
     * left and top bounds are floored, right and bottom bounds are rounded (half to even).</p>
     *
     * <p>The box is then clipped to the decoded buffer and always contains at least 1 pixel
     * in every direction, if the buffer is not empty.</p>
     *
     * @param bufferDimX actual width of the decoded buffer.
     * @param bufferDimY actual height of the decoded buffer.
     * @return the integer crop box.
     */
    public long[] integerCropBox(long bufferDimX, long bufferDimY) {
        final double fromX = cropFromX();
        final double fromY = cropFromY();
        long left = (long) Math.floor(fromX);
        long top = (long) Math.floor(fromY);
        long right = (long) Math.rint(fromX + nativeSizeX);
        long bottom = (long) Math.rint(fromY + nativeSizeY);
        left = Math.max(0, Math.min(left, bufferDimX - 1));
        top = Math.max(0, Math.min(top, bufferDimY - 1));
        right = Math.min(Math.max(right, left + 1), bufferDimX);
        bottom = Math.min(Math.max(bottom, top + 1), bufferDimY);
        return new long[] {left, top, Math.max(left, right), Math.max(top, bottom)};
    }

    @Override
    public String toString() {
        return String.format(Locale.US,
            "native region at level %d (downsample %.4f, native scaling %.5f): "
                + "native %.3f,%.3f [%.3f x %.3f], support %.1f/%.1f, "
                + "window %d,%d at level #0 (%d,%d at level, adapted %.3f,%.3f) [%d x %d]",
            level, levelDownsample, nativeScaling,
            nativeX, nativeY, nativeSizeX, nativeSizeY, supportX, supportY,
            levelZeroX, levelZeroY, levelOriginX, levelOriginY, adaptedX, adaptedY, windowSizeX, windowSizeY);
    }

    private static double clip(double value, long max) {
        return Math.min(Math.max(value, 0.0), (double) max);
    }
}
