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
 * Sanity checks of requested regions. All methods throw before any access to the pixel data.
 */
public final class RegionChecks {
    public static final double MPP_RELATIVE_TOLERANCE = 0.015;

    private RegionChecks() {
    }

    public static void checkScaling(double scaling) {
        if (!(scaling > 0.0) || Double.isInfinite(scaling)) {
            throw new IllegalArgumentException("Illegal scaling " + scaling + " (must be positive and finite)");
        }
    }

    public static void checkSize(long sizeX, long sizeY) {
        if (sizeX < 0 || sizeY < 0) {
            throw new IndexOutOfBoundsException("Size values must not be negative. Got ["
                + sizeX + ", " + sizeY + "]");
        }
    }

    /**
     * Checks that the rectangle <tt>x..x+sizeX</tt> x <tt>y..y+sizeY</tt> lies inside
     * <tt>0..levelDimX</tt> x <tt>0..levelDimY</tt>.
     *
     * @throws IndexOutOfBoundsException if some size is negative or if the region is outside level boundaries.
     */
    public static void checkSizeAndLocation(
        double x, double y,
        long sizeX, long sizeY,
        long levelDimX, long levelDimY)
    {
        checkSize(sizeX, sizeY);
        if (Double.isNaN(x) || Double.isNaN(y)) {
            throw new IllegalArgumentException("NaN location (" + x + ", " + y + ")");
        }
        final double toX = x + sizeX;
        final double toY = y + sizeY;
        if (x < 0 || y < 0 || toX > levelDimX || toY > levelDimY) {
            throw new IndexOutOfBoundsException(String.format(Locale.US,
                "Requested region is outside level boundaries. [%s, %s] + [%d, %d] (=[%s, %s]) > [%d, %d]",
                format(x), format(y), sizeX, sizeY, format(toX), format(toY), levelDimX, levelDimY));
        }
    }

    /**
     * Checks that both microns-per-pixel values are positive and finite and that the pixels are square
     * with relative tolerance {@link #MPP_RELATIVE_TOLERANCE}: <tt>|mppX&minus;mppY| &le;
     * tolerance&nbsp;&middot;&nbsp;max(mppX,&nbsp;mppY)</tt>.
     *
     * @throws IllegalArgumentException if the values are invalid or too anisotropic.
     */
    public static void checkMpp(double mppX, double mppY) {
        if (!(mppX > 0.0) || !(mppY > 0.0) || Double.isInfinite(mppX) || Double.isInfinite(mppY)) {
            throw new IllegalArgumentException("Illegal microns per pixel " + mppX + ", " + mppY
                + " (must be positive and finite)");
        }
        if (Math.abs(mppX - mppY) > MPP_RELATIVE_TOLERANCE * Math.max(mppX, mppY)) {
            throw new IllegalArgumentException(String.format(Locale.US,
                "Microns per pixel %s and %s differ by more than %.1f%%: non-square pixels are not supported",
                mppX, mppY, MPP_RELATIVE_TOLERANCE * 100.0));
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) && Math.abs(value) < 1e15 ?
            String.valueOf((long) value) :
            String.valueOf(value);
    }
}
