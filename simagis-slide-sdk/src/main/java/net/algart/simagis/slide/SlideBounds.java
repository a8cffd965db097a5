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

/**
 * Rectangle at the level #0, containing the tissue: offset and size in pixels.
 * It may be less than the full dimensions of the slide.
 */
public final class SlideBounds {
    private final long offsetX;
    private final long offsetY;
    private final long sizeX;
    private final long sizeY;

    private SlideBounds(long offsetX, long offsetY, long sizeX, long sizeY) {
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
    }

    public static SlideBounds valueOf(long offsetX, long offsetY, long sizeX, long sizeY) {
        if (offsetX < 0 || offsetY < 0) {
            throw new IllegalArgumentException("Negative offset of slide bounds " + offsetX + ", " + offsetY);
        }
        if (sizeX < 0 || sizeY < 0) {
            throw new IllegalArgumentException("Negative size of slide bounds " + sizeX + "x" + sizeY);
        }
        return new SlideBounds(offsetX, offsetY, sizeX, sizeY);
    }

    public long offsetX() {
        return offsetX;
    }

    public long offsetY() {
        return offsetY;
    }

    public long sizeX() {
        return sizeX;
    }

    public long sizeY() {
        return sizeY;
    }

    /**
     * Returns these bounds at the given scaling: all 4 values are multiplied by <tt>scaling</tt>
     * and truncated.
     *
     * @param scaling the scaling relatively to the level #0.
     * @return scaled bounds.
     */
    public SlideBounds scale(double scaling) {
        if (!(scaling > 0.0) || Double.isInfinite(scaling)) {
            throw new IllegalArgumentException("Illegal scaling " + scaling + " (must be positive and finite)");
        }
        return new SlideBounds(
            (long) (scaling * offsetX), (long) (scaling * offsetY),
            (long) (scaling * sizeX), (long) (scaling * sizeY));
    }

    @Override
    public String toString() {
        return "slide bounds " + offsetX + "," + offsetY + " [" + sizeX + "x" + sizeY + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlideBounds)) {
            return false;
        }
        final SlideBounds that = (SlideBounds) o;
        return offsetX == that.offsetX && offsetY == that.offsetY && sizeX == that.sizeX && sizeY == that.sizeY;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(offsetX);
        result = 31 * result + Long.hashCode(offsetY);
        result = 31 * result + Long.hashCode(sizeX);
        result = 31 * result + Long.hashCode(sizeY);
        return result;
    }
}
