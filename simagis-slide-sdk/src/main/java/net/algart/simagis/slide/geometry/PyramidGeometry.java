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

import java.util.NoSuchElementException;

/**
 * <p>Geometry of a discretely-leveled pyramid: the number of stored levels, their dimensions and
 * their downsample factors relatively to the level #0.</p>
 *
 * <p>This is the only part of a slide backend, necessary for {@link CoordinateMapper}.</p>
 */
public interface PyramidGeometry {
    int DIM_BAND = 0;
    int DIM_WIDTH = 1;
    int DIM_HEIGHT = 2;

    int numberOfLevels();

    // Usually 1, 3, 4; must be positive
    int bandCount();

    /**
     * <p>Returns dimensions of the given pyramid level. Number of elements in the result array is always 3:</p>
     * <ul>
     * <li><tt>result[{@link #DIM_BAND}]</tt> is always equal to {@link #bandCount()};</li>
     * <li><tt>result[{@link #DIM_WIDTH}]</tt> is the <i>x</i>-dimension of the level in pixels;</li>
     * <li><tt>result[{@link #DIM_HEIGHT}]</tt> is the <i>y</i>-dimension of the level in pixels.</li>
     * </ul>
     *
     * <p>This method always returns a new Java array.</p>
     *
     * @param level the level of pyramid; zero level corresponds to the best resolution.
     * @return dimensions of the specified level.
     * @throws NoSuchElementException if there is no such level.
     */
    long[] dimensions(int level) throws NoSuchElementException;

    // Always >= 1.0; 1.0 for the level #0
    double levelDownsample(int level) throws NoSuchElementException;

    /**
     * Returns the index of the level with the largest downsample factor, not exceeding the passed one,
     * or 0 if the passed factor is less than the downsample of every level.
     *
     * @param downsample desired downsample factor relatively to the level #0.
     * @return the best level for reading data at this downsample.
     */
    int bestLevelForDownsample(double downsample);
}
