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
import net.algart.simagis.slide.geometry.PyramidGeometry;
import org.json.JSONObject;

import java.awt.color.ICC_Profile;
import java.io.Closeable;
import java.io.IOException;
import java.util.NoSuchElementException;

/**
 * <p>Access to a pyramidal slide, stored in some external format: the discrete set of levels
 * (see {@link PyramidGeometry}), slide metadata and reading of native pixels.</p>
 *
 * <p>All pixel data are represented by 3-dimensional packed matrices <tt>[band, x, y]</tt>:
 * <tt>dim(0)</tt> is the number of color bands (usually 1, 3 or 4), <tt>dim(1)</tt> and <tt>dim(2)</tt>
 * are the width and the height.</p>
 *
 * <p>Implementations must allow reading from several threads simultaneously, or serialize reading
 * internally: {@link SlideImage} does not synchronize calls of {@link #read read} method.</p>
 */
public interface SlideBackend extends PyramidGeometry, Closeable {
    int DEBUG_LEVEL = Math.max(
        Arrays.SystemSettings.getIntProperty("net.algart.simagis.slide.debugLevel", 1),
        Arrays.SystemSettings.getIntEnv("NET_ALGART_SIMAGIS_SLIDE_DEBUGLEVEL", 1));

    long DEFAULT_THUMBNAIL_SIZE = Math.max(16,
        Arrays.SystemSettings.getLongProperty("net.algart.simagis.slide.thumbnailSize", 512));

    /**
     * Returns the element type of all matrices, returned by this backend: <tt>byte.class</tt> for
     * usual 8-bit images.
     *
     * @return the element type of pixel data.
     */
    Class<?> elementType();

    /**
     * Returns <tt>{mppX, mppY}</tt>, microns per pixel of the level #0, or <tt>null</tt>
     * if the format does not store this information and it was not set by {@link #setSpacing}.
     *
     * @return new array with the spacing or <tt>null</tt>.
     */
    double[] spacing();

    void setSpacing(double mppX, double mppY);

    /**
     * Returns the spacing of the given level: {@link #spacing()}, multiplied by the level downsample,
     * or <tt>null</tt> if the spacing is unknown.
     */
    double[] levelSpacing(int level) throws NoSuchElementException;

    // Scanner vendor, null if unknown
    String vendor();

    // Objective power, null if unknown
    Double magnification();

    /**
     * Returns all additional metadata of the slide as JSON. The result is a new object,
     * which can be modified without affecting the backend.
     *
     * @return the properties of this slide (maybe empty, but never <tt>null</tt>).
     */
    JSONObject properties();

    SlideBounds slideBounds();

    // Embedded ICC profile of the pixel data, null if absent
    ICC_Profile colorProfile();

    /**
     * <p>Reads the rectangle of the given level. The position is specified in level #0 coordinates,
     * the size in pixels of the level. The first read pixel of the level is
     * {@link net.algart.simagis.slide.geometry.CoordinateMapper#levelOrigin(long, double, long)
     * levelOrigin(levelZeroX, levelDownsample(level), levelDimX)} (and the same for y).</p>
     *
     * <p>The returned matrix has <tt>sizeX</tt>&nbsp;x&nbsp;<tt>sizeY</tt> pixels or a little less,
     * if the rectangle crosses the boundary of the level and the backend does not continue the level
     * outside its dimensions.</p>
     *
     * @param levelZeroX x-coordinate of the top left corner at the level #0.
     * @param levelZeroY y-coordinate of the top left corner at the level #0.
     * @param level      index of the level.
     * @param sizeX      width of the rectangle at the specified level.
     * @param sizeY      height of the rectangle at the specified level.
     * @return packed pixels <tt>[band, x, y]</tt>.
     * @throws IOException               in a case of any problems while reading or decoding data.
     * @throws NoSuchElementException    if there is no such level.
     * @throws IndexOutOfBoundsException if the position or the size is negative.
     * @throws IllegalStateException     if the backend is already closed.
     */
    Matrix<? extends PArray> read(long levelZeroX, long levelZeroY, int level, long sizeX, long sizeY)
        throws IOException;

    /**
     * Returns the whole slide, reduced to fit inside <tt>maxDimX</tt>&nbsp;x&nbsp;<tt>maxDimY</tt>
     * with preserving the aspect ratio. The thumbnail is never larger than the level #0.
     */
    Matrix<? extends PArray> thumbnail(long maxDimX, long maxDimY) throws IOException;

    boolean isClosed();

    /**
     * Releases all resources of this backend. Must be idempotent: second and further calls do nothing.
     */
    @Override
    void close();
}
