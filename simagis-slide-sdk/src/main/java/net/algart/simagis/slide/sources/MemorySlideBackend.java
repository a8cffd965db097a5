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

package net.algart.simagis.slide.sources;

import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.simagis.slide.AbstractSlideBackend;
import net.algart.simagis.slide.SlideBackend;
import net.algart.simagis.slide.SlideBounds;
import org.json.JSONObject;

import java.awt.color.ICC_Profile;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <p>Backend, which stores all levels in the list of matrices <tt>[band, x, y]</tt>.</p>
 *
 * <p>If continuation is enabled (default), reading outside a level returns zero pixels there,
 * so the result always has the requested size. If it is disabled, the result is cropped by the level
 * boundaries, like in some real formats, which return a little less pixels at the right and bottom
 * edges.</p>
 */
public final class MemorySlideBackend extends AbstractSlideBackend implements SlideBackend {
    private final List<Matrix<? extends PArray>> levels;
    private final Class<?> elementType;
    private final int bandCount;

    private volatile boolean continuationEnabled = true;
    private volatile String vendor = null;
    private volatile Double magnification = null;
    private volatile SlideBounds slideBounds = null;
    private volatile String properties = "{}";
    private volatile ICC_Profile colorProfile = null;

    public MemorySlideBackend(List<? extends Matrix<? extends PArray>> levels) {
        Objects.requireNonNull(levels, "Null levels");
        this.levels = new ArrayList<Matrix<? extends PArray>>(levels);
        if (this.levels.isEmpty()) {
            throw new IllegalArgumentException("Empty list of levels");
        }
        final Matrix<? extends PArray> first = this.levels.get(0);
        for (int k = 0, n = this.levels.size(); k < n; k++) {
            final Matrix<? extends PArray> m = this.levels.get(k);
            Objects.requireNonNull(m, "Null level #" + k);
            if (m.dimCount() != 3) {
                throw new IllegalArgumentException("Illegal number of dimensions (" + m.dimCount()
                    + ") in level #" + k + ": all matrices must be 3-dimensional");
            }
            if (m.dim(DIM_BAND) > Integer.MAX_VALUE || m.dim(DIM_BAND) == 0) {
                throw new IllegalArgumentException("Illegal band count " + m.dim(DIM_BAND) + " in level #" + k);
            }
            if (m.dim(DIM_WIDTH) == 0 || m.dim(DIM_HEIGHT) == 0) {
                throw new IllegalArgumentException("Empty level #" + k + ": " + m);
            }
            if (m.dim(DIM_BAND) != first.dim(DIM_BAND)) {
                throw new IllegalArgumentException("Different band count in level #" + k + ": "
                    + m.dim(DIM_BAND) + " != " + first.dim(DIM_BAND));
            }
            if (m.elementType() != first.elementType()) {
                throw new IllegalArgumentException("Different element type in level #" + k + ": "
                    + m.elementType() + " != " + first.elementType());
            }
        }
        this.elementType = first.elementType();
        this.bandCount = (int) first.dim(DIM_BAND);
    }

    public boolean isContinuationEnabled() {
        return continuationEnabled;
    }

    public MemorySlideBackend setContinuationEnabled(boolean continuationEnabled) {
        this.continuationEnabled = continuationEnabled;
        return this;
    }

    public MemorySlideBackend setVendor(String vendor) {
        this.vendor = vendor;
        return this;
    }

    public MemorySlideBackend setMagnification(Double magnification) {
        this.magnification = magnification;
        return this;
    }

    // null means the whole level #0
    public MemorySlideBackend setSlideBounds(SlideBounds slideBounds) {
        this.slideBounds = slideBounds;
        return this;
    }

    public MemorySlideBackend setProperties(JSONObject properties) {
        Objects.requireNonNull(properties, "Null properties");
        this.properties = properties.toString();
        return this;
    }

    public MemorySlideBackend setColorProfile(ICC_Profile colorProfile) {
        this.colorProfile = colorProfile;
        return this;
    }

    @Override
    public int numberOfLevels() {
        return levels.size();
    }

    @Override
    public int bandCount() {
        return bandCount;
    }

    @Override
    public long[] dimensions(int level) throws NoSuchElementException {
        checkLevel(level);
        return levels.get(level).dimensions();
    }

    @Override
    public Class<?> elementType() {
        return elementType;
    }

    @Override
    public String vendor() {
        return vendor;
    }

    @Override
    public Double magnification() {
        return magnification;
    }

    @Override
    public JSONObject properties() {
        return new JSONObject(properties);
    }

    @Override
    public SlideBounds slideBounds() {
        final SlideBounds slideBounds = this.slideBounds;
        return slideBounds != null ? slideBounds : super.slideBounds();
    }

    @Override
    public ICC_Profile colorProfile() {
        return colorProfile;
    }

    @Override
    public String toString() {
        return "memory slide backend " + levels.get(0).dim(DIM_WIDTH) + "x" + levels.get(0).dim(DIM_HEIGHT)
            + " (" + levels.size() + " levels, " + bandCount + " bands, " + elementType + ")";
    }

    @Override
    protected Matrix<? extends PArray> readLevelRegion(int level, long fromX, long fromY, long sizeX, long sizeY) {
        final Matrix<? extends PArray> m = levels.get(level);
        if (continuationEnabled) {
            return m.subMatr(0, fromX, fromY, bandCount, sizeX, sizeY, Matrix.ContinuationMode.NULL_CONSTANT);
        }
        return m.subMatr(0, fromX, fromY, bandCount,
            Math.min(sizeX, m.dim(DIM_WIDTH) - fromX),
            Math.min(sizeY, m.dim(DIM_HEIGHT) - fromY));
    }
}
