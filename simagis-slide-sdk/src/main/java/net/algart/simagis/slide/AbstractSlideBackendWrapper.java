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

import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import org.json.JSONObject;

import java.awt.color.ICC_Profile;
import java.io.IOException;
import java.util.NoSuchElementException;

public abstract class AbstractSlideBackendWrapper implements SlideBackend {
    protected abstract SlideBackend parent();

    public int numberOfLevels() {
        return parent().numberOfLevels();
    }

    public int bandCount() {
        return parent().bandCount();
    }

    public long[] dimensions(int level) throws NoSuchElementException {
        return parent().dimensions(level);
    }

    public double levelDownsample(int level) throws NoSuchElementException {
        return parent().levelDownsample(level);
    }

    public int bestLevelForDownsample(double downsample) {
        return parent().bestLevelForDownsample(downsample);
    }

    public Class<?> elementType() {
        return parent().elementType();
    }

    public double[] spacing() {
        return parent().spacing();
    }

    public void setSpacing(double mppX, double mppY) {
        parent().setSpacing(mppX, mppY);
    }

    public double[] levelSpacing(int level) throws NoSuchElementException {
        return parent().levelSpacing(level);
    }

    public String vendor() {
        return parent().vendor();
    }

    public Double magnification() {
        return parent().magnification();
    }

    public JSONObject properties() {
        return parent().properties();
    }

    public SlideBounds slideBounds() {
        return parent().slideBounds();
    }

    public ICC_Profile colorProfile() {
        return parent().colorProfile();
    }

    public Matrix<? extends PArray> read(long levelZeroX, long levelZeroY, int level, long sizeX, long sizeY)
        throws IOException
    {
        return parent().read(levelZeroX, levelZeroY, level, sizeX, sizeY);
    }

    public Matrix<? extends PArray> thumbnail(long maxDimX, long maxDimY) throws IOException {
        return parent().thumbnail(maxDimX, maxDimY);
    }

    public boolean isClosed() {
        return parent().isClosed();
    }

    public void close() {
        parent().close();
    }
}
