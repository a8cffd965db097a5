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
import net.algart.simagis.slide.geometry.RegionChecks;

import java.io.IOException;
import java.util.Objects;

/**
 * View of a {@link SlideImage} at one fixed scaling. It holds no resources: it can be created
 * for every request and dropped without closing.
 */
public final class SlideRegionView extends RegionView {
    private final SlideImage slide;
    private final double scaling;

    SlideRegionView(SlideImage slide, double scaling, BoundaryMode boundaryMode) {
        super(boundaryMode);
        this.slide = Objects.requireNonNull(slide, "Null slide");
        RegionChecks.checkScaling(scaling);
        this.scaling = scaling;
    }

    public SlideImage slide() {
        return slide;
    }

    public double scaling() {
        return scaling;
    }

    @Override
    public double mpp() {
        return slide.mpp() / scaling;
    }

    @Override
    public long dimX() {
        return slide.getScaledSize(scaling)[0];
    }

    @Override
    public long dimY() {
        return slide.getScaledSize(scaling)[1];
    }

    @Override
    protected Matrix<? extends PArray> readRegionImpl(double x, double y, long sizeX, long sizeY)
        throws IOException
    {
        return slide.readRegion(x, y, scaling, sizeX, sizeY);
    }

    @Override
    public String toString() {
        return "view of " + slide.identifier() + " at scaling " + scaling + " (" + dimX() + "x" + dimY()
            + ", boundary mode " + boundaryMode() + ")";
    }
}
