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

package net.algart.simagis.slide.color;

import net.algart.arrays.Arrays;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.PFloatingArray;
import net.algart.arrays.UpdatablePArray;

import java.awt.color.ICC_ColorSpace;
import java.awt.color.ICC_Profile;
import java.util.Objects;

/**
 * <p>Transforms packed pixels <tt>[band, x, y]</tt> from the color space, described by an ICC profile,
 * into sRGB.</p>
 *
 * <p>The first bands of the source matrix are the color components of the profile; the result contains
 * 3 sRGB bands and then all remaining source bands (usually alpha) without changes.
 * Element type is preserved; integer samples are considered to be normalized to
 * <tt>0..maxPossibleValue</tt>.</p>
 */
public final class SrgbColorTransform {
    private final ICC_Profile profile;
    private final ICC_ColorSpace colorSpace;
    private final int numComponents;

    public SrgbColorTransform(ICC_Profile profile) {
        this.profile = Objects.requireNonNull(profile, "Null ICC profile");
        this.colorSpace = new ICC_ColorSpace(profile);
        this.numComponents = colorSpace.getNumComponents();
    }

    public ICC_Profile profile() {
        return profile;
    }

    public int numComponents() {
        return numComponents;
    }

    public Matrix<UpdatablePArray> apply(Matrix<? extends PArray> source) {
        Objects.requireNonNull(source, "Null source matrix");
        if (source.dimCount() != 3) {
            throw new IllegalArgumentException("Illegal number of dimensions (" + source.dimCount()
                + ") of " + source + ": must be 3 (band, x, y)");
        }
        final long bandCount = source.dim(0);
        if (bandCount < numComponents) {
            throw new IllegalArgumentException("Cannot apply color profile with " + numComponents
                + " components to " + bandCount + "-band matrix");
        }
        final int extraBands = (int) (bandCount - numComponents);
        final int resultBands = 3 + extraBands;
        final Matrix<UpdatablePArray> result = Arrays.SMM.newMatrix(
            UpdatablePArray.class, source.elementType(), resultBands, source.dim(1), source.dim(2));
        final PArray src = source.array();
        final UpdatablePArray dest = result.array();
        final boolean rounding = !(dest instanceof PFloatingArray);
        final double scale = src.maxPossibleValue(1.0);
        final float[] components = new float[numComponents];
        final float[] minValues = new float[numComponents];
        final float[] ranges = new float[numComponents];
        for (int c = 0; c < numComponents; c++) {
            minValues[c] = colorSpace.getMinValue(c);
            ranges[c] = colorSpace.getMaxValue(c) - minValues[c];
        }
        final long pixelCount = source.dim(1) * source.dim(2);
        for (long p = 0, srcDisp = 0, destDisp = 0; p < pixelCount; p++, srcDisp += bandCount) {
            for (int c = 0; c < numComponents; c++) {
                components[c] = minValues[c] + ranges[c] * (float) (src.getDouble(srcDisp + c) / scale);
            }
            final float[] rgb = toRGB(components);
            for (int c = 0; c < 3; c++) {
                final double v = rgb[c] * scale;
                dest.setDouble(destDisp++, rounding ? Math.min(scale, Math.max(0.0, Math.rint(v))) : v);
            }
            for (int c = 0; c < extraBands; c++) {
                dest.setDouble(destDisp++, src.getDouble(srcDisp + numComponents + c));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "sRGB color transform from " + numComponents + "-component ICC profile (class "
            + profile.getProfileClass() + ")";
    }

    private synchronized float[] toRGB(float[] components) {
        return colorSpace.toRGB(components);
    }
}
