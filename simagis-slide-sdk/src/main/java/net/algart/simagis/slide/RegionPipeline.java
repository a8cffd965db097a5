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
import net.algart.arrays.UpdatablePArray;
import net.algart.simagis.slide.color.SrgbColorTransform;
import net.algart.simagis.slide.geometry.NativeRegion;
import net.algart.simagis.slide.resampling.MatrixResampler;

import java.util.Locale;
import java.util.Objects;

/**
 * <p>Way of cropping the requested region from the native window and resizing it to the requested size.</p>
 *
 * <p>Both pipelines return the matrix of exactly the requested size, but their results differ a little
 * at the pixel level, because they round the crop box differently.</p>
 */
public enum RegionPipeline {
    /**
     * The crop box is kept real-valued and passed directly to the resizing; its right and bottom bounds
     * are clipped by the actually decoded buffer. Color profiles are not supported.
     */
    PIXEL_ARRAY {
        @Override
        public boolean isColorProfileSupported() {
            return false;
        }

        @Override
        public Matrix<UpdatablePArray> cropAndResize(
            Matrix<? extends PArray> buffer,
            NativeRegion region,
            long sizeX, long sizeY,
            MatrixResampler resampler,
            SrgbColorTransform colorTransform)
        {
            checkArguments(buffer, region, resampler);
            final double[] box = region.continuousCropBox(
                buffer.dim(SlideBackend.DIM_WIDTH), buffer.dim(SlideBackend.DIM_HEIGHT));
            return resampler.resize(buffer, sizeX, sizeY, box[0], box[1], box[2], box[3]);
        }
    },

    /**
     * The crop box is converted to integers (left and top bounds are floored, right and bottom are rounded),
     * the buffer is cropped, optionally transformed into sRGB, and then resized with independent
     * horizontal and vertical scales <tt>sizeX/cropWidth</tt>, <tt>sizeY/cropHeight</tt>.
     */
    TILE_STREAM {
        @Override
        public boolean isColorProfileSupported() {
            return true;
        }

        @Override
        public Matrix<UpdatablePArray> cropAndResize(
            Matrix<? extends PArray> buffer,
            NativeRegion region,
            long sizeX, long sizeY,
            MatrixResampler resampler,
            SrgbColorTransform colorTransform)
        {
            checkArguments(buffer, region, resampler);
            final long[] box = region.integerCropBox(
                buffer.dim(SlideBackend.DIM_WIDTH), buffer.dim(SlideBackend.DIM_HEIGHT));
            final long cropX = box[2] - box[0];
            final long cropY = box[3] - box[1];
            if (cropX == 0 || cropY == 0) {
                throw new IllegalArgumentException("Empty decoded buffer " + buffer + " for " + region);
            }
            Matrix<? extends PArray> crop = buffer.subMatr(
                0, box[0], box[1], buffer.dim(SlideBackend.DIM_BAND), cropX, cropY);
            if (colorTransform != null) {
                crop = colorTransform.apply(crop);
            }
            return resampler.resize(crop, (double) sizeX / (double) cropX, (double) sizeY / (double) cropY);
        }
    };

    public abstract boolean isColorProfileSupported();

    /**
     * Crops the requested region from the decoded native window and resizes it
     * to <tt>sizeX</tt>&nbsp;x&nbsp;<tt>sizeY</tt>.
     *
     * @param buffer         the decoded native window.
     * @param region         the result of mapping the requested region to the native level.
     * @param sizeX          the requested width, must be positive.
     * @param sizeY          the requested height, must be positive.
     * @param resampler      resizing method.
     * @param colorTransform transformation into sRGB, or <tt>null</tt> if not needed;
     *                       ignored if {@link #isColorProfileSupported()} returns <tt>false</tt>.
     * @return new matrix with the requested region.
     */
    public abstract Matrix<UpdatablePArray> cropAndResize(
        Matrix<? extends PArray> buffer,
        NativeRegion region,
        long sizeX, long sizeY,
        MatrixResampler resampler,
        SrgbColorTransform colorTransform);

    public static RegionPipeline valueOfName(String name) {
        Objects.requireNonNull(name, "Null pipeline name");
        try {
            return valueOf(name.trim().toUpperCase(Locale.US));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown region pipeline \"" + name
                + "\" (PIXEL_ARRAY or TILE_STREAM expected)", e);
        }
    }

    private static void checkArguments(
        Matrix<? extends PArray> buffer,
        NativeRegion region,
        MatrixResampler resampler)
    {
        Objects.requireNonNull(buffer, "Null buffer");
        Objects.requireNonNull(region, "Null native region");
        Objects.requireNonNull(resampler, "Null resampler");
    }
}
