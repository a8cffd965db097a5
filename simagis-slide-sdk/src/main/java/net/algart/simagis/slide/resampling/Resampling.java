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

package net.algart.simagis.slide.resampling;

import java.util.Locale;
import java.util.Objects;

/**
 * Resampling methods for reading regions: <tt>LANCZOS</tt> is usually the best choice for images,
 * <tt>NEAREST</tt> for masks.
 */
public enum Resampling implements ResamplingKernel {
    NEAREST {
        @Override
        public double radius() {
            return 0.0;
        }

        @Override
        public double weight(double x) {
            return -0.5 <= x && x < 0.5 ? 1.0 : 0.0;
        }
    },

    /**
     * Lanczos kernel with support 3: <tt>sinc(x)&middot;sinc(x/3)</tt> for <tt>-3&le;x&lt;3</tt>.
     */
    LANCZOS {
        @Override
        public double radius() {
            return 3.0;
        }

        @Override
        public double weight(double x) {
            if (-3.0 <= x && x < 3.0) {
                return sinc(x) * sinc(x / 3.0);
            }
            return 0.0;
        }
    };

    public static Resampling valueOfName(String name) {
        Objects.requireNonNull(name, "Null resampling name");
        try {
            return valueOf(name.trim().toUpperCase(Locale.US));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resampling method \"" + name
                + "\" (NEAREST or LANCZOS expected)", e);
        }
    }

    static double sinc(double x) {
        if (x == 0.0) {
            return 1.0;
        }
        x *= Math.PI;
        return Math.sin(x) / x;
    }
}
