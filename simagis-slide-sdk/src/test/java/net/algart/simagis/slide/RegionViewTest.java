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
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;

@RunWith(JUnit4.class)
public class RegionViewTest {
    @Test
    public void testScaledView() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(200, 100, 1), "view")) {
            final SlideRegionView view = slide.getScaledView(0.5);
            Assert.assertEquals(100, view.dimX());
            Assert.assertEquals(50, view.dimY());
            Assert.assertEquals(0.5, view.mpp(), 1e-12);
            Assert.assertEquals(0.5, view.scaling(), 0.0);
            Assert.assertSame(slide, view.slide());
            Assert.assertNull(view.boundaryMode());
            Assert.assertArrayEquals(new long[] {3, 20, 10}, view.readRegion(10, 10, 20, 10).dimensions());
        }
    }

    @Test
    public void testConstantBoundary() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(200, 100, 1), "constant",
            new SlideReadingBehaviour().setPipeline(RegionPipeline.TILE_STREAM)))
        {
            final SlideRegionView view = slide.getScaledView(1.0, BoundaryMode.CONSTANT);
            final Matrix<? extends PArray> region = view.readRegion(-10, -5, 20, 10);
            Assert.assertArrayEquals(new long[] {3, 20, 10}, region.dimensions());
            for (int b = 0; b < 3; b++) {
                for (long y = 0; y < 10; y++) {
                    for (long x = 0; x < 20; x++) {
                        final double expected = x >= 10 && y >= 5 ? SyntheticSlides.value(b, x - 10, y - 5) : 0.0;
                        Assert.assertEquals("(" + b + "," + x + "," + y + ")",
                            expected, SyntheticSlides.get(region, b, x, y), 0.0);
                    }
                }
            }

            final Matrix<? extends PArray> outside = view.readRegion(250, 10, 4, 4);
            Assert.assertArrayEquals(new long[] {3, 4, 4}, outside.dimensions());
            for (long i = 0, n = outside.size(); i < n; i++) {
                Assert.assertEquals(0.0, outside.array().getDouble(i), 0.0);
            }
            Assert.assertArrayEquals(new long[] {3, 5, 5}, view.readRegion(-20, -20, 5, 5).dimensions());
        }
    }

    @Test
    public void testCropBoundary() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(200, 100, 1), "crop")) {
            final SlideRegionView view = slide.getScaledView(0.5, BoundaryMode.CROP);
            Assert.assertArrayEquals(new long[] {3, 5, 5}, view.readRegion(95, 45, 10, 10).dimensions());
            Assert.assertArrayEquals(new long[] {3, 10, 10}, view.readRegion(0, 0, 10, 10).dimensions());
            Assert.assertArrayEquals(new long[] {3, 0, 0}, view.readRegion(120, 70, 10, 10).dimensions());
        }
    }

    @Test
    public void testNoBoundaryMode() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(200, 100, 1), "strict")) {
            final SlideRegionView view = slide.getScaledView(0.5);
            try {
                view.readRegion(95, 45, 10, 10);
                Assert.fail("Region outside the view must be rejected");
            } catch (IndexOutOfBoundsException e) {
                // expected
            }
            try {
                slide.getScaledView(0.5, BoundaryMode.CROP).readRegion(0, 0, -1, 10);
                Assert.fail("Negative size must be rejected in any mode");
            } catch (IndexOutOfBoundsException e) {
                // expected
            }
        }
    }
}
