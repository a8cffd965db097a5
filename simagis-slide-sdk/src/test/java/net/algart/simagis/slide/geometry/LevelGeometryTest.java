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

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.NoSuchElementException;

@RunWith(JUnit4.class)
public class LevelGeometryTest {
    private final LevelGeometry geometry = LevelGeometry.valueOf(3,
        new long[][] {{1000, 800}, {500, 400}, {250, 200}});

    @Test
    public void testDownsamples() {
        Assert.assertEquals(3, geometry.numberOfLevels());
        Assert.assertEquals(3, geometry.bandCount());
        Assert.assertArrayEquals(new long[] {3, 500, 400}, geometry.dimensions(1));
        Assert.assertEquals(1.0, geometry.levelDownsample(0), 0.0);
        Assert.assertEquals(2.0, geometry.levelDownsample(1), 0.0);
        Assert.assertEquals(4.0, geometry.levelDownsample(2), 0.0);

        final LevelGeometry uneven = LevelGeometry.valueOf(1, new long[][] {{1000, 1000}, {333, 250}});
        Assert.assertEquals(0.5 * (1000.0 / 333.0 + 4.0), uneven.levelDownsample(1), 1e-12);

        final LevelGeometry explicit = LevelGeometry.valueOf(1, new long[][] {{1000, 1000}, {333, 333}},
            new double[] {1.0, 3.0});
        Assert.assertEquals(3.0, explicit.levelDownsample(1), 0.0);
    }

    @Test
    public void testBestLevel() {
        Assert.assertEquals(0, geometry.bestLevelForDownsample(0.5));
        Assert.assertEquals(0, geometry.bestLevelForDownsample(1.99));
        Assert.assertEquals(1, geometry.bestLevelForDownsample(2.0));
        Assert.assertEquals(1, geometry.bestLevelForDownsample(3.0));
        Assert.assertEquals(2, geometry.bestLevelForDownsample(100.0));
        Assert.assertEquals(2, geometry.bestLevelForDownsample(Double.POSITIVE_INFINITY));
        Assert.assertEquals(1, LevelGeometry.bestLevel(new double[] {1.0, 4.0, 2.0}, 3.0));
        try {
            geometry.bestLevelForDownsample(Double.NaN);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testInvalidGeometry() {
        expectIllegal(0, new long[][] {{10, 10}}, null);
        expectIllegal(1, new long[][] {}, null);
        expectIllegal(1, new long[][] {{10, 0}}, null);
        expectIllegal(1, new long[][] {{10}}, null);
        expectIllegal(1, new long[][] {{10, 10}}, new double[] {1.0, 2.0});
        expectIllegal(1, new long[][] {{10, 10}, {20, 20}}, null);
        try {
            geometry.dimensions(3);
            Assert.fail();
        } catch (NoSuchElementException e) {
            // expected
        }
    }

    private static void expectIllegal(int bandCount, long[][] dims, double[] downsamples) {
        try {
            LevelGeometry.valueOf(bandCount, dims, downsamples);
            Assert.fail("Invalid geometry accepted");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
