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

import net.algart.simagis.slide.resampling.Resampling;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SlideBoundsTest {
    @Test
    public void testScale() {
        final SlideBounds bounds = SlideBounds.valueOf(101, 51, 603, 401);
        Assert.assertEquals(SlideBounds.valueOf(50, 25, 301, 200), bounds.scale(0.5));
        Assert.assertEquals(SlideBounds.valueOf(30, 15, 180, 120), bounds.scale(0.3));
        Assert.assertEquals(bounds, bounds.scale(1.0));
        Assert.assertEquals(bounds.hashCode(), SlideBounds.valueOf(101, 51, 603, 401).hashCode());
        Assert.assertNotEquals(bounds, SlideBounds.valueOf(101, 51, 603, 400));
        try {
            bounds.scale(0.0);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            SlideBounds.valueOf(-1, 0, 10, 10);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testReadingBehaviour() {
        final SlideReadingBehaviour behaviour = new SlideReadingBehaviour()
            .setInterpolator(Resampling.NEAREST)
            .setOverwriteMpp(0.25, 0.26)
            .setApplyColorProfile(true)
            .setPipeline(RegionPipeline.TILE_STREAM);
        final SlideReadingBehaviour clone = behaviour.clone();
        behaviour.setOverwriteMpp(1.0, 1.0).setPipeline(null);
        Assert.assertArrayEquals(new double[] {0.25, 0.26}, clone.getOverwriteMpp(), 0.0);
        Assert.assertEquals(RegionPipeline.TILE_STREAM, clone.getPipeline());
        Assert.assertEquals(Resampling.NEAREST, clone.getInterpolator());
        Assert.assertTrue(clone.isApplyColorProfile());
        Assert.assertNull(behaviour.resetOverwriteMpp().getOverwriteMpp());
        Assert.assertEquals(Resampling.LANCZOS, new SlideReadingBehaviour().getInterpolator());
        Assert.assertTrue(clone.toString(), clone.toString().contains("TILE_STREAM"));
    }

    @Test
    public void testBackendKinds() {
        Assert.assertEquals(SlideBackendKind.IMAGE_IO, SlideBackendKind.valueOfName("image_io"));
        Assert.assertEquals(SlideBackendKind.IMAGE_DIRECTORY, SlideBackendKind.valueOfName(" Image_Directory"));
    }
}
