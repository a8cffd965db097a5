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
import net.algart.simagis.slide.resampling.Resampling;
import net.algart.simagis.slide.sources.MemorySlideBackend;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@RunWith(JUnit4.class)
public class SlideImageTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static SlideReadingBehaviour behaviour(RegionPipeline pipeline) {
        return new SlideReadingBehaviour().setPipeline(pipeline);
    }

    @Test
    public void testHalfScalingScenario() throws IOException {
        final SyntheticSlides.CountingBackend backend = new SyntheticSlides.CountingBackend(
            SyntheticSlides.backend(1000, 1000, 1));
        try (SlideImage slide = new SlideImage(backend, "synthetic", behaviour(RegionPipeline.PIXEL_ARRAY))) {
            final Matrix<? extends PArray> region = slide.readRegion(100, 100, 0.5, 50, 50);
            Assert.assertArrayEquals(new long[] {3, 50, 50}, region.dimensions());
            Assert.assertEquals(1, backend.readCount.get());
            // native location 200, size 100, support 6: window 194..306 at level #0
            Assert.assertArrayEquals(new long[] {194, 194, 0, 112, 112}, backend.lastRead);
        }
    }

    @Test
    public void testNonIntegerDownsamplesAtNativeScaling() throws IOException {
        final long[][][] pyramids = {
            {{1000, 1000}, {667, 667}},
            {{1001, 1001}, {500, 500}}
        };
        for (long[][] dims : pyramids) {
            for (RegionPipeline pipeline : RegionPipeline.values()) {
                for (boolean continuation : new boolean[] {true, false}) {
                    final MemorySlideBackend backend = SyntheticSlides.rampBackend(dims)
                        .setContinuationEnabled(continuation);
                    try (SlideImage slide = new SlideImage(backend, "ramp", behaviour(pipeline))) {
                        final double scaling = 1.0 / backend.levelDownsample(1);
                        final long levelDim = dims[1][0];
                        final String msg = dims[1][0] + ", " + pipeline + ", continuation " + continuation;
                        Assert.assertArrayEquals(msg, new long[] {levelDim, levelDim}, slide.getScaledSize(scaling));
                        final Matrix<? extends PArray> left = slide.readRegion(4, 4, scaling, 10, 1);
                        for (int x = 0; x < 10; x++) {
                            Assert.assertEquals(msg, 10.0 * (4 + x), SyntheticSlides.get(left, 0, x, 0), 1e-3);
                        }
                        // the window ends exactly at the right edge of the level, without zero padding
                        final Matrix<? extends PArray> right = slide.readRegion(levelDim - 10, 4, scaling, 10, 1);
                        for (int x = 0; x < 10; x++) {
                            Assert.assertEquals(msg, 10.0 * (levelDim - 10 + x),
                                SyntheticSlides.get(right, 0, x, 0), 1e-3);
                        }
                    }
                }
            }
        }
    }

    @Test
    public void testNonIntegerDownsampleWhileDownsampling() throws IOException {
        for (RegionPipeline pipeline : RegionPipeline.values()) {
            final MemorySlideBackend backend = SyntheticSlides.rampBackend(new long[][] {{1000, 1000}, {667, 667}});
            try (SlideImage slide = new SlideImage(backend, "ramp", behaviour(pipeline))) {
                final double scaling = 0.5 / backend.levelDownsample(1);
                final Matrix<? extends PArray> region = slide.readRegion(4, 4, scaling, 10, 1);
                // every result pixel averages native pixels 8+2x and 9+2x of level #1
                for (int x = 3; x <= 6; x++) {
                    Assert.assertEquals(pipeline + ", x=" + x, 85.0 + 20.0 * x,
                        SyntheticSlides.get(region, 0, x, 0), 0.01);
                }
            }
        }
    }

    @Test
    public void testOutOfBoundsRequestsDoNotReachBackend() throws IOException {
        final SyntheticSlides.CountingBackend backend = new SyntheticSlides.CountingBackend(
            SyntheticSlides.backend(1000, 1000, 1));
        try (SlideImage slide = new SlideImage(backend, "synthetic", behaviour(RegionPipeline.TILE_STREAM))) {
            try {
                slide.readRegion(995, 995, 1.0, 10, 10);
                Assert.fail("995 + 10 > 1000 must be rejected");
            } catch (IndexOutOfBoundsException e) {
                Assert.assertTrue(e.getMessage(), e.getMessage().contains("1005"));
            }
            try {
                slide.readRegion(-1, 0, 1.0, 10, 10);
                Assert.fail("Negative location must be rejected");
            } catch (IndexOutOfBoundsException e) {
                // expected
            }
            try {
                slide.readRegion(0, 0, 1.0, -1, 10);
                Assert.fail("Negative size must be rejected");
            } catch (IndexOutOfBoundsException e) {
                // expected
            }
            try {
                slide.readRegion(400, 0, 0.5, 101, 10);
                Assert.fail("The level at scaling 0.5 has only 500 pixels");
            } catch (IndexOutOfBoundsException e) {
                // expected
            }
            Assert.assertEquals(0, backend.readCount.get());
            slide.readRegion(990, 990, 1.0, 10, 10);
            Assert.assertEquals(1, backend.readCount.get());
        }
    }

    @Test
    public void testFullSlideAtScalingOne() throws IOException {
        for (RegionPipeline pipeline : RegionPipeline.values()) {
            try (SlideImage slide = new SlideImage(SyntheticSlides.backend(200, 150, 2), "full", behaviour(pipeline))) {
                final Matrix<? extends PArray> region = slide.readRegion(0, 0, 1.0, 200, 150);
                Assert.assertArrayEquals(new long[] {3, 200, 150}, region.dimensions());
                for (long y = 0; y < 150; y += 7) {
                    for (long x = 0; x < 200; x += 5) {
                        Assert.assertEquals(pipeline + " at " + x + "," + y,
                            SyntheticSlides.value(1, x, y), SyntheticSlides.get(region, 1, x, y), 0.0);
                    }
                }
            }
        }
    }

    @Test
    public void testRegionAtScalingOneIsExactCopy() throws IOException {
        for (RegionPipeline pipeline : RegionPipeline.values()) {
            try (SlideImage slide = new SlideImage(SyntheticSlides.backend(200, 150, 1), "copy", behaviour(pipeline))) {
                final Matrix<? extends PArray> region = slide.readRegion(10, 20, 1.0, 30, 25);
                for (long y = 0; y < 25; y++) {
                    for (long x = 0; x < 30; x++) {
                        Assert.assertEquals(SyntheticSlides.value(2, x + 10, y + 20),
                            SyntheticSlides.get(region, 2, x, y), 0.0);
                    }
                }
            }
        }
    }

    @Test
    public void testResultSizeAlwaysEqualsRequest() throws IOException {
        final Random random = new Random(157);
        for (RegionPipeline pipeline : RegionPipeline.values()) {
            for (Resampling resampling : Resampling.values()) {
                try (SlideImage slide = new SlideImage(SyntheticSlides.backend(400, 300, 3), "sizes",
                    behaviour(pipeline).setInterpolator(resampling)))
                {
                    for (int test = 0; test < 40; test++) {
                        final double scaling = 0.05 + random.nextDouble() * 2.0;
                        final long[] levelSize = slide.getScaledSize(scaling);
                        final long sizeX = random.nextInt((int) levelSize[0] + 1);
                        final long sizeY = random.nextInt((int) levelSize[1] + 1);
                        final double x = random.nextDouble() * (levelSize[0] - sizeX);
                        final double y = random.nextDouble() * (levelSize[1] - sizeY);
                        final Matrix<? extends PArray> region = slide.readRegion(x, y, scaling, sizeX, sizeY);
                        Assert.assertArrayEquals(pipeline + "/" + resampling + ": " + x + "," + y + " ["
                                + sizeX + "x" + sizeY + "] at " + scaling,
                            new long[] {3, sizeX, sizeY}, region.dimensions());
                    }
                }
            }
        }
    }

    @Test
    public void testZeroSizeRegion() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(100, 100, 1), "empty")) {
            Assert.assertArrayEquals(new long[] {3, 0, 5}, slide.readRegion(3, 4, 1.0, 0, 5).dimensions());
            Assert.assertArrayEquals(new long[] {3, 0, 0}, slide.readRegion(100, 100, 1.0, 0, 0).dimensions());
        }
    }

    @Test
    public void testMppAndScaling() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(1000, 1000, 3), "mpp")) {
            Assert.assertEquals(SyntheticSlides.MPP, slide.mpp(), 0.0);
            Assert.assertEquals(1.0, slide.getScaling(null), 0.0);
            Assert.assertEquals(1.0, slide.getScaling(0.0), 0.0);
            Assert.assertEquals(0.5, slide.getScaling(0.5), 1e-12);
            Assert.assertEquals(1.0, slide.getMpp(0.25), 1e-12);
            for (double mpp = 0.1; mpp < 20.0; mpp *= 1.37) {
                Assert.assertEquals(mpp, slide.getMpp(slide.getScaling(mpp)), 1e-12 * mpp);
            }
            Assert.assertEquals(0, slide.getClosestNativeLevel(0.2));
            Assert.assertEquals(1, slide.getClosestNativeLevel(0.6));
            Assert.assertEquals(2, slide.getClosestNativeLevel(5.0));
            Assert.assertArrayEquals(new double[] {1.0, 1.0}, slide.getClosestNativeMpp(2.0), 1e-12);
        }
    }

    @Test
    public void testSpacingValidation() throws IOException {
        final MemorySlideBackend noSpacing = new MemorySlideBackend(
            Collections.singletonList(SyntheticSlides.gradient(1, 50, 40)));
        try {
            new SlideImage(noSpacing, "no spacing");
            Assert.fail("Slide without spacing must be rejected");
        } catch (UnsupportedSlideException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("no spacing"));
        }
        try (SlideImage slide = new SlideImage(noSpacing, "overwritten",
            behaviour(RegionPipeline.PIXEL_ARRAY).setOverwriteMpp(0.5, 0.5)))
        {
            Assert.assertEquals(0.5, slide.mpp(), 0.0);
            Assert.assertEquals(0.25, slide.getMpp(2.0), 0.0);
        }

        final MemorySlideBackend anisotropic = SyntheticSlides.backend(100, 100, 1);
        anisotropic.setSpacing(0.25, 0.3);
        try {
            new SlideImage(anisotropic, "anisotropic");
            Assert.fail("Non-square pixels must be rejected");
        } catch (UnsupportedSlideException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
        anisotropic.setSpacing(0.25, 0.252);
        try (SlideImage slide = new SlideImage(anisotropic, "almost square")) {
            Assert.assertEquals(0.251, slide.mpp(), 1e-12);
        }
    }

    @Test
    public void testCloseReleasesBackendOnce() throws IOException {
        final SyntheticSlides.CountingBackend backend = new SyntheticSlides.CountingBackend(
            SyntheticSlides.backend(100, 100, 1));
        final SlideImage slide = new SlideImage(backend, "closing");
        try (SlideImage s = slide) {
            s.readRegion(0, 0, 1.0, 10, 10);
        }
        slide.close();
        Assert.assertTrue(slide.isClosed());
        Assert.assertTrue(backend.isClosed());
        Assert.assertEquals(1, backend.closeCount.get());
        try {
            slide.readRegion(0, 0, 1.0, 10, 10);
            Assert.fail("Reading after close must fail");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testBackendFailurePropagates() throws IOException {
        try (SlideImage slide = new SlideImage(
            new SyntheticSlides.FailingBackend(SyntheticSlides.backend(100, 100, 1)), "failing"))
        {
            try {
                slide.readRegion(0, 0, 1.0, 10, 10);
                Assert.fail("Backend error must be propagated");
            } catch (IOException e) {
                Assert.assertEquals("Corrupted tile at level #0", e.getMessage());
            }
            Assert.assertFalse(slide.isClosed());
        }
    }

    @Test
    public void testBoundsAndMetadata() throws IOException {
        final MemorySlideBackend backend = SyntheticSlides.backend(1000, 500, 2)
            .setSlideBounds(SlideBounds.valueOf(100, 50, 600, 400))
            .setVendor("synthetic scanner")
            .setMagnification(40.0);
        try (SlideImage slide = new SlideImage(backend, "bounds")) {
            Assert.assertEquals(SlideBounds.valueOf(50, 25, 300, 200), slide.getScaledSlideBounds(0.5));
            Assert.assertArrayEquals(new long[] {300, 200}, slide.getScaledSize(0.5, true));
            Assert.assertArrayEquals(new long[] {500, 250}, slide.getScaledSize(0.5));
            Assert.assertArrayEquals(new long[] {333, 166}, slide.getScaledSize(1.0 / 3.0));
            Assert.assertEquals(2.0, slide.aspectRatio(), 0.0);
            Assert.assertEquals("synthetic scanner", slide.vendor());
            Assert.assertEquals(40.0, slide.magnification(), 0.0);
            Assert.assertEquals(1000, slide.dimX());
            Assert.assertEquals(500, slide.dimY());
            Assert.assertEquals(0, slide.properties().length());
            Assert.assertNull(slide.colorProfile());
            Assert.assertEquals(Resampling.LANCZOS, slide.interpolator());
            Assert.assertTrue(slide.toString(), slide.toString().contains("identifier=bounds"));
            Assert.assertTrue(slide.toString(), slide.toString().contains("MemorySlideBackend"));
            for (double scaling : new double[] {0.0, -0.5, Double.NaN, Double.POSITIVE_INFINITY}) {
                try {
                    slide.getScaledSlideBounds(scaling);
                    Assert.fail("Scaling " + scaling + " must be rejected");
                } catch (IllegalArgumentException e) {
                    Assert.assertTrue(e.getMessage(), e.getMessage().startsWith("Illegal scaling"));
                }
            }
        }
    }

    @Test
    public void testThumbnail() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(1000, 500, 3), "thumbnail")) {
            Assert.assertArrayEquals(new long[] {3, 100, 50}, slide.getThumbnail(100, 100).dimensions());
        }
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(200, 100, 1), "small")) {
            Assert.assertArrayEquals(new long[] {3, 200, 100}, slide.getThumbnail().dimensions());
        }
    }

    @Test
    public void testDefaultPipeline() throws IOException {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(100, 100, 1), "default",
            new SlideReadingBehaviour()))
        {
            Assert.assertEquals(RegionPipeline.PIXEL_ARRAY, slide.pipeline());
        }
    }

    @Test
    public void testColorProfile() throws IOException {
        final ICC_Profile linear = ICC_Profile.getInstance(ColorSpace.CS_LINEAR_RGB);
        for (RegionPipeline pipeline : RegionPipeline.values()) {
            final MemorySlideBackend backend = SyntheticSlides.backend(100, 100, 1).setColorProfile(linear);
            try (SlideImage slide = new SlideImage(backend, "profile",
                behaviour(pipeline).setApplyColorProfile(true)))
            {
                Assert.assertTrue(slide.isApplyColorProfile());
                Assert.assertSame(linear, slide.colorProfile());
                final Matrix<? extends PArray> region = slide.readRegion(10, 10, 0.7, 20, 15);
                Assert.assertArrayEquals(new long[] {3, 20, 15}, region.dimensions());
                // the warning does not prevent the second read
                Assert.assertArrayEquals(new long[] {3, 5, 5}, slide.readRegion(0, 0, 0.7, 5, 5).dimensions());
            }
        }
    }

    @Test
    public void testConcurrentReads() throws Exception {
        try (SlideImage slide = new SlideImage(SyntheticSlides.backend(400, 400, 3), "concurrent",
            behaviour(RegionPipeline.TILE_STREAM)))
        {
            final Matrix<? extends PArray> expected = slide.readRegion(30, 40, 0.6, 32, 32);
            final ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                final List<Future<Matrix<? extends PArray>>> futures =
                    new ArrayList<Future<Matrix<? extends PArray>>>();
                for (int k = 0; k < 24; k++) {
                    final SlideRegionView view = slide.getScaledView(0.6);
                    futures.add(executor.submit(new Callable<Matrix<? extends PArray>>() {
                        @Override
                        public Matrix<? extends PArray> call() throws IOException {
                            return view.readRegion(30, 40, 32, 32);
                        }
                    }));
                }
                for (Future<Matrix<? extends PArray>> future : futures) {
                    final Matrix<? extends PArray> actual = future.get();
                    Assert.assertArrayEquals(expected.dimensions(), actual.dimensions());
                    for (long i = 0, n = expected.size(); i < n; i++) {
                        Assert.assertEquals(expected.array().getDouble(i), actual.array().getDouble(i), 0.0);
                    }
                }
            } finally {
                executor.shutdown();
            }
        }
    }

    @Test
    public void testOpen() throws IOException {
        final BufferedImage image = new BufferedImage(120, 80, BufferedImage.TYPE_INT_RGB);
        image.setRGB(5, 6, 0x123456);
        final File file = folder.newFile("slide.png");
        Assert.assertTrue(ImageIO.write(image, "png", file));
        final Path path = file.toPath();

        try (SlideImage slide = SlideImage.open(path, SlideBackendKind.IMAGE_IO, "{\"mpp\": 0.5}", null,
            behaviour(RegionPipeline.TILE_STREAM)))
        {
            Assert.assertEquals(path.toAbsolutePath().normalize().toString(), slide.identifier());
            Assert.assertEquals(120, slide.dimX());
            Assert.assertEquals(80, slide.dimY());
            Assert.assertEquals(0.5, slide.mpp(), 0.0);
            final Matrix<? extends PArray> region = slide.readRegion(5, 6, 1.0, 1, 1);
            Assert.assertEquals(0x12, SyntheticSlides.get(region, 0, 0, 0), 0.0);
            Assert.assertEquals(0x34, SyntheticSlides.get(region, 1, 0, 0), 0.0);
            Assert.assertEquals(0x56, SyntheticSlides.get(region, 2, 0, 0), 0.0);
        }
        try (SlideImage slide = SlideImage.open(path, SlideBackendKind.IMAGE_IO, "{\"mpp\": 0.5}", "my slide",
            behaviour(RegionPipeline.PIXEL_ARRAY)))
        {
            Assert.assertEquals("my slide", slide.identifier());
        }
        try {
            SlideImage.open(path, "image_io");
            Assert.fail("PNG without spacing must be rejected");
        } catch (UnsupportedSlideException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("spacing"));
        }
    }

    @Test
    public void testOpenErrors() throws IOException {
        try {
            SlideImage.open(folder.getRoot().toPath().resolve("absent.png"), "IMAGE_IO");
            Assert.fail("Absent file must be reported");
        } catch (NoSuchFileException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().endsWith("absent.png"));
        }
        final Path text = folder.newFile("notes.txt").toPath();
        Files.write(text, "not an image".getBytes(StandardCharsets.UTF_8));
        try {
            SlideImage.open(text, "IMAGE_IO");
            Assert.fail("Non-image file must be rejected");
        } catch (UnsupportedSlideException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().startsWith("Unsupported file: "));
            Assert.assertTrue(e.getCause() instanceof UnsupportedSlideException);
        }
        try {
            SlideImage.open(text, "openslide");
            Assert.fail("Unknown backend must be rejected");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("openslide"));
        }
    }
}
