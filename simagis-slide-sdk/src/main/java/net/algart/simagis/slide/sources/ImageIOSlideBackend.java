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

import net.algart.arrays.Arrays;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.simagis.slide.AbstractSlideBackendWrapper;
import net.algart.simagis.slide.SlideBackend;
import net.algart.simagis.slide.SlideTools;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>Backend for usual images, readable by <tt>javax.imageio</tt> (PNG, JPEG, BMP, GIF and TIFF).
 * The image is fully decoded while opening, and the pyramid is built in memory with integer compression
 * between neighbour levels.</p>
 *
 * <p>Recognized keys of the JSON configuration:</p>
 * <ul>
 * <li><tt>mpp</tt> or <tt>mppX</tt> and <tt>mppY</tt>: spacing of the image in microns per pixel;
 * if absent, the spacing is taken from the standard ImageIO metadata, if the format stores it;</li>
 * <li><tt>compression</tt>: compression between neighbour levels (2 or more);</li>
 * <li><tt>minLevelSide</tt>: the pyramid is built while both sides are not less than this value;</li>
 * <li><tt>imageIndex</tt>: index of the image in multi-image files;</li>
 * <li><tt>vendor</tt>, <tt>magnification</tt>: slide metadata.</li>
 * </ul>
 */
public final class ImageIOSlideBackend extends AbstractSlideBackendWrapper implements SlideBackend {
    static final String COMPRESSION_KEY = "compression";
    static final String MIN_LEVEL_SIDE_KEY = "minLevelSide";
    static final String IMAGE_INDEX_KEY = "imageIndex";

    private static final int COMPRESSION = Math.max(2, Arrays.SystemSettings.getIntProperty(
        "net.algart.simagis.slide.sources.ImageIOSlideBackend.compression", 2));
    private static final int MIN_LEVEL_SIDE = Math.max(1, Arrays.SystemSettings.getIntProperty(
        "net.algart.simagis.slide.sources.ImageIOSlideBackend.minLevelSide", 512));

    private static final Logger LOGGER = Logger.getLogger(ImageIOSlideBackend.class.getName());

    private final Path imageFile;
    private final MemorySlideBackend parent;

    private ImageIOSlideBackend(Path imageFile, MemorySlideBackend parent) {
        this.imageFile = imageFile;
        this.parent = parent;
    }

    public static ImageIOSlideBackend newInstance(Path imageFile, String configuration) throws IOException {
        Objects.requireNonNull(imageFile, "Null image file");
        final BackendConfiguration config = BackendConfiguration.parse(configuration,
            "configuration of " + imageFile);
        final int compression = config.getInt(COMPRESSION_KEY, COMPRESSION);
        if (compression < 2) {
            throw new IOException("Invalid compression " + compression + " in " + config + " (must be 2 or greater)");
        }
        final int minLevelSide = config.getInt(MIN_LEVEL_SIDE_KEY, MIN_LEVEL_SIDE);
        if (minLevelSide <= 0) {
            throw new IOException("Invalid minimal level side " + minLevelSide + " in " + config);
        }
        final int imageIndex = config.getInt(IMAGE_INDEX_KEY, 0);
        long t1 = System.nanoTime();
        final DecodedImage decoded = DecodedImage.read(imageFile, imageIndex);
        long t2 = System.nanoTime();
        final Matrix<? extends PArray> matrixZero = SlideTools.toMatrix(decoded.image());
        final List<Matrix<? extends PArray>> pyramid = SlideTools.buildPyramid(matrixZero, compression, minLevelSide);
        long t3 = System.nanoTime();
        final JSONObject properties = IIOMetadataToJson.toProperties(decoded.metadata());
        properties.put(IIOMetadataToJson.PREFIX + ".formatName", decoded.formatName());
        final MemorySlideBackend parent = new MemorySlideBackend(pyramid)
            .setProperties(properties)
            .setVendor(config.getString(BackendConfiguration.VENDOR))
            .setMagnification(config.getDouble(BackendConfiguration.MAGNIFICATION))
            .setColorProfile(decoded.colorProfile());
        double[] spacing = config.spacing();
        if (spacing == null) {
            spacing = metadataSpacing(properties);
        }
        if (spacing != null) {
            parent.setSpacing(spacing[0], spacing[1]);
        }
        if (SlideBackend.DEBUG_LEVEL >= 1) {
            LOGGER.config(String.format(Locale.US,
                "ImageIOSlideBackend opened %s (%s image #%d/%d): %dx%d, %d bands, %d levels, "
                    + "compression in %d times, spacing %s (%.3f ms = %.3f reading + %.3f building pyramid)",
                imageFile, decoded.formatName(), imageIndex, decoded.imageCount(),
                matrixZero.dim(DIM_WIDTH), matrixZero.dim(DIM_HEIGHT), parent.bandCount(),
                parent.numberOfLevels(), compression,
                spacing == null ? "unknown" : spacing[0] + "x" + spacing[1],
                (t3 - t1) * 1e-6, (t2 - t1) * 1e-6, (t3 - t2) * 1e-6));
        }
        return new ImageIOSlideBackend(imageFile, parent);
    }

    public Path imageFile() {
        return imageFile;
    }

    @Override
    public String toString() {
        return "ImageIO slide backend for " + imageFile + ": " + parent;
    }

    @Override
    protected SlideBackend parent() {
        return parent;
    }

    // Standard ImageIO metadata measure pixels in millimetres
    static double[] metadataSpacing(JSONObject properties) {
        final double horizontal = properties.optDouble(IIOMetadataToJson.HORIZONTAL_PIXEL_SIZE, Double.NaN);
        final double vertical = properties.optDouble(IIOMetadataToJson.VERTICAL_PIXEL_SIZE, Double.NaN);
        if (horizontal > 0.0 && vertical > 0.0 && !Double.isInfinite(horizontal) && !Double.isInfinite(vertical)) {
            return new double[] {horizontal * 1000.0, vertical * 1000.0};
        }
        return null;
    }
}
