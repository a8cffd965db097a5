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

import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.simagis.slide.AbstractSlideBackendWrapper;
import net.algart.simagis.slide.SlideBackend;
import net.algart.simagis.slide.SlideBounds;
import net.algart.simagis.slide.SlideTools;
import net.algart.simagis.slide.UnsupportedSlideException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.awt.color.ICC_Profile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>Backend for a pyramid, stored as a directory of usual images (one per level), described by
 * <tt>pyramid.json</tt> file in the same directory:</p>
 *
 * <pre>
 * {
 *   "levels": ["level0.png", "level1.png", "level2.png"],
 *   "mppX": 0.25, "mppY": 0.25,
 *   "vendor": "some scanner",
 *   "magnification": 40,
 *   "bounds": {"x": 100, "y": 200, "width": 3000, "height": 2000},
 *   "properties": {"any": "metadata"}
 * }
 * </pre>
 *
 * <p>Only <tt>levels</tt> is required. The slide path may be the directory or the descriptor file itself.
 * The JSON configuration of this backend may contain <tt>mpp</tt> or <tt>mppX</tt>/<tt>mppY</tt>,
 * overriding the spacing from the descriptor.</p>
 */
public final class ImageDirectorySlideBackend extends AbstractSlideBackendWrapper implements SlideBackend {
    public static final String DESCRIPTOR_FILE_NAME = "pyramid.json";

    static final String LEVELS_KEY = "levels";
    static final String BOUNDS_KEY = "bounds";
    static final String PROPERTIES_KEY = "properties";

    private static final Logger LOGGER = Logger.getLogger(ImageDirectorySlideBackend.class.getName());

    private final Path directory;
    private final MemorySlideBackend parent;

    private ImageDirectorySlideBackend(Path directory, MemorySlideBackend parent) {
        this.directory = directory;
        this.parent = parent;
    }

    public static ImageDirectorySlideBackend newInstance(Path slidePath, String configuration) throws IOException {
        Objects.requireNonNull(slidePath, "Null slide path");
        final BackendConfiguration config = BackendConfiguration.parse(configuration,
            "configuration of " + slidePath);
        final Path descriptorFile = Files.isDirectory(slidePath) ?
            slidePath.resolve(DESCRIPTOR_FILE_NAME) :
            slidePath;
        if (!Files.isRegularFile(descriptorFile)) {
            throw new UnsupportedSlideException("No " + DESCRIPTOR_FILE_NAME + " in " + slidePath);
        }
        final Path directory = descriptorFile.toAbsolutePath().getParent();
        final BackendConfiguration descriptor;
        try {
            descriptor = BackendConfiguration.parse(
                new String(Files.readAllBytes(descriptorFile), StandardCharsets.UTF_8), descriptorFile.toString());
        } catch (IOException e) {
            throw new UnsupportedSlideException("Cannot read pyramid descriptor " + descriptorFile, e);
        }
        long t1 = System.nanoTime();
        final List<Matrix<? extends PArray>> levels = new ArrayList<Matrix<? extends PArray>>();
        ICC_Profile colorProfile = null;
        final JSONArray levelFiles = levelFiles(descriptor, descriptorFile);
        for (int k = 0; k < levelFiles.length(); k++) {
            final String levelFileName = levelFiles.optString(k, "");
            if (levelFileName.isEmpty()) {
                throw new UnsupportedSlideException("Invalid file name of level #" + k + " in " + descriptorFile);
            }
            final Path levelFile = directory.resolve(levelFileName);
            final DecodedImage decoded = DecodedImage.read(levelFile, 0);
            if (k == 0) {
                colorProfile = decoded.colorProfile();
            }
            levels.add(SlideTools.toMatrix(decoded.image()));
        }
        final MemorySlideBackend parent;
        try {
            parent = new MemorySlideBackend(levels);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedSlideException("Inconsistent levels in " + descriptorFile + ": " + e.getMessage(), e);
        }
        parent.setVendor(descriptor.getString(BackendConfiguration.VENDOR))
            .setMagnification(descriptor.getDouble(BackendConfiguration.MAGNIFICATION))
            .setSlideBounds(bounds(descriptor, descriptorFile))
            .setColorProfile(colorProfile);
        final JSONObject properties = descriptor.json().optJSONObject(PROPERTIES_KEY);
        if (properties != null) {
            parent.setProperties(properties);
        }
        double[] spacing = config.spacing();
        if (spacing == null) {
            spacing = descriptor.spacing();
        }
        if (spacing != null) {
            parent.setSpacing(spacing[0], spacing[1]);
        }
        long t2 = System.nanoTime();
        if (SlideBackend.DEBUG_LEVEL >= 1) {
            LOGGER.config(String.format(Locale.US,
                "ImageDirectorySlideBackend opened %s: %d levels, %d bands (%.3f ms)",
                directory, parent.numberOfLevels(), parent.bandCount(), (t2 - t1) * 1e-6));
        }
        return new ImageDirectorySlideBackend(directory, parent);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public String toString() {
        return "image directory slide backend for " + directory + ": " + parent;
    }

    @Override
    protected SlideBackend parent() {
        return parent;
    }

    private static JSONArray levelFiles(BackendConfiguration descriptor, Path descriptorFile)
        throws UnsupportedSlideException
    {
        final JSONArray result = descriptor.json().optJSONArray(LEVELS_KEY);
        if (result == null || result.length() == 0) {
            throw new UnsupportedSlideException("No \"" + LEVELS_KEY + "\" list in " + descriptorFile);
        }
        return result;
    }

    private static SlideBounds bounds(BackendConfiguration descriptor, Path descriptorFile)
        throws UnsupportedSlideException
    {
        final JSONObject bounds = descriptor.json().optJSONObject(BOUNDS_KEY);
        if (bounds == null) {
            return null;
        }
        try {
            return SlideBounds.valueOf(
                bounds.getLong("x"), bounds.getLong("y"), bounds.getLong("width"), bounds.getLong("height"));
        } catch (JSONException | IllegalArgumentException e) {
            throw new UnsupportedSlideException("Invalid \"" + BOUNDS_KEY + "\" in " + descriptorFile
                + ": " + e.getMessage(), e);
        }
    }
}
