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

import net.algart.arrays.Arrays;
import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.UpdatablePArray;
import net.algart.simagis.slide.color.SrgbColorTransform;
import net.algart.simagis.slide.geometry.CoordinateMapper;
import net.algart.simagis.slide.geometry.NativeRegion;
import net.algart.simagis.slide.geometry.RegionChecks;
import net.algart.simagis.slide.resampling.MatrixResampler;
import net.algart.simagis.slide.resampling.Resampling;
import org.json.JSONObject;

import java.awt.color.ICC_Profile;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * <p>Slide, which can be read at any scaling, not only at the discrete levels, stored by its backend.</p>
 *
 * <p>The scaling <tt>s</tt> is the ratio of the requested resolution to the resolution of the level #0:
 * <tt>s=1.0</tt> is the full resolution, <tt>s=0.25</tt> is 4 times coarser.
 * Every region is read from the best native level (see {@link CoordinateMapper}) with some additional
 * pixels around it, necessary for interpolation, and then cropped and resized by the chosen
 * {@link RegionPipeline}.</p>
 *
 * <p>This object owns its backend: {@link #close()} closes it. It is recommended to use slide images
 * in try-with-resources statement. All reading methods are thread-safe, if the backend is thread-safe.</p>
 */
public final class SlideImage implements Closeable {
    private static final Logger LOGGER = Logger.getLogger(SlideImage.class.getName());

    private final SlideBackend backend;
    private final String identifier;
    private final Resampling interpolator;
    private final RegionPipeline pipeline;
    private final boolean applyColorProfile;
    private final SrgbColorTransform colorTransform;
    private final MatrixResampler resampler;
    private final CoordinateMapper mapper;
    private final double averageMpp;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean colorProfileWarningLogged = new AtomicBoolean(false);
    private final SpeedInfo speedInfo = new SpeedInfo();

    public SlideImage(SlideBackend backend, String identifier) throws UnsupportedSlideException {
        this(backend, identifier, new SlideReadingBehaviour().setPipeline(RegionPipeline.PIXEL_ARRAY));
    }

    /**
     * Creates new slide image.
     *
     * @param backend    the backend; will be closed by {@link #close()}.
     * @param identifier user-defined identifier of the slide, used in messages; may be <tt>null</tt>.
     * @param behaviour  reading options.
     * @throws UnsupportedSlideException if the spacing of the slide is unknown and not overwritten by
     *                                   the behaviour, or if it is invalid or not isotropic.
     */
    public SlideImage(SlideBackend backend, String identifier, SlideReadingBehaviour behaviour)
        throws UnsupportedSlideException
    {
        Objects.requireNonNull(backend, "Null backend");
        Objects.requireNonNull(behaviour, "Null reading behaviour");
        this.backend = backend;
        this.identifier = identifier;
        this.interpolator = behaviour.getInterpolator();
        final double[] overwriteMpp = behaviour.getOverwriteMpp();
        if (overwriteMpp != null) {
            backend.setSpacing(overwriteMpp[0], overwriteMpp[1]);
        }
        final double[] spacing = backend.spacing();
        if (spacing == null) {
            throw new UnsupportedSlideException("The spacing of " + identifier + " cannot be derived from image "
                + "and is not explicitly set by overwriteMpp");
        }
        try {
            RegionChecks.checkMpp(spacing[0], spacing[1]);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedSlideException("Unsupported spacing of " + identifier + ": " + e.getMessage(), e);
        }
        this.averageMpp = 0.5 * (spacing[0] + spacing[1]);
        RegionPipeline pipeline = behaviour.getPipeline();
        if (pipeline == null) {
            LOGGER.warning("The region pipeline is not set for " + identifier + ": defaulting to "
                + RegionPipeline.PIXEL_ARRAY + "; set it explicitly to keep the current behaviour");
            pipeline = RegionPipeline.PIXEL_ARRAY;
        }
        this.pipeline = pipeline;
        this.applyColorProfile = behaviour.isApplyColorProfile();
        final ICC_Profile profile = backend.colorProfile();
        this.colorTransform = applyColorProfile && pipeline.isColorProfileSupported() && profile != null ?
            new SrgbColorTransform(profile) :
            null;
        this.resampler = new MatrixResampler(interpolator);
        this.mapper = new CoordinateMapper(backend);
    }

    public static SlideImage open(Path slidePath, String backendName) throws IOException {
        return open(slidePath, SlideBackendKind.valueOfName(backendName), "", null, new SlideReadingBehaviour());
    }

    public static SlideImage open(Path slidePath, SlideBackendFactory factory, SlideReadingBehaviour behaviour)
        throws IOException
    {
        return open(slidePath, factory, "", null, behaviour);
    }

    /**
     * Opens the slide at the given path by the given backend factory.
     *
     * @param slidePath     path to the slide file or directory.
     * @param factory       backend factory, usually one of {@link SlideBackendKind} constants.
     * @param configuration JSON configuration, passed to the factory.
     * @param identifier    identifier of the slide; if <tt>null</tt>, the absolute path is used.
     * @param behaviour     reading options.
     * @return new slide image.
     * @throws NoSuchFileException       if there is no file or directory at this path.
     * @throws UnsupportedSlideException if the backend cannot read this slide or the slide spacing
     *                                   is unknown or invalid.
     * @throws IOException               in a case of other I/O errors.
     */
    public static SlideImage open(
        Path slidePath,
        SlideBackendFactory factory,
        String configuration,
        String identifier,
        SlideReadingBehaviour behaviour)
        throws IOException
    {
        Objects.requireNonNull(slidePath, "Null slide path");
        Objects.requireNonNull(factory, "Null backend factory");
        Objects.requireNonNull(configuration, "Null configuration");
        Objects.requireNonNull(behaviour, "Null reading behaviour");
        final Path path = slidePath.toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        final SlideBackend backend;
        try {
            backend = factory.newSlideBackend(path, configuration);
        } catch (UnsupportedSlideException e) {
            throw new UnsupportedSlideException("Unsupported file: " + path, e);
        }
        boolean success = false;
        try {
            final SlideImage result = new SlideImage(
                backend, identifier != null ? identifier : path.toString(), behaviour);
            success = true;
            return result;
        } finally {
            if (!success) {
                backend.close();
            }
        }
    }

    /**
     * <p>Reads the region <tt>x..x+sizeX</tt> x <tt>y..y+sizeY</tt> of the slide at the given scaling.
     * The coordinates are specified at this scaling; they must lie inside
     * {@link #getScaledSize(double) getScaledSize(scaling)}.</p>
     *
     * <p>The result has exactly <tt>sizeX</tt>&nbsp;x&nbsp;<tt>sizeY</tt> pixels.</p>
     *
     * @param x       x-coordinate of the top left corner at the requested scaling.
     * @param y       y-coordinate of the top left corner at the requested scaling.
     * @param scaling the scaling relatively to the level #0.
     * @param sizeX   width of the result.
     * @param sizeY   height of the result.
     * @return packed pixels <tt>[band, x, y]</tt>.
     * @throws IndexOutOfBoundsException if the sizes are negative or the region is outside the scaled slide;
     *                                   the backend is not accessed in this case.
     * @throws IllegalArgumentException  if the scaling is not positive.
     * @throws IllegalStateException     if this slide image is closed.
     * @throws IOException               if the backend failed to read the data.
     */
    public Matrix<? extends PArray> readRegion(double x, double y, double scaling, long sizeX, long sizeY)
        throws IOException
    {
        checkNotClosed();
        long t1 = System.nanoTime();
        final NativeRegion region = mapper.map(x, y, scaling, sizeX, sizeY);
        if (SlideBackend.DEBUG_LEVEL >= 3) {
            LOGGER.info(String.format(Locale.US, "%s: region %.3f,%.3f [%d x %d] at scaling %.5f -> %s",
                identifier, x, y, sizeX, sizeY, scaling, region));
        }
        final Matrix<? extends PArray> buffer = backend.read(
            region.levelZeroX(), region.levelZeroY(), region.level(),
            region.windowSizeX(), region.windowSizeY());
        long t2 = System.nanoTime();
        final Matrix<UpdatablePArray> result;
        if (sizeX == 0 || sizeY == 0) {
            result = Arrays.SMM.newMatrix(UpdatablePArray.class, buffer.elementType(),
                buffer.dim(SlideBackend.DIM_BAND), sizeX, sizeY);
        } else {
            if (applyColorProfile && !pipeline.isColorProfileSupported()
                && colorProfileWarningLogged.compareAndSet(false, true))
            {
                LOGGER.warning("Applying color profile is not supported by " + pipeline
                    + " pipeline: the profile of " + identifier + " is ignored");
            }
            result = pipeline.cropAndResize(buffer, region, sizeX, sizeY, resampler, colorTransform);
        }
        long t3 = System.nanoTime();
        if (SlideBackend.DEBUG_LEVEL >= 2) {
            final String averageSpeed = speedInfo.update(Matrices.sizeOf(result), t3 - t1);
            LOGGER.info(String.format(Locale.US,
                "%s: region %d x %d at scaling %.5f from level #%d, window %d x %d "
                    + "in %.3f ms = %.3f reading + %.3f %s (%s)",
                identifier, sizeX, sizeY, scaling, region.level(), region.windowSizeX(), region.windowSizeY(),
                (t3 - t1) * 1e-6, (t2 - t1) * 1e-6, (t3 - t2) * 1e-6, pipeline, averageSpeed));
        }
        return result;
    }

    public long[] getScaledSize(double scaling) {
        return getScaledSize(scaling, false);
    }

    /**
     * Returns <tt>{width, height}</tt> of the slide at the given scaling: dimensions of the level #0
     * or, if <tt>limitBounds</tt>, the size of {@link #slideBounds()}, multiplied by the scaling and truncated.
     */
    public long[] getScaledSize(double scaling, boolean limitBounds) {
        RegionChecks.checkScaling(scaling);
        if (limitBounds) {
            final SlideBounds bounds = backend.slideBounds();
            return new long[] {
                CoordinateMapper.scaledDim(bounds.sizeX(), scaling),
                CoordinateMapper.scaledDim(bounds.sizeY(), scaling)
            };
        }
        return mapper.scaledSize(scaling);
    }

    public double getMpp(double scaling) {
        RegionChecks.checkScaling(scaling);
        return averageMpp / scaling;
    }

    /**
     * Inverse of {@link #getMpp(double)}; <tt>null</tt> or zero argument means the level #0.
     *
     * @param mpp microns per pixel or <tt>null</tt>.
     * @return the scaling, corresponding to this mpp.
     */
    public double getScaling(Double mpp) {
        if (mpp == null || mpp == 0.0) {
            return 1.0;
        }
        return averageMpp / mpp;
    }

    public int getClosestNativeLevel(double mpp) {
        int result = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int level = 0, n = backend.numberOfLevels(); level < n; level++) {
            final double[] spacing = backend.levelSpacing(level);
            final double distance = Math.abs(0.5 * (spacing[0] + spacing[1]) - mpp);
            if (distance < bestDistance) {
                bestDistance = distance;
                result = level;
            }
        }
        return result;
    }

    public double[] getClosestNativeMpp(double mpp) {
        return backend.levelSpacing(getClosestNativeLevel(mpp));
    }

    public SlideRegionView getScaledView(double scaling) {
        return getScaledView(scaling, null);
    }

    public SlideRegionView getScaledView(double scaling, BoundaryMode boundaryMode) {
        return new SlideRegionView(this, scaling, boundaryMode);
    }

    public Matrix<? extends PArray> getThumbnail() throws IOException {
        return getThumbnail(SlideBackend.DEFAULT_THUMBNAIL_SIZE, SlideBackend.DEFAULT_THUMBNAIL_SIZE);
    }

    public Matrix<? extends PArray> getThumbnail(long maxDimX, long maxDimY) throws IOException {
        checkNotClosed();
        return backend.thumbnail(maxDimX, maxDimY);
    }

    public SlideBounds getScaledSlideBounds(double scaling) {
        RegionChecks.checkScaling(scaling);
        return backend.slideBounds().scale(scaling);
    }

    public String identifier() {
        return identifier;
    }

    public String vendor() {
        return backend.vendor();
    }

    public JSONObject properties() {
        return backend.properties();
    }

    public long dimX() {
        return backend.dimensions(0)[SlideBackend.DIM_WIDTH];
    }

    public long dimY() {
        return backend.dimensions(0)[SlideBackend.DIM_HEIGHT];
    }

    public int bandCount() {
        return backend.bandCount();
    }

    // Average microns per pixel of the level #0
    public double mpp() {
        return averageMpp;
    }

    public Double magnification() {
        return backend.magnification();
    }

    public double aspectRatio() {
        return (double) dimX() / (double) dimY();
    }

    public SlideBounds slideBounds() {
        return backend.slideBounds();
    }

    public ICC_Profile colorProfile() {
        return backend.colorProfile();
    }

    public Resampling interpolator() {
        return interpolator;
    }

    public RegionPipeline pipeline() {
        return pipeline;
    }

    public boolean isApplyColorProfile() {
        return applyColorProfile;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            backend.close();
        }
    }

    @Override
    public String toString() {
        return "SlideImage{"
            + "identifier=" + identifier
            + ", vendor=" + vendor()
            + ", mpp=" + averageMpp
            + ", magnification=" + magnification()
            + ", size=" + dimX() + "x" + dimY()
            + ", pipeline=" + pipeline
            + ", interpolator=" + interpolator
            + ", backend=" + backend.getClass().getSimpleName()
            + '}';
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Slide " + identifier + " is already closed");
        }
    }
}
