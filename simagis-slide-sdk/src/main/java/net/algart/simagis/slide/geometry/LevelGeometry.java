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

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable {@link PyramidGeometry}, built from the list of level dimensions.
 * Downsample factors are calculated from the dimensions, if not specified explicitly.
 */
public final class LevelGeometry implements PyramidGeometry {
    private final int bandCount;
    private final List<long[]> dimensions;
    private final double[] downsamples;

    private LevelGeometry(int bandCount, List<long[]> dimensions, double[] downsamples) {
        this.bandCount = bandCount;
        this.dimensions = dimensions;
        this.downsamples = downsamples;
    }

    public static LevelGeometry valueOf(int bandCount, long[][] levelDimXY) {
        return valueOf(bandCount, levelDimXY, null);
    }

    public static LevelGeometry valueOf(int bandCount, long[][] levelDimXY, double[] downsamples) {
        Objects.requireNonNull(levelDimXY, "Null level dimensions");
        if (bandCount <= 0) {
            throw new IllegalArgumentException("Non-positive bandCount " + bandCount);
        }
        if (levelDimXY.length == 0) {
            throw new IllegalArgumentException("Empty list of levels");
        }
        if (downsamples != null && downsamples.length != levelDimXY.length) {
            throw new IllegalArgumentException("Number of downsamples " + downsamples.length
                + " does not match the number of levels " + levelDimXY.length);
        }
        final List<long[]> dimensions = new ArrayList<long[]>();
        for (int k = 0; k < levelDimXY.length; k++) {
            final long[] dim = levelDimXY[k];
            if (dim == null || dim.length != 2) {
                throw new IllegalArgumentException("Level #" + k + " must be described by 2 dimensions (x, y)");
            }
            if (dim[0] <= 0 || dim[1] <= 0) {
                throw new IllegalArgumentException("Illegal dimensions " + dim[0] + "x" + dim[1]
                    + " of level #" + k + " (must be positive)");
            }
            dimensions.add(new long[] {bandCount, dim[0], dim[1]});
        }
        final double[] levelDownsamples = downsamples != null ?
            downsamples.clone() :
            downsamplesOf(dimensions);
        for (int k = 0; k < levelDownsamples.length; k++) {
            if (!(levelDownsamples[k] >= 1.0) || Double.isInfinite(levelDownsamples[k])) {
                throw new IllegalArgumentException("Illegal downsample " + levelDownsamples[k]
                    + " of level #" + k + " (must be finite and >= 1.0)");
            }
        }
        return new LevelGeometry(bandCount, dimensions, levelDownsamples);
    }

    /**
     * Calculates downsample factors as the average of <i>x</i> and <i>y</i> ratios between the dimensions
     * of the level #0 and every level.
     *
     * @param dimensions dimensions of all levels, every element in the form returned by
     *                   {@link PyramidGeometry#dimensions(int)}.
     * @return downsample factors of all levels.
     */
    public static double[] downsamplesOf(List<long[]> dimensions) {
        final double[] result = new double[dimensions.size()];
        final long[] dim0 = dimensions.get(0);
        for (int k = 0; k < result.length; k++) {
            final long[] dim = dimensions.get(k);
            result[k] = k == 0 ? 1.0 :
                0.5 * ((double) dim0[DIM_WIDTH] / (double) dim[DIM_WIDTH]
                    + (double) dim0[DIM_HEIGHT] / (double) dim[DIM_HEIGHT]);
        }
        return result;
    }

    public static int bestLevel(double[] downsamples, double downsample) {
        if (Double.isNaN(downsample)) {
            throw new IllegalArgumentException("NaN downsample");
        }
        int result = 0;
        for (int k = 1; k < downsamples.length; k++) {
            if (downsamples[k] <= downsample && downsamples[k] > downsamples[result]) {
                result = k;
            }
        }
        return result;
    }

    @Override
    public int numberOfLevels() {
        return dimensions.size();
    }

    @Override
    public int bandCount() {
        return bandCount;
    }

    @Override
    public long[] dimensions(int level) {
        checkLevel(level);
        return dimensions.get(level).clone();
    }

    @Override
    public double levelDownsample(int level) {
        checkLevel(level);
        return downsamples[level];
    }

    @Override
    public int bestLevelForDownsample(double downsample) {
        return bestLevel(downsamples, downsample);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("LevelGeometry " + dimensions.size() + " levels:");
        for (int k = 0; k < dimensions.size(); k++) {
            sb.append(k == 0 ? " " : ", ").append(dimensions.get(k)[DIM_WIDTH]).append("x")
                .append(dimensions.get(k)[DIM_HEIGHT]).append(" (x").append(downsamples[k]).append(")");
        }
        return sb.toString();
    }

    private void checkLevel(int level) {
        if (level < 0 || level >= dimensions.size()) {
            throw new NoSuchElementException("Level #" + level + " is absent");
        }
    }
}
