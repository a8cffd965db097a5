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

import java.util.Objects;

/**
 * Options of reading regions from {@link SlideImage}. They are resolved once, while creating
 * the slide image; further changes of this object do not affect existing slide images.
 */
public class SlideReadingBehaviour implements Cloneable {
    private Resampling interpolator = Resampling.LANCZOS;
    private double[] overwriteMpp = null;
    private boolean applyColorProfile = false;
    private RegionPipeline pipeline = null;

    public Resampling getInterpolator() {
        return interpolator;
    }

    public SlideReadingBehaviour setInterpolator(Resampling interpolator) {
        this.interpolator = Objects.requireNonNull(interpolator, "Null interpolator");
        return this;
    }

    public double[] getOverwriteMpp() {
        return overwriteMpp == null ? null : overwriteMpp.clone();
    }

    /**
     * Sets the spacing, which replaces the spacing stored in the slide (or absent there).
     */
    public SlideReadingBehaviour setOverwriteMpp(double mppX, double mppY) {
        this.overwriteMpp = new double[] {mppX, mppY};
        return this;
    }

    public SlideReadingBehaviour resetOverwriteMpp() {
        this.overwriteMpp = null;
        return this;
    }

    public boolean isApplyColorProfile() {
        return applyColorProfile;
    }

    public SlideReadingBehaviour setApplyColorProfile(boolean applyColorProfile) {
        this.applyColorProfile = applyColorProfile;
        return this;
    }

    // null means "not specified": PIXEL_ARRAY with a warning
    public RegionPipeline getPipeline() {
        return pipeline;
    }

    public SlideReadingBehaviour setPipeline(RegionPipeline pipeline) {
        this.pipeline = pipeline;
        return this;
    }

    public SlideReadingBehaviour clone() {
        try {
            final SlideReadingBehaviour result = (SlideReadingBehaviour) super.clone();
            result.overwriteMpp = getOverwriteMpp();
            return result;
        } catch (CloneNotSupportedException e) {
            throw new InternalError(e.toString());
        }
    }

    @Override
    public String toString() {
        return "SlideReadingBehaviour{"
            + "interpolator=" + interpolator
            + ", overwriteMpp=" + (overwriteMpp == null ? "none" : overwriteMpp[0] + "," + overwriteMpp[1])
            + ", applyColorProfile=" + applyColorProfile
            + ", pipeline=" + pipeline
            + '}';
    }
}
