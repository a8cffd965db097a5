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

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON configuration of a backend or JSON descriptor of a slide.
 * Syntax errors and invalid values are reported as <tt>IOException</tt>, like format errors in the data.
 */
final class BackendConfiguration {
    static final String MPP = "mpp";
    static final String MPP_X = "mppX";
    static final String MPP_Y = "mppY";
    static final String VENDOR = "vendor";
    static final String MAGNIFICATION = "magnification";

    private final JSONObject json;
    private final String source;

    private BackendConfiguration(JSONObject json, String source) {
        this.json = json;
        this.source = source;
    }

    static BackendConfiguration parse(String json, String source) throws IOException {
        Objects.requireNonNull(json, "Null configuration");
        final String trimmed = json.trim();
        if (trimmed.isEmpty()) {
            return new BackendConfiguration(new JSONObject(), source);
        }
        try {
            return new BackendConfiguration(new JSONObject(trimmed), source);
        } catch (JSONException e) {
            throw new IOException("Invalid JSON in " + source + ": " + e.getMessage(), e);
        }
    }

    JSONObject json() {
        return json;
    }

    boolean has(String key) {
        return json.has(key);
    }

    int getInt(String key, int defaultValue) throws IOException {
        if (!json.has(key)) {
            return defaultValue;
        }
        try {
            return json.getInt(key);
        } catch (JSONException e) {
            throw new IOException("Invalid \"" + key + "\" in " + source + ": " + e.getMessage(), e);
        }
    }

    Double getDouble(String key) throws IOException {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        try {
            return json.getDouble(key);
        } catch (JSONException e) {
            throw new IOException("Invalid \"" + key + "\" in " + source + ": " + e.getMessage(), e);
        }
    }

    String getString(String key) {
        return json.has(key) && !json.isNull(key) ? String.valueOf(json.get(key)) : null;
    }

    /**
     * Returns <tt>{mppX, mppY}</tt> from <tt>mppX</tt>/<tt>mppY</tt> pair or from the single
     * <tt>mpp</tt> value, or <tt>null</tt> if there is no spacing here.
     */
    double[] spacing() throws IOException {
        final Double mppX = getDouble(MPP_X);
        final Double mppY = getDouble(MPP_Y);
        if (mppX != null || mppY != null) {
            if (mppX == null || mppY == null) {
                throw new IOException("Both \"" + MPP_X + "\" and \"" + MPP_Y + "\" must be specified in " + source);
            }
            return checkedSpacing(mppX, mppY);
        }
        final Double mpp = getDouble(MPP);
        return mpp == null ? null : checkedSpacing(mpp, mpp);
    }

    @Override
    public String toString() {
        return source + " " + json;
    }

    private double[] checkedSpacing(double mppX, double mppY) throws IOException {
        if (!(mppX > 0.0) || !(mppY > 0.0) || Double.isInfinite(mppX) || Double.isInfinite(mppY)) {
            throw new IOException("Invalid spacing " + mppX + ", " + mppY + " in " + source
                + " (must be positive and finite)");
        }
        return new double[] {mppX, mppY};
    }
}
