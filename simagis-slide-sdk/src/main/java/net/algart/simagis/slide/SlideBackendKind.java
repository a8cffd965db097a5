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

import net.algart.simagis.slide.sources.ImageDirectorySlideBackend;
import net.algart.simagis.slide.sources.ImageIOSlideBackend;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Backends, available in this package, selected by name.
 */
public enum SlideBackendKind implements SlideBackendFactory {
    /**
     * Single image file, readable by <tt>javax.imageio</tt>; the pyramid is built in memory.
     */
    IMAGE_IO {
        @Override
        public SlideBackend newSlideBackend(Path slidePath, String configuration) throws IOException {
            return ImageIOSlideBackend.newInstance(slidePath, configuration);
        }
    },

    /**
     * Directory with pre-built level images and <tt>pyramid.json</tt> descriptor.
     */
    IMAGE_DIRECTORY {
        @Override
        public SlideBackend newSlideBackend(Path slidePath, String configuration) throws IOException {
            return ImageDirectorySlideBackend.newInstance(slidePath, configuration);
        }
    };

    public static SlideBackendKind valueOfName(String name) {
        Objects.requireNonNull(name, "Null backend name");
        try {
            return valueOf(name.trim().toUpperCase(Locale.US));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown slide backend \"" + name
                + "\" (IMAGE_IO or IMAGE_DIRECTORY expected)", e);
        }
    }
}
