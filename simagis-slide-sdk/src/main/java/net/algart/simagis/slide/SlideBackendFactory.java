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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Factory allowing to construct {@link SlideBackend} instance on the base
 * of the path to an external resource, where the slide is stored,
 * and some additional configuration information.
 * This interface should have different implementations for different formats of slides.
 */
public interface SlideBackendFactory {
    /**
     * Creates new backend, providing access to the slide, stored at the given path,
     * with possible using additional recommendations, described in <tt>configuration</tt> argument.
     *
     * <p>The <tt>configuration</tt> must be a JSON object, or an empty string (equivalent to <tt>{}</tt>).
     * Syntax errors in it lead to <tt>IOException</tt>, like format errors in the data file.
     *
     * @param slidePath     path to the slide: a file or a directory.
     * @param configuration additional information, describing the slide (like its spacing, when the format
     *                      does not store it) and the necessary behaviour of the resulting backend.
     * @return new backend, providing access to the slide at the specified path.
     * @throws NullPointerException      if one of the arguments is <tt>null</tt>.
     * @throws UnsupportedSlideException if the slide has a format, which this backend cannot read.
     * @throws IOException               if some I/O problems occur while opening the slide, and also in a case
     *                                   of invalid format of the passed <tt>configuration</tt>.
     */
    SlideBackend newSlideBackend(Path slidePath, String configuration) throws IOException;
}
