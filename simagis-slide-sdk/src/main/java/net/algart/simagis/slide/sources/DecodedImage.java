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

import net.algart.simagis.slide.UnsupportedSlideException;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;
import java.awt.color.ColorSpace;
import java.awt.color.ICC_ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Image, decoded by <tt>javax.imageio</tt>, together with its metadata.
 */
final class DecodedImage {
    private final BufferedImage image;
    private final IIOMetadata metadata;
    private final String formatName;
    private final int imageCount;

    private DecodedImage(BufferedImage image, IIOMetadata metadata, String formatName, int imageCount) {
        this.image = image;
        this.metadata = metadata;
        this.formatName = formatName;
        this.imageCount = imageCount;
    }

    static DecodedImage read(Path file, int imageIndex) throws IOException {
        try (ImageInputStream iis = ImageIO.createImageInputStream(file.toFile())) {
            if (iis == null) {
                throw new IIOException("Cannot create image input stream for " + file
                    + ": no suitable ImageInputStreamSpi exists");
            }
            final Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new UnsupportedSlideException("Unknown image format of " + file
                    + ": no suitable ImageIO readers");
            }
            final ImageReader reader = readers.next();
            try {
                reader.setInput(iis, false);
                final BufferedImage image = reader.read(imageIndex, reader.getDefaultReadParam());
                final IIOMetadata metadata = reader.getImageMetadata(imageIndex);
                return new DecodedImage(image, metadata, reader.getFormatName(), reader.getNumImages(false));
            } finally {
                reader.dispose();
            }
        }
    }

    BufferedImage image() {
        return image;
    }

    IIOMetadata metadata() {
        return metadata;
    }

    String formatName() {
        return formatName;
    }

    // -1 if the reader cannot find it quickly
    int imageCount() {
        return imageCount;
    }

    /**
     * Returns the embedded ICC profile of a color image, or <tt>null</tt> if it is absent
     * or if the image is already sRGB or grayscale.
     */
    ICC_Profile colorProfile() {
        final ColorSpace colorSpace = image.getColorModel().getColorSpace();
        if (colorSpace instanceof ICC_ColorSpace
            && !colorSpace.isCS_sRGB()
            && colorSpace.getType() != ColorSpace.TYPE_GRAY)
        {
            return ((ICC_ColorSpace) colorSpace).getProfile();
        }
        return null;
    }
}
