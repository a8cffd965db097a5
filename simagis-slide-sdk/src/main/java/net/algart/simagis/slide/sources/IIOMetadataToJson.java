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

import org.json.JSONObject;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;

/**
 * Flattens the standard (format-independent) ImageIO metadata tree into slide properties:
 * every attribute becomes a key like <tt>imageio.Dimension.HorizontalPixelSize</tt>.
 */
final class IIOMetadataToJson {
    static final String PREFIX = "imageio";
    static final String HORIZONTAL_PIXEL_SIZE = PREFIX + ".Dimension.HorizontalPixelSize";
    static final String VERTICAL_PIXEL_SIZE = PREFIX + ".Dimension.VerticalPixelSize";

    private static final int MAX_VALUE_LENGTH = 4096;

    private IIOMetadataToJson() {
    }

    static JSONObject toProperties(IIOMetadata metadata) {
        final JSONObject result = new JSONObject();
        if (metadata == null || !metadata.isStandardMetadataFormatSupported()) {
            return result;
        }
        final Node tree = metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
        for (Node child = tree.getFirstChild(); child != null; child = child.getNextSibling()) {
            flatten(child, PREFIX + "." + child.getNodeName(), result);
        }
        return result;
    }

    private static void flatten(Node node, String path, JSONObject result) {
        final NamedNodeMap attributes = node.getAttributes();
        if (attributes != null) {
            for (int k = 0, n = attributes.getLength(); k < n; k++) {
                final Node attribute = attributes.item(k);
                final String name = attribute.getNodeName();
                final String key = "value".equals(name) ? path : path + "." + name;
                put(result, key, attribute.getNodeValue());
            }
        }
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            flatten(child, path + "." + child.getNodeName(), result);
        }
    }

    // Similar nodes (like several ChannelBitsPerSample) are joined into one comma-separated value
    private static void put(JSONObject result, String key, String value) {
        if (value == null || value.length() > MAX_VALUE_LENGTH) {
            return;
        }
        final String existing = result.optString(key, null);
        result.put(key, existing == null ? value : existing + "," + value);
    }
}
