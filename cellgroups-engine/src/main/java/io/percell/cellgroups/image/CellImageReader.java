/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.percell.cellgroups.image;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

/// Reads cell images through ImageIO, which covers 8 and 16 bit TIFF as well as
/// the common raster formats.
///
/// Images with several color bands are averaged down to a single band; an
/// alpha band, when present, is ignored.
public final class CellImageReader {

    private static final Logger logger = LogManager.getLogger(CellImageReader.class);

    /// Native metadata format of the JDK TIFF plugin
    static final String TIFF_NATIVE_FORMAT = "javax_imageio_tiff_image_1.0";

    private CellImageReader() {
    }

    /// Reads one image file into a single-band [CellImage].
    ///
    /// @param path the image file
    /// @return the decoded image
    /// @throws IOException if no reader accepts the file or decoding fails
    public static CellImage read(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("No image reader accepts " + path);
        }
        Raster raster = image.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bands = Math.max(1, Math.min(raster.getNumBands(), image.getColorModel().getNumColorComponents()));

        double[] pixels = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0.0;
                for (int b = 0; b < bands; b++) {
                    sum += raster.getSampleDouble(x, y, b);
                }
                pixels[y * width + x] = bands == 1 ? sum : sum / bands;
            }
        }
        return new CellImage(width, height, pixels);
    }

    /// Reads the TIFF resolution tags of an image, if it has any.
    ///
    /// Files that are not TIFF, or TIFFs without both resolution tags, yield an
    /// empty result rather than an error.
    ///
    /// @param path the image file
    /// @return the resolution metadata, or empty when unavailable
    /// @throws IOException if the file cannot be opened
    public static Optional<ImageResolution> readResolution(Path path) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                IIOMetadata metadata = reader.getImageMetadata(0);
                if (metadata == null) {
                    return Optional.empty();
                }
                return fromMetadata(metadata);
            } finally {
                reader.dispose();
            }
        }
    }

    private static Optional<ImageResolution> fromMetadata(IIOMetadata metadata) throws IOException {
        // createFromMetadata also accepts the standard tree every reader exposes
        if (!TIFF_NATIVE_FORMAT.equals(metadata.getNativeMetadataFormatName())) {
            logger.trace("Metadata format {} carries no TIFF resolution", metadata.getNativeMetadataFormatName());
            return Optional.empty();
        }
        TIFFDirectory directory;
        try {
            directory = TIFFDirectory.createFromMetadata(metadata);
        } catch (IllegalArgumentException e) {
            logger.trace("Metadata is not in TIFF format: {}", e.getMessage());
            return Optional.empty();
        }
        TIFFField xField = directory.getTIFFField(BaselineTIFFTagSet.TAG_X_RESOLUTION);
        TIFFField yField = directory.getTIFFField(BaselineTIFFTagSet.TAG_Y_RESOLUTION);
        if (xField == null || yField == null) {
            return Optional.empty();
        }
        long[] x = xField.getAsRational(0);
        long[] y = yField.getAsRational(0);
        if (x[1] <= 0 || y[1] <= 0) {
            return Optional.empty();
        }
        TIFFField unitField = directory.getTIFFField(BaselineTIFFTagSet.TAG_RESOLUTION_UNIT);
        int unit = unitField != null ? unitField.getAsInt(0) : BaselineTIFFTagSet.RESOLUTION_UNIT_NONE;
        return Optional.of(new ImageResolution(x[0], x[1], y[0], y[1], unit));
    }
}
