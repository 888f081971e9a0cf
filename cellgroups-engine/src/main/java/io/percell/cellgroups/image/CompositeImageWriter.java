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

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.plugins.tiff.TIFFTagSet;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/// Writes 16-bit grayscale TIFF composites.
///
/// When source resolution metadata is supplied it is written into the
/// baseline resolution tags. Any failure on that path falls back to a plain
/// TIFF without resolution tags.
public final class CompositeImageWriter {

    private static final Logger logger = LogManager.getLogger(CompositeImageWriter.class);

    /// ImageIO format name used for all composites.
    public static final String FORMAT = "TIFF";

    /// Largest sample value of a 16-bit image.
    public static final int MAX_16_BIT = 65535;

    private CompositeImageWriter() {
    }

    /// Writes a 16-bit image, overwriting any existing file.
    ///
    /// @param output destination file
    /// @param width image width
    /// @param height image height
    /// @param samples row-major samples in `[0, 65535]`
    /// @param resolution resolution to preserve, or `null`
    /// @return true if resolution metadata was written, false for a plain TIFF
    /// @throws IOException if neither the metadata nor the plain write succeeds
    public static boolean write(Path output, int width, int height, int[] samples, ImageResolution resolution)
        throws IOException {
        BufferedImage image = toImage(width, height, samples);
        if (resolution != null) {
            try {
                writeWithResolution(output, image, resolution);
                return true;
            } catch (IOException | RuntimeException e) {
                logger.warn("Could not write {} with resolution metadata, writing without it: {}",
                    output.getFileName(), e.getMessage());
            }
        }
        Files.deleteIfExists(output);
        if (!ImageIO.write(image, FORMAT, output.toFile())) {
            throw new IOException("No " + FORMAT + " writer available for " + output);
        }
        return false;
    }

    static BufferedImage toImage(int width, int height, int[] samples) {
        if (samples.length != width * height) {
            throw new IllegalArgumentException("expected " + (width * height) + " samples, got " + samples.length);
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_USHORT_GRAY);
        WritableRaster raster = image.getRaster();
        raster.setSamples(0, 0, width, height, 0, samples);
        return image;
    }

    private static void writeWithResolution(Path output, BufferedImage image, ImageResolution resolution)
        throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(FORMAT);
        if (!writers.hasNext()) {
            throw new IOException("No " + FORMAT + " writer available");
        }
        ImageWriter writer = writers.next();
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            IIOMetadata defaults = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaults);
            TIFFTagSet baseline = BaselineTIFFTagSet.getInstance();
            directory.addTIFFField(rational(baseline, BaselineTIFFTagSet.TAG_X_RESOLUTION,
                resolution.xNumerator(), resolution.xDenominator()));
            directory.addTIFFField(rational(baseline, BaselineTIFFTagSet.TAG_Y_RESOLUTION,
                resolution.yNumerator(), resolution.yDenominator()));
            directory.addTIFFField(new TIFFField(baseline.getTag(BaselineTIFFTagSet.TAG_RESOLUTION_UNIT),
                resolution.unit()));
            IIOMetadata metadata = directory.getAsMetadata();

            // ImageOutputStream does not truncate an existing file
            Files.deleteIfExists(output);
            try (ImageOutputStream stream = ImageIO.createImageOutputStream(output.toFile())) {
                if (stream == null) {
                    throw new IOException("Could not open output stream for " + output);
                }
                writer.setOutput(stream);
                writer.write(null, new IIOImage(image, null, metadata), param);
            }
        } finally {
            writer.dispose();
        }
    }

    private static TIFFField rational(TIFFTagSet tagSet, int tagNumber, long numerator, long denominator) {
        TIFFTag tag = tagSet.getTag(tagNumber);
        return new TIFFField(tag, TIFFTag.TIFF_RATIONAL, 1, new long[][]{{numerator, denominator}});
    }
}
