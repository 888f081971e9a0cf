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

import java.util.Arrays;

/// A single-band cell image held in memory as row-major double samples.
///
/// Multi-band sources are reduced to one band when they are read, so every
/// consumer downstream sees exactly one intensity value per pixel.
public final class CellImage {

    private final int width;
    private final int height;
    private final double[] pixels;

    /// Creates an image over the given row-major sample array.
    ///
    /// @param width image width in pixels
    /// @param height image height in pixels
    /// @param pixels row-major samples, `width * height` long; the array is not copied
    public CellImage(int width, int height, double[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("image dimensions must be positive, got " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("pixel array must hold exactly " + (width * height) + " samples");
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /// Creates an image with every pixel set to the same value.
    public static CellImage filled(int width, int height, double value) {
        double[] pixels = new double[width * height];
        Arrays.fill(pixels, value);
        return new CellImage(width, height, pixels);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /// Returns the sample at column `x`, row `y`.
    public double get(int x, int y) {
        return pixels[y * width + x];
    }

    /// Returns the backing row-major sample array. Callers must not modify it.
    public double[] pixels() {
        return pixels;
    }

    /// Integrated intensity over all pixels.
    public double sum() {
        double sum = 0.0;
        for (double v : pixels) {
            sum += v;
        }
        return sum;
    }

    public double max() {
        double max = pixels[0];
        for (double v : pixels) {
            if (v > max) {
                max = v;
            }
        }
        return max;
    }

    public double mean() {
        return sum() / pixels.length;
    }

    @Override
    public String toString() {
        return "CellImage[" + width + "x" + height + "]";
    }
}
