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

package io.percell.cellgroups.composite;

import io.percell.cellgroups.image.CellImage;

/// Fits an image onto a fixed canvas, keeping its aspect ratio and centering
/// it between zero-valued margins.
///
/// The image is scaled so that it touches the canvas on the limiting axis.
/// Resampling is area-weighted: every output pixel is the overlap-weighted
/// average of the source pixels its footprint covers, applied separably
/// along rows and then columns.
public final class CanvasResizer {

    private CanvasResizer() {
    }

    /// Places `image` on a `targetWidth` × `targetHeight` canvas.
    ///
    /// @return row-major canvas samples
    public static double[] fit(CellImage image, int targetWidth, int targetHeight) {
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw new IllegalArgumentException("canvas must be non-empty, got " + targetWidth + "x" + targetHeight);
        }
        int w = image.width();
        int h = image.height();
        int newWidth;
        int newHeight;
        // w/h > W/H without floating point
        if ((long) w * targetHeight > (long) targetWidth * h) {
            newWidth = targetWidth;
            newHeight = (int) Math.max(1L, (long) targetWidth * h / w);
        } else {
            newHeight = targetHeight;
            newWidth = (int) Math.max(1L, (long) targetHeight * w / h);
        }

        double[] resized = resample(image.pixels(), w, h, newWidth, newHeight);

        double[] canvas = new double[targetWidth * targetHeight];
        int top = (targetHeight - newHeight) / 2;
        int left = (targetWidth - newWidth) / 2;
        for (int y = 0; y < newHeight; y++) {
            System.arraycopy(resized, y * newWidth, canvas, (top + y) * targetWidth + left, newWidth);
        }
        return canvas;
    }

    static double[] resample(double[] src, int w, int h, int newWidth, int newHeight) {
        if (w == newWidth && h == newHeight) {
            return src.clone();
        }
        AxisWeights horizontal = AxisWeights.of(w, newWidth);
        AxisWeights vertical = AxisWeights.of(h, newHeight);

        double[] rows = new double[newWidth * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < newWidth; x++) {
                rows[y * newWidth + x] = horizontal.apply(src, y * w, 1, x);
            }
        }
        double[] out = new double[newWidth * newHeight];
        for (int y = 0; y < newHeight; y++) {
            for (int x = 0; x < newWidth; x++) {
                out[y * newWidth + x] = vertical.apply(rows, x, newWidth, y);
            }
        }
        return out;
    }

    /// Source indices and overlap weights for every output index along one axis.
    private static final class AxisWeights {
        private final int[][] indices;
        private final double[][] weights;

        private AxisWeights(int[][] indices, double[][] weights) {
            this.indices = indices;
            this.weights = weights;
        }

        static AxisWeights of(int srcLength, int dstLength) {
            double scale = (double) srcLength / dstLength;
            int[][] indices = new int[dstLength][];
            double[][] weights = new double[dstLength][];
            for (int j = 0; j < dstLength; j++) {
                double start = j * scale;
                double end = start + scale;
                int first = (int) Math.floor(start);
                int last = Math.min(srcLength - 1, (int) Math.ceil(end) - 1);
                int count = last - first + 1;
                indices[j] = new int[count];
                weights[j] = new double[count];
                double total = 0.0;
                for (int c = 0; c < count; c++) {
                    int s = first + c;
                    double overlap = Math.min(end, s + 1) - Math.max(start, s);
                    indices[j][c] = s;
                    weights[j][c] = Math.max(0.0, overlap);
                    total += weights[j][c];
                }
                for (int c = 0; c < count; c++) {
                    weights[j][c] /= total;
                }
            }
            return new AxisWeights(indices, weights);
        }

        double apply(double[] data, int offset, int stride, int outIndex) {
            int[] idx = indices[outIndex];
            double[] wt = weights[outIndex];
            double sum = 0.0;
            for (int c = 0; c < idx.length; c++) {
                sum += data[offset + idx[c] * stride] * wt[c];
            }
            return sum;
        }
    }
}
