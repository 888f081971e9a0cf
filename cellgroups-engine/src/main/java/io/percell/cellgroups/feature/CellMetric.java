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

package io.percell.cellgroups.feature;

import io.percell.cellgroups.image.CellImage;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Locale;

/// Scalar per-cell features used to rank and bin cells.
public enum CellMetric {

    /// Total integrated intensity, the sum of all pixel values.
    AUC("auc") {
        @Override
        public double compute(CellImage image) {
            return image.sum();
        }
    },

    /// Peak pixel value.
    MAX("max") {
        @Override
        public double compute(CellImage image) {
            return image.max();
        }
    },

    /// Mean pixel value.
    MEAN("mean") {
        @Override
        public double compute(CellImage image) {
            return image.mean();
        }
    },

    /// Signal-to-ground ratio: the summed intensity at or above the 95th
    /// percentile over the summed intensity at or below the 50th percentile.
    SG("sg") {
        @Override
        public double compute(CellImage image) {
            double[] pixels = image.pixels();
            Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
            percentile.setData(pixels);
            double signalThreshold = percentile.evaluate(SIGNAL_PERCENTILE);
            double groundThreshold = percentile.evaluate(GROUND_PERCENTILE);

            double signal = 0.0;
            double ground = 0.0;
            for (double v : pixels) {
                if (v >= signalThreshold) {
                    signal += v;
                }
                if (v <= groundThreshold) {
                    ground += v;
                }
            }
            // zero ground would make the ratio infinite
            if (ground == 0.0) {
                ground = 1.0;
            }
            return signal / ground;
        }
    };

    static final double SIGNAL_PERCENTILE = 95.0;
    static final double GROUND_PERCENTILE = 50.0;

    private final String label;

    CellMetric(String label) {
        this.label = label;
    }

    /// Reduces one cell image to its scalar feature.
    public abstract double compute(CellImage image);

    /// Lower-case name used in option values and output column names.
    public String label() {
        return label;
    }

    /// Looks up a metric by its label, ignoring case.
    ///
    /// @throws IllegalArgumentException for an unknown name
    public static CellMetric fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (CellMetric metric : values()) {
                if (metric.label.equals(normalized)) {
                    return metric;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric '" + name + "', expected one of auc, max, mean, sg");
    }

    @Override
    public String toString() {
        return label;
    }
}
