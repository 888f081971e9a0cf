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

import io.percell.cellgroups.feature.CellSample;
import io.percell.cellgroups.group.CellGroup;
import io.percell.cellgroups.image.CompositeImageWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/// Sums the members of a group on a common canvas and normalizes the sum to
/// the 16-bit range.
///
/// The canvas is the tallest member height by the widest member width. Each
/// member is fitted onto it by [CanvasResizer], accumulated in double
/// precision, and the accumulator is min-max scaled to `[0, 65535]`. A
/// constant accumulator becomes an all-zero image.
public final class CompositeBuilder {

    private static final Logger logger = LogManager.getLogger(CompositeBuilder.class);

    private CompositeBuilder() {
    }

    /// Builds the composite of a group, or nothing for an empty group.
    public static Optional<CompositeImage> build(CellGroup group) {
        if (group.isEmpty()) {
            logger.warn("No images in group {}, skipping composite", group.id());
            return Optional.empty();
        }
        int width = group.canvasWidth();
        int height = group.canvasHeight();
        double[] accumulator = new double[width * height];
        for (CellSample member : group.members()) {
            double[] fitted = CanvasResizer.fit(member.image(), width, height);
            for (int i = 0; i < accumulator.length; i++) {
                accumulator[i] += fitted[i];
            }
        }
        logger.debug("Group {}: summed {} cells on a {}x{} canvas", group.id(), group.size(), width, height);
        return Optional.of(new CompositeImage(group.id(), width, height, normalize(accumulator), group.size()));
    }

    static int[] normalize(double[] accumulator) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : accumulator) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        int[] out = new int[accumulator.length];
        double span = max - min;
        if (!(span > 0)) {
            return out;
        }
        double scale = CompositeImageWriter.MAX_16_BIT / span;
        for (int i = 0; i < accumulator.length; i++) {
            int v = (int) ((accumulator[i] - min) * scale);
            out[i] = Math.min(CompositeImageWriter.MAX_16_BIT, Math.max(0, v));
        }
        return out;
    }
}
