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

import java.util.Locale;

/// TIFF resolution metadata carried from source cell images onto composites.
///
/// Resolutions are kept as the unsigned rationals stored in the TIFF
/// `XResolution`/`YResolution` tags so they round-trip without loss.
///
/// @param xNumerator numerator of the horizontal resolution
/// @param xDenominator denominator of the horizontal resolution
/// @param yNumerator numerator of the vertical resolution
/// @param yDenominator denominator of the vertical resolution
/// @param unit TIFF `ResolutionUnit` value (1 = none, 2 = inch, 3 = centimeter)
public record ImageResolution(
    long xNumerator,
    long xDenominator,
    long yNumerator,
    long yDenominator,
    int unit
) {

    public ImageResolution {
        if (xDenominator <= 0 || yDenominator <= 0) {
            throw new IllegalArgumentException("resolution denominators must be positive");
        }
    }

    /// Horizontal pixels per resolution unit.
    public double xPixelsPerUnit() {
        return (double) xNumerator / xDenominator;
    }

    /// Vertical pixels per resolution unit.
    public double yPixelsPerUnit() {
        return (double) yNumerator / yDenominator;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ImageResolution[x=%.4f, y=%.4f, unit=%d]",
            xPixelsPerUnit(), yPixelsPerUnit(), unit);
    }
}
