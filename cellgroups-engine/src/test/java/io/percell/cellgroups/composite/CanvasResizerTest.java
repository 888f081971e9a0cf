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

import io.percell.cellgroups.TestImages;
import io.percell.cellgroups.image.CellImage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class CanvasResizerTest {

    @Test
    void squareImageIsScaledToWidthAndCenteredVertically() {
        // 15 wide by 20 high canvas
        double[] canvas = CanvasResizer.fit(CellImage.filled(10, 10, 100), 15, 20);

        assertThat(canvas).hasSize(15 * 20);
        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 15; x++) {
                double v = canvas[y * 15 + x];
                if (y >= 2 && y < 17) {
                    assertThat(v).as("(%d,%d)", x, y).isCloseTo(100.0, within(1e-9));
                } else {
                    assertThat(v).as("(%d,%d)", x, y).isZero();
                }
            }
        }
    }

    @Test
    void wideImageIsLetterboxed() {
        double[] canvas = CanvasResizer.fit(CellImage.filled(4, 1, 1), 4, 4);

        // 4x1 stays 4x1, placed on row (4 - 1) / 2 = 1
        for (int x = 0; x < 4; x++) {
            assertThat(canvas[x]).isZero();
            assertThat(canvas[4 + x]).isEqualTo(1.0);
            assertThat(canvas[8 + x]).isZero();
        }
    }

    @Test
    void downscalingAveragesCoveredPixels() {
        CellImage ramp = TestImages.ramp(4, 4);

        double[] canvas = CanvasResizer.fit(ramp, 2, 2);

        // each output pixel averages one 2x2 block
        assertThat(canvas[0]).isCloseTo((0 + 1 + 4 + 5) / 4.0, within(1e-9));
        assertThat(canvas[1]).isCloseTo((2 + 3 + 6 + 7) / 4.0, within(1e-9));
        assertThat(canvas[2]).isCloseTo((8 + 9 + 12 + 13) / 4.0, within(1e-9));
        assertThat(canvas[3]).isCloseTo((10 + 11 + 14 + 15) / 4.0, within(1e-9));
    }

    @Test
    void sameSizeImageIsCopiedUnchanged() {
        CellImage ramp = TestImages.ramp(3, 2);

        double[] canvas = CanvasResizer.fit(ramp, 3, 2);

        assertThat(canvas).containsExactly(ramp.pixels());
        assertThat(canvas).isNotSameAs(ramp.pixels());
    }

    @Test
    void upscalingPreservesTheMeanOfAConstantImage() {
        double[] canvas = CanvasResizer.fit(CellImage.filled(3, 3, 7), 7, 7);

        for (double v : canvas) {
            assertThat(v).isCloseTo(7.0, within(1e-9));
        }
    }

    @Test
    void rejectsEmptyCanvas() {
        assertThatThrownBy(() -> CanvasResizer.fit(CellImage.filled(2, 2, 1), 0, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
