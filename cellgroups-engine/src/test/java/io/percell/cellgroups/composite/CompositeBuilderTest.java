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
import io.percell.cellgroups.image.CellImage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class CompositeBuilderTest {

    private static CellSample cell(String id, CellImage image) {
        return new CellSample(id, null, image.sum(), image);
    }

    @Test
    void smallerCellIsCenteredOnTheGroupCanvas() {
        CellSample small = cell("CELL1", CellImage.filled(10, 10, 100));
        CellSample large = cell("CELL2", CellImage.filled(15, 20, 50));
        CellGroup group = new CellGroup(1, List.of(small, large), 0);

        CompositeImage composite = CompositeBuilder.build(group).orElseThrow();

        assertThat(composite.width()).isEqualTo(15);
        assertThat(composite.height()).isEqualTo(20);
        assertThat(composite.memberCount()).isEqualTo(2);
        // padding rows hold only the large cell, rows 2..16 hold both
        assertThat(composite.get(0, 0)).isZero();
        assertThat(composite.get(14, 19)).isZero();
        assertThat(composite.get(0, 2)).isCloseTo(65535, within(1));
        assertThat(composite.get(7, 16)).isCloseTo(65535, within(1));
        assertThat(composite.get(7, 17)).isZero();
    }

    @Test
    void constantSumBecomesAllZero() {
        CellGroup group = new CellGroup(2, List.of(cell("CELL1", CellImage.filled(4, 4, 0))), 0);

        CompositeImage composite = CompositeBuilder.build(group).orElseThrow();

        assertThat(composite.samples()).containsOnly(0);
        assertThat(composite.groupId()).isEqualTo(2);
    }

    @Test
    void nonZeroConstantSumAlsoBecomesAllZero() {
        CellGroup group = new CellGroup(1, List.of(cell("CELL1", CellImage.filled(3, 3, 9)),
            cell("CELL2", CellImage.filled(3, 3, 1))), 0);

        assertThat(CompositeBuilder.build(group).orElseThrow().samples()).containsOnly(0);
    }

    @Test
    void normalizesLinearlyTo16Bits() {
        int[] out = CompositeBuilder.normalize(new double[]{10, 20, 30});

        assertThat(out).containsExactly(0, 32767, 65535);
    }

    @Test
    void emptyGroupHasNoComposite() {
        Optional<CompositeImage> composite = CompositeBuilder.build(new CellGroup(3, List.of(), 0));

        assertThat(composite).isEmpty();
    }
}
