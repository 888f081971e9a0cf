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

package io.percell.cellgroups.cluster;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class QuantilePartitionerTest {

    @Test
    void earliestRunsTakeTheRemainder() {
        int[] labels = QuantilePartitioner.partition(new double[]{5, 5, 5, 5, 5, 5, 5}, 3);

        assertThat(labels).containsExactly(0, 0, 0, 1, 1, 2, 2);
    }

    @Test
    void runsFollowAscendingValues() {
        int[] labels = QuantilePartitioner.partition(new double[]{9, 1, 7, 3, 5, 2}, 3);

        // sorted: 1(1) 2(5) 3(3) 5(4) 7(2) 9(0)
        assertThat(labels).containsExactly(2, 0, 2, 1, 1, 0);
    }

    @Test
    void singleRunHoldsEverything() {
        assertThat(QuantilePartitioner.partition(new double[]{3, 1, 2}, 1)).containsOnly(0);
    }

    @Test
    void runMeansAreAscending() {
        double[] means = QuantilePartitioner.runMeans(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10}, 2);

        assertThat(means).containsExactly(3.0, 8.0);
    }

    @Test
    void rejectsMoreRunsThanValues() {
        assertThatThrownBy(() -> QuantilePartitioner.partition(new double[]{1, 2}, 3))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuantilePartitioner.partition(new double[]{1, 2}, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
