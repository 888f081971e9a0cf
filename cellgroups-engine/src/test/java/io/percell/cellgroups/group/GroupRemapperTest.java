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

package io.percell.cellgroups.group;

import io.percell.cellgroups.cluster.ClusterMethod;
import io.percell.cellgroups.cluster.ClusterResult;
import io.percell.cellgroups.feature.CellSample;
import io.percell.cellgroups.image.CellImage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class GroupRemapperTest {

    private static List<CellSample> samples(double... features) {
        List<CellSample> samples = new ArrayList<>();
        for (int i = 0; i < features.length; i++) {
            samples.add(new CellSample("CELL" + i, null, features[i], CellImage.filled(1, 1, features[i])));
        }
        return samples;
    }

    private static ClusterResult result(int[] labels, List<CellSample> samples, int bins) {
        List<String> ids = new ArrayList<>();
        double[] features = new double[samples.size()];
        for (int i = 0; i < features.length; i++) {
            ids.add(samples.get(i).id());
            features[i] = samples.get(i).feature();
        }
        return new ClusterResult(labels, ids, features, ClusterMethod.KMEANS, true, bins, bins);
    }

    @Test
    void ordersGroupsByAscendingMean() {
        List<CellSample> cells = samples(900, 10, 500, 20);
        ClusterResult result = result(new int[]{0, 2, 1, 2}, cells, 3);

        LabelMapping mapping = GroupRemapper.remap(result);

        assertThat(mapping.groupId(2)).isEqualTo(1);
        assertThat(mapping.groupId(1)).isEqualTo(2);
        assertThat(mapping.groupId(0)).isEqualTo(3);
        assertThat(mapping.rawLabelFor(1)).hasValue(2);
    }

    @Test
    void breaksTiesByRawLabel() {
        List<CellSample> cells = samples(5, 5, 5);
        ClusterResult result = result(new int[]{2, 0, 1}, cells, 3);

        LabelMapping mapping = GroupRemapper.remap(result);

        assertThat(mapping.asMap()).containsExactly(entry(0, 0), entry(1, 1), entry(2, 2));
    }

    @Test
    void keepsEmptyGroupsAndStampsGroupIds() {
        List<CellSample> cells = samples(1, 2, 300);
        ClusterResult result = result(new int[]{4, 4, 1}, cells, 3);

        List<CellGroup> groups = GroupRemapper.apply(result, cells);

        assertThat(groups).extracting(CellGroup::id).containsExactly(1, 2, 3);
        assertThat(groups).extracting(CellGroup::size).containsExactly(2, 1, 0);
        assertThat(groups.get(2).isEmpty()).isTrue();
        assertThat(groups.get(2).meanFeature()).isZero();
        assertThat(groups.get(0).meanFeature()).isEqualTo(1.5);
        assertThat(cells).extracting(c -> c.groupId().getAsInt()).containsExactly(1, 1, 2);
        assertThat(groups.get(1).name()).isEqualTo("Group_2");
    }

    @Test
    void remappingIsStable() {
        List<CellSample> cells = samples(3, 1, 2, 3);
        ClusterResult result = result(new int[]{1, 0, 0, 1}, cells, 2);

        assertThat(GroupRemapper.remap(result).asMap()).isEqualTo(GroupRemapper.remap(result).asMap());
    }

    @Test
    void canvasIsTheLargestMemberExtent() {
        CellSample tall = new CellSample("a", null, 1, CellImage.filled(10, 20, 1));
        CellSample wide = new CellSample("b", null, 1, CellImage.filled(15, 5, 1));

        CellGroup group = new CellGroup(1, List.of(tall, wide), 1);

        assertThat(group.canvasWidth()).isEqualTo(15);
        assertThat(group.canvasHeight()).isEqualTo(20);
    }
}
