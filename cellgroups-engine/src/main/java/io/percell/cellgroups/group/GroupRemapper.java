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

import io.percell.cellgroups.cluster.ClusterResult;
import io.percell.cellgroups.feature.CellSample;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Turns arbitrary raw cluster labels into group ids ordered by intensity:
/// group 1 holds the lowest-mean cluster, group k the highest.
public final class GroupRemapper {

    private static final Logger logger = LogManager.getLogger(GroupRemapper.class);

    private GroupRemapper() {
    }

    /// Orders the non-empty raw labels by ascending mean, ties by raw label.
    public static LabelMapping remap(ClusterResult result) {
        List<Map.Entry<Integer, Double>> ordered = new ArrayList<>(result.means().entrySet());
        ordered.sort(Map.Entry.<Integer, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey()));
        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        for (int rank = 0; rank < ordered.size(); rank++) {
            mapping.put(ordered.get(rank).getKey(), rank);
        }
        return new LabelMapping(mapping);
    }

    /// Remaps a result, stamps each sample with its group id and returns every
    /// group from 1 to the result's actual bin count, empty ones included.
    ///
    /// @param result the raw assignment
    /// @param samples the clustered samples, in the order the result was built from
    /// @return groups 1..actualBins in id order
    public static List<CellGroup> apply(ClusterResult result, List<CellSample> samples) {
        if (samples.size() != result.sampleCount()) {
            throw new IllegalArgumentException("expected " + result.sampleCount() + " samples, got " + samples.size());
        }
        LabelMapping mapping = remap(result);
        List<List<CellSample>> byGroup = new ArrayList<>();
        for (int g = 0; g < result.actualBins(); g++) {
            byGroup.add(new ArrayList<>());
        }
        for (int i = 0; i < samples.size(); i++) {
            CellSample sample = samples.get(i);
            int groupId = mapping.groupId(result.label(i));
            sample.assignGroup(groupId);
            byGroup.get(groupId - 1).add(sample);
        }

        List<CellGroup> groups = new ArrayList<>(byGroup.size());
        for (int g = 0; g < byGroup.size(); g++) {
            List<CellSample> members = byGroup.get(g);
            double mean = members.stream().mapToDouble(CellSample::feature).average().orElse(0.0);
            if (members.isEmpty()) {
                logger.warn("Group {} has no cells assigned to it", g + 1);
            }
            groups.add(new CellGroup(g + 1, members, mean));
        }
        return groups;
    }
}
