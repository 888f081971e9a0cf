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

package io.percell.cellgroups.provenance;

import io.percell.cellgroups.cluster.ClusterResult;
import io.percell.cellgroups.feature.CellMetric;
import io.percell.cellgroups.feature.FeatureSet;
import io.percell.cellgroups.group.CellGroup;

import java.nio.file.Path;
import java.util.List;

/// Everything the grouping summary reports about one directory.
public record GroupingSummary(
    Path cellDirectory,
    FeatureSet features,
    ClusterResult result,
    List<CellGroup> groups,
    CellMetric metric,
    boolean forceRedistribute
) {
}
