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
import io.percell.cellgroups.feature.CellSample;
import io.percell.cellgroups.feature.FeatureSet;
import io.percell.cellgroups.group.CellGroup;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/// Writes the per-cell group table and the human-readable grouping summary.
///
/// CSV rows follow RFC 4180: CRLF line endings, and fields holding a comma,
/// quote or line break are quoted with inner quotes doubled.
public final class ProvenanceWriter {

    static final String CRLF = "\r\n";

    private ProvenanceWriter() {
    }

    /// Writes `<dirname>_cell_groups.csv`, one row per cell in sample order.
    ///
    /// @param file destination, overwritten
    /// @param samples grouped samples; each must carry a group id
    /// @param groups all groups, indexed by id - 1
    /// @param metric metric naming the mean and per-cell columns
    public static void writeCsv(Path file, List<CellSample> samples, List<CellGroup> groups, CellMetric metric)
        throws IOException {
        Files.writeString(file, csv(samples, groups, metric), StandardCharsets.UTF_8);
    }

    public static String csv(List<CellSample> samples, List<CellGroup> groups, CellMetric metric) {
        StringBuilder sb = new StringBuilder();
        sb.append("cell_filename,cell_id,group_id,group_name,group_mean_").append(metric.label())
            .append(",cell_").append(metric.label()).append(CRLF);
        for (CellSample sample : samples) {
            int groupId = sample.groupId().orElseThrow(
                () -> new IllegalStateException("sample " + sample.id() + " has not been assigned a group"));
            CellGroup group = groups.get(groupId - 1);
            sb.append(field(sample.source() != null ? sample.source().toString() : sample.fileName())).append(',')
                .append(field(cellId(sample.id()))).append(',')
                .append(groupId).append(',')
                .append(group.name()).append(',')
                .append(number(group.meanFeature())).append(',')
                .append(number(sample.feature())).append(CRLF);
        }
        return sb.toString();
    }

    /// Short cell id: the digits of the stem when it contains `CELL`, otherwise
    /// the stem itself.
    public static String cellId(String stem) {
        if (stem.contains("CELL")) {
            StringBuilder digits = new StringBuilder();
            for (int i = 0; i < stem.length(); i++) {
                char c = stem.charAt(i);
                if (c >= '0' && c <= '9') {
                    digits.append(c);
                }
            }
            if (digits.length() > 0) {
                return digits.toString();
            }
        }
        return stem;
    }

    /// Writes `<dirname>_grouping_info.txt`.
    public static void writeSummary(Path file, GroupingSummary summary) throws IOException {
        Files.writeString(file, summary(summary), StandardCharsets.UTF_8);
    }

    public static String summary(GroupingSummary s) {
        FeatureSet features = s.features();
        ClusterResult result = s.result();
        StringBuilder sb = new StringBuilder();
        sb.append("Cell directory: ").append(s.cellDirectory()).append('\n');
        sb.append("Number of cells: ").append(features.size()).append('\n');
        sb.append("Clustering method: ").append(result.method().label()).append('\n');
        sb.append("Converged: ").append(result.converged()).append('\n');
        sb.append("Force clusters: ").append(s.forceRedistribute()).append('\n');
        sb.append("Metric: ").append(s.metric().label()).append('\n');
        sb.append("Number of groups: ").append(result.actualBins()).append('\n');
        sb.append("Images with zero intensity: ").append(features.zeroCount()).append('\n');
        sb.append("Images with non-zero intensity: ").append(features.nonZeroCount()).append('\n');
        sb.append(String.format(Locale.ROOT, "Intensity range: %.2f", features.range())).append("\n\n");
        for (CellGroup group : s.groups()) {
            sb.append("Group ").append(group.id()).append(":\n");
            sb.append("  Cells: ").append(group.size()).append('\n');
            if (!group.isEmpty()) {
                sb.append(String.format(Locale.ROOT, "  Mean intensity: %.2f", group.meanFeature())).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    static String field(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
