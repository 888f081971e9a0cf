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

import java.util.Locale;

/// Clustering method, either requested by configuration or reported as the
/// one that produced a result.
public enum ClusterMethod {
    GMM("gmm"),
    KMEANS("kmeans"),
    /// Deterministic rank-run partition; never requested directly.
    FORCED_QUANTILE("forced_quantile");

    private final String label;

    ClusterMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Parses a requestable method name (`gmm` or `kmeans`), ignoring case.
    ///
    /// @throws IllegalArgumentException for any other name
    public static ClusterMethod fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "gmm":
                return GMM;
            case "kmeans":
            case "k-means":
                return KMEANS;
            default:
                throw new IllegalArgumentException("Unknown clustering method '" + name + "', expected gmm or kmeans");
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
