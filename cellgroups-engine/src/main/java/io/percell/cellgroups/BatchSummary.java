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

package io.percell.cellgroups;

import java.util.List;

/// Aggregate outcome of a batch run.
///
/// @param results per-directory results in submission order
public record BatchSummary(List<DirectoryGroupingResult> results) {

    public BatchSummary {
        results = List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    public int succeeded() {
        return (int) results.stream().filter(DirectoryGroupingResult::success).count();
    }

    public int failed() {
        return total() - succeeded();
    }

    /// True when at least one directory produced a composite.
    public boolean anySucceeded() {
        return succeeded() > 0;
    }
}
