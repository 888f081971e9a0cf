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

import io.percell.cellgroups.cluster.ClusterMethod;

import java.nio.file.Path;
import java.util.Optional;

/// Outcome of grouping one cell directory.
///
/// @param cellDirectory the directory that was processed
/// @param outputDirectory where its outputs went, or would have gone
/// @param success true iff at least one composite was written
/// @param samplesRead readable cell images
/// @param unreadable cell images that could not be decoded
/// @param actualBins bin count after limiting to the sample count, 0 if clustering never ran
/// @param method method that produced the labels, null if clustering never ran
/// @param compositesWritten composites written to disk
/// @param failureReason why the directory failed, null on success
public record DirectoryGroupingResult(
    Path cellDirectory,
    Path outputDirectory,
    boolean success,
    int samplesRead,
    int unreadable,
    int actualBins,
    ClusterMethod method,
    int compositesWritten,
    String failureReason
) {

    static DirectoryGroupingResult failure(Path cellDirectory, Path outputDirectory, int samplesRead,
                                           int unreadable, String reason) {
        return new DirectoryGroupingResult(cellDirectory, outputDirectory, false, samplesRead, unreadable,
            0, null, 0, reason);
    }

    public Optional<String> failure() {
        return Optional.ofNullable(failureReason);
    }
}
