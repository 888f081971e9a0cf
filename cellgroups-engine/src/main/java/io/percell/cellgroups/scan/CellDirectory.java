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

package io.percell.cellgroups.scan;

import java.nio.file.Path;

/// A directory of per-cell images, two levels below the cells root.
///
/// @param root the cells root the directory was found under
/// @param condition name of the first-level condition directory
/// @param directory the region directory holding the cell images
public record CellDirectory(Path root, String condition, Path directory) {

    /// Region directory name, used to name every output file.
    public String name() {
        return directory.getFileName().toString();
    }

    /// Path of the directory relative to the cells root, e.g. `Control/R1_ch00`.
    public String relativeName() {
        return root.relativize(directory).toString().replace('\\', '/');
    }
}
