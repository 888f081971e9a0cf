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

/// A normalized 16-bit composite of one group.
///
/// @param groupId 1-based group id
/// @param width canvas width
/// @param height canvas height
/// @param samples row-major samples in `[0, 65535]`
/// @param memberCount cells summed into the composite
public record CompositeImage(int groupId, int width, int height, int[] samples, int memberCount) {

    public int get(int x, int y) {
        return samples[y * width + x];
    }
}
