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

import io.percell.cellgroups.feature.CellSample;

import java.util.List;

/// A group of cells sharing one intensity bin.
///
/// @param id 1-based group id
/// @param members cells in the group, possibly none
/// @param meanFeature mean feature of the members, 0 for an empty group
public record CellGroup(int id, List<CellSample> members, double meanFeature) {

    public CellGroup {
        if (id < 1) {
            throw new IllegalArgumentException("group ids are 1-based, got " + id);
        }
        members = List.copyOf(members);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    /// Tallest member height, 0 for an empty group.
    public int canvasHeight() {
        int h = 0;
        for (CellSample member : members) {
            h = Math.max(h, member.image().height());
        }
        return h;
    }

    /// Widest member width, 0 for an empty group.
    public int canvasWidth() {
        int w = 0;
        for (CellSample member : members) {
            w = Math.max(w, member.image().width());
        }
        return w;
    }

    /// Display name used in provenance, `Group_<id>`.
    public String name() {
        return "Group_" + id;
    }
}
