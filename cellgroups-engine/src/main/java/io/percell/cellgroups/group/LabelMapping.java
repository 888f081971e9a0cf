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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/// Bijection from raw cluster labels to contiguous group ids, in ascending
/// order of cluster mean.
///
/// Group ids are 0-based internally; [#groupId(int)] gives the 1-based id
/// used in file names and provenance.
public final class LabelMapping {

    private final Map<Integer, Integer> rawToGroup;

    LabelMapping(Map<Integer, Integer> rawToGroup) {
        this.rawToGroup = Collections.unmodifiableMap(new LinkedHashMap<>(rawToGroup));
    }

    /// 1-based group id of a raw label.
    ///
    /// @throws IllegalArgumentException if the label is not mapped
    public int groupId(int rawLabel) {
        Integer index = rawToGroup.get(rawLabel);
        if (index == null) {
            throw new IllegalArgumentException("raw label " + rawLabel + " is not mapped");
        }
        return index + 1;
    }

    /// Raw label mapped to a 1-based group id, if any cluster landed there.
    public OptionalInt rawLabelFor(int groupId) {
        for (Map.Entry<Integer, Integer> e : rawToGroup.entrySet()) {
            if (e.getValue() + 1 == groupId) {
                return OptionalInt.of(e.getKey());
            }
        }
        return OptionalInt.empty();
    }

    /// Raw label to 0-based group index, iterated in group order.
    public Map<Integer, Integer> asMap() {
        return rawToGroup;
    }

    public int size() {
        return rawToGroup.size();
    }

    @Override
    public String toString() {
        return "LabelMapping" + rawToGroup;
    }
}
