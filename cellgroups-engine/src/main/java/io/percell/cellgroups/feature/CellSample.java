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

package io.percell.cellgroups.feature;

import io.percell.cellgroups.image.CellImage;

import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalInt;

/// One cell image together with its extracted feature and, once the grouping
/// run reaches them, its raw cluster label and final group id.
public final class CellSample {

    private final String id;
    private final Path source;
    private final double feature;
    private final CellImage image;

    private int rawLabel = -1;
    private int groupId = -1;

    public CellSample(String id, Path source, double feature, CellImage image) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = source;
        this.feature = feature;
        this.image = Objects.requireNonNull(image, "image");
    }

    /// Derives the sample id from a file name by dropping its extension.
    public static String idFor(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String id() {
        return id;
    }

    public Path source() {
        return source;
    }

    /// File name of the source image, or the id when the sample has no source.
    public String fileName() {
        return source != null ? source.getFileName().toString() : id;
    }

    public double feature() {
        return feature;
    }

    public CellImage image() {
        return image;
    }

    public OptionalInt rawLabel() {
        return rawLabel < 0 ? OptionalInt.empty() : OptionalInt.of(rawLabel);
    }

    public void assignRawLabel(int label) {
        if (label < 0) {
            throw new IllegalArgumentException("raw label must be non-negative, got " + label);
        }
        this.rawLabel = label;
    }

    /// The 1-based group id, present once the sample has been remapped.
    public OptionalInt groupId() {
        return groupId < 1 ? OptionalInt.empty() : OptionalInt.of(groupId);
    }

    public void assignGroup(int groupId) {
        if (groupId < 1) {
            throw new IllegalArgumentException("group ids are 1-based, got " + groupId);
        }
        this.groupId = groupId;
    }

    @Override
    public String toString() {
        return "CellSample[" + id + ", feature=" + feature + "]";
    }
}
