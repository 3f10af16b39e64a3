/*
 * Copyright 2022 - 2026 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.domain.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * A dotted path (for instance {@code aggregate.id}) into a JSON object. The empty path denotes the
 * object itself.
 */
public final class FieldPath {
    public static final FieldPath ROOT = new FieldPath("", new String[0]);

    private final String path;
    private final String[] segments;

    private FieldPath(String path, String[] segments) {
        this.path = path;
        this.segments = segments;
    }

    public static FieldPath of(String path) {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            return ROOT;
        }
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("Invalid field path '" + path + "': empty segment");
            }
        }
        return new FieldPath(path, segments);
    }

    @Nullable
    public static FieldPath ofNullable(@Nullable String path) {
        return path != null ? of(path) : null;
    }

    public boolean isRoot() {
        return segments.length == 0;
    }

    public String path() {
        return path;
    }

    /**
     * @return the node at this path, or {@code null} when the path is missing or holds a JSON null
     */
    @Nullable
    public JsonNode get(@Nullable JsonNode source) {
        JsonNode current = source;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current == null || current.isNull() || current.isMissingNode() ? null : current;
    }

    @Nullable
    public String getText(@Nullable JsonNode source) {
        JsonNode value = get(source);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    public boolean exists(@Nullable JsonNode source) {
        JsonNode value = get(source);
        return value != null && !(value.isTextual() && value.asText().isEmpty());
    }

    public void put(ObjectNode target, JsonNode value) {
        if (isRoot()) {
            if (!value.isObject()) {
                throw new IllegalArgumentException("Only objects can be written to the root path");
            }
            target.setAll((ObjectNode) value);
            return;
        }
        parentOf(target, true).set(segments[segments.length - 1], value);
    }

    public void remove(ObjectNode target) {
        if (isRoot()) {
            target.removeAll();
            return;
        }
        ObjectNode parent = parentOf(target, false);
        if (parent != null) {
            parent.remove(segments[segments.length - 1]);
        }
    }

    @Nullable
    private ObjectNode parentOf(ObjectNode target, boolean create) {
        ObjectNode current = target;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode next = current.get(segments[i]);
            if (next == null || !next.isObject()) {
                if (!create) {
                    return null;
                }
                next = current.putObject(segments[i]);
            }
            current = (ObjectNode) next;
        }
        return current;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(segments, ((FieldPath) o).segments);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(segments);
    }

    @Override
    public String toString() {
        return path;
    }
}
