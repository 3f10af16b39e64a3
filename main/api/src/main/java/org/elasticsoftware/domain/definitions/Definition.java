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

package org.elasticsoftware.domain.definitions;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.json.FieldPath;

/**
 * Common part of every definition an aggregate is assembled from: a name, a version and the path of
 * the payload inside the command or event the definition is applied to.
 */
public abstract class Definition {
    private final String name;
    private final int version;
    private final String description;
    private volatile FieldPath payload;

    protected Definition(String name, int version, @Nullable String payload, @Nullable String description) {
        if (name == null || name.isBlank()) {
            throw new InvalidDefinitionException("Please pass a valid name for " + getClass().getSimpleName());
        }
        if (version < 0) {
            throw new InvalidDefinitionException("Version of " + name + " must not be negative but was " + version);
        }
        this.name = name;
        this.version = version;
        this.description = description;
        this.payload = payload != null ? parsePath(payload) : null;
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public FieldPath getPayload() {
        return payload != null ? payload : FieldPath.ROOT;
    }

    public boolean hasPayload() {
        return payload != null;
    }

    /**
     * Assigns the aggregate wide default payload path, unless this definition declared its own.
     */
    public void usePayloadIfUnset(String defaultPayload) {
        if (payload == null) {
            payload = parsePath(defaultPayload);
        }
    }

    protected JsonNode extractPayload(JsonNode source) {
        if (getPayload().isRoot()) {
            return source.deepCopy();
        }
        JsonNode value = getPayload().get(source);
        return value != null ? value.deepCopy() : null;
    }

    private FieldPath parsePath(String path) {
        try {
            return FieldPath.of(path);
        } catch (IllegalArgumentException e) {
            throw new InvalidDefinitionException("Invalid payload path for " + name, e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", v" + version + "]";
    }
}
