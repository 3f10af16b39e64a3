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

package org.elasticsoftware.domain.mapping;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.json.FieldPath;

/**
 * Where the runtime reads and writes the attributes of an event.
 */
public record EventFieldMapping(@NotNull FieldPath correlationId,
                                @NotNull FieldPath id,
                                @NotNull FieldPath name,
                                @NotNull FieldPath aggregateId,
                                @Nullable FieldPath context,
                                @Nullable FieldPath aggregate,
                                @NotNull FieldPath payload,
                                @NotNull FieldPath revision,
                                @Nullable FieldPath version,
                                @Nullable FieldPath meta) {
    public EventFieldMapping {
        FieldMappings.requireField("event", "correlationId", correlationId);
        FieldMappings.requireField("event", "id", id);
        FieldMappings.requireField("event", "name", name);
        FieldMappings.requireField("event", "aggregateId", aggregateId);
        FieldMappings.require("event", "payload", payload);
        FieldMappings.requireField("event", "revision", revision);
    }

    public static EventFieldMapping defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String correlationId = "correlationId";
        private String id = "id";
        private String name = "name";
        private String aggregateId = "aggregate.id";
        private String context = "context.name";
        private String aggregate = "aggregate.name";
        private String payload = "payload";
        private String revision = "revision";
        private String version = "version";
        private String meta = "meta";

        private Builder() {
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder context(@Nullable String context) {
            this.context = context;
            return this;
        }

        public Builder aggregate(@Nullable String aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder revision(String revision) {
            this.revision = revision;
            return this;
        }

        public Builder version(@Nullable String version) {
            this.version = version;
            return this;
        }

        public Builder meta(@Nullable String meta) {
            this.meta = meta;
            return this;
        }

        public EventFieldMapping build() {
            try {
                return new EventFieldMapping(FieldPath.ofNullable(correlationId),
                        FieldPath.ofNullable(id),
                        FieldPath.ofNullable(name),
                        FieldPath.ofNullable(aggregateId),
                        FieldPath.ofNullable(context),
                        FieldPath.ofNullable(aggregate),
                        FieldPath.ofNullable(payload),
                        FieldPath.ofNullable(revision),
                        FieldPath.ofNullable(version),
                        FieldPath.ofNullable(meta));
            } catch (IllegalArgumentException e) {
                throw new InvalidDefinitionException("Invalid event field mapping", e);
            }
        }
    }
}
