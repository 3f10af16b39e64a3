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

package org.elasticsoftware.domain.events;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.aggregate.AggregateModel;
import org.elasticsoftware.domain.definitions.Definition;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;

/**
 * Describes how an event of a given name and version changes the state of an aggregate. The same
 * definition is used while a command emits the event and while the event is replayed from history.
 */
public final class EventDefinition extends Definition {
    private final EventSourcingHandlerFunction handler;

    private EventDefinition(Builder builder) {
        super(builder.name, builder.version, builder.payload, builder.description);
        if (builder.handler == null) {
            throw new InvalidDefinitionException("Event " + builder.name + " has no event sourcing handler");
        }
        this.handler = builder.handler;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public void apply(ObjectNode event, AggregateModel model) {
        handler.apply(extractPayload(event), model);
    }

    public static final class Builder {
        private final String name;
        private int version;
        private String payload;
        private String description;
        private EventSourcingHandlerFunction handler;

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder handler(EventSourcingHandlerFunction handler) {
            this.handler = handler;
            return this;
        }

        public EventDefinition build() {
            return new EventDefinition(this);
        }
    }
}
