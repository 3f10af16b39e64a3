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

package org.elasticsoftware.domain.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.events.EventDefinition;
import org.elasticsoftware.domain.json.FieldPath;
import org.elasticsoftware.domain.json.JsonNodes;
import org.elasticsoftware.domain.mapping.CommandFieldMapping;
import org.elasticsoftware.domain.mapping.EventFieldMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits events on behalf of the command being handled: completes the envelope from the command,
 * assigns the next revision, buffers the event and applies it to the model right away.
 */
final class CommandEventApplier implements EventApplier {
    private static final Logger log = LoggerFactory.getLogger(CommandEventApplier.class);
    private final AggregateDefinition aggregate;
    private final AggregateModel model;
    private final ObjectNode command;
    private final CommandFieldMapping commandMapping;
    private final EventFieldMapping eventMapping;

    CommandEventApplier(AggregateDefinition aggregate, AggregateModel model, ObjectNode command) {
        this.aggregate = aggregate;
        this.model = model;
        this.command = command;
        this.commandMapping = aggregate.getFieldMappings().command();
        this.eventMapping = aggregate.getFieldMappings().event();
    }

    @Override
    public void apply(String eventName, @Nullable JsonNode payload) {
        ObjectNode event = JsonNodes.newObject();
        eventMapping.name().put(event, TextNode.valueOf(eventName));
        if (payload != null) {
            eventMapping.payload().put(event, payload.deepCopy());
        }
        emit(event);
    }

    @Override
    public void apply(ObjectNode event) {
        emit(event.deepCopy());
    }

    private void emit(ObjectNode event) {
        if (eventMapping.meta() != null && commandMapping.meta() != null) {
            JsonNode meta = commandMapping.meta().get(command);
            if (meta != null) {
                eventMapping.meta().put(event, meta.deepCopy());
            }
        }
        FieldPath versionPath = eventMapping.version();
        if (versionPath != null && versionPath.get(event) == null) {
            // an event emitted without a version targets the latest one registered under its name
            String eventName = eventMapping.name().getText(event);
            int latestVersion = eventName != null ? aggregate.getLatestEventVersion(eventName) : 0;
            versionPath.put(event, IntNode.valueOf(latestVersion));
        }
        // resolve before touching the model so an unknown event leaves no trace
        EventDefinition eventDefinition = aggregate.resolveEvent(event);

        long revision = model.getRevision() + 1;
        model.setRevision(revision);
        eventMapping.revision().put(event, LongNode.valueOf(revision));
        eventMapping.aggregateId().put(event, TextNode.valueOf(model.getId()));
        JsonNode correlationId = commandMapping.id().get(command);
        if (correlationId != null) {
            eventMapping.correlationId().put(event, correlationId.deepCopy());
        }
        if (eventMapping.aggregate() != null && commandMapping.aggregate() != null) {
            stamp(event, eventMapping.aggregate(), commandMapping.aggregate().getText(command), aggregate.getName());
        }
        if (eventMapping.context() != null && commandMapping.context() != null) {
            stamp(event, eventMapping.context(), commandMapping.context().getText(command), aggregate.getContextName());
        }

        model.addUncommittedEvent(event);
        log.trace("Applying event {} (version {}) at revision {} on {}",
                eventDefinition.getName(), eventDefinition.getVersion(), revision, model.getId());
        aggregate.applyEvent(eventDefinition, event, model);
    }

    private static void stamp(ObjectNode event, FieldPath path, @Nullable String fromCommand, @Nullable String fallback) {
        String value = fromCommand != null && !fromCommand.isEmpty() ? fromCommand : fallback;
        if (value != null) {
            path.put(event, TextNode.valueOf(value));
        }
    }
}
