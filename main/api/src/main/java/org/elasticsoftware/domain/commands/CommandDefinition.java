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

package org.elasticsoftware.domain.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.aggregate.AggregateModel;
import org.elasticsoftware.domain.definitions.Definition;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.definitions.PrioritizedDefinition;
import org.elasticsoftware.domain.rules.PreCondition;
import org.elasticsoftware.domain.util.FutureUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public final class CommandDefinition extends Definition {
    private final Boolean existing;
    private final CommandValidator validator;
    private final CommandHandlerFunction handler;
    private volatile List<PreCondition> preConditions;

    private CommandDefinition(Builder builder) {
        super(builder.name, builder.version, builder.payload, builder.description);
        if (builder.handler == null) {
            throw new InvalidDefinitionException("Command " + builder.name + " has no handler function");
        }
        this.existing = builder.existing;
        this.validator = builder.validator;
        this.handler = builder.handler;
        this.preConditions = List.of();
        builder.preConditions.forEach(this::addPreCondition);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @return {@code true} if the aggregate must exist, {@code false} if it must not, {@code null} if
     * the command does not care
     */
    @Nullable
    public Boolean getExisting() {
        return existing;
    }

    public List<PreCondition> getPreConditions() {
        return preConditions;
    }

    public synchronized void addPreCondition(PreCondition preCondition) {
        if (preCondition == null) {
            throw new InvalidDefinitionException("Please inject a valid preCondition object!");
        }
        if (preConditions.stream().anyMatch(existingPreCondition -> existingPreCondition == preCondition)) {
            return;
        }
        if (hasPayload()) {
            preCondition.usePayloadIfUnset(getPayload().path());
        }
        List<PreCondition> updated = new ArrayList<>(preConditions);
        updated.add(preCondition);
        updated.sort(PrioritizedDefinition.BY_PRIORITY);
        this.preConditions = List.copyOf(updated);
    }

    /**
     * Preconditions of this command that declare no payload path read the same payload as the command.
     */
    @Override
    public void usePayloadIfUnset(String defaultPayload) {
        super.usePayloadIfUnset(defaultPayload);
        preConditions.forEach(preCondition -> preCondition.usePayloadIfUnset(getPayload().path()));
    }

    public void validate(ObjectNode command) throws CommandValidationException {
        if (validator != null) {
            validator.validate(getName(), getVersion(), extractPayload(command));
        }
    }

    public CompletableFuture<Void> checkPreConditions(ObjectNode command, AggregateModel model) {
        return FutureUtils.sequentially(preConditions, preCondition -> preCondition.check(command, model));
    }

    public void handle(ObjectNode command, AggregateModel model) {
        JsonNode payload = extractPayload(command);
        handler.handle(payload, model);
    }

    public static final class Builder {
        private final String name;
        private final List<PreCondition> preConditions = new ArrayList<>();
        private int version;
        private String payload;
        private String description;
        private Boolean existing;
        private CommandValidator validator;
        private CommandHandlerFunction handler;

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

        public Builder existing(@Nullable Boolean existing) {
            this.existing = existing;
            return this;
        }

        public Builder validator(@Nullable CommandValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder preCondition(PreCondition preCondition) {
            this.preConditions.add(preCondition);
            return this;
        }

        public Builder handler(CommandHandlerFunction handler) {
            this.handler = handler;
            return this;
        }

        public CommandDefinition build() {
            return new CommandDefinition(this);
        }
    }
}
