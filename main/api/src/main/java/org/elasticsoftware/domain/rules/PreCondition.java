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

package org.elasticsoftware.domain.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.aggregate.AggregateModel;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.definitions.PrioritizedDefinition;
import org.elasticsoftware.domain.util.FutureUtils;

import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A check that runs before a command is handled. A failing precondition rejects the command before
 * any state was touched.
 */
public final class PreCondition extends PrioritizedDefinition {
    private final Set<String> commandNames;
    private final AsyncPreConditionFunction function;

    private PreCondition(Builder builder) {
        super(builder.name, builder.version, builder.payload, builder.description, builder.priority);
        if (builder.function == null) {
            throw new InvalidDefinitionException("PreCondition " + builder.name + " has no check function");
        }
        this.commandNames = builder.commandNames;
        this.function = builder.function;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @return the command names this precondition is restricted to, empty when it applies to all
     */
    public Set<String> getCommandNames() {
        return commandNames;
    }

    public boolean appliesTo(String commandName) {
        return commandNames.isEmpty() || commandNames.contains(commandName);
    }

    public CompletableFuture<Void> check(ObjectNode command, AggregateModel model) {
        JsonNode payload = extractPayload(command);
        return FutureUtils.invoke(() -> function.check(payload, model));
    }

    public static final class Builder {
        private final String name;
        private int version;
        private String payload;
        private String description;
        private int priority;
        private Set<String> commandNames = Set.of();
        private AsyncPreConditionFunction function;

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

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder commands(String... commandNames) {
            this.commandNames = Set.copyOf(Arrays.asList(commandNames));
            return this;
        }

        public Builder check(PreConditionFunction function) {
            this.function = (payload, model) -> {
                try {
                    function.check(payload, model);
                    return CompletableFuture.completedFuture(null);
                } catch (Exception e) {
                    return CompletableFuture.failedFuture(e);
                }
            };
            return this;
        }

        public Builder checkAsync(AsyncPreConditionFunction function) {
            this.function = function;
            return this;
        }

        public PreCondition build() {
            return new PreCondition(this);
        }
    }
}
