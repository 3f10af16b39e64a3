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

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.aggregate.AggregateModel;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.definitions.PrioritizedDefinition;
import org.elasticsoftware.domain.util.FutureUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * An invariant checked after a command handler ran, with both the changed and the previous state at
 * hand. A failing rule makes the runtime roll the command back.
 */
public final class BusinessRule extends PrioritizedDefinition {
    private final AsyncBusinessRuleFunction function;

    private BusinessRule(Builder builder) {
        super(builder.name, 0, null, builder.description, builder.priority);
        if (builder.function == null) {
            throw new InvalidDefinitionException("BusinessRule " + builder.name + " has no check function");
        }
        this.function = builder.function;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public CompletableFuture<Void> check(AggregateModel changed,
                                         AggregateModel previous,
                                         List<ObjectNode> events,
                                         ObjectNode command) {
        return FutureUtils.invoke(() -> function.check(changed, previous, events, command));
    }

    public static final class Builder {
        private final String name;
        private String description;
        private int priority;
        private AsyncBusinessRuleFunction function;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder check(BusinessRuleFunction function) {
            this.function = (changed, previous, events, command) -> {
                try {
                    function.check(changed, previous, events, command);
                    return CompletableFuture.completedFuture(null);
                } catch (Exception e) {
                    return CompletableFuture.failedFuture(e);
                }
            };
            return this;
        }

        public Builder checkAsync(AsyncBusinessRuleFunction function) {
            this.function = function;
            return this;
        }

        public BusinessRule build() {
            return new BusinessRule(this);
        }
    }
}
