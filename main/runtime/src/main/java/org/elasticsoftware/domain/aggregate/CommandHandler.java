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

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;

/**
 * Takes over dispatching of one command (by name and version) from the {@link DefaultCommandHandler},
 * for instance to add checks that need I/O before the aggregate handles the command.
 */
public interface CommandHandler {
    String getName();

    default int getVersion() {
        return 0;
    }

    /**
     * Called when the handler is registered with an aggregate.
     */
    default void useAggregate(AggregateDefinition aggregate) {
    }

    CompletableFuture<Void> handle(AggregateModel model, ObjectNode command);
}
