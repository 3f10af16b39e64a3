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
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.elasticsoftware.domain.DomainException;
import org.elasticsoftware.domain.commands.CommandDefinition;
import org.elasticsoftware.domain.json.FieldPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Used for every command that has no {@link CommandHandler} of its own. Validates the command, checks
 * it against the lifecycle and revision of the aggregate and lets the aggregate handle it.
 */
public class DefaultCommandHandler implements CommandHandler {
    public static final String NAME = "*";
    private static final Logger log = LoggerFactory.getLogger(DefaultCommandHandler.class);
    private AggregateDefinition aggregate;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void useAggregate(AggregateDefinition aggregate) {
        this.aggregate = aggregate;
    }

    @Override
    public CompletableFuture<Void> handle(AggregateModel model, ObjectNode command) {
        if (aggregate == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("DefaultCommandHandler is not bound to an aggregate"));
        }
        try {
            CommandDefinition commandDefinition = aggregate.resolveCommand(command);
            commandDefinition.validate(command);
            verifyAggregate(model, command, commandDefinition);
        } catch (DomainException e) {
            log.debug("Command rejected before handling on {} {}: {}", aggregate.getName(), model.getId(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return aggregate.handle(model, command);
    }

    private void verifyAggregate(AggregateModel model, ObjectNode command, CommandDefinition commandDefinition) {
        if (model.isDestroyed()) {
            throw new AggregateDestroyedException(aggregate.getName(), model.getId(), model.getRevision());
        }
        FieldPath revisionPath = aggregate.getFieldMappings().command().revision();
        if (revisionPath != null) {
            JsonNode expected = revisionPath.get(command);
            if (expected != null && expected.canConvertToLong() && expected.asLong() != model.getRevision()) {
                throw new AggregateConcurrencyException(aggregate.getName(), model.getId(), expected.asLong(), model.getRevision());
            }
        }
        Boolean existing = commandDefinition.getExisting();
        if (existing != null && existing != (model.getRevision() > 0)) {
            throw new AggregateExistenceException(aggregate.getName(), model.getId(), commandDefinition.getName(), existing);
        }
    }
}
