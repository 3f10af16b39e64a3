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
import com.fasterxml.jackson.databind.node.TextNode;
import org.elasticsoftware.domain.commands.CommandDefinition;
import org.elasticsoftware.domain.json.FieldPath;
import org.elasticsoftware.domain.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handles one command against one model: preconditions, the command handler, id assignment for the
 * emitted events and business rules, ending in either a commit or a rollback to the state the model
 * was in before. Instances are used once.
 */
final class CommandPipeline {
    private static final Logger log = LoggerFactory.getLogger(CommandPipeline.class);

    enum HandlingPhase {
        IDLE,
        PRECONDITIONS_RUNNING,
        HANDLING,
        FINALIZING,
        COMMITTED,
        REJECTED,
        ROLLED_BACK
    }

    private final AggregateDefinition aggregate;
    private final AggregateModel model;
    private final ObjectNode command;
    private final CommandDefinition commandDefinition;
    private volatile HandlingPhase phase = HandlingPhase.IDLE;

    CommandPipeline(AggregateDefinition aggregate,
                    AggregateModel model,
                    ObjectNode command,
                    CommandDefinition commandDefinition) {
        this.aggregate = aggregate;
        this.model = model;
        this.command = command;
        this.commandDefinition = commandDefinition;
    }

    CompletableFuture<Void> run() {
        if (phase != HandlingPhase.IDLE) {
            throw new IllegalStateException("CommandPipeline can only be run once");
        }
        // nothing but the event sourcing handlers may write to the model from here on
        model.enterPhase(AggregateModel.Phase.LOCKED);
        transition(HandlingPhase.PRECONDITIONS_RUNNING);
        CompletableFuture<Void> result = new CompletableFuture<>();
        aggregate.checkPreConditions(command, model).whenComplete((ignored, throwable) -> {
            if (throwable != null) {
                transition(HandlingPhase.REJECTED);
                log.debug("Command {} on {} {} rejected by precondition: {}",
                        commandDefinition.getName(), aggregate.getName(), model.getId(), throwable.getMessage());
                result.completeExceptionally(FutureUtils.unwrap(throwable));
            } else {
                try {
                    execute(result);
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            }
        });
        return result;
    }

    HandlingPhase getPhase() {
        return phase;
    }

    private void execute(CompletableFuture<Void> result) {
        AggregateModel previous = model.copy();
        transition(HandlingPhase.HANDLING);
        log.debug("Handling command {} (version {}) on {} {}",
                commandDefinition.getName(), commandDefinition.getVersion(), aggregate.getName(), model.getId());
        model.openApplyCapability(new CommandEventApplier(aggregate, model, command));
        try {
            commandDefinition.handle(command, model);
        } catch (Throwable t) {
            // business code may throw errors or undeclared checked exceptions
            rollback(previous, t, result);
            return;
        } finally {
            model.revokeApplyCapability();
        }
        transition(HandlingPhase.FINALIZING);
        List<ObjectNode> events = List.copyOf(model.getUncommittedEvents());
        assignEventIds(events)
                .thenCompose(ignored -> aggregate.checkBusinessRules(model, previous, events, command))
                .whenComplete((ignored, throwable) -> {
                    try {
                        if (throwable != null) {
                            rollback(previous, FutureUtils.unwrap(throwable), result);
                        } else {
                            transition(HandlingPhase.COMMITTED);
                            log.debug("Command {} on {} {} committed with {} events, now at revision {}",
                                    commandDefinition.getName(), aggregate.getName(), model.getId(), events.size(), model.getRevision());
                            result.complete(null);
                        }
                    } catch (Throwable t) {
                        result.completeExceptionally(t);
                    }
                });
    }

    /**
     * Generates ids for events that were emitted without one. Generations run concurrently and the
     * first failure fails the whole batch.
     */
    private CompletableFuture<Void> assignEventIds(List<ObjectNode> events) {
        FieldPath idPath = aggregate.getFieldMappings().event().id();
        List<CompletableFuture<Void>> generations = new ArrayList<>();
        for (ObjectNode event : events) {
            if (idPath.exists(event)) {
                continue;
            }
            generations.add(aggregate.generateId().thenAccept(id -> idPath.put(event, TextNode.valueOf(id))));
        }
        if (!generations.isEmpty()) {
            log.trace("Generating {} event ids for command {} on {}", generations.size(), commandDefinition.getName(), model.getId());
        }
        return FutureUtils.allOrFirstFailure(generations);
    }

    private void rollback(AggregateModel previous, Throwable cause, CompletableFuture<Void> result) {
        model.reset(previous.toJSON());
        model.setRevision(previous.getRevision());
        model.clearUncommittedEvents();
        model.enterPhase(AggregateModel.Phase.LOCKED);
        transition(HandlingPhase.ROLLED_BACK);
        log.warn("Rolled back command {} on {} {} to revision {}: {}",
                commandDefinition.getName(), aggregate.getName(), model.getId(), previous.getRevision(), cause.getMessage());
        result.completeExceptionally(cause);
    }

    private void transition(HandlingPhase next) {
        log.trace("{} {}: {} -> {}", aggregate.getName(), model.getId(), phase, next);
        phase = next;
    }
}
