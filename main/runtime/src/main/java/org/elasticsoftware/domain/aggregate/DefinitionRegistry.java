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

import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.commands.CommandDefinition;
import org.elasticsoftware.domain.definitions.Definition;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.definitions.PrioritizedDefinition;
import org.elasticsoftware.domain.events.EventDefinition;
import org.elasticsoftware.domain.rules.BusinessRule;
import org.elasticsoftware.domain.rules.PreCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * The definitions an aggregate is made of. Registration is expected during bootstrap only; readers
 * see immutable copies and never block.
 */
final class DefinitionRegistry {
    private volatile List<CommandDefinition> commands = List.of();
    private volatile List<EventDefinition> events = List.of();
    private volatile List<BusinessRule> businessRules = List.of();
    private volatile List<PreCondition> preConditions = List.of();
    private volatile List<CommandHandler> commandHandlers = List.of();

    synchronized boolean addCommand(CommandDefinition command) {
        requireNonNull(command, "command");
        if (containsReference(commands, command)) {
            return false;
        }
        commands = append(commands, command);
        return true;
    }

    synchronized boolean addEvent(EventDefinition event) {
        requireNonNull(event, "event");
        if (containsReference(events, event)) {
            return false;
        }
        events = append(events, event);
        return true;
    }

    synchronized boolean addBusinessRule(BusinessRule businessRule) {
        requireNonNull(businessRule, "businessRule");
        if (containsReference(businessRules, businessRule)) {
            return false;
        }
        businessRules = sortedByPriority(append(businessRules, businessRule));
        return true;
    }

    synchronized boolean addPreCondition(PreCondition preCondition) {
        requireNonNull(preCondition, "preCondition");
        if (containsReference(preConditions, preCondition)) {
            return false;
        }
        preConditions = sortedByPriority(append(preConditions, preCondition));
        return true;
    }

    synchronized boolean addCommandHandler(CommandHandler commandHandler) {
        requireNonNull(commandHandler, "commandHandler");
        if (containsReference(commandHandlers, commandHandler)) {
            return false;
        }
        commandHandlers = append(commandHandlers, commandHandler);
        return true;
    }

    @Nullable
    CommandDefinition getCommand(String name, int version) {
        return find(commands, matches(name, version));
    }

    @Nullable
    EventDefinition getEvent(String name, int version) {
        return find(events, matches(name, version));
    }

    /**
     * @return the highest version registered for events with the given name, 0 if there are none
     */
    int getLatestEventVersion(String name) {
        return events.stream()
                .filter(event -> event.getName().equals(name))
                .mapToInt(Definition::getVersion)
                .max()
                .orElse(0);
    }

    List<CommandDefinition> getCommandsByName(String name) {
        return commands.stream().filter(command -> command.getName().equals(name)).toList();
    }

    @Nullable
    CommandHandler getCommandHandler(String name, int version) {
        return find(commandHandlers, handler -> handler.getName().equals(name) && handler.getVersion() == version);
    }

    List<CommandDefinition> getCommands() {
        return commands;
    }

    List<EventDefinition> getEvents() {
        return events;
    }

    List<BusinessRule> getBusinessRules() {
        return businessRules;
    }

    List<PreCondition> getPreConditions() {
        return preConditions;
    }

    List<CommandHandler> getCommandHandlers() {
        return commandHandlers;
    }

    private static <T extends Definition> Predicate<T> matches(String name, int version) {
        return definition -> definition.getName().equals(name) && definition.getVersion() == version;
    }

    @Nullable
    private static <T> T find(List<T> definitions, Predicate<T> predicate) {
        for (T definition : definitions) {
            if (predicate.test(definition)) {
                return definition;
            }
        }
        return null;
    }

    private static boolean containsReference(List<?> definitions, Object candidate) {
        for (Object definition : definitions) {
            if (definition == candidate) {
                return true;
            }
        }
        return false;
    }

    private static <T> List<T> append(List<T> definitions, T definition) {
        List<T> updated = new ArrayList<>(definitions.size() + 1);
        updated.addAll(definitions);
        updated.add(definition);
        return List.copyOf(updated);
    }

    private static <T extends PrioritizedDefinition> List<T> sortedByPriority(List<T> definitions) {
        List<T> sorted = new ArrayList<>(definitions);
        sorted.sort(PrioritizedDefinition.BY_PRIORITY);
        return List.copyOf(sorted);
    }

    private static void requireNonNull(Object definition, String kind) {
        if (definition == null) {
            throw new InvalidDefinitionException("Please inject a valid " + kind + " object!");
        }
    }
}
