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
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.DomainException;
import org.elasticsoftware.domain.commands.CommandDefinition;
import org.elasticsoftware.domain.commands.CommandValidationException;
import org.elasticsoftware.domain.definitions.DefinitionNotFoundException;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.events.EventDefinition;
import org.elasticsoftware.domain.ids.AsyncIdGenerator;
import org.elasticsoftware.domain.ids.IdGenerator;
import org.elasticsoftware.domain.ids.UuidIdGenerator;
import org.elasticsoftware.domain.json.FieldPath;
import org.elasticsoftware.domain.json.JsonNodes;
import org.elasticsoftware.domain.mapping.FieldMappings;
import org.elasticsoftware.domain.rules.BusinessRule;
import org.elasticsoftware.domain.rules.PreCondition;
import org.elasticsoftware.domain.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * An aggregate: the registries of its commands, events, preconditions, business rules and command
 * handlers, together with the machinery to hydrate an {@link AggregateModel} from history and to
 * handle commands against it.
 *
 * <p>Definitions are registered at bootstrap, before the first command is handled.
 */
public final class AggregateDefinition {
    private static final Logger log = LoggerFactory.getLogger(AggregateDefinition.class);
    private final String name;
    private final int version;
    private final String contextName;
    private final String defaultCommandPayload;
    private final String defaultEventPayload;
    private final String defaultPreConditionPayload;
    private final FieldMappings fieldMappings;
    private final AggregateOptions options;
    private final AsyncIdGenerator idGenerator;
    private final ObjectNode modelInitValues;
    private final DefinitionRegistry registry = new DefinitionRegistry();
    private final SnapshotPolicy snapshotPolicy;
    private final DefaultCommandHandler defaultCommandHandler;

    private AggregateDefinition(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new InvalidDefinitionException("Please pass a valid name for the aggregate");
        }
        if (builder.version < 0) {
            throw new InvalidDefinitionException("Version of aggregate " + builder.name + " must not be negative but was " + builder.version);
        }
        this.name = builder.name;
        this.version = builder.version;
        this.contextName = builder.contextName;
        this.defaultCommandPayload = builder.defaultCommandPayload;
        this.defaultEventPayload = builder.defaultEventPayload;
        this.defaultPreConditionPayload = builder.defaultPreConditionPayload;
        this.fieldMappings = builder.fieldMappings;
        this.options = builder.options;
        this.idGenerator = builder.idGenerator;
        this.modelInitValues = builder.modelInitValues;
        this.snapshotPolicy = new SnapshotPolicy(options);
        this.defaultCommandHandler = new DefaultCommandHandler();
        this.defaultCommandHandler.useAggregate(this);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    @Nullable
    public String getContextName() {
        return contextName;
    }

    public FieldMappings getFieldMappings() {
        return fieldMappings;
    }

    public AggregateOptions getOptions() {
        return options;
    }

    public AggregateDefinition addCommand(CommandDefinition command) {
        if (command != null) {
            command.usePayloadIfUnset(defaultCommandPayload);
        }
        if (registry.addCommand(command)) {
            log.debug("Registered command {} (version {}) on aggregate {}", command.getName(), command.getVersion(), name);
        }
        return this;
    }

    public AggregateDefinition addEvent(EventDefinition event) {
        if (event != null) {
            event.usePayloadIfUnset(defaultEventPayload);
        }
        if (registry.addEvent(event)) {
            log.debug("Registered event {} (version {}) on aggregate {}", event.getName(), event.getVersion(), name);
        }
        return this;
    }

    public AggregateDefinition addBusinessRule(BusinessRule businessRule) {
        registry.addBusinessRule(businessRule);
        return this;
    }

    public AggregateDefinition addPreCondition(PreCondition preCondition) {
        if (preCondition != null) {
            preCondition.usePayloadIfUnset(defaultPreConditionPayload);
        }
        registry.addPreCondition(preCondition);
        return this;
    }

    public AggregateDefinition addCommandHandler(CommandHandler commandHandler) {
        if (registry.addCommandHandler(commandHandler)) {
            commandHandler.useAggregate(this);
        }
        return this;
    }

    @Nullable
    public CommandDefinition getCommand(String name) {
        return getCommand(name, 0);
    }

    @Nullable
    public CommandDefinition getCommand(String name, int version) {
        return registry.getCommand(name, version);
    }

    public List<CommandDefinition> getCommandsByName(String name) {
        return registry.getCommandsByName(name);
    }

    @Nullable
    public EventDefinition getEvent(String name) {
        return getEvent(name, 0);
    }

    @Nullable
    public EventDefinition getEvent(String name, int version) {
        return registry.getEvent(name, version);
    }

    public CommandHandler getCommandHandler(String name) {
        return getCommandHandler(name, 0);
    }

    /**
     * @return the handler registered for the command, or the default command handler
     */
    public CommandHandler getCommandHandler(String name, int version) {
        CommandHandler commandHandler = registry.getCommandHandler(name, version);
        return commandHandler != null ? commandHandler : defaultCommandHandler;
    }

    public List<CommandDefinition> getCommands() {
        return registry.getCommands();
    }

    public List<EventDefinition> getEvents() {
        return registry.getEvents();
    }

    public List<BusinessRule> getBusinessRules() {
        return registry.getBusinessRules();
    }

    public List<PreCondition> getPreConditions() {
        return registry.getPreConditions();
    }

    public List<CommandHandler> getCommandHandlers() {
        return registry.getCommandHandlers();
    }

    /**
     * Registers how snapshots taken under {@code fromVersion} are brought into a model of the current version.
     */
    public AggregateDefinition defineSnapshotConversion(int fromVersion, SnapshotConversionFunction conversion) {
        snapshotPolicy.defineConversion(fromVersion, conversion);
        return this;
    }

    public AggregateDefinition defineSnapshotNeed(SnapshotNeedFunction needFunction) {
        snapshotPolicy.defineNeed(needFunction);
        return this;
    }

    public boolean isSnapshotNeeded(long loadingTime, List<ObjectNode> events, ObjectNode modelData) {
        return snapshotPolicy.isSnapshotNeeded(loadingTime, events, modelData);
    }

    /**
     * @return a new, locked model with the configured init values
     */
    public AggregateModel create(String id) {
        return new AggregateModel(id, modelInitValues);
    }

    public void validateCommand(ObjectNode command) throws CommandValidationException {
        resolveCommand(command).validate(command);
    }

    /**
     * Runs the preconditions of the aggregate that apply to the command, then those of the command itself.
     */
    public CompletableFuture<Void> checkPreConditions(ObjectNode command, AggregateModel model) {
        String commandName;
        try {
            commandName = readCommandName(command);
        } catch (DomainException e) {
            return CompletableFuture.failedFuture(e);
        }
        List<PreCondition> applicable = registry.getPreConditions().stream()
                .filter(preCondition -> preCondition.appliesTo(commandName))
                .toList();
        if (applicable.isEmpty()) {
            log.trace("No aggregate preconditions for {} on {}", commandName, name);
        }
        return FutureUtils.unwrapping(FutureUtils.sequentially(applicable, preCondition -> preCondition.check(command, model))
                .thenCompose(ignored -> FutureUtils.invoke(() -> resolveCommand(command).checkPreConditions(command, model))));
    }

    public CompletableFuture<Void> checkBusinessRules(AggregateModel changed,
                                                      AggregateModel previous,
                                                      List<ObjectNode> events,
                                                      ObjectNode command) {
        return FutureUtils.sequentially(registry.getBusinessRules(),
                businessRule -> businessRule.check(changed, previous, events, command));
    }

    /**
     * Handles the command against the model. On success the model holds the new state and the
     * uncommitted events; on failure it is back in the state it was in before.
     */
    public CompletableFuture<Void> handle(AggregateModel model, ObjectNode command) {
        CommandDefinition commandDefinition;
        try {
            commandDefinition = resolveCommand(command);
        } catch (DomainException e) {
            return CompletableFuture.failedFuture(e);
        }
        return new CommandPipeline(this, model, command, commandDefinition).run();
    }

    /**
     * Hands the command to the command handler registered for it, or to the default command handler.
     */
    public CompletableFuture<Void> dispatch(AggregateModel model, ObjectNode command) {
        CommandHandler commandHandler;
        try {
            commandHandler = getCommandHandler(readCommandName(command), readCommandVersion(command));
        } catch (DomainException e) {
            return CompletableFuture.failedFuture(e);
        }
        return FutureUtils.unwrapping(FutureUtils.invoke(() -> commandHandler.handle(model, command)));
    }

    /**
     * Replays a single event on the model. The revision is left untouched.
     */
    public void apply(ObjectNode event, AggregateModel model) {
        applyEvent(resolveEvent(event), event, model);
    }

    /**
     * Replays the events on the model in the given order. The revision is left untouched.
     */
    public void apply(@Nullable List<ObjectNode> events, AggregateModel model) {
        if (events == null) {
            return;
        }
        for (ObjectNode event : events) {
            apply(event, model);
        }
    }

    /**
     * Hydrates the model from an optional snapshot followed by the events stored after it.
     *
     * @param loadingTime the time in milliseconds it took the caller to load the history
     * @return {@code true} if the caller should store a new snapshot
     */
    public boolean loadFromHistory(AggregateModel model,
                                   @Nullable Snapshot snapshot,
                                   @Nullable List<ObjectNode> events,
                                   long loadingTime) {
        boolean snapshotNeeded = false;
        AggregateModel.Phase previousPhase = model.enterPhase(AggregateModel.Phase.MUTABLE);
        try {
            if (snapshot != null) {
                if (snapshot.version() == version) {
                    log.debug("Loading snapshot of {} {} at revision {}", name, model.getId(), snapshot.revision());
                    model.set(snapshot.data());
                } else {
                    snapshotPolicy.convert(snapshot, model);
                    snapshotNeeded = true;
                }
                model.setRevision(snapshot.revision());
            }
            if (events != null && !events.isEmpty()) {
                log.debug("Replaying {} events on {} {}", events.size(), name, model.getId());
                long maxRevision = model.getRevision();
                for (ObjectNode event : events) {
                    JsonNode revision = fieldMappings.event().revision().get(event);
                    if (revision != null && revision.canConvertToLong() && revision.asLong() > maxRevision) {
                        maxRevision = revision.asLong();
                    }
                }
                apply(events, model);
                model.setRevision(maxRevision);
                if (!snapshotNeeded) {
                    snapshotNeeded = snapshotPolicy.isSnapshotNeeded(loadingTime, List.copyOf(events), model.toJSON());
                }
            }
        } finally {
            model.enterPhase(previousPhase);
        }
        return snapshotNeeded;
    }

    public CompletableFuture<String> generateId() {
        return FutureUtils.unwrapping(FutureUtils.invoke(idGenerator::generate).thenApply(id -> {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Id generator of aggregate " + name + " returned no id");
            }
            return id;
        }));
    }

    CommandDefinition resolveCommand(ObjectNode command) {
        String commandName = readCommandName(command);
        int commandVersion = readCommandVersion(command);
        CommandDefinition commandDefinition = registry.getCommand(commandName, commandVersion);
        if (commandDefinition == null) {
            throw DefinitionNotFoundException.notFound("command", commandName, commandVersion, name);
        }
        return commandDefinition;
    }

    EventDefinition resolveEvent(ObjectNode event) {
        FieldPath namePath = fieldMappings.event().name();
        String eventName = namePath.getText(event);
        if (eventName == null || eventName.isEmpty()) {
            throw DefinitionNotFoundException.missingName("event", namePath.path(), name);
        }
        int eventVersion = readVersion(event, fieldMappings.event().version(), "event");
        EventDefinition eventDefinition = registry.getEvent(eventName, eventVersion);
        if (eventDefinition == null) {
            throw DefinitionNotFoundException.notFound("event", eventName, eventVersion, name);
        }
        return eventDefinition;
    }

    int getLatestEventVersion(String eventName) {
        return registry.getLatestEventVersion(eventName);
    }

    /**
     * Applies the event with the model opened for mutation, restoring the phase afterwards.
     */
    void applyEvent(EventDefinition eventDefinition, ObjectNode event, AggregateModel model) {
        AggregateModel.Phase previousPhase = model.enterPhase(AggregateModel.Phase.MUTABLE);
        try {
            eventDefinition.apply(event, model);
        } finally {
            model.enterPhase(previousPhase);
        }
    }

    String readCommandName(ObjectNode command) {
        FieldPath namePath = fieldMappings.command().name();
        String commandName = namePath.getText(command);
        if (commandName == null || commandName.isEmpty()) {
            throw DefinitionNotFoundException.missingName("command", namePath.path(), name);
        }
        return commandName;
    }

    int readCommandVersion(ObjectNode command) {
        return readVersion(command, fieldMappings.command().version(), "command");
    }

    private int readVersion(ObjectNode source, @Nullable FieldPath versionPath, String kind) {
        if (versionPath == null) {
            return 0;
        }
        JsonNode value = versionPath.get(source);
        if (value == null) {
            return 0;
        }
        // 1.0 is the same version as 1
        if (value.isNumber() && value.canConvertToInt() && value.doubleValue() == value.intValue()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim()).intValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new InvalidDefinitionException("Version of " + kind + " in " + versionPath + " is not a whole number: " + value, e);
            }
        }
        throw new InvalidDefinitionException("Version of " + kind + " in " + versionPath + " is not a whole number: " + value);
    }

    @Override
    public String toString() {
        return "AggregateDefinition[" + name + ", v" + version + "]";
    }

    public static final class Builder {
        private final String name;
        private int version;
        private String contextName;
        private String defaultCommandPayload = "";
        private String defaultEventPayload = "";
        private String defaultPreConditionPayload = "";
        private FieldMappings fieldMappings = FieldMappings.defaults();
        private AggregateOptions options = AggregateOptions.defaults();
        private AsyncIdGenerator idGenerator = AsyncIdGenerator.of(UuidIdGenerator.INSTANCE);
        private ObjectNode modelInitValues = JsonNodes.newObject();

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder contextName(@Nullable String contextName) {
            this.contextName = contextName;
            return this;
        }

        public Builder defaultCommandPayload(String defaultCommandPayload) {
            this.defaultCommandPayload = requirePath(defaultCommandPayload, "defaultCommandPayload");
            return this;
        }

        public Builder defaultEventPayload(String defaultEventPayload) {
            this.defaultEventPayload = requirePath(defaultEventPayload, "defaultEventPayload");
            return this;
        }

        public Builder defaultPreConditionPayload(String defaultPreConditionPayload) {
            this.defaultPreConditionPayload = requirePath(defaultPreConditionPayload, "defaultPreConditionPayload");
            return this;
        }

        public Builder fieldMappings(FieldMappings fieldMappings) {
            if (fieldMappings == null) {
                throw new InvalidDefinitionException("Please pass in valid field mappings");
            }
            this.fieldMappings = fieldMappings;
            return this;
        }

        public Builder options(AggregateOptions options) {
            if (options == null) {
                throw new InvalidDefinitionException("Please pass in valid aggregate options");
            }
            this.options = options;
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            if (idGenerator == null) {
                throw new InvalidDefinitionException("Please pass in a valid id generator");
            }
            this.idGenerator = AsyncIdGenerator.of(idGenerator);
            return this;
        }

        public Builder asyncIdGenerator(AsyncIdGenerator idGenerator) {
            if (idGenerator == null) {
                throw new InvalidDefinitionException("Please pass in a valid id generator");
            }
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder modelInitValues(@Nullable ObjectNode modelInitValues) {
            this.modelInitValues = modelInitValues != null ? modelInitValues.deepCopy() : JsonNodes.newObject();
            return this;
        }

        public AggregateDefinition build() {
            return new AggregateDefinition(this);
        }

        private static String requirePath(String path, String property) {
            if (path == null) {
                throw new InvalidDefinitionException(property + " must not be null");
            }
            try {
                FieldPath.of(path);
            } catch (IllegalArgumentException e) {
                throw new InvalidDefinitionException("Invalid path for " + property + ": '" + path + "'", e);
            }
            return path;
        }
    }
}
