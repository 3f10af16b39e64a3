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
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.json.FieldPath;
import org.elasticsoftware.domain.json.JsonNodes;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The working state of a single aggregate instance: identity, revision, the field bag and the events
 * produced by the command currently being handled.
 *
 * <p>Fields can only be changed while the model is {@link Phase#MUTABLE}. The phase is driven by the
 * aggregate runtime: it opens the model while events are applied (during hydration and while a
 * command emits events) and locks it everywhere else.
 */
public class AggregateModel {
    public enum Phase {
        LOCKED,
        MUTABLE
    }

    static final String ID_FIELD = "id";
    static final String DESTROYED_FIELD = "_destroyed";

    private final String id;
    private final List<ObjectNode> uncommittedEvents = new ArrayList<>();
    private ObjectNode data;
    private long revision;
    private Phase phase = Phase.LOCKED;
    private EventApplier eventApplier;

    public AggregateModel(String id) {
        this(id, null);
    }

    public AggregateModel(String id, @Nullable ObjectNode initialValues) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Please pass a valid string as id!");
        }
        this.id = id;
        this.data = initialValues != null ? initialValues.deepCopy() : JsonNodes.newObject();
        this.data.put(ID_FIELD, id);
    }

    public String getId() {
        return id;
    }

    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }

    public Phase getPhase() {
        return phase;
    }

    @Nullable
    public JsonNode get(String path) {
        return JsonNodes.copyOf(FieldPath.of(path).get(data));
    }

    @Nullable
    public String getText(String path) {
        return FieldPath.of(path).getText(data);
    }

    public long getLong(String path, long defaultValue) {
        JsonNode value = FieldPath.of(path).get(data);
        return value != null && value.isNumber() ? value.asLong() : defaultValue;
    }

    /**
     * @return the number at {@code path}, also when stored as text, or {@code null} if the field is
     * missing or holds no number
     */
    @Nullable
    public BigDecimal getDecimal(String path) {
        JsonNode value = FieldPath.of(path).get(data);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (!value.isTextual()) {
            return null;
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean has(String path) {
        return FieldPath.of(path).get(data) != null;
    }

    /**
     * Deep merges the given values into the field bag.
     */
    public void set(ObjectNode values) {
        ensureMutable();
        JsonNodes.deepMerge(data, values);
    }

    public void set(String path, JsonNode value) {
        ensureMutable();
        FieldPath.of(path).put(data, value.deepCopy());
    }

    public void set(String path, String value) {
        set(path, TextNode.valueOf(value));
    }

    public void set(String path, long value) {
        set(path, LongNode.valueOf(value));
    }

    public void set(String path, BigDecimal value) {
        set(path, DecimalNode.valueOf(value));
    }

    public void set(String path, boolean value) {
        set(path, BooleanNode.valueOf(value));
    }

    public void unset(String path) {
        ensureMutable();
        FieldPath.of(path).remove(data);
    }

    public void destroy() {
        set(DESTROYED_FIELD, true);
    }

    public boolean isDestroyed() {
        JsonNode destroyed = data.get(DESTROYED_FIELD);
        return destroyed != null && destroyed.asBoolean(false);
    }

    /**
     * Emits an event without payload for the command that is being handled.
     */
    public void apply(String eventName) {
        apply(eventName, null);
    }

    public void apply(String eventName, @Nullable JsonNode payload) {
        currentEventApplier().apply(eventName, payload);
    }

    public void apply(ObjectNode event) {
        currentEventApplier().apply(event);
    }

    public List<ObjectNode> getUncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public void clearUncommittedEvents() {
        uncommittedEvents.clear();
    }

    /**
     * @return a deep copy of the field bag
     */
    public ObjectNode toJSON() {
        return data.deepCopy();
    }

    void addUncommittedEvent(ObjectNode event) {
        uncommittedEvents.add(event);
    }

    void reset(ObjectNode values) {
        this.data = values.deepCopy();
        this.data.put(ID_FIELD, id);
    }

    /**
     * @return the phase the model was in before
     */
    Phase enterPhase(Phase next) {
        Phase previous = this.phase;
        this.phase = next;
        return previous;
    }

    void openApplyCapability(EventApplier eventApplier) {
        this.eventApplier = eventApplier;
    }

    void revokeApplyCapability() {
        this.eventApplier = null;
    }

    /**
     * Copy of identity, revision and fields; uncommitted events are not part of it.
     */
    AggregateModel copy() {
        AggregateModel copy = new AggregateModel(id, data);
        copy.setRevision(revision);
        return copy;
    }

    private EventApplier currentEventApplier() {
        if (eventApplier == null) {
            throw new AggregateModelLockedException("Events can only be applied while a command is being handled", id);
        }
        return eventApplier;
    }

    private void ensureMutable() {
        if (phase != Phase.MUTABLE) {
            throw new AggregateModelLockedException("You are not allowed to set a value in this step!", id);
        }
    }

    @Override
    public String toString() {
        return "AggregateModel[" + id + ", revision " + revision + "]";
    }
}
