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
import org.elasticsoftware.domain.aggregate.wallet.Wallet;
import org.elasticsoftware.domain.definitions.DefinitionNotFoundException;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.json.JsonNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LoadFromHistoryTests {
    private AggregateDefinition wallet;

    @BeforeEach
    void setUp() {
        wallet = Wallet.definition();
    }

    @Test
    void testSnapshotAtCurrentVersionWithoutEventsNeedsNoSnapshot() {
        AggregateModel model = wallet.create("wallet-1");

        boolean snapshotNeeded = wallet.loadFromHistory(model, new Snapshot(1, 7, walletData("EUR", "42")), List.of(), 12);

        assertFalse(snapshotNeeded);
        assertEquals(7, model.getRevision());
        assertEquals("EUR", model.getText("currency"));
        assertEquals(0, new BigDecimal("42").compareTo(Wallet.balance(model)));
        assertEquals(AggregateModel.Phase.LOCKED, model.getPhase());
    }

    @Test
    void testManyTrailingEventsNeedASnapshot() {
        AggregateModel model = wallet.create("wallet-1");

        boolean snapshotNeeded = wallet.loadFromHistory(model, new Snapshot(1, 7, walletData("EUR", "0")), credits(8, 150), 12);

        assertTrue(snapshotNeeded);
        assertEquals(157, model.getRevision());
        assertEquals(0, new BigDecimal("150").compareTo(Wallet.balance(model)));
    }

    @Test
    void testFewTrailingEventsNeedNoSnapshot() {
        AggregateModel model = wallet.create("wallet-1");

        assertFalse(wallet.loadFromHistory(model, null, history(99), 0));
        assertEquals(99, model.getRevision());
    }

    @Test
    void testThresholdCountsOnlyTheLoadedEvents() {
        AggregateDefinition strict = Wallet.register(Wallet.builder()
                .options(AggregateOptions.builder().snapshotThreshold(3).build())
                .build());

        assertTrue(strict.loadFromHistory(strict.create("wallet-1"), null, history(3), 0));
        assertFalse(strict.loadFromHistory(strict.create("wallet-1"), null, history(2), 0));
    }

    @Test
    void testLoadingTimeThresholdTakesPrecedence() {
        AggregateDefinition timed = Wallet.register(Wallet.builder()
                .options(AggregateOptions.builder().snapshotThresholdMs(200L).build())
                .build());

        assertFalse(timed.loadFromHistory(timed.create("wallet-1"), null, history(500), 199));
        assertTrue(timed.loadFromHistory(timed.create("wallet-1"), null, history(2), 200));
    }

    @Test
    void testCustomSnapshotNeed() {
        AtomicReference<ObjectNode> seenData = new AtomicReference<>();
        List<Integer> seenSizes = new ArrayList<>();
        wallet.defineSnapshotNeed((loadingTime, events, modelData) -> {
            seenData.set(modelData);
            seenSizes.add(events.size());
            return loadingTime > 1000;
        });

        assertFalse(wallet.loadFromHistory(wallet.create("wallet-1"), null, history(300), 10));
        assertTrue(wallet.loadFromHistory(wallet.create("wallet-1"), null, history(1), 5000));
        assertEquals(List.of(300, 1), seenSizes);
        assertEquals("EUR", seenData.get().get("currency").asText());
    }

    @Test
    void testOlderSnapshotIsConvertedAndFlagsANewSnapshot() {
        wallet.defineSnapshotConversion(0, (snapshotData, model) -> {
            model.set("currency", snapshotData.get("ccy").asText());
            model.set("balance", new BigDecimal(snapshotData.get("amount").asText()));
        });
        ObjectNode oldData = JsonNodes.newObject();
        oldData.put("ccy", "EUR");
        oldData.put("amount", "42");
        AggregateModel converted = wallet.create("wallet-1");
        AggregateModel direct = wallet.create("wallet-1");

        assertTrue(wallet.loadFromHistory(converted, new Snapshot(0, 7, oldData), List.of(), 0));
        assertFalse(wallet.loadFromHistory(direct, new Snapshot(1, 7, walletData("EUR", "42")), List.of(), 0));

        assertEquals(direct.getText("currency"), converted.getText("currency"));
        assertEquals(0, Wallet.balance(direct).compareTo(Wallet.balance(converted)));
        assertEquals(direct.getRevision(), converted.getRevision());

        wallet.apply(credit(8, "8"), converted);
        wallet.apply(credit(8, "8"), direct);
        assertEquals(0, new BigDecimal("50").compareTo(Wallet.balance(converted)));
        assertEquals(0, Wallet.balance(direct).compareTo(Wallet.balance(converted)));
    }

    @Test
    void testConvertedSnapshotStaysFlaggedAfterTrailingEvents() {
        wallet.defineSnapshotConversion(0, (snapshotData, model) -> model.set("currency", "EUR"));
        wallet.defineSnapshotNeed((loadingTime, events, modelData) -> fail("policy must not be consulted"));

        assertTrue(wallet.loadFromHistory(wallet.create("wallet-1"), new Snapshot(0, 1, JsonNodes.newObject()), credits(2, 1), 0));
    }

    @Test
    void testMissingSnapshotConversionIsAConfigurationError() {
        AggregateModel model = wallet.create("wallet-1");

        InvalidDefinitionException exception = assertThrows(InvalidDefinitionException.class,
                () -> wallet.loadFromHistory(model, new Snapshot(0, 7, JsonNodes.newObject()), List.of(), 0));

        assertEquals("No snapshot conversion defined for version 0!", exception.getMessage());
        assertEquals(AggregateModel.Phase.LOCKED, model.getPhase());
    }

    @Test
    void testReplayIsIdempotent() {
        List<ObjectNode> events = history(25);
        AggregateModel first = wallet.create("wallet-1");
        AggregateModel second = wallet.create("wallet-1");

        wallet.loadFromHistory(first, null, events, 0);
        wallet.loadFromHistory(second, null, events, 0);

        assertEquals(first.toJSON(), second.toJSON());
        assertEquals(first.getRevision(), second.getRevision());
    }

    @Test
    void testRevisionIsTheHighestRevisionInTheBatch() {
        AggregateModel model = wallet.create("wallet-1");
        List<ObjectNode> events = new ArrayList<>(history(3));
        events.add(credit(12, "1"));
        events.add(credit(5, "1"));

        wallet.loadFromHistory(model, null, events, 0);

        assertEquals(12, model.getRevision());
    }

    @Test
    void testEventsWithoutRevisionNeverMoveTheRevisionBack() {
        AggregateModel model = wallet.create("wallet-1");
        ObjectNode withoutRevision = credit(1, "1");
        withoutRevision.remove("revision");

        wallet.loadFromHistory(model, new Snapshot(1, 9, walletData("EUR", "0")), List.of(withoutRevision), 0);

        assertEquals(9, model.getRevision());
        assertEquals(0, BigDecimal.ONE.compareTo(Wallet.balance(model)));
    }

    @Test
    void testReplayDoesNotChangeTheRevision() {
        AggregateModel model = wallet.create("wallet-1");
        model.setRevision(3);

        wallet.apply(history(2), model);

        assertEquals(3, model.getRevision());
        assertEquals("EUR", model.getText("currency"));
        assertTrue(model.getUncommittedEvents().isEmpty());
        assertThrows(AggregateModelLockedException.class, () -> model.set("currency", "USD"));
    }

    @Test
    void testReplayOfUnknownOrNamelessEventsFails() {
        AggregateModel model = wallet.create("wallet-1");
        ObjectNode unknown = credit(1, "1");
        unknown.put("name", "walletClosed");
        ObjectNode nameless = credit(1, "1");
        nameless.remove("name");

        assertThrows(DefinitionNotFoundException.class, () -> wallet.apply(unknown, model));
        DefinitionNotFoundException exception = assertThrows(DefinitionNotFoundException.class, () -> wallet.apply(nameless, model));
        assertEquals("event has no event name in name", exception.getMessage());
        assertDoesNotThrow(() -> wallet.apply((List<ObjectNode>) null, model));
    }

    @Test
    void testReplayHonoursTheEventVersion() {
        AggregateModel model = wallet.create("wallet-1");
        ObjectNode future = credit(1, "1");
        future.put("version", 4);

        DefinitionNotFoundException exception = assertThrows(DefinitionNotFoundException.class, () -> wallet.apply(future, model));

        assertEquals(4, exception.getDefinitionVersion());
    }

    @Test
    void testReplayAcceptsWholeNumberVersions() {
        AggregateModel model = wallet.create("wallet-1");
        List<ObjectNode> events = history(3);
        events.get(1).put("version", 0.0);
        events.get(2).put("version", "0");

        wallet.loadFromHistory(model, null, events, 0);

        assertEquals(3, model.getRevision());
        assertEquals(0, new BigDecimal("2").compareTo(model.getDecimal("balance")));
    }

    private static ObjectNode walletData(String currency, String balance) {
        ObjectNode data = JsonNodes.newObject();
        data.put("id", "wallet-1");
        data.put("currency", currency);
        data.put("balance", new BigDecimal(balance));
        return data;
    }

    /**
     * A created event followed by credits of 1, {@code size} events in total.
     */
    static List<ObjectNode> history(int size) {
        List<ObjectNode> events = new ArrayList<>();
        ObjectNode created = event("walletCreated", 1);
        ((ObjectNode) created.get("payload")).put("currency", "EUR");
        events.add(created);
        events.addAll(credits(2, size - 1));
        return events;
    }

    static List<ObjectNode> credits(long firstRevision, int count) {
        List<ObjectNode> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(credit(firstRevision + i, "1"));
        }
        return events;
    }

    static ObjectNode credit(long revision, String amount) {
        ObjectNode event = event("walletCredited", revision);
        ((ObjectNode) event.get("payload")).put("currency", "EUR").put("amount", new BigDecimal(amount));
        return event;
    }

    private static ObjectNode event(String name, long revision) {
        ObjectNode event = JsonNodes.newObject();
        event.put("id", "event-" + revision);
        event.put("name", name);
        event.put("revision", revision);
        event.put("version", 0);
        event.putObject("aggregate").put("id", "wallet-1");
        event.putObject("payload");
        return event;
    }
}
