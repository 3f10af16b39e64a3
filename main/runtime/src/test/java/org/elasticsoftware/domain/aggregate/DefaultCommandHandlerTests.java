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
import org.elasticsoftware.domain.commands.CommandDefinition;
import org.elasticsoftware.domain.commands.CommandValidationException;
import org.elasticsoftware.domain.definitions.DefinitionNotFoundException;
import org.elasticsoftware.domain.events.EventDefinition;
import org.elasticsoftware.domain.json.JsonNodes;
import org.elasticsoftware.domain.mapping.CommandFieldMapping;
import org.elasticsoftware.domain.mapping.EventFieldMapping;
import org.elasticsoftware.domain.mapping.FieldMappings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.elasticsoftware.domain.aggregate.CommandPipelineTests.failureOf;
import static org.elasticsoftware.domain.aggregate.wallet.WalletCommands.*;
import static org.junit.jupiter.api.Assertions.*;

class DefaultCommandHandlerTests {
    private AggregateDefinition wallet;

    @BeforeEach
    void setUp() {
        wallet = Wallet.definition();
    }

    @Test
    void testValidCommandIsHandled() throws Exception {
        AggregateModel model = wallet.create("wallet-1");

        wallet.dispatch(model, createWallet("wallet-1", "EUR")).get(5, TimeUnit.SECONDS);

        assertEquals(1, model.getRevision());
        assertEquals(1, model.getUncommittedEvents().size());
    }

    @Test
    void testInvalidPayloadIsRejectedBeforeHandling() {
        AggregateModel model = wallet.create("wallet-1");
        ObjectNode command = createWallet("wallet-1", "EUR");
        ((ObjectNode) command.get("payload")).put("owner", "someone");

        Throwable cause = failureOf(wallet.dispatch(model, command));

        CommandValidationException exception = assertInstanceOf(CommandValidationException.class, cause);
        assertEquals(1, exception.getViolations().size());
        assertTrue(exception.getViolations().get(0).contains("owner"));
        assertEquals(0, model.getRevision());
    }

    @Test
    void testUnknownCommandIsRejected() {
        Throwable cause = failureOf(wallet.dispatch(wallet.create("wallet-1"), command("closeWallet", "wallet-1", JsonNodes.newObject())));

        assertInstanceOf(DefinitionNotFoundException.class, cause);
    }

    @Test
    void testCreateOnExistingAggregateIsRejected() throws Exception {
        AggregateModel model = wallet.create("wallet-1");
        wallet.dispatch(model, createWallet("wallet-1", "EUR")).get(5, TimeUnit.SECONDS);

        Throwable cause = failureOf(wallet.dispatch(model, createWallet("wallet-1", "EUR")));

        AggregateExistenceException exception = assertInstanceOf(AggregateExistenceException.class, cause);
        assertFalse(exception.isExpectedExisting());
        assertEquals("wallet-1", exception.getAggregateId());
        assertEquals(Wallet.NAME, exception.getAggregateName());
    }

    @Test
    void testCommandOnMissingAggregateIsRejected() {
        Throwable cause = failureOf(wallet.dispatch(wallet.create("wallet-1"), creditWallet("wallet-1", "EUR", "1")));

        AggregateExistenceException exception = assertInstanceOf(AggregateExistenceException.class, cause);
        assertTrue(exception.isExpectedExisting());
    }

    @Test
    void testRevisionMismatchIsRejected() throws Exception {
        AggregateModel model = wallet.create("wallet-1");
        wallet.dispatch(model, createWallet("wallet-1", "EUR")).get(5, TimeUnit.SECONDS);
        ObjectNode stale = creditWallet("wallet-1", "EUR", "1");
        stale.put("revision", 0);

        Throwable cause = failureOf(wallet.dispatch(model, stale));

        AggregateConcurrencyException exception = assertInstanceOf(AggregateConcurrencyException.class, cause);
        assertEquals(0, exception.getExpectedRevision());
        assertEquals(1, exception.getActualRevision());

        ObjectNode current = creditWallet("wallet-1", "EUR", "1");
        current.put("revision", 1);
        assertDoesNotThrow(() -> wallet.dispatch(model, current).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testRevisionCheckCanBeSwitchedOff() throws Exception {
        AggregateDefinition lenient = Wallet.register(Wallet.builder()
                .fieldMappings(new FieldMappings(CommandFieldMapping.builder().revision(null).build(), EventFieldMapping.defaults()))
                .build());
        AggregateModel model = lenient.create("wallet-1");
        ObjectNode command = createWallet("wallet-1", "EUR");
        command.put("revision", 42);

        lenient.dispatch(model, command).get(5, TimeUnit.SECONDS);

        assertEquals(1, model.getRevision());
    }

    @Test
    void testDestroyedAggregateRejectsCommands() throws Exception {
        wallet.addEvent(EventDefinition.builder("walletClosed").handler((payload, model) -> model.destroy()).build())
                .addCommand(CommandDefinition.builder("closeWallet")
                        .existing(true)
                        .handler((payload, model) -> model.apply("walletClosed"))
                        .build());
        AggregateModel model = wallet.create("wallet-1");
        wallet.dispatch(model, createWallet("wallet-1", "EUR")).get(5, TimeUnit.SECONDS);
        wallet.dispatch(model, command("closeWallet", "wallet-1", JsonNodes.newObject())).get(5, TimeUnit.SECONDS);
        assertTrue(model.isDestroyed());

        Throwable cause = failureOf(wallet.dispatch(model, creditWallet("wallet-1", "EUR", "1")));

        AggregateDestroyedException exception = assertInstanceOf(AggregateDestroyedException.class, cause);
        assertEquals(2, exception.getRevision());
    }

    @Test
    void testUnboundHandlerFails() {
        DefaultCommandHandler handler = new DefaultCommandHandler();

        Throwable cause = failureOf(handler.handle(wallet.create("wallet-1"), createWallet("wallet-1", "EUR")));

        assertInstanceOf(IllegalStateException.class, cause);
        assertEquals(DefaultCommandHandler.NAME, handler.getName());
        assertEquals(0, handler.getVersion());
    }
}
