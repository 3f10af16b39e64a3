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

package org.elasticsoftware.domain.aggregate.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.elasticsoftware.domain.aggregate.AggregateDefinition;
import org.elasticsoftware.domain.aggregate.AggregateModel;
import org.elasticsoftware.domain.commands.CommandDefinition;
import org.elasticsoftware.domain.commands.JsonSchemaCommandValidator;
import org.elasticsoftware.domain.events.EventDefinition;
import org.elasticsoftware.domain.json.JsonNodes;
import org.elasticsoftware.domain.rules.BusinessRule;
import org.elasticsoftware.domain.rules.BusinessRuleViolationException;
import org.elasticsoftware.domain.rules.PreCondition;

import java.math.BigDecimal;

/**
 * A wallet holding a balance in a single currency.
 */
public final class Wallet {
    public static final String NAME = "Wallet";
    public static final String CONTEXT = "banking";

    private Wallet() {
    }

    public static AggregateDefinition.Builder builder() {
        ObjectNode initValues = JsonNodes.newObject();
        initValues.put("balance", BigDecimal.ZERO);
        return AggregateDefinition.builder(NAME)
                .version(1)
                .contextName(CONTEXT)
                .defaultCommandPayload("payload")
                .defaultEventPayload("payload")
                .defaultPreConditionPayload("payload")
                .modelInitValues(initValues);
    }

    public static AggregateDefinition definition() {
        return register(builder().build());
    }

    public static AggregateDefinition register(AggregateDefinition wallet) {
        return wallet
                .addCommand(CommandDefinition.builder("createWallet")
                        .existing(false)
                        .validator(JsonSchemaCommandValidator.forClass(CreateWalletCommand.class))
                        .handler((payload, model) -> model.apply("walletCreated", payload))
                        .build())
                .addCommand(CommandDefinition.builder("creditWallet")
                        .existing(true)
                        .handler((payload, model) -> model.apply("walletCredited", payload))
                        .build())
                .addCommand(CommandDefinition.builder("debitWallet")
                        .existing(true)
                        .handler(Wallet::debit)
                        .build())
                .addEvent(EventDefinition.builder("walletCreated")
                        .handler((payload, model) -> model.set("currency", payload.get("currency").asText()))
                        .build())
                .addEvent(EventDefinition.builder("walletCredited")
                        .handler((payload, model) -> model.set("balance", balance(model).add(amount(payload))))
                        .build())
                .addEvent(EventDefinition.builder("walletDebited")
                        .handler((payload, model) -> model.set("balance", balance(model).subtract(amount(payload))))
                        .build())
                .addEvent(EventDefinition.builder("feeCharged")
                        .handler((payload, model) -> model.set("balance", balance(model).subtract(amount(payload))))
                        .build())
                .addPreCondition(PreCondition.builder("currencyMatches")
                        .commands("creditWallet", "debitWallet")
                        .check((payload, model) -> {
                            String currency = payload.path("currency").asText();
                            if (!currency.equals(model.getText("currency"))) {
                                throw new BusinessRuleViolationException("Wallet holds " + model.getText("currency") + ", not " + currency);
                            }
                        })
                        .build())
                .addBusinessRule(BusinessRule.builder("balanceNotNegative")
                        .check((changed, previous, events, command) -> {
                            if (balance(changed).signum() < 0) {
                                throw new BusinessRuleViolationException("Insufficient funds", balance(previous));
                            }
                        })
                        .build());
    }

    private static void debit(JsonNode payload, AggregateModel model) {
        model.apply("walletDebited", payload);
        if (payload.has("fee")) {
            ObjectNode fee = JsonNodes.newObject();
            fee.put("amount", payload.get("fee").decimalValue());
            model.apply("feeCharged", fee);
        }
    }

    public static BigDecimal balance(AggregateModel model) {
        BigDecimal balance = model.getDecimal("balance");
        return balance != null ? balance : BigDecimal.ZERO;
    }

    private static BigDecimal amount(JsonNode payload) {
        return payload.get("amount").decimalValue();
    }
}
