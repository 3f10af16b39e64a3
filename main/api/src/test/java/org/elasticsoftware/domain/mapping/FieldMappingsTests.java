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

package org.elasticsoftware.domain.mapping;

import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.json.FieldPath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldMappingsTests {

    @Test
    void testDefaults() {
        FieldMappings mappings = FieldMappings.defaults();

        assertEquals(FieldPath.of("aggregate.id"), mappings.command().aggregateId());
        assertEquals(FieldPath.of("context.name"), mappings.command().context());
        assertEquals(FieldPath.of("revision"), mappings.command().revision());
        assertEquals(FieldPath.of("correlationId"), mappings.event().correlationId());
        assertEquals(FieldPath.of("aggregate.name"), mappings.event().aggregate());
        assertEquals(FieldPath.of("meta"), mappings.event().meta());
    }

    @Test
    void testOptionalMappingsCanBeSwitchedOff() {
        CommandFieldMapping command = CommandFieldMapping.builder()
                .context(null)
                .aggregate(null)
                .version(null)
                .meta(null)
                .revision(null)
                .build();
        EventFieldMapping event = EventFieldMapping.builder()
                .id("head.id")
                .version(null)
                .build();

        assertNull(command.context());
        assertNull(command.revision());
        assertNull(event.version());
        assertEquals("head.id", event.id().path());
    }

    @Test
    void testRequiredMappings() {
        assertThrows(InvalidDefinitionException.class, () -> CommandFieldMapping.builder().name(null).build());
        assertThrows(InvalidDefinitionException.class, () -> CommandFieldMapping.builder().id("").build());
        assertThrows(InvalidDefinitionException.class, () -> EventFieldMapping.builder().revision(null).build());
        assertThrows(InvalidDefinitionException.class, () -> EventFieldMapping.builder().correlationId("a..b").build());
        assertThrows(InvalidDefinitionException.class, () -> new FieldMappings(null, EventFieldMapping.defaults()));
        assertDoesNotThrow(() -> EventFieldMapping.builder().payload("").build());
    }
}
