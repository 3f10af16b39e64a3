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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.elasticsoftware.domain.json.FieldPath;

public record FieldMappings(@NotNull CommandFieldMapping command, @NotNull EventFieldMapping event) {
    public FieldMappings {
        if (command == null || event == null) {
            throw new InvalidDefinitionException("Both a command and an event field mapping are required");
        }
    }

    public static FieldMappings defaults() {
        return new FieldMappings(CommandFieldMapping.defaults(), EventFieldMapping.defaults());
    }

    static void require(String kind, String attribute, FieldPath path) {
        if (path == null) {
            throw new InvalidDefinitionException("The " + kind + " field mapping needs a path for " + attribute);
        }
    }

    // only the payload may point at the whole object
    static void requireField(String kind, String attribute, FieldPath path) {
        require(kind, attribute, path);
        if (path.isRoot()) {
            throw new InvalidDefinitionException("The " + kind + " field mapping for " + attribute + " must not be empty");
        }
    }
}
