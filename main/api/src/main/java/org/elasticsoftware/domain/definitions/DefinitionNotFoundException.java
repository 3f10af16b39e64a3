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

package org.elasticsoftware.domain.definitions;

import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.DomainException;

public class DefinitionNotFoundException extends DomainException {
    private final String definitionType;
    private final String definitionName;
    private final int definitionVersion;

    public DefinitionNotFoundException(String message,
                                       String definitionType,
                                       @Nullable String definitionName,
                                       int definitionVersion,
                                       @Nullable String aggregateName) {
        super(message, aggregateName, null);
        this.definitionType = definitionType;
        this.definitionName = definitionName;
        this.definitionVersion = definitionVersion;
    }

    public static DefinitionNotFoundException missingName(String definitionType, String path, String aggregateName) {
        return new DefinitionNotFoundException(definitionType + " has no " + definitionType + " name in " + path,
                definitionType,
                null,
                0,
                aggregateName);
    }

    public static DefinitionNotFoundException notFound(String definitionType, String name, int version, String aggregateName) {
        String label = Character.toUpperCase(definitionType.charAt(0)) + definitionType.substring(1);
        return new DefinitionNotFoundException(label + " \"" + name + "\" (version " + version + ") not found!",
                definitionType,
                name,
                version,
                aggregateName);
    }

    public String getDefinitionType() {
        return definitionType;
    }

    @Nullable
    public String getDefinitionName() {
        return definitionName;
    }

    public int getDefinitionVersion() {
        return definitionVersion;
    }
}
