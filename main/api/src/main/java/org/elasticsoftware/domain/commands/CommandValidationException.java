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

package org.elasticsoftware.domain.commands;

import org.elasticsoftware.domain.DomainException;

import java.util.List;

public class CommandValidationException extends DomainException {
    private final String commandName;
    private final int commandVersion;
    private final List<String> violations;

    public CommandValidationException(String commandName, int commandVersion, List<String> violations) {
        this(commandName, commandVersion, violations, null);
    }

    public CommandValidationException(String commandName, int commandVersion, List<String> violations, Throwable cause) {
        super("Validation of command " + commandName + " (version " + commandVersion + ") failed: " + String.join(", ", violations), cause);
        this.commandName = commandName;
        this.commandVersion = commandVersion;
        this.violations = List.copyOf(violations);
    }

    public String getCommandName() {
        return commandName;
    }

    public int getCommandVersion() {
        return commandVersion;
    }

    public List<String> getViolations() {
        return violations;
    }
}
