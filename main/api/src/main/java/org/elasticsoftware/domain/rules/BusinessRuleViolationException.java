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

package org.elasticsoftware.domain.rules;

import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.DomainException;

/**
 * Raised by preconditions and business rules to reject a command.
 */
public class BusinessRuleViolationException extends DomainException {
    private final Object details;

    public BusinessRuleViolationException(String message) {
        this(message, null);
    }

    public BusinessRuleViolationException(String message, @Nullable Object details) {
        super(message);
        this.details = details;
    }

    @Nullable
    public Object getDetails() {
        return details;
    }
}
