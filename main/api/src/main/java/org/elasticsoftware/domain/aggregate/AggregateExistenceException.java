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

import org.elasticsoftware.domain.DomainException;

public class AggregateExistenceException extends DomainException {
    private final boolean expectedExisting;

    public AggregateExistenceException(String aggregateName, String aggregateId, String commandName, boolean expectedExisting) {
        super(expectedExisting
                        ? "Command " + commandName + " requires an existing aggregate, but " + aggregateId + " does not exist!"
                        : "Command " + commandName + " creates a new aggregate, but " + aggregateId + " already exists!",
                aggregateName,
                aggregateId);
        this.expectedExisting = expectedExisting;
    }

    public boolean isExpectedExisting() {
        return expectedExisting;
    }
}
