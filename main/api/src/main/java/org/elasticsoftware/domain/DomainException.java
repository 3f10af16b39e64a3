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

package org.elasticsoftware.domain;

import jakarta.annotation.Nullable;

public abstract class DomainException extends RuntimeException {
    private final String aggregateName;
    private final String aggregateId;

    protected DomainException(String message) {
        this(message, null, null, null);
    }

    protected DomainException(String message, @Nullable Throwable cause) {
        this(message, null, null, cause);
    }

    protected DomainException(String message, @Nullable String aggregateName, @Nullable String aggregateId) {
        this(message, aggregateName, aggregateId, null);
    }

    protected DomainException(String message,
                              @Nullable String aggregateName,
                              @Nullable String aggregateId,
                              @Nullable Throwable cause) {
        super(message, cause);
        this.aggregateName = aggregateName;
        this.aggregateId = aggregateId;
    }

    @Nullable
    public String getAggregateName() {
        return aggregateName;
    }

    @Nullable
    public String getAggregateId() {
        return aggregateId;
    }
}
