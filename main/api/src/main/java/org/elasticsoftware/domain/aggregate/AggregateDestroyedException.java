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

public class AggregateDestroyedException extends DomainException {
    private final long revision;

    public AggregateDestroyedException(String aggregateName, String aggregateId, long revision) {
        super("Aggregate " + aggregateName + " with id " + aggregateId + " has already been destroyed!",
                aggregateName,
                aggregateId);
        this.revision = revision;
    }

    public long getRevision() {
        return revision;
    }
}
