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
import jakarta.validation.constraints.NotNull;

/**
 * A materialized aggregate state.
 *
 * @param version  the aggregate definition version the data was produced under
 * @param revision the position in the event stream the data corresponds to
 * @param data     the field bag of the aggregate
 */
public record Snapshot(int version, long revision, @NotNull ObjectNode data) {
    public Snapshot {
        if (data == null) {
            throw new IllegalArgumentException("Snapshot data must not be null");
        }
    }

    public static Snapshot of(int version, AggregateModel model) {
        return new Snapshot(version, model.getRevision(), model.toJSON());
    }
}
