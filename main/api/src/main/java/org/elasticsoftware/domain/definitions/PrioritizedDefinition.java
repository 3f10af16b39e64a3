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

import java.util.Comparator;

public abstract class PrioritizedDefinition extends Definition {
    /**
     * Ascending priority. {@code List.sort} is stable, so equal priorities keep their registration order.
     */
    public static final Comparator<PrioritizedDefinition> BY_PRIORITY =
            Comparator.comparingInt(PrioritizedDefinition::getPriority);

    private final int priority;

    protected PrioritizedDefinition(String name,
                                    int version,
                                    @Nullable String payload,
                                    @Nullable String description,
                                    int priority) {
        super(name, version, payload, description);
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
