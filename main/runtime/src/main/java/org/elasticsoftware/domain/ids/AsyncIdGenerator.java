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

package org.elasticsoftware.domain.ids;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Produces identifiers for events that were emitted without one. Implementations may do I/O, for
 * instance to reserve ids from a sequence.
 */
@FunctionalInterface
public interface AsyncIdGenerator {
    CompletionStage<String> generate();

    static AsyncIdGenerator of(IdGenerator generator) {
        return () -> {
            try {
                return CompletableFuture.completedFuture(generator.generate());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }
}
