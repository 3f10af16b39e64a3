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

package org.elasticsoftware.domain.util;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

public final class FutureUtils {
    private FutureUtils() {
    }

    /**
     * Runs {@code step} for each item, one after the other. The chain stops at the first failure and
     * the returned future fails with it.
     */
    public static <T> CompletableFuture<Void> sequentially(List<T> items, Function<T, ? extends CompletionStage<Void>> step) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (T item : items) {
            chain = chain.thenCompose(ignored -> invoke(() -> step.apply(item)));
        }
        return unwrapping(chain);
    }

    /**
     * Completes when all futures did, or fails as soon as the first one fails. Outstanding futures are
     * cancelled on failure.
     */
    public static CompletableFuture<Void> allOrFirstFailure(List<? extends CompletableFuture<?>> futures) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (futures.isEmpty()) {
            result.complete(null);
            return result;
        }
        AtomicInteger remaining = new AtomicInteger(futures.size());
        for (CompletableFuture<?> future : futures) {
            future.whenComplete((value, throwable) -> {
                if (throwable != null) {
                    if (result.completeExceptionally(unwrap(throwable))) {
                        futures.forEach(sibling -> sibling.cancel(false));
                    }
                } else if (remaining.decrementAndGet() == 0) {
                    result.complete(null);
                }
            });
        }
        return result;
    }

    /**
     * Invokes a supplier of a stage, turning a synchronous throw into a failed future.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> supplier) {
        try {
            CompletionStage<T> stage = supplier.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Asynchronous function returned null instead of a CompletionStage"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns a future that fails with the underlying cause instead of a {@link CompletionException}.
     */
    public static <T> CompletableFuture<T> unwrapping(CompletableFuture<T> future) {
        CompletableFuture<T> result = new CompletableFuture<>();
        future.whenComplete((value, throwable) -> {
            if (throwable != null) {
                result.completeExceptionally(unwrap(throwable));
            } else {
                result.complete(value);
            }
        });
        return result;
    }
}
