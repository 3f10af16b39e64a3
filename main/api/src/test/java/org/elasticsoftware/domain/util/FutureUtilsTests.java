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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class FutureUtilsTests {

    @Test
    void testSequentiallyRunsInOrder() throws Exception {
        List<Integer> seen = new ArrayList<>();

        FutureUtils.sequentially(List.of(1, 2, 3), item -> {
            seen.add(item);
            return CompletableFuture.completedFuture(null);
        }).get();

        assertEquals(List.of(1, 2, 3), seen);
    }

    @Test
    void testSequentiallyStopsAtFirstFailure() {
        List<Integer> seen = new ArrayList<>();

        CompletableFuture<Void> result = FutureUtils.sequentially(List.of(1, 2, 3), item -> {
            seen.add(item);
            if (item == 2) {
                throw new IllegalArgumentException("two");
            }
            return CompletableFuture.completedFuture(null);
        });

        ExecutionException exception = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(IllegalArgumentException.class, exception.getCause());
        assertEquals(List.of(1, 2), seen);
    }

    @Test
    void testSequentiallyWaitsForEachStep() throws Exception {
        CompletableFuture<Void> firstStep = new CompletableFuture<>();
        List<Integer> seen = new ArrayList<>();

        CompletableFuture<Void> result = FutureUtils.sequentially(List.of(1, 2), item -> {
            seen.add(item);
            return item == 1 ? firstStep : CompletableFuture.completedFuture(null);
        });

        assertEquals(List.of(1), seen);
        assertFalse(result.isDone());
        firstStep.complete(null);
        result.get();
        assertEquals(List.of(1, 2), seen);
    }

    @Test
    void testAllOrFirstFailure() throws Exception {
        FutureUtils.allOrFirstFailure(List.of()).get();

        CompletableFuture<String> slow = new CompletableFuture<>();
        CompletableFuture<String> failing = new CompletableFuture<>();
        CompletableFuture<Void> result = FutureUtils.allOrFirstFailure(List.of(slow, failing));
        assertFalse(result.isDone());

        failing.completeExceptionally(new CompletionException(new IllegalStateException("no id")));

        ExecutionException exception = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertTrue(slow.isCancelled());
    }

    @Test
    void testAllOrFirstFailureCompletesWhenAllDid() throws Exception {
        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();
        CompletableFuture<Void> result = FutureUtils.allOrFirstFailure(List.of(first, second));

        second.complete("b");
        assertFalse(result.isDone());
        first.complete("a");

        result.get();
    }

    @Test
    void testUnwrap() {
        IllegalStateException cause = new IllegalStateException();

        assertSame(cause, FutureUtils.unwrap(new CompletionException(new ExecutionException(cause))));
        assertSame(cause, FutureUtils.unwrap(cause));
    }
}
