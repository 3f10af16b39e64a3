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

import java.util.List;

@FunctionalInterface
public interface SnapshotNeedFunction {
    /**
     * @param loadingTime the time in milliseconds it took to load the history
     * @param events      the events replayed on top of the snapshot
     * @param modelData   the state after the replay
     */
    boolean isSnapshotNeeded(long loadingTime, List<ObjectNode> events, ObjectNode modelData);
}
