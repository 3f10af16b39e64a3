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
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Version bridging for snapshots and the decision whether a new snapshot should be taken.
 */
final class SnapshotPolicy {
    private static final Logger log = LoggerFactory.getLogger(SnapshotPolicy.class);
    private final Map<Integer, SnapshotConversionFunction> conversions = new ConcurrentHashMap<>();
    private final AggregateOptions options;
    private volatile SnapshotNeedFunction needFunction;

    SnapshotPolicy(AggregateOptions options) {
        this.options = options;
        this.needFunction = this::isSnapshotNeededByDefault;
    }

    void defineConversion(int fromVersion, SnapshotConversionFunction conversion) {
        if (fromVersion < 0) {
            throw new InvalidDefinitionException("Please pass in a valid snapshot version, got " + fromVersion);
        }
        if (conversion == null) {
            throw new InvalidDefinitionException("Please pass in a snapshot conversion function");
        }
        conversions.put(fromVersion, conversion);
    }

    void defineNeed(SnapshotNeedFunction needFunction) {
        if (needFunction == null) {
            throw new InvalidDefinitionException("Please pass in a snapshot need function");
        }
        this.needFunction = needFunction;
    }


    void convert(Snapshot snapshot, AggregateModel model) {
        SnapshotConversionFunction conversion = conversions.get(snapshot.version());
        if (conversion == null) {
            throw new InvalidDefinitionException("No snapshot conversion defined for version " + snapshot.version() + "!");
        }
        log.debug("Converting snapshot of {} from version {}", model.getId(), snapshot.version());
        conversion.convert(snapshot.data().deepCopy(), model);
    }

    boolean isSnapshotNeeded(long loadingTime, List<ObjectNode> events, ObjectNode modelData) {
        return needFunction.isSnapshotNeeded(loadingTime, events, modelData);
    }

    private boolean isSnapshotNeededByDefault(long loadingTime, List<ObjectNode> events, ObjectNode modelData) {
        if (options.snapshotThresholdMs() != null) {
            return loadingTime >= options.snapshotThresholdMs();
        }
        return events.size() >= options.snapshotThreshold();
    }
}
