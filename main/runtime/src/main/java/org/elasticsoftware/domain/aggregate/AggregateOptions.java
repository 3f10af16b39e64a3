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

import jakarta.annotation.Nullable;
import org.elasticsoftware.domain.definitions.InvalidDefinitionException;

import java.util.Properties;

/**
 * Tuning of the default snapshot policy.
 *
 * @param snapshotThreshold   number of replayed events from which a new snapshot is due
 * @param snapshotThresholdMs when set, loading time in milliseconds from which a new snapshot is due;
 *                            takes precedence over the event count
 */
public record AggregateOptions(int snapshotThreshold, @Nullable Long snapshotThresholdMs) {
    public static final int DEFAULT_SNAPSHOT_THRESHOLD = 100;
    public static final String SNAPSHOT_THRESHOLD_PROPERTY = "aggregate.snapshot.threshold";
    public static final String SNAPSHOT_THRESHOLD_MS_PROPERTY = "aggregate.snapshot.threshold-ms";

    public AggregateOptions {
        if (snapshotThreshold <= 0) {
            throw new InvalidDefinitionException("snapshotThreshold must be positive but was " + snapshotThreshold);
        }
        if (snapshotThresholdMs != null && snapshotThresholdMs <= 0) {
            throw new InvalidDefinitionException("snapshotThresholdMs must be positive but was " + snapshotThresholdMs);
        }
    }

    public static AggregateOptions defaults() {
        return new AggregateOptions(DEFAULT_SNAPSHOT_THRESHOLD, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AggregateOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String threshold = properties.getProperty(SNAPSHOT_THRESHOLD_PROPERTY);
        if (threshold != null && !threshold.isBlank()) {
            builder.snapshotThreshold((int) parse(SNAPSHOT_THRESHOLD_PROPERTY, threshold));
        }
        String thresholdMs = properties.getProperty(SNAPSHOT_THRESHOLD_MS_PROPERTY);
        if (thresholdMs != null && !thresholdMs.isBlank()) {
            builder.snapshotThresholdMs(parse(SNAPSHOT_THRESHOLD_MS_PROPERTY, thresholdMs));
        }
        return builder.build();
    }

    private static long parse(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidDefinitionException("Property " + key + " must be numeric but was '" + value + "'", e);
        }
    }

    public static final class Builder {
        private int snapshotThreshold = DEFAULT_SNAPSHOT_THRESHOLD;
        private Long snapshotThresholdMs;

        private Builder() {
        }

        public Builder snapshotThreshold(int snapshotThreshold) {
            this.snapshotThreshold = snapshotThreshold;
            return this;
        }

        public Builder snapshotThresholdMs(@Nullable Long snapshotThresholdMs) {
            this.snapshotThresholdMs = snapshotThresholdMs;
            return this;
        }

        public AggregateOptions build() {
            return new AggregateOptions(snapshotThreshold, snapshotThresholdMs);
        }
    }
}
