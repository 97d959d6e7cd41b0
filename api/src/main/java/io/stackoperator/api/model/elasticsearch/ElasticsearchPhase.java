/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.elasticsearch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Orchestration phase of an Elasticsearch cluster
 */
public enum ElasticsearchPhase {
    APPLYING_CHANGES("ApplyingChanges"),
    MIGRATING_DATA("MigratingData"),
    READY("Ready"),
    NODE_SHUTDOWN_STALLED("Stalled"),
    INVALID("Invalid");

    private final String value;

    ElasticsearchPhase(String value) {
        this.value = value;
    }

    @JsonCreator
    public static ElasticsearchPhase forValue(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }

        for (ElasticsearchPhase phase : values()) {
            if (phase.value.equals(value)) {
                return phase;
            }
        }

        throw new IllegalArgumentException("Unknown Elasticsearch phase " + value);
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
