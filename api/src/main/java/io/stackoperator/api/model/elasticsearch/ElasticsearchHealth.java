/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.elasticsearch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health of an Elasticsearch cluster as reported by the cluster health API. The declaration order is the order used
 * to decide whether the health got worse: {@code red < yellow < unknown < green}.
 */
public enum ElasticsearchHealth {
    RED("red"),
    YELLOW("yellow"),
    UNKNOWN("unknown"),
    GREEN("green");

    private final String value;

    ElasticsearchHealth(String value) {
        this.value = value;
    }

    /**
     * Maps the status string returned by the cluster health API. Values which are not known map to UNKNOWN.
     *
     * @param value     Health status string
     *
     * @return  The matching health or UNKNOWN
     */
    @JsonCreator
    public static ElasticsearchHealth forValue(String value) {
        if (value != null) {
            for (ElasticsearchHealth health : values()) {
                if (health.value.equalsIgnoreCase(value)) {
                    return health;
                }
            }
        }

        return UNKNOWN;
    }

    /**
     * @param other     Health to compare with
     *
     * @return  True if this health is worse than the other one
     */
    public boolean lessThan(ElasticsearchHealth other) {
        return other != null && this.ordinal() < other.ordinal();
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
