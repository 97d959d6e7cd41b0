/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.observer;

/**
 * Health of an Elasticsearch cluster as reported by its cluster health API
 *
 * @param status    The health status (red, yellow or green)
 */
public record ClusterHealth(String status) {
}
