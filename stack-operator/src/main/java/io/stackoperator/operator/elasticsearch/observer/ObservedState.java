/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.observer;

/**
 * What was observed about a running Elasticsearch cluster. The cluster health is null when it could not be observed.
 *
 * @param clusterHealth     Cluster health or null
 */
public record ObservedState(ClusterHealth clusterHealth) {
    private static final ObservedState EMPTY = new ObservedState(null);

    /**
     * @return  Observed state without any observation
     */
    public static ObservedState empty() {
        return EMPTY;
    }
}
