/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.stackoperator.operator.elasticsearch.observer.ObservedState;

/**
 * Step of an Elasticsearch reconciliation which decides the phase of the cluster and records it in the state
 */
@FunctionalInterface
public interface PhaseDriver {
    /**
     * @param state             State of the reconciliation
     * @param resourcesState    Resources of the cluster
     * @param observedState     Observed cluster state
     */
    void drive(ReconcileState state, ResourcesState resourcesState, ObservedState observedState);
}
