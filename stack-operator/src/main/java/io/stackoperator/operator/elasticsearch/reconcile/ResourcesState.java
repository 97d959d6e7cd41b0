/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;

import java.util.List;

/**
 * Kubernetes resources of an Elasticsearch cluster as read at the start of a reconciliation
 *
 * @param currentPods   Pods which are not being deleted
 * @param allPods       All Pods of the cluster, including the terminating ones
 * @param statefulSets  StatefulSets of the node sets
 */
public record ResourcesState(List<Pod> currentPods, List<Pod> allPods, List<StatefulSet> statefulSets) {
    public ResourcesState {
        currentPods = currentPods != null ? List.copyOf(currentPods) : List.of();
        allPods = allPods != null ? List.copyOf(allPods) : List.of();
        statefulSets = statefulSets != null ? List.copyOf(statefulSets) : List.of();
    }
}
