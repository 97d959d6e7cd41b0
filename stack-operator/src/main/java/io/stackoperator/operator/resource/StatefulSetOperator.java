/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.resource;

import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;
import io.vertx.core.Vertx;

/**
 * Operator for {@code StatefulSet}s
 */
public class StatefulSetOperator extends AbstractNamespacedResourceOperator<StatefulSet, StatefulSetList, RollableScalableResource<StatefulSet>> {
    /**
     * Constructor
     *
     * @param vertx     Vert.x instance
     * @param client    Kubernetes client
     */
    public StatefulSetOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, "StatefulSet");
    }

    @Override
    protected MixedOperation<StatefulSet, StatefulSetList, RollableScalableResource<StatefulSet>> operation() {
        return client.apps().statefulSets();
    }
}
