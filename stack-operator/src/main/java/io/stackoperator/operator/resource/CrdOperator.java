/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.resource;

import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.vertx.core.Vertx;

/**
 * Operator for custom resources
 *
 * @param <T>   Type of the custom resource
 * @param <L>   Type of the custom resource list
 */
public class CrdOperator<T extends CustomResource<?, ?>, L extends KubernetesResourceList<T>> extends AbstractNamespacedResourceOperator<T, L, Resource<T>> {
    private final Class<T> cls;
    private final Class<L> listCls;

    /**
     * Constructor
     *
     * @param vertx         Vert.x instance
     * @param client        Kubernetes client
     * @param cls           Class of the custom resource
     * @param listCls       Class of the custom resource list
     * @param kind          Kind of the custom resource
     */
    public CrdOperator(Vertx vertx, KubernetesClient client, Class<T> cls, Class<L> listCls, String kind) {
        super(vertx, client, kind);
        this.cls = cls;
        this.listCls = listCls;
    }

    @Override
    protected MixedOperation<T, L, Resource<T>> operation() {
        return client.resources(cls, listCls);
    }
}
