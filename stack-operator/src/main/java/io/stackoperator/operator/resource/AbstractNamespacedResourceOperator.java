/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.util.List;
import java.util.Map;

/**
 * Asynchronous access to namespaced Kubernetes resources. The blocking fabric8 calls are run on the Vert.x worker pool.
 *
 * @param <T>   Type of the resource
 * @param <L>   Type of the resource list
 * @param <R>   Type of the fabric8 resource handle
 */
public abstract class AbstractNamespacedResourceOperator<T extends HasMetadata, L extends KubernetesResourceList<T>, R extends Resource<T>> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractNamespacedResourceOperator.class);

    /**
     * Namespace value selecting all namespaces
     */
    public static final String ANY_NAMESPACE = "*";

    protected final Vertx vertx;
    protected final KubernetesClient client;
    protected final String resourceKind;

    /**
     * Constructor
     *
     * @param vertx         Vert.x instance
     * @param client        Kubernetes client
     * @param resourceKind  Kind of the resource, used in log messages
     */
    protected AbstractNamespacedResourceOperator(Vertx vertx, KubernetesClient client, String resourceKind) {
        this.vertx = vertx;
        this.client = client;
        this.resourceKind = resourceKind;
    }

    /**
     * @return  The fabric8 operation for this resource type
     */
    protected abstract MixedOperation<T, L, R> operation();

    /**
     * Gets a resource
     *
     * @param namespace     Namespace of the resource
     * @param name          Name of the resource
     *
     * @return  The resource or null if it does not exist
     */
    public T get(String namespace, String name) {
        return operation().inNamespace(namespace).withName(name).get();
    }

    /**
     * Gets a resource asynchronously
     *
     * @param namespace     Namespace of the resource
     * @param name          Name of the resource
     *
     * @return  Future with the resource or with null if it does not exist
     */
    public Future<T> getAsync(String namespace, String name) {
        return vertx.executeBlocking(() -> get(namespace, name), false);
    }

    /**
     * Lists the resources in a namespace
     *
     * @param namespace     Namespace or {@link #ANY_NAMESPACE}
     *
     * @return  Future with the resources
     */
    public Future<List<T>> listAsync(String namespace) {
        return vertx.executeBlocking(() -> {
            if (ANY_NAMESPACE.equals(namespace)) {
                return operation().inAnyNamespace().list().getItems();
            } else {
                return operation().inNamespace(namespace).list().getItems();
            }
        }, false);
    }

    /**
     * Lists the resources matching a label selector in a namespace
     *
     * @param namespace     Namespace
     * @param selector      Labels the resources must have
     *
     * @return  Future with the resources
     */
    public Future<List<T>> listAsync(String namespace, Map<String, String> selector) {
        return vertx.executeBlocking(() -> operation().inNamespace(namespace).withLabels(selector).list().getItems(), false);
    }

    /**
     * Starts an informer delivering the changes of the resources to the handler
     *
     * @param namespace     Namespace or {@link #ANY_NAMESPACE}
     * @param handler       Handler of the changes
     *
     * @return  The running informer
     */
    public SharedIndexInformer<T> inform(String namespace, ResourceEventHandler<T> handler) {
        if (ANY_NAMESPACE.equals(namespace)) {
            return operation().inAnyNamespace().inform(handler);
        } else {
            return operation().inNamespace(namespace).inform(handler);
        }
    }

    /**
     * Replaces a resource. The update uses the resource version of the given resource for optimistic locking.
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          The desired resource
     *
     * @return  Future with the updated resource
     */
    public Future<T> updateAsync(Reconciliation reconciliation, T resource) {
        String namespace = resource.getMetadata().getNamespace();
        String name = resource.getMetadata().getName();

        return vertx.<T>executeBlocking(() -> operation().inNamespace(namespace).resource(resource).update(), false)
                .onSuccess(updated -> LOGGER.debugCr(reconciliation, "{} {}/{} has been updated", resourceKind, namespace, name))
                .onFailure(error -> LOGGER.debugCr(reconciliation, "Failed to update {} {}/{}", resourceKind, namespace, name, error));
    }
}
