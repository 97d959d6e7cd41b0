/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.stackoperator.api.model.esconfig.ElasticsearchConfigOperation;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.stackoperator.operator.esclient.ElasticsearchClient;
import io.stackoperator.operator.esclient.ElasticsearchResponse;
import io.stackoperator.operator.esclient.UnacceptableStatusException;
import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;

import java.util.List;

/**
 * Converges the settings of an Elasticsearch cluster to the declared operations. Every operation reads the current
 * value from the cluster, and replaces it with the declared body only when the current value does not already contain
 * it. Nothing is cached between operations or reconciliations.
 */
public class OperationReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(OperationReconciler.class);

    private final Reconciliation reconciliation;
    private final ElasticsearchClient client;
    private final long requestTimeoutMs;

    /**
     * Constructor
     *
     * @param reconciliation    Reconciliation marker
     * @param client            Client of the Elasticsearch cluster
     * @param requestTimeoutMs  Timeout of every request sent to the cluster
     */
    public OperationReconciler(Reconciliation reconciliation, ElasticsearchClient client, long requestTimeoutMs) {
        this.reconciliation = reconciliation;
        this.client = client;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Reconciles the operations one after the other in the given order. The first failed operation fails the
     * returned future and the remaining operations are not attempted.
     *
     * @param operations    Operations to reconcile
     *
     * @return  Future which completes when all operations are reconciled
     */
    public Future<Void> reconcile(List<ElasticsearchConfigOperation> operations) {
        Future<Void> chain = Future.succeededFuture();

        for (ElasticsearchConfigOperation operation : operations) {
            chain = chain.compose(i -> reconcileOperation(operation));
        }

        return chain;
    }

    /**
     * Reconciles a single operation
     *
     * @param operation     The operation
     *
     * @return  Future which completes when the operation is reconciled
     */
    public Future<Void> reconcileOperation(ElasticsearchConfigOperation operation) {
        return updateRequired(operation)
                .compose(required -> {
                    if (!required) {
                        return Future.succeededFuture();
                    }

                    LOGGER.debugCr(reconciliation, "Content of {} is different, sending PUT", operation.getUrl());
                    return client.request(HttpMethod.PUT, operation.getUrl(), operation.getBody(), requestTimeoutMs)
                            .compose(response -> {
                                if (LOGGER.isDebugEnabled()) {
                                    LOGGER.debugCr(reconciliation, "Response from PUT {}: status {} body {}", operation.getUrl(), response.statusCode(), response.body());
                                }

                                if (!response.isSuccess()) {
                                    LOGGER.warnCr(reconciliation, "Failed to update {}: status {}", operation.getUrl(), response.statusCode());
                                    return Future.failedFuture(new UnacceptableStatusException(HttpMethod.PUT, operation.getUrl(), response.statusCode()));
                                }

                                LOGGER.infoCr(reconciliation, "Updated {}", operation.getUrl());
                                return Future.succeededFuture();
                            });
                });
    }

    /**
     * Checks whether the declared body has to be written
     *
     * @param operation     The operation
     *
     * @return  Future with true when the resource does not exist or does not contain the declared body
     */
    /* test */ Future<Boolean> updateRequired(ElasticsearchConfigOperation operation) {
        String url = operation.getUrl();
        LOGGER.debugCr(reconciliation, "Requesting {}", url);

        return client.request(HttpMethod.GET, url, null, requestTimeoutMs)
                .compose(response -> {
                    if (response.statusCode() == ElasticsearchResponse.NOT_FOUND) {
                        LOGGER.debugCr(reconciliation, "{} does not exist yet", url);
                        return Future.succeededFuture(true);
                    }

                    if (response.statusCode() != ElasticsearchResponse.OK) {
                        LOGGER.errorCr(reconciliation, "Error getting current setting {}: status {}", url, response.statusCode());
                        return Future.failedFuture(new UnacceptableStatusException(HttpMethod.GET, url, response.statusCode()));
                    }

                    return Future.succeededFuture(!isSatisfied(url, response.body(), operation.getBody()));
                });
    }

    private boolean isSatisfied(String url, String actual, String expected) {
        try {
            if (JsonSupersetMatcher.isSatisfied(actual, expected)) {
                LOGGER.debugCr(reconciliation, "Content of {} is a match, no action required", url);
                return true;
            } else {
                LOGGER.debugCr(reconciliation, "Content of {} is not a superset match, reconciliation required. Actual: {} Expected: {}", url, actual, expected);
                return false;
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.debugCr(reconciliation, "Content of {} could not be compared, reconciliation required", url, e);
            return false;
        }
    }
}
