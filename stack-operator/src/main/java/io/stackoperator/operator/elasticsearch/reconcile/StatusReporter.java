/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.api.model.elasticsearch.ElasticsearchList;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.stackoperator.operator.events.EventPublisher;
import io.stackoperator.operator.resource.CrdOperator;
import io.vertx.core.Future;

/**
 * Reports the outcome of a reconciliation of an Elasticsearch cluster: publishes the queued events and persists the
 * status and hints with a single update.
 */
public class StatusReporter {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(StatusReporter.class);

    private final CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator;
    private final EventPublisher eventPublisher;

    /**
     * Constructor
     *
     * @param elasticsearchOperator     Operator for the Elasticsearch resources
     * @param eventPublisher            Publishes the events
     */
    public StatusReporter(CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator, EventPublisher eventPublisher) {
        this.elasticsearchOperator = elasticsearchOperator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Applies the state and reports the result
     *
     * @param reconciliation    Reconciliation marker
     * @param state             State of the reconciliation
     *
     * @return  Future which completes when the status is persisted
     */
    public Future<Void> report(Reconciliation reconciliation, ReconcileState state) {
        ReconcileState.ApplyResult result = state.apply();
        Elasticsearch resource = result.resource();

        Future<Void> events = result.events().isEmpty()
                ? Future.succeededFuture()
                : eventPublisher.publishAll(reconciliation, state.cluster(), result.events());

        return events
                .recover(error -> {
                    LOGGER.warnCr(reconciliation, "Failed to publish events", error);
                    return Future.succeededFuture();
                })
                .compose(i -> {
                    if (resource == null) {
                        LOGGER.debugCr(reconciliation, "Status did not change");
                        return Future.succeededFuture();
                    }

                    LOGGER.debugCr(reconciliation, "Updating status to {}", resource.getStatus());
                    return elasticsearchOperator.updateAsync(reconciliation, resource).mapEmpty();
                });
    }
}
