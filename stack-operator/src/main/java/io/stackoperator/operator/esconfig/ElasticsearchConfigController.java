/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esconfig;

import io.micrometer.core.instrument.Timer;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.api.model.elasticsearch.ElasticsearchList;
import io.stackoperator.api.model.esconfig.ElasticsearchConfig;
import io.stackoperator.api.model.esconfig.ElasticsearchConfigList;
import io.stackoperator.api.model.esconfig.ElasticsearchConfigStatus;
import io.stackoperator.operator.common.Annotations;
import io.stackoperator.operator.common.InvalidResourceException;
import io.stackoperator.operator.common.ReconcileResult;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.stackoperator.operator.esclient.ElasticsearchClientProvider;
import io.stackoperator.operator.events.Event;
import io.stackoperator.operator.events.EventPublisher;
import io.stackoperator.operator.events.EventReasons;
import io.stackoperator.operator.events.EventRecorder;
import io.stackoperator.operator.metrics.ControllerMetricsHolder;
import io.stackoperator.operator.resource.CrdOperator;
import io.stackoperator.operator.version.MalformedVersionException;
import io.vertx.core.Future;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Controller for the ElasticsearchConfig resource. One reconciliation fetches the resource, checks that it is managed
 * and compatible with this controller, validates it, resolves the referenced Elasticsearch cluster and converges the
 * declared operations in their order. Events produced during the reconciliation are published when it completes.
 */
public class ElasticsearchConfigController {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ElasticsearchConfigController.class);

    private final CrdOperator<ElasticsearchConfig, ElasticsearchConfigList> configOperator;
    private final CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator;
    private final ElasticsearchClientProvider clientProvider;
    private final EventPublisher eventPublisher;
    private final CompatibilityCheck compatibilityCheck;
    private final ControllerMetricsHolder metrics;
    private final long requestTimeoutMs;

    /**
     * Constructor
     *
     * @param configOperator            Operator for the ElasticsearchConfig resources
     * @param elasticsearchOperator     Operator for the Elasticsearch resources
     * @param clientProvider            Creates clients for the Elasticsearch clusters
     * @param eventPublisher            Publishes the events
     * @param compatibilityCheck        Compatibility check based on the version of this controller
     * @param metrics                   Reconciliation metrics
     * @param requestTimeoutMs          Timeout of every request sent to Elasticsearch
     */
    public ElasticsearchConfigController(CrdOperator<ElasticsearchConfig, ElasticsearchConfigList> configOperator,
                                         CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator,
                                         ElasticsearchClientProvider clientProvider,
                                         EventPublisher eventPublisher,
                                         CompatibilityCheck compatibilityCheck,
                                         ControllerMetricsHolder metrics,
                                         long requestTimeoutMs) {
        this.configOperator = configOperator;
        this.elasticsearchOperator = elasticsearchOperator;
        this.clientProvider = clientProvider;
        this.eventPublisher = eventPublisher;
        this.compatibilityCheck = compatibilityCheck;
        this.metrics = metrics;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Runs one reconciliation of an ElasticsearchConfig resource. The returned future always succeeds; errors are
     * reported through a result asking for the reconciliation to be retried.
     *
     * @param reconciliation    Reconciliation identifying the resource
     *
     * @return  Future with the reconciliation result
     */
    public Future<ReconcileResult> reconcile(Reconciliation reconciliation) {
        String namespace = reconciliation.namespace();
        Timer.Sample sample = Timer.start(metrics.registry());
        metrics.reconciliationsCounter(namespace).increment();
        LOGGER.infoCr(reconciliation, "ElasticsearchConfig {} will be checked for creation or modification", reconciliation.name());

        return configOperator.getAsync(namespace, reconciliation.name())
                .compose(esc -> {
                    if (esc == null) {
                        LOGGER.infoCr(reconciliation, "ElasticsearchConfig {} does not exist anymore, nothing to do", reconciliation.name());
                        return Future.succeededFuture(ReconcileResult.noRequeue());
                    }

                    EventRecorder recorder = new EventRecorder();
                    return reconcileResource(reconciliation, esc, recorder)
                            .compose(result -> flushEvents(reconciliation, esc, recorder.events()).map(result));
                })
                .recover(error -> {
                    LOGGER.warnCr(reconciliation, "Failed to get ElasticsearchConfig {}", reconciliation.name(), error);
                    return Future.succeededFuture(ReconcileResult.requeue(error));
                })
                .onSuccess(result -> {
                    sample.stop(metrics.reconciliationsTimer(namespace));

                    if (result.isRequeue()) {
                        metrics.failedReconciliationsCounter(namespace).increment();
                        LOGGER.warnCr(reconciliation, "Reconciliation failed and will be retried: {}", String.valueOf(result.getCause()));
                    } else if (result.isSkipped()) {
                        metrics.skippedReconciliationsCounter(namespace).increment();
                    } else {
                        metrics.successfulReconciliationsCounter(namespace).increment();
                        LOGGER.infoCr(reconciliation, "Reconciliation completed");
                    }
                });
    }

    private Future<ReconcileResult> reconcileResource(Reconciliation reconciliation, ElasticsearchConfig esc, EventRecorder recorder) {
        if (Annotations.isUnmanaged(esc)) {
            LOGGER.infoCr(reconciliation, "Object is currently not managed by this controller. Skipping reconciliation");
            return Future.succeededFuture(ReconcileResult.skipped());
        }

        try {
            if (!compatibilityCheck.isCompatible(esc)) {
                LOGGER.warnCr(reconciliation, "Resource was last reconciled by controller version {} which is not compatible with version {}. Skipping reconciliation",
                        esc.getStatus().getControllerVersion(), compatibilityCheck.controllerVersion());
                return Future.succeededFuture(ReconcileResult.skipped());
            }
        } catch (MalformedVersionException e) {
            LOGGER.errorCr(reconciliation, "Error during compatibility check", e);
            recorder.addEvent(Event.TYPE_WARNING, EventReasons.COMPATIBILITY_CHECK_ERROR, "Error during compatibility check: " + e.getMessage());
            return Future.succeededFuture(ReconcileResult.requeue(e));
        }

        try {
            ElasticsearchConfigValidator.validate(esc);
        } catch (InvalidResourceException e) {
            LOGGER.errorCr(reconciliation, "Validation failed: {}", e.getMessage());
            recorder.addEvent(Event.TYPE_WARNING, EventReasons.VALIDATION, e.getMessage());
            return Future.succeededFuture(ReconcileResult.noRequeue());
        }

        return doReconcile(reconciliation, esc, recorder);
    }

    private Future<ReconcileResult> doReconcile(Reconciliation reconciliation, ElasticsearchConfig esc, EventRecorder recorder) {
        String esNamespace = esc.getSpec().getElasticsearchRef().getNamespace() != null
                ? esc.getSpec().getElasticsearchRef().getNamespace()
                : esc.getMetadata().getNamespace();
        String esName = esc.getSpec().getElasticsearchRef().getName();

        return elasticsearchOperator.getAsync(esNamespace, esName)
                .compose(es -> {
                    if (es == null) {
                        String message = "Associated Elasticsearch " + esNamespace + "/" + esName + " does not exist yet";
                        LOGGER.warnCr(reconciliation, message);
                        recorder.addEvent(Event.TYPE_WARNING, EventReasons.ASSOCIATION_ERROR, message);
                        return Future.failedFuture(new NoSuchElementException(message));
                    }

                    return clientProvider.createClient(reconciliation, es);
                })
                .compose(client -> new OperationReconciler(reconciliation, client, requestTimeoutMs)
                        .reconcile(esc.getSpec().getOperations() != null ? esc.getSpec().getOperations() : List.of())
                        .onComplete(i -> client.close()))
                .compose(i -> updateStatus(reconciliation, esc))
                .map(i -> ReconcileResult.noRequeue())
                .recover(error -> {
                    // The missing association already has its own event
                    if (recorder.events().isEmpty()) {
                        recorder.addEvent(Event.TYPE_WARNING, EventReasons.RECONCILIATION_ERROR, String.valueOf(error.getMessage()));
                    }

                    return Future.succeededFuture(ReconcileResult.requeue(error));
                });
    }

    /**
     * Records the version of this controller in the status, only when it changed. Without a status sub-resource every
     * write bumps the generation of the resource and fires a watch event.
     */
    private Future<Void> updateStatus(Reconciliation reconciliation, ElasticsearchConfig esc) {
        ElasticsearchConfigStatus current = esc.getStatus();
        String controllerVersion = compatibilityCheck.controllerVersion().toString();

        if (current != null && controllerVersion.equals(current.getControllerVersion())) {
            LOGGER.debugCr(reconciliation, "Status did not change");
            return Future.succeededFuture();
        }

        ElasticsearchConfigStatus desired = new ElasticsearchConfigStatus();
        desired.setControllerVersion(controllerVersion);
        esc.setStatus(desired);

        return configOperator.updateAsync(reconciliation, esc).mapEmpty();
    }

    private Future<Void> flushEvents(Reconciliation reconciliation, ElasticsearchConfig esc, List<Event> events) {
        return eventPublisher.publishAll(reconciliation, esc, events)
                .recover(error -> {
                    LOGGER.warnCr(reconciliation, "Failed to publish events", error);
                    return Future.succeededFuture();
                });
    }
}
