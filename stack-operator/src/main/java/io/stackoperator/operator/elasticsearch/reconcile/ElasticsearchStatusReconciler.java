/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.micrometer.core.instrument.Timer;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.api.model.elasticsearch.ElasticsearchList;
import io.stackoperator.operator.common.Annotations;
import io.stackoperator.operator.common.ReconcileResult;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.stackoperator.operator.elasticsearch.observer.ClusterHealthObserver;
import io.stackoperator.operator.metrics.ControllerMetricsHolder;
import io.stackoperator.operator.resource.CrdOperator;
import io.stackoperator.operator.resource.PodOperator;
import io.stackoperator.operator.resource.StatefulSetOperator;
import io.vertx.core.Future;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Reconciles the status of Elasticsearch clusters. A reconciliation reads the Pods and StatefulSets of the cluster,
 * observes its health, lets the {@link PhaseDriver} decide the phase and reports the new status.
 */
public class ElasticsearchStatusReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ElasticsearchStatusReconciler.class);

    private final CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator;
    private final PodOperator podOperator;
    private final StatefulSetOperator statefulSetOperator;
    private final ClusterHealthObserver healthObserver;
    private final StatusReporter statusReporter;
    private final PhaseDriver phaseDriver;
    private final Predicate<Pod> readiness;
    private final ControllerMetricsHolder metrics;

    /**
     * Constructor
     *
     * @param elasticsearchOperator     Operator for the Elasticsearch resources
     * @param podOperator               Operator for the Pods
     * @param statefulSetOperator       Operator for the StatefulSets
     * @param healthObserver            Observes the cluster health
     * @param statusReporter            Publishes the events and persists the status
     * @param phaseDriver               Decides the phase of the cluster
     * @param readiness                 Decides whether a Pod counts as an available node
     * @param metrics                   Reconciliation metrics
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public ElasticsearchStatusReconciler(CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator,
                                         PodOperator podOperator,
                                         StatefulSetOperator statefulSetOperator,
                                         ClusterHealthObserver healthObserver,
                                         StatusReporter statusReporter,
                                         PhaseDriver phaseDriver,
                                         Predicate<Pod> readiness,
                                         ControllerMetricsHolder metrics) {
        this.elasticsearchOperator = elasticsearchOperator;
        this.podOperator = podOperator;
        this.statefulSetOperator = statefulSetOperator;
        this.healthObserver = healthObserver;
        this.statusReporter = statusReporter;
        this.phaseDriver = phaseDriver;
        this.readiness = readiness;
        this.metrics = metrics;
    }

    /**
     * Runs one reconciliation of the status of an Elasticsearch cluster
     *
     * @param reconciliation    Reconciliation identifying the resource
     *
     * @return  Future with the reconciliation result. The future does not fail.
     */
    public Future<ReconcileResult> reconcile(Reconciliation reconciliation) {
        String namespace = reconciliation.namespace();
        Timer.Sample sample = Timer.start(metrics.registry());
        metrics.reconciliationsCounter(namespace).increment();

        return elasticsearchOperator.getAsync(namespace, reconciliation.name())
                .compose(es -> {
                    if (es == null) {
                        LOGGER.infoCr(reconciliation, "Elasticsearch {} does not exist anymore, nothing to do", reconciliation.name());
                        return Future.succeededFuture(ReconcileResult.noRequeue());
                    } else if (Annotations.isUnmanaged(es)) {
                        LOGGER.infoCr(reconciliation, "Object is currently not managed by this controller. Skipping reconciliation");
                        return Future.succeededFuture(ReconcileResult.skipped());
                    }

                    return ReconcileState.create(reconciliation, es, readiness)
                            .compose(state -> resourcesState(es)
                                    .compose(resources -> healthObserver.observe(reconciliation, es)
                                            .map(observed -> {
                                                phaseDriver.drive(state, resources, observed);
                                                return state;
                                            })))
                            .compose(state -> statusReporter.report(reconciliation, state))
                            .map(i -> ReconcileResult.noRequeue());
                })
                .recover(error -> {
                    LOGGER.warnCr(reconciliation, "Failed to reconcile the status of Elasticsearch {}", reconciliation.name(), error);
                    return Future.succeededFuture(ReconcileResult.requeue(error));
                })
                .onSuccess(result -> {
                    sample.stop(metrics.reconciliationsTimer(namespace));

                    if (result.isRequeue()) {
                        metrics.failedReconciliationsCounter(namespace).increment();
                    } else if (result.isSkipped()) {
                        metrics.skippedReconciliationsCounter(namespace).increment();
                    } else {
                        metrics.successfulReconciliationsCounter(namespace).increment();
                    }
                });
    }

    private Future<ResourcesState> resourcesState(Elasticsearch es) {
        String namespace = es.getMetadata().getNamespace();
        Map<String, String> selector = Map.of(Elasticsearch.CLUSTER_NAME_LABEL, es.getMetadata().getName());

        Future<List<Pod>> pods = podOperator.listAsync(namespace, selector);
        Future<List<StatefulSet>> statefulSets = statefulSetOperator.listAsync(namespace, selector);

        return Future.join(pods, statefulSets)
                .map(i -> {
                    List<Pod> currentPods = pods.result().stream()
                            .filter(pod -> pod.getMetadata().getDeletionTimestamp() == null)
                            .collect(Collectors.toList());

                    return new ResourcesState(currentPods, pods.result(), statefulSets.result());
                });
    }
}
