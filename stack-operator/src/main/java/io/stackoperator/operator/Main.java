/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.api.model.elasticsearch.ElasticsearchList;
import io.stackoperator.api.model.esconfig.ElasticsearchConfig;
import io.stackoperator.api.model.esconfig.ElasticsearchConfigList;
import io.stackoperator.operator.common.BackOff;
import io.stackoperator.operator.elasticsearch.observer.ClusterHealthObserver;
import io.stackoperator.operator.elasticsearch.reconcile.ElasticsearchStatusReconciler;
import io.stackoperator.operator.elasticsearch.reconcile.ObservedPhaseDriver;
import io.stackoperator.operator.elasticsearch.reconcile.PodReadiness;
import io.stackoperator.operator.elasticsearch.reconcile.StatusReporter;
import io.stackoperator.operator.esclient.DefaultElasticsearchClientProvider;
import io.stackoperator.operator.esclient.ElasticsearchClientProvider;
import io.stackoperator.operator.esconfig.CompatibilityCheck;
import io.stackoperator.operator.esconfig.ElasticsearchConfigController;
import io.stackoperator.operator.events.EventPublisher;
import io.stackoperator.operator.events.KubernetesEventPublisher;
import io.stackoperator.operator.metrics.ControllerMetricsHolder;
import io.stackoperator.operator.resource.CrdOperator;
import io.stackoperator.operator.resource.PodOperator;
import io.stackoperator.operator.resource.SecretOperator;
import io.stackoperator.operator.resource.StatefulSetOperator;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The main class used to start the Stack Operator
 */
@SuppressFBWarnings("DM_EXIT")
@SuppressWarnings({"checkstyle:ClassDataAbstractionCoupling", "checkstyle:ClassFanOutComplexity"})
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class.getName());

    private static final String COMPONENT = "stack-operator";
    private static final long SHUTDOWN_TIMEOUT_MS = 10_000L;

    /**
     * The main method used to run the Stack Operator
     *
     * @param args  The command line arguments
     */
    public static void main(String[] args) {
        ControllerConfig config = ControllerConfig.buildFromMap(System.getenv());
        LOGGER.info("Stack Operator {} is starting with configuration {}", config.getVersion(), config);

        Vertx vertx = Vertx.vertx();
        KubernetesClient client = new KubernetesClientBuilder().build();
        MeterRegistry registry = new SimpleMeterRegistry();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(vertx, client)));

        try {
            start(vertx, client, registry, config);
        } catch (RuntimeException e) {
            LOGGER.error("Unable to start the Stack Operator", e);
            shutdown(vertx, client);
            System.exit(1);
        }
    }

    /**
     * Creates the controllers, starts watching the resources and schedules the periodic reconciliations
     *
     * @param vertx     Vert.x instance
     * @param client    Kubernetes client
     * @param registry  Meter registry for the reconciliation metrics
     * @param config    Operator configuration
     */
    static void start(Vertx vertx, KubernetesClient client, MeterRegistry registry, ControllerConfig config) {
        CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator
                = new CrdOperator<>(vertx, client, Elasticsearch.class, ElasticsearchList.class, Elasticsearch.RESOURCE_KIND);
        CrdOperator<ElasticsearchConfig, ElasticsearchConfigList> configOperator
                = new CrdOperator<>(vertx, client, ElasticsearchConfig.class, ElasticsearchConfigList.class, ElasticsearchConfig.RESOURCE_KIND);

        ElasticsearchClientProvider clientProvider = new DefaultElasticsearchClientProvider(vertx, new SecretOperator(vertx, client));
        EventPublisher eventPublisher = new KubernetesEventPublisher(vertx, client, COMPONENT, Clock.systemUTC());

        ElasticsearchConfigController configController = new ElasticsearchConfigController(
                configOperator,
                elasticsearchOperator,
                clientProvider,
                eventPublisher,
                new CompatibilityCheck(config.getVersion()),
                new ControllerMetricsHolder(ElasticsearchConfig.RESOURCE_KIND, registry),
                config.getRequestTimeoutMs());

        ElasticsearchStatusReconciler statusReconciler = new ElasticsearchStatusReconciler(
                elasticsearchOperator,
                new PodOperator(vertx, client),
                new StatefulSetOperator(vertx, client),
                new ClusterHealthObserver(clientProvider, config.getRequestTimeoutMs()),
                new StatusReporter(elasticsearchOperator, eventPublisher),
                new ObservedPhaseDriver(),
                PodReadiness::isReady,
                new ControllerMetricsHolder(Elasticsearch.RESOURCE_KIND, registry));

        ReconcileScheduler configScheduler = new ReconcileScheduler(vertx, ElasticsearchConfig.RESOURCE_KIND, configController::reconcile, BackOff::new);
        ReconcileScheduler statusScheduler = new ReconcileScheduler(vertx, Elasticsearch.RESOURCE_KIND, statusReconciler::reconcile, BackOff::new);

        configOperator.inform(config.getNamespace(), new EnqueueingHandler<>(configScheduler));
        elasticsearchOperator.inform(config.getNamespace(), new EnqueueingHandler<>(statusScheduler));
        LOGGER.info("Watching {} and {} resources in namespace {}", ElasticsearchConfig.RESOURCE_KIND, Elasticsearch.RESOURCE_KIND, config.getNamespace());

        vertx.setPeriodic(config.getFullReconciliationIntervalMs(), id -> {
            LOGGER.info("Triggering periodic reconciliation for namespace {}", config.getNamespace());
            reconcileAll(configOperator, configScheduler, config.getNamespace());
            reconcileAll(elasticsearchOperator, statusScheduler, config.getNamespace());
        });
    }

    private static void reconcileAll(CrdOperator<?, ?> operator, ReconcileScheduler scheduler, String namespace) {
        operator.listAsync(namespace)
                .onSuccess(resources -> resources.forEach(resource ->
                        scheduler.enqueue("timer", resource.getMetadata().getNamespace(), resource.getMetadata().getName())))
                .onFailure(error -> LOGGER.warn("Failed to list the resources for the periodic reconciliation in namespace {}", namespace, error));
    }

    private static void shutdown(Vertx vertx, KubernetesClient client) {
        LOGGER.info("Shutting down the Stack Operator");
        client.close();

        try {
            vertx.close().toCompletionStage().toCompletableFuture().get(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for Vert.x to close");
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Failed to close Vert.x", e);
        }
    }

    /**
     * Enqueues a reconciliation for every change delivered by an informer
     *
     * @param <T>   Type of the watched resource
     */
    static class EnqueueingHandler<T extends HasMetadata> implements ResourceEventHandler<T> {
        private final ReconcileScheduler scheduler;

        EnqueueingHandler(ReconcileScheduler scheduler) {
            this.scheduler = scheduler;
        }

        @Override
        public void onAdd(T resource) {
            scheduler.enqueue("watch", resource.getMetadata().getNamespace(), resource.getMetadata().getName());
        }

        @Override
        public void onUpdate(T oldResource, T newResource) {
            scheduler.enqueue("watch", newResource.getMetadata().getNamespace(), newResource.getMetadata().getName());
        }

        @Override
        public void onDelete(T resource, boolean deletedFinalStateUnknown) {
            scheduler.enqueue("watch", resource.getMetadata().getNamespace(), resource.getMetadata().getName());
        }
    }
}
