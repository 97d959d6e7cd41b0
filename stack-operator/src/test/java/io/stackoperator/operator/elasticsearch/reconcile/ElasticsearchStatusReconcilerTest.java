/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.api.model.elasticsearch.ElasticsearchHealth;
import io.stackoperator.api.model.elasticsearch.ElasticsearchList;
import io.stackoperator.api.model.elasticsearch.ElasticsearchPhase;
import io.stackoperator.api.model.elasticsearch.ElasticsearchStatus;
import io.stackoperator.operator.ResourceUtils;
import io.stackoperator.operator.common.Annotations;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.elasticsearch.observer.ClusterHealthObserver;
import io.stackoperator.operator.esclient.MockElasticsearchClient;
import io.stackoperator.operator.esclient.MockElasticsearchClientProvider;
import io.stackoperator.operator.events.EventReasons;
import io.stackoperator.operator.events.RecordingEventPublisher;
import io.stackoperator.operator.metrics.ControllerMetricsHolder;
import io.stackoperator.operator.resource.CrdOperator;
import io.stackoperator.operator.resource.PodOperator;
import io.stackoperator.operator.resource.StatefulSetOperator;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

@EnableKubernetesMockClient(crud = true)
@ExtendWith(VertxExtension.class)
public class ElasticsearchStatusReconcilerTest {
    private static final String NAME = "my-cluster";
    private static final String VERSION = "7.10.0";
    private static final String READY_LABEL = "test.stackoperator.io/ready";
    private static final Predicate<Pod> READINESS = pod -> "true".equals(pod.getMetadata().getLabels().get(READY_LABEL));

    private static KubernetesClient client;
    private static Vertx vertx;
    private static int namespaceCounter = 0;

    private String namespace;
    private MeterRegistry registry;
    private RecordingEventPublisher eventPublisher;

    @BeforeAll
    public static void beforeAll() {
        vertx = Vertx.vertx();
        client.apiextensions().v1().customResourceDefinitions().resource(ResourceUtils.elasticsearchCrd()).create();
    }

    @AfterAll
    public static void afterAll() {
        if (vertx != null) {
            vertx.close();
        }
    }

    @BeforeEach
    public void beforeEach() {
        namespace = "status-" + namespaceCounter++;
        registry = new SimpleMeterRegistry();
        eventPublisher = new RecordingEventPublisher();
    }

    private ElasticsearchStatusReconciler reconciler(MockElasticsearchClient esClient) {
        CrdOperator<Elasticsearch, ElasticsearchList> elasticsearchOperator = new CrdOperator<>(vertx, client, Elasticsearch.class, ElasticsearchList.class, Elasticsearch.RESOURCE_KIND);

        return new ElasticsearchStatusReconciler(elasticsearchOperator,
                new PodOperator(vertx, client),
                new StatefulSetOperator(vertx, client),
                new ClusterHealthObserver(new MockElasticsearchClientProvider(esClient), 1_000L),
                new StatusReporter(elasticsearchOperator, eventPublisher),
                new ObservedPhaseDriver(),
                READINESS,
                new ControllerMetricsHolder(Elasticsearch.RESOURCE_KIND, registry));
    }

    private static MockElasticsearchClient health(String status) {
        return new MockElasticsearchClient()
                .respond(HttpMethod.GET, "/_cluster/health", 200, "{\"cluster_name\":\"" + NAME + "\",\"status\":\"" + status + "\"}");
    }

    private Reconciliation reconciliation() {
        return new Reconciliation("test", Elasticsearch.RESOURCE_KIND, namespace, NAME);
    }

    private void createElasticsearch(int nodes, ElasticsearchStatus status) {
        Elasticsearch es = ResourceUtils.elasticsearch(namespace, NAME, VERSION, nodes);
        es.setStatus(status);
        client.resources(Elasticsearch.class).inNamespace(namespace).resource(es).create();
    }

    private void createPods(int count, boolean ready) {
        for (Pod pod : ReconcileStateTest.pods(count, VERSION)) {
            Pod inNamespace = new PodBuilder(pod)
                    .editMetadata()
                        .withNamespace(namespace)
                        .addToLabels(READY_LABEL, String.valueOf(ready))
                    .endMetadata()
                    .build();
            client.pods().inNamespace(namespace).resource(inNamespace).create();
        }
    }

    private Elasticsearch getElasticsearch() {
        return client.resources(Elasticsearch.class).inNamespace(namespace).withName(NAME).get();
    }

    @Test
    public void testAllNodesAvailableMakesClusterReady(VertxTestContext context) {
        createElasticsearch(3, null);
        createPods(3, true);

        reconciler(health("green")).reconcile(reconciliation())
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result.isRequeue(), is(false));

                    ElasticsearchStatus status = getElasticsearch().getStatus();
                    assertThat(status.getPhase(), is(ElasticsearchPhase.READY));
                    assertThat(status.getHealth(), is(ElasticsearchHealth.GREEN));
                    assertThat(status.getAvailableNodes(), is(3));
                    assertThat(status.getVersion(), is(VERSION));
                    assertThat(eventPublisher.events(), is(empty()));
                    context.completeNow();
                })));
    }

    @Test
    public void testMissingPodsMeansApplyingChanges(VertxTestContext context) {
        createElasticsearch(3, ReconcileStateTest.status(ElasticsearchPhase.READY, ElasticsearchHealth.GREEN, 3, VERSION));
        createPods(2, true);

        reconciler(health("yellow")).reconcile(reconciliation())
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result.isRequeue(), is(false));

                    ElasticsearchStatus status = getElasticsearch().getStatus();
                    assertThat(status.getPhase(), is(ElasticsearchPhase.APPLYING_CHANGES));
                    assertThat(status.getHealth(), is(ElasticsearchHealth.RED));
                    assertThat(status.getAvailableNodes(), is(2));

                    assertThat(eventPublisher.events(), hasSize(1));
                    assertThat(eventPublisher.events().get(0).reason(), is(EventReasons.UNHEALTHY));
                    assertThat(eventPublisher.resources(), is(List.of(namespace + "/" + NAME)));
                    context.completeNow();
                })));
    }

    @Test
    public void testUnreachableClusterHasUnknownHealth(VertxTestContext context) {
        createElasticsearch(3, null);
        createPods(3, false);

        reconciler(null).reconcile(reconciliation())
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result.isRequeue(), is(false));

                    ElasticsearchStatus status = getElasticsearch().getStatus();
                    assertThat(status.getHealth(), is(ElasticsearchHealth.UNKNOWN));
                    assertThat(status.getAvailableNodes(), is(0));
                    assertThat(status.getVersion(), is(VERSION));
                    context.completeNow();
                })));
    }

    @Test
    public void testInvalidSpecMarksClusterInvalid(VertxTestContext context) {
        Elasticsearch es = ResourceUtils.elasticsearch(namespace, NAME, "not-a-version", 3);
        client.resources(Elasticsearch.class).inNamespace(namespace).resource(es).create();

        reconciler(health("green")).reconcile(reconciliation())
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result.isRequeue(), is(false));
                    assertThat(getElasticsearch().getStatus().getPhase(), is(ElasticsearchPhase.INVALID));
                    assertThat(eventPublisher.events(), hasSize(1));
                    assertThat(eventPublisher.events().get(0).reason(), is(EventReasons.VALIDATION));
                    context.completeNow();
                })));
    }

    @Test
    public void testUnchangedStatusIsNotRewritten(VertxTestContext context) {
        createElasticsearch(3, null);
        createPods(3, true);
        ElasticsearchStatusReconciler reconciler = reconciler(health("green"));

        reconciler.reconcile(reconciliation())
                .compose(first -> {
                    String resourceVersion = getElasticsearch().getMetadata().getResourceVersion();
                    return reconciler.reconcile(reconciliation())
                            .onComplete(context.succeeding(second -> context.verify(() -> {
                                assertThat(second.isRequeue(), is(false));
                                assertThat(getElasticsearch().getMetadata().getResourceVersion(), is(resourceVersion));
                                context.completeNow();
                            })));
                })
                .onFailure(context::failNow);
    }

    @Test
    public void testUnmanagedClusterIsSkipped(VertxTestContext context) {
        Elasticsearch es = ResourceUtils.elasticsearch(namespace, NAME, VERSION, 3);
        es.getMetadata().setAnnotations(Map.of(Annotations.ANNO_MANAGED, "false"));
        client.resources(Elasticsearch.class).inNamespace(namespace).resource(es).create();
        createPods(3, true);

        reconciler(health("green")).reconcile(reconciliation())
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result.isRequeue(), is(false));
                    assertThat(getElasticsearch().getStatus(), is(nullValue()));
                    assertThat(registry.counter(ControllerMetricsHolder.METRICS_PREFIX + "reconciliations.skipped",
                            "kind", Elasticsearch.RESOURCE_KIND, "namespace", namespace).count(), is(1.0));
                    assertThat(registry.counter(ControllerMetricsHolder.METRICS_PREFIX + "reconciliations.successful",
                            "kind", Elasticsearch.RESOURCE_KIND, "namespace", namespace).count(), is(0.0));
                    context.completeNow();
                })));
    }

    @Test
    public void testMissingClusterIsNotRequeued(VertxTestContext context) {
        reconciler(health("green")).reconcile(reconciliation())
                .onComplete(context.succeeding(result -> context.verify(() -> {
                    assertThat(result.isRequeue(), is(false));
                    assertThat(eventPublisher.events(), is(empty()));
                    context.completeNow();
                })));
    }
}
