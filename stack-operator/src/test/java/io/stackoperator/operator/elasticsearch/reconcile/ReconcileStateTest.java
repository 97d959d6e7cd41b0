/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.api.model.elasticsearch.ElasticsearchHealth;
import io.stackoperator.api.model.elasticsearch.ElasticsearchPhase;
import io.stackoperator.api.model.elasticsearch.ElasticsearchStatus;
import io.stackoperator.operator.common.InvalidResourceException;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.elasticsearch.hints.OrchestrationHints;
import io.stackoperator.operator.elasticsearch.observer.ClusterHealth;
import io.stackoperator.operator.elasticsearch.observer.ObservedState;
import io.stackoperator.operator.events.Event;
import io.stackoperator.operator.events.EventReasons;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ReconcileStateTest {
    private static final String NAMESPACE = "ns";
    private static final String NAME = "my-cluster";
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", Elasticsearch.RESOURCE_KIND, NAMESPACE, NAME);
    private static final ObservedState GREEN = new ObservedState(new ClusterHealth("green"));
    private static final Event UNHEALTHY = Event.warning(EventReasons.UNHEALTHY, "Elasticsearch cluster health degraded");

    static Pod pod(String name, String version, boolean ready) {
        return new PodBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(NAMESPACE)
                    .withLabels(Map.of(Elasticsearch.CLUSTER_NAME_LABEL, NAME, Elasticsearch.VERSION_LABEL, version))
                .endMetadata()
                .withNewStatus()
                    .addNewCondition()
                        .withType("Ready")
                        .withStatus(ready ? "True" : "False")
                    .endCondition()
                .endStatus()
                .build();
    }

    static List<Pod> pods(int count, String version) {
        List<Pod> pods = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            pods.add(pod(NAME + "-es-default-" + i, version, true));
        }
        return pods;
    }

    static StatefulSet statefulSet(String name, String version) {
        return new StatefulSetBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(NAMESPACE)
                .endMetadata()
                .withNewSpec()
                    .withNewTemplate()
                        .withNewMetadata()
                            .withLabels(Map.of(Elasticsearch.VERSION_LABEL, version))
                        .endMetadata()
                    .endTemplate()
                .endSpec()
                .build();
    }

    static Elasticsearch cluster(ElasticsearchStatus status) {
        Elasticsearch es = new Elasticsearch();
        es.setMetadata(new ObjectMetaBuilder().withName(NAME).withNamespace(NAMESPACE).build());
        es.setStatus(status);
        return es;
    }

    static ElasticsearchStatus status(ElasticsearchPhase phase, ElasticsearchHealth health, int nodes, String version) {
        ElasticsearchStatus status = new ElasticsearchStatus();
        status.setPhase(phase);
        status.setHealth(health);
        status.setAvailableNodes(nodes);
        status.setVersion(version);
        return status;
    }

    private static ReconcileState readyGreenState(int nodes) {
        return ReconcileState.mustCreate(RECONCILIATION,
                cluster(status(ElasticsearchPhase.READY, ElasticsearchHealth.GREEN, nodes, "7.10.0")),
                PodReadiness::isReady);
    }

    @Test
    public void testMarkReady() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), PodReadiness::isReady);
        List<Pod> pods = pods(3, "7.10.0");

        state.markReady(new ResourcesState(pods, pods, List.of()), GREEN);

        assertThat(state.isReady(), is(true));
        assertThat(state.status(), is(status(ElasticsearchPhase.READY, ElasticsearchHealth.GREEN, 3, "7.10.0")));
    }

    @Test
    public void testAvailableNodesCountOnlyReadyCurrentPods() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), PodReadiness::isReady);
        List<Pod> current = List.of(pod("a", "7.10.0", true), pod("b", "7.10.0", false));
        List<Pod> all = List.of(pod("a", "7.10.0", true), pod("b", "7.10.0", false), pod("c", "7.10.0", true));

        state.updateElasticsearchState(new ResourcesState(current, all, List.of()), GREEN);

        assertThat(state.status().getAvailableNodes(), is(1));
    }

    @Test
    public void testReadinessPredicateIsInjected() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), pod -> true);
        List<Pod> current = List.of(pod("a", "7.10.0", false), pod("b", "7.10.0", false));

        state.updateElasticsearchState(new ResourcesState(current, current, List.of()), GREEN);

        assertThat(state.status().getAvailableNodes(), is(2));
    }

    @Test
    public void testVersionIsTheMinimumOfPodsAndStatefulSets() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), PodReadiness::isReady);
        List<Pod> pods = List.of(pod("a", "7.10.0", true), pod("b", "7.9.1", true));

        state.markReady(new ResourcesState(pods, pods, List.of(statefulSet("default", "7.10.0"))), GREEN);

        assertThat(state.status().getVersion(), is("7.9.1"));
    }

    @Test
    public void testVersionFromStatefulSetsWhenNoPods() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), PodReadiness::isReady);

        state.markReady(new ResourcesState(List.of(), List.of(), List.of(statefulSet("default", "7.10.2"), statefulSet("data", "7.10.0"))), GREEN);

        assertThat(state.status().getVersion(), is("7.10.0"));
    }

    @Test
    public void testMalformedPodVersionIsIgnored() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), PodReadiness::isReady);
        List<Pod> pods = List.of(pod("a", "7.9.1", true), pod("b", "not-a-version", true));

        state.markReady(new ResourcesState(pods, pods, List.of(statefulSet("default", "7.10.0"))), GREEN);

        assertThat(state.status().getVersion(), is("7.10.0"));
    }

    @Test
    public void testPreviousVersionIsKeptWithoutInformation() {
        ReconcileState state = readyGreenState(3);
        List<Pod> pods = List.of(pod("a", "broken", true));

        state.markReady(new ResourcesState(pods, pods, List.of()), GREEN);

        assertThat(state.status().getVersion(), is("7.10.0"));
    }

    @Test
    public void testHealthDefaultsToUnknown() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), PodReadiness::isReady);
        List<Pod> pods = pods(1, "7.10.0");
        ResourcesState resources = new ResourcesState(pods, pods, List.of());

        state.markReady(resources, ObservedState.empty());
        assertThat(state.status().getHealth(), is(ElasticsearchHealth.UNKNOWN));

        state.markReady(resources, new ObservedState(new ClusterHealth("")));
        assertThat(state.status().getHealth(), is(ElasticsearchHealth.UNKNOWN));

        state.markReady(resources, new ObservedState(new ClusterHealth("yellow")));
        assertThat(state.status().getHealth(), is(ElasticsearchHealth.YELLOW));
    }

    @Test
    public void testMarkApplyingChangesForcesRedHealth() {
        ReconcileState state = readyGreenState(3);
        List<Pod> pods = pods(3, "7.10.0");

        state.markReady(new ResourcesState(pods, pods, List.of()), GREEN);
        state.markApplyingChanges(pods);

        assertThat(state.status().getPhase(), is(ElasticsearchPhase.APPLYING_CHANGES));
        assertThat(state.status().getHealth(), is(ElasticsearchHealth.RED));
        assertThat(state.isReady(), is(false));
    }

    @Test
    public void testApplyingChangesWithoutNodeLossIsNotADegradation() {
        ReconcileState state = readyGreenState(3);

        state.markApplyingChanges(pods(3, "7.10.0"));
        ReconcileState.ApplyResult result = state.apply();

        assertThat(result.resource(), is(notNullValue()));
        assertThat(result.resource().getStatus().getHealth(), is(ElasticsearchHealth.RED));
        assertThat(result.events(), not(hasItem(UNHEALTHY)));
    }

    @Test
    public void testApplyingChangesWithNodeLossIsADegradation() {
        ReconcileState state = readyGreenState(3);
        List<Pod> pods = List.of(pod("a", "7.10.0", true), pod("b", "7.10.0", true), pod("c", "7.10.0", false));

        state.markApplyingChanges(pods);
        ReconcileState.ApplyResult result = state.apply();

        assertThat(result.resource(), is(notNullValue()));
        assertThat(result.resource().getStatus().getAvailableNodes(), is(2));
        assertThat(result.events(), hasItem(UNHEALTHY));
    }

    @Test
    public void testLowerHealthIsADegradation() {
        ReconcileState state = readyGreenState(3);
        List<Pod> pods = pods(3, "7.10.0");

        state.markReady(new ResourcesState(pods, pods, List.of()), new ObservedState(new ClusterHealth("yellow")));
        ReconcileState.ApplyResult result = state.apply();

        assertThat(result.events(), is(List.of(UNHEALTHY)));
    }

    @Test
    public void testApplyWithoutChangesReturnsNoResource() {
        ReconcileState state = readyGreenState(3);
        List<Pod> pods = pods(3, "7.10.0");

        state.markReady(new ResourcesState(pods, pods, List.of()), GREEN);
        ReconcileState.ApplyResult result = state.apply();

        assertThat(result.resource(), is(nullValue()));
        assertThat(result.events(), is(empty()));
    }

    @Test
    public void testApplyIsIdempotent() {
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, cluster(null), PodReadiness::isReady);
        List<Pod> pods = pods(3, "7.10.0");
        state.markReady(new ResourcesState(pods, pods, List.of()), GREEN);

        ReconcileState.ApplyResult first = state.apply();
        assertThat(first.resource(), is(notNullValue()));
        assertThat(first.resource().getStatus(), is(status(ElasticsearchPhase.READY, ElasticsearchHealth.GREEN, 3, "7.10.0")));

        ReconcileState.ApplyResult second = state.apply();
        assertThat(second.resource(), is(nullValue()));
    }

    @Test
    public void testMarkMigratingDataQueuesDelayedEvent() {
        ReconcileState state = readyGreenState(3);
        List<Pod> pods = pods(3, "7.10.0");

        state.markMigratingData(new ResourcesState(pods, pods, List.of()), GREEN);

        assertThat(state.status().getPhase(), is(ElasticsearchPhase.MIGRATING_DATA));
        assertThat(state.apply().events(), is(List.of(Event.normal(EventReasons.DELAYED,
                "Requested topology change delayed by data migration. Ensure index settings allow node removal."))));
    }

    @Test
    public void testMarkShutdownStalledQueuesStalledEvent() {
        ReconcileState state = readyGreenState(3);
        List<Pod> pods = pods(3, "7.10.0");

        state.markShutdownStalled(new ResourcesState(pods, pods, List.of()), GREEN, "Node my-cluster-es-default-2 holds the only copy of shard 0.");

        assertThat(state.status().getPhase(), is(ElasticsearchPhase.NODE_SHUTDOWN_STALLED));
        assertThat(state.apply().events(), is(List.of(Event.warning(EventReasons.STALLED,
                "Requested topology change is stalled. User intervention maybe required if this condition persists. "
                        + "Node my-cluster-es-default-2 holds the only copy of shard 0."))));
    }

    @Test
    public void testMarkInvalidOnlyChangesThePhase() {
        ReconcileState state = readyGreenState(3);

        state.markInvalid(new InvalidResourceException("spec.version is required"));

        assertThat(state.status(), is(status(ElasticsearchPhase.INVALID, ElasticsearchHealth.GREEN, 3, "7.10.0")));
        assertThat(state.apply().events(), is(List.of(Event.warning(EventReasons.VALIDATION, "spec.version is required"))));
    }

    @Test
    public void testUpdatePhase() {
        ReconcileState state = readyGreenState(3);

        state.updatePhase(ElasticsearchPhase.MIGRATING_DATA);

        assertThat(state.status().getPhase(), is(ElasticsearchPhase.MIGRATING_DATA));
        assertThat(state.status().getHealth(), is(ElasticsearchHealth.GREEN));
    }

    @Test
    public void testHintsArePersistedWithTheStatus() {
        Elasticsearch es = cluster(status(ElasticsearchPhase.READY, ElasticsearchHealth.GREEN, 3, "7.10.0"));
        es.getMetadata().setAnnotations(Map.of(OrchestrationHints.ANNOTATION, "{\"noTransientSettings\":true}", "keep", "me"));
        ReconcileState state = ReconcileState.mustCreate(RECONCILIATION, es, PodReadiness::isReady);

        state.updateOrchestrationHints(OrchestrationHints.of(Map.of(OrchestrationHints.NO_TRANSIENT_SETTINGS, false, OrchestrationHints.SERVICE_ACCOUNTS, true)));
        assertThat(state.orchestrationHints().isSet(OrchestrationHints.NO_TRANSIENT_SETTINGS), is(true));
        assertThat(state.orchestrationHints().isSet(OrchestrationHints.SERVICE_ACCOUNTS), is(true));

        ReconcileState.ApplyResult result = state.apply();
        assertThat(result.resource(), is(notNullValue()));
        assertThat(result.resource().getMetadata().getAnnotations().get("keep"), is("me"));

        OrchestrationHints persisted = OrchestrationHints.fromAnnotations(result.resource().getMetadata().getAnnotations());
        assertThat(persisted, is(state.orchestrationHints()));
        assertThat(state.apply().resource(), is(nullValue()));
    }

    @Test
    public void testInvalidHintsFailTheCreation() {
        Elasticsearch es = cluster(null);
        es.getMetadata().setAnnotations(Map.of(OrchestrationHints.ANNOTATION, "{broken"));

        assertThrows(IllegalArgumentException.class, () -> ReconcileState.mustCreate(RECONCILIATION, es, PodReadiness::isReady));
        assertThat(ReconcileState.create(RECONCILIATION, es, PodReadiness::isReady).failed(), is(true));
    }
}
