/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.fabric8.kubernetes.api.model.Pod;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.api.model.elasticsearch.ElasticsearchHealth;
import io.stackoperator.api.model.elasticsearch.ElasticsearchPhase;
import io.stackoperator.api.model.elasticsearch.ElasticsearchStatus;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.stackoperator.operator.elasticsearch.hints.OrchestrationHints;
import io.stackoperator.operator.elasticsearch.observer.ObservedState;
import io.stackoperator.operator.events.Event;
import io.stackoperator.operator.events.EventReasons;
import io.stackoperator.operator.events.EventRecorder;
import io.stackoperator.operator.version.MalformedVersionException;
import io.stackoperator.operator.version.Version;
import io.stackoperator.operator.version.Versions;
import io.vertx.core.Future;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Accumulates the status of an Elasticsearch cluster during one reconciliation. The new status starts as a copy of the
 * persisted one and is mutated by the phase transitions. {@link #apply()} compares it with the persisted status and
 * decides whether the resource has to be updated.
 */
public class ReconcileState {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ReconcileState.class);

    static final String DELAYED_MESSAGE = "Requested topology change delayed by data migration. Ensure index settings allow node removal.";
    static final String STALLED_MESSAGE = "Requested topology change is stalled. User intervention maybe required if this condition persists. ";
    static final String DEGRADED_MESSAGE = "Elasticsearch cluster health degraded";

    private final Reconciliation reconciliation;
    private final Elasticsearch cluster;
    private final Predicate<Pod> readiness;
    private final EventRecorder recorder = new EventRecorder();

    private ElasticsearchStatus previousStatus;
    private OrchestrationHints previousHints;
    private final ElasticsearchStatus status;
    private OrchestrationHints hints;

    private ReconcileState(Reconciliation reconciliation, Elasticsearch cluster, Predicate<Pod> readiness, OrchestrationHints hints) {
        this.reconciliation = reconciliation;
        this.cluster = cluster;
        this.readiness = readiness;
        this.previousStatus = cluster.getStatus() != null ? new ElasticsearchStatus(cluster.getStatus()) : new ElasticsearchStatus();
        this.status = new ElasticsearchStatus(previousStatus);
        this.previousHints = hints;
        this.hints = hints;
    }

    /**
     * Creates the reconciliation state of an Elasticsearch cluster
     *
     * @param reconciliation    Reconciliation marker
     * @param cluster           The Elasticsearch resource
     * @param readiness         Decides whether a Pod counts as an available node
     *
     * @return  Future with the state, failed when the orchestration hints of the resource cannot be parsed
     */
    public static Future<ReconcileState> create(Reconciliation reconciliation, Elasticsearch cluster, Predicate<Pod> readiness) {
        try {
            return Future.succeededFuture(mustCreate(reconciliation, cluster, readiness));
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Like {@link #create(Reconciliation, Elasticsearch, Predicate)} but throws when the hints cannot be parsed.
     *
     * @param reconciliation    Reconciliation marker
     * @param cluster           The Elasticsearch resource
     * @param readiness         Decides whether a Pod counts as an available node
     *
     * @return  The state
     *
     * @throws IllegalArgumentException when the orchestration hints annotation is not valid
     */
    public static ReconcileState mustCreate(Reconciliation reconciliation, Elasticsearch cluster, Predicate<Pod> readiness) {
        OrchestrationHints hints = OrchestrationHints.fromAnnotations(cluster.getMetadata().getAnnotations());
        return new ReconcileState(reconciliation, cluster, readiness, hints);
    }

    private long availableNodes(List<Pod> pods) {
        return pods.stream().filter(readiness).count();
    }

    /**
     * Lowest version running in the cluster. Each source with a malformed label is logged and left out.
     */
    private Version minRunningVersion(ResourcesState resourcesState) {
        Version minPodVersion = null;
        Version minSsetVersion = null;

        try {
            minPodVersion = Versions.minInPods(resourcesState.allPods(), Elasticsearch.VERSION_LABEL);
        } catch (MalformedVersionException e) {
            LOGGER.errorCr(reconciliation, "Failed to parse the version of the running Pods", e);
        }

        try {
            minSsetVersion = Versions.minInStatefulSets(resourcesState.statefulSets(), Elasticsearch.VERSION_LABEL);
        } catch (MalformedVersionException e) {
            LOGGER.errorCr(reconciliation, "Failed to parse the version of the StatefulSets", e);
        }

        if (minPodVersion == null) {
            return minSsetVersion;
        } else if (minSsetVersion == null) {
            return minPodVersion;
        } else {
            return minPodVersion.gt(minSsetVersion) ? minSsetVersion : minPodVersion;
        }
    }

    private ReconcileState updateWithPhase(ElasticsearchPhase phase, ResourcesState resourcesState, ObservedState observedState) {
        status.setAvailableNodes((int) availableNodes(resourcesState.currentPods()));
        status.setPhase(phase);

        Version lowestVersion = minRunningVersion(resourcesState);
        if (lowestVersion != null) {
            status.setVersion(lowestVersion.toString());
        }

        ElasticsearchHealth health = ElasticsearchHealth.UNKNOWN;
        if (observedState != null
                && observedState.clusterHealth() != null
                && observedState.clusterHealth().status() != null
                && !observedState.clusterHealth().status().isEmpty()) {
            health = ElasticsearchHealth.forValue(observedState.clusterHealth().status());
        }
        status.setHealth(health);

        return this;
    }

    /**
     * Updates the node count, version and health while keeping the current phase
     *
     * @param resourcesState    Resources of the cluster
     * @param observedState     Observed cluster state
     *
     * @return  This state
     */
    public ReconcileState updateElasticsearchState(ResourcesState resourcesState, ObservedState observedState) {
        return updateWithPhase(status.getPhase(), resourcesState, observedState);
    }

    /**
     * Marks the cluster as ready
     *
     * @param resourcesState    Resources of the cluster
     * @param observedState     Observed cluster state
     *
     * @return  This state
     */
    public ReconcileState markReady(ResourcesState resourcesState, ObservedState observedState) {
        return updateWithPhase(ElasticsearchPhase.READY, resourcesState, observedState);
    }

    /**
     * Marks the cluster as applying changes. The health is red while the topology changes, whatever the cluster reports.
     *
     * @param pods  Current Pods of the cluster
     *
     * @return  This state
     */
    public ReconcileState markApplyingChanges(List<Pod> pods) {
        status.setAvailableNodes((int) availableNodes(pods));
        status.setPhase(ElasticsearchPhase.APPLYING_CHANGES);
        status.setHealth(ElasticsearchHealth.RED);
        return this;
    }

    /**
     * Marks the cluster as migrating data away from the nodes to remove
     *
     * @param resourcesState    Resources of the cluster
     * @param observedState     Observed cluster state
     *
     * @return  This state
     */
    public ReconcileState markMigratingData(ResourcesState resourcesState, ObservedState observedState) {
        recorder.addEvent(Event.TYPE_NORMAL, EventReasons.DELAYED, DELAYED_MESSAGE);
        return updateWithPhase(ElasticsearchPhase.MIGRATING_DATA, resourcesState, observedState);
    }

    /**
     * Marks the node shutdown as stalled
     *
     * @param resourcesState    Resources of the cluster
     * @param observedState     Observed cluster state
     * @param reasonDetail      Why the shutdown does not progress
     *
     * @return  This state
     */
    public ReconcileState markShutdownStalled(ResourcesState resourcesState, ObservedState observedState, String reasonDetail) {
        recorder.addEvent(Event.TYPE_WARNING, EventReasons.STALLED, STALLED_MESSAGE + reasonDetail);
        return updateWithPhase(ElasticsearchPhase.NODE_SHUTDOWN_STALLED, resourcesState, observedState);
    }

    /**
     * Marks the resource as invalid. Node count, version and health are left as they are.
     *
     * @param error     The validation error
     */
    public void markInvalid(Throwable error) {
        status.setPhase(ElasticsearchPhase.INVALID);
        recorder.addEvent(Event.TYPE_WARNING, EventReasons.VALIDATION, error.getMessage());
    }

    public void updatePhase(ElasticsearchPhase phase) {
        status.setPhase(phase);
    }

    public boolean isReady() {
        return status.getPhase() == ElasticsearchPhase.READY;
    }

    /**
     * Merges the given hints into the hints collected so far
     *
     * @param incoming  The new hints
     */
    public void updateOrchestrationHints(OrchestrationHints incoming) {
        hints = hints.merge(incoming);
    }

    /**
     * @return  The hints as maintained during this reconciliation. They can differ from the ones stored on the resource.
     */
    public OrchestrationHints orchestrationHints() {
        return hints;
    }

    /**
     * @return  The Elasticsearch resource being reconciled
     */
    public Elasticsearch cluster() {
        return cluster;
    }

    /**
     * @return  Copy of the status being built
     */
    public ElasticsearchStatus status() {
        return new ElasticsearchStatus(status);
    }

    /**
     * Compares the new status and hints with the persisted ones. When they differ, the new status and hints are set on
     * the resource, which is returned to be persisted. A Warning event is queued when the cluster got degraded.
     *
     * @return  The queued events and the resource to persist, or null when nothing changed
     */
    public ApplyResult apply() {
        if (previousStatus.equals(status) && previousHints.equals(hints)) {
            return new ApplyResult(recorder.events(), null);
        }

        if (status.isDegraded(previousStatus)) {
            recorder.addEvent(Event.TYPE_WARNING, EventReasons.UNHEALTHY, DEGRADED_MESSAGE);
        }

        cluster.setStatus(new ElasticsearchStatus(status));

        if (!previousHints.equals(hints)) {
            Map<String, String> annotations = cluster.getMetadata().getAnnotations() != null
                    ? new HashMap<>(cluster.getMetadata().getAnnotations())
                    : new HashMap<>();
            annotations.put(OrchestrationHints.ANNOTATION, hints.asAnnotation());
            cluster.getMetadata().setAnnotations(annotations);
        }

        previousStatus = new ElasticsearchStatus(status);
        previousHints = hints;

        return new ApplyResult(recorder.events(), cluster);
    }

    /**
     * Result of {@link #apply()}
     *
     * @param events    Events to publish, in the order they were queued
     * @param resource  Resource to persist or null when it did not change
     */
    public record ApplyResult(List<Event> events, Elasticsearch resource) {
    }
}
