/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.reconcile;

import io.stackoperator.api.model.elasticsearch.ElasticsearchSpec;
import io.stackoperator.api.model.elasticsearch.NodeSet;
import io.stackoperator.operator.common.InvalidResourceException;
import io.stackoperator.operator.elasticsearch.observer.ObservedState;
import io.stackoperator.operator.version.MalformedVersionException;
import io.stackoperator.operator.version.Version;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the phase from what runs in the cluster: Invalid when the resource spec cannot be used, ApplyingChanges while the
 * number of Pods differs from the declared node count, Ready when all declared nodes are available. Otherwise the phase is kept.
 */
public class ObservedPhaseDriver implements PhaseDriver {
    @Override
    public void drive(ReconcileState state, ResourcesState resourcesState, ObservedState observedState) {
        List<String> errors = validate(state.cluster().getSpec());
        if (!errors.isEmpty()) {
            state.markInvalid(new InvalidResourceException(errors));
            return;
        }

        int expectedNodes = state.cluster().getSpec().getNodeSets().stream().mapToInt(NodeSet::getCount).sum();

        state.updateElasticsearchState(resourcesState, observedState);

        if (resourcesState.currentPods().size() != expectedNodes) {
            state.markApplyingChanges(resourcesState.currentPods());
        } else if (state.status().getAvailableNodes() == expectedNodes) {
            state.markReady(resourcesState, observedState);
        }
    }

    private static List<String> validate(ElasticsearchSpec spec) {
        List<String> errors = new ArrayList<>();

        if (spec == null) {
            errors.add("spec is required");
            return errors;
        }

        if (spec.getVersion() == null) {
            errors.add("spec.version is required");
        } else {
            try {
                Version.parse(spec.getVersion());
            } catch (MalformedVersionException e) {
                errors.add("spec.version is invalid: " + e.getMessage());
            }
        }

        if (spec.getNodeSets() == null || spec.getNodeSets().isEmpty()) {
            errors.add("spec.nodeSets must contain at least one node set");
        } else {
            for (NodeSet nodeSet : spec.getNodeSets()) {
                if (nodeSet.getCount() < 0) {
                    errors.add("spec.nodeSets[" + nodeSet.getName() + "].count must not be negative");
                }
            }
        }

        return errors;
    }
}
