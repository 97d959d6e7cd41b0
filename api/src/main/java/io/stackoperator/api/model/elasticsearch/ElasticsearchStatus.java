/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.elasticsearch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.KubernetesResource;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;

/**
 * Represents the observed status of an Elasticsearch cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"availableNodes", "version", "health", "phase"})
@EqualsAndHashCode
@ToString
public class ElasticsearchStatus implements KubernetesResource, Serializable {
    private static final long serialVersionUID = 1L;

    private int availableNodes;
    private String version;
    private ElasticsearchHealth health;
    private ElasticsearchPhase phase;

    public ElasticsearchStatus() {
    }

    /**
     * Copy constructor
     *
     * @param other     Status to copy
     */
    public ElasticsearchStatus(ElasticsearchStatus other) {
        this.availableNodes = other.availableNodes;
        this.version = other.version;
        this.health = other.health;
        this.phase = other.phase;
    }

    public int getAvailableNodes() {
        return availableNodes;
    }

    public void setAvailableNodes(int availableNodes) {
        this.availableNodes = availableNodes;
    }

    /**
     * @return  The lowest version of Elasticsearch running in the cluster
     */
    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public ElasticsearchHealth getHealth() {
        return health;
    }

    public void setHealth(ElasticsearchHealth health) {
        this.health = health;
    }

    public ElasticsearchPhase getPhase() {
        return phase;
    }

    public void setPhase(ElasticsearchPhase phase) {
        this.phase = phase;
    }

    /**
     * Checks whether this status is degraded compared to a previous one. The number of available nodes going down is
     * always a degradation. A lower health is a degradation unless this status is in the ApplyingChanges phase, where
     * the red health is set on purpose while the topology changes.
     *
     * @param previous  The previous status
     *
     * @return  True if this status is degraded compared to the previous one
     */
    public boolean isDegraded(ElasticsearchStatus previous) {
        if (previous == null) {
            return false;
        }

        if (availableNodes < previous.availableNodes) {
            return true;
        }

        return phase != ElasticsearchPhase.APPLYING_CHANGES
                && health != null
                && health.lessThan(previous.health);
    }
}
