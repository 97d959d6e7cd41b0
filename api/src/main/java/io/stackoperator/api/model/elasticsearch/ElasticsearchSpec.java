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
import java.util.ArrayList;
import java.util.List;

/**
 * Desired state of an Elasticsearch cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"version", "nodeSets"})
@EqualsAndHashCode
@ToString
public class ElasticsearchSpec implements KubernetesResource, Serializable {
    private static final long serialVersionUID = 1L;

    private String version;
    private List<NodeSet> nodeSets = new ArrayList<>();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<NodeSet> getNodeSets() {
        return nodeSets;
    }

    public void setNodeSets(List<NodeSet> nodeSets) {
        this.nodeSets = nodeSets;
    }
}
