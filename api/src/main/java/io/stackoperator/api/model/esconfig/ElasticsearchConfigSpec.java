/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.esconfig;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.KubernetesResource;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Desired settings of an Elasticsearch cluster. Operations are applied in the declared order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"elasticsearchRef", "operations"})
@EqualsAndHashCode
@ToString
public class ElasticsearchConfigSpec implements KubernetesResource, Serializable {
    private static final long serialVersionUID = 1L;

    private ElasticsearchRef elasticsearchRef;
    private List<ElasticsearchConfigOperation> operations = new ArrayList<>();

    public ElasticsearchRef getElasticsearchRef() {
        return elasticsearchRef;
    }

    public void setElasticsearchRef(ElasticsearchRef elasticsearchRef) {
        this.elasticsearchRef = elasticsearchRef;
    }

    public List<ElasticsearchConfigOperation> getOperations() {
        return operations;
    }

    public void setOperations(List<ElasticsearchConfigOperation> operations) {
        this.operations = operations;
    }
}
