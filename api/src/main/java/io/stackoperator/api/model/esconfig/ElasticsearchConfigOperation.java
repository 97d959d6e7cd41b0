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

/**
 * A single setting declared on an Elasticsearch cluster: the path of the REST endpoint and the JSON body which should
 * be returned by it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"url", "body"})
@EqualsAndHashCode
@ToString
public class ElasticsearchConfigOperation implements KubernetesResource, Serializable {
    private static final long serialVersionUID = 1L;

    private String url;
    private String body;

    public ElasticsearchConfigOperation() {
    }

    public ElasticsearchConfigOperation(String url, String body) {
        this.url = url;
        this.body = body;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }
}
