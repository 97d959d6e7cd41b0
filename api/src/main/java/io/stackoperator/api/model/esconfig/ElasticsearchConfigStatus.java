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
 * Status of the ElasticsearchConfig resource
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"controllerVersion"})
@EqualsAndHashCode
@ToString
public class ElasticsearchConfigStatus implements KubernetesResource, Serializable {
    private static final long serialVersionUID = 1L;

    private String controllerVersion;

    /**
     * @return  Version of the controller which last reconciled the resource successfully
     */
    public String getControllerVersion() {
        return controllerVersion;
    }

    public void setControllerVersion(String controllerVersion) {
        this.controllerVersion = controllerVersion;
    }
}
