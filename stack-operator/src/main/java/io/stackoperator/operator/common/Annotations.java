/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.common;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.stackoperator.api.model.common.Constants;

import java.util.Map;

/**
 * Annotations used by the operator and helpers to read them
 */
public class Annotations {
    /**
     * When set to "false", the resource is ignored by the operator
     */
    public static final String ANNO_MANAGED = Constants.COMMON_ANNOTATION_PREFIX + "managed";

    private Annotations() {
    }

    /**
     * Gets a string annotation of a resource
     *
     * @param resource      The resource
     * @param annotation    Name of the annotation
     * @param defaultValue  Value returned when the annotation is missing
     *
     * @return  The annotation value or the default value
     */
    public static String stringAnnotation(HasMetadata resource, String annotation, String defaultValue) {
        Map<String, String> annotations = resource.getMetadata() != null ? resource.getMetadata().getAnnotations() : null;

        if (annotations != null && annotations.containsKey(annotation)) {
            return annotations.get(annotation);
        } else {
            return defaultValue;
        }
    }

    /**
     * Checks whether the user paused the management of the resource by annotating it with
     * {@code common.k8s.elastic.co/managed: "false"}
     *
     * @param resource  The resource
     *
     * @return  True if the resource is not managed by the operator
     */
    public static boolean isUnmanaged(HasMetadata resource) {
        return "false".equalsIgnoreCase(stringAnnotation(resource, ANNO_MANAGED, "true").trim());
    }
}
