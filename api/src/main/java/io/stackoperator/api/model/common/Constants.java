/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.common;

/**
 * Constants shared by the custom resource model classes
 */
public class Constants {
    /**
     * API group of the Elasticsearch resource
     */
    public static final String ELASTICSEARCH_GROUP = "elasticsearch.k8s.elastic.co";

    /**
     * API group of the ElasticsearchConfig resource
     */
    public static final String ESCONFIG_GROUP = "esconfig.k8s.elastic.co";

    /**
     * Prefix used by annotations shared by all resources managed by the operator
     */
    public static final String COMMON_ANNOTATION_PREFIX = "common.k8s.elastic.co/";

    public static final String V1 = "v1";
    public static final String V1ALPHA1 = "v1alpha1";

    private Constants() {
    }
}
