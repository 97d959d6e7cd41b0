/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.elasticsearch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Version;
import io.stackoperator.api.model.common.Constants;

import java.util.List;

/**
 * Custom resource describing an Elasticsearch cluster. The resource is served without the status sub-resource so
 * that the operator persists the status and the orchestration hints annotation in a single write.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(Elasticsearch.GROUP)
@Version(Elasticsearch.VERSION)
@Plural(Elasticsearch.RESOURCE_PLURAL)
@ShortNames(Elasticsearch.SHORT_NAME)
public class Elasticsearch extends CustomResource<ElasticsearchSpec, ElasticsearchStatus> implements Namespaced {
    public static final String GROUP = Constants.ELASTICSEARCH_GROUP;
    public static final String VERSION = Constants.V1;

    public static final String RESOURCE_KIND = "Elasticsearch";
    public static final String RESOURCE_LIST_KIND = RESOURCE_KIND + "List";
    public static final String RESOURCE_PLURAL = "elasticsearches";
    public static final String RESOURCE_SINGULAR = "elasticsearch";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;
    public static final String SHORT_NAME = "es";
    public static final List<String> RESOURCE_SHORTNAMES = List.of(SHORT_NAME);

    /**
     * Label carrying the Elasticsearch version on Pods and on StatefulSet pod templates
     */
    public static final String VERSION_LABEL = GROUP + "/version";

    /**
     * Label carrying the name of the cluster on the resources belonging to it
     */
    public static final String CLUSTER_NAME_LABEL = GROUP + "/cluster-name";
}
