/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.esconfig;

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
 * Custom resource declaring settings which are kept in sync on an Elasticsearch cluster through its REST API
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(ElasticsearchConfig.GROUP)
@Version(ElasticsearchConfig.VERSION)
@Plural(ElasticsearchConfig.RESOURCE_PLURAL)
@ShortNames(ElasticsearchConfig.SHORT_NAME)
public class ElasticsearchConfig extends CustomResource<ElasticsearchConfigSpec, ElasticsearchConfigStatus> implements Namespaced {
    public static final String GROUP = Constants.ESCONFIG_GROUP;
    public static final String VERSION = Constants.V1ALPHA1;

    public static final String RESOURCE_KIND = "ElasticsearchConfig";
    public static final String RESOURCE_LIST_KIND = RESOURCE_KIND + "List";
    public static final String RESOURCE_PLURAL = "elasticsearchconfigs";
    public static final String RESOURCE_SINGULAR = "elasticsearchconfig";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;
    public static final String SHORT_NAME = "esc";
    public static final List<String> RESOURCE_SHORTNAMES = List.of(SHORT_NAME);
}
