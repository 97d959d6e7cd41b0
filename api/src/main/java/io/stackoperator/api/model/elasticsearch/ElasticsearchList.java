/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.elasticsearch;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

public class ElasticsearchList extends DefaultKubernetesResourceList<Elasticsearch> {
}
