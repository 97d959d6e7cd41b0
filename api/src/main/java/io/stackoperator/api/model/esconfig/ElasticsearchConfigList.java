/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.api.model.esconfig;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

public class ElasticsearchConfigList extends DefaultKubernetesResourceList<ElasticsearchConfig> {
}
