/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.operator.common.Reconciliation;
import io.vertx.core.Future;

/**
 * Creates clients for the REST API of managed Elasticsearch clusters
 */
public interface ElasticsearchClientProvider {
    /**
     * Creates a client for the given cluster
     *
     * @param reconciliation    Reconciliation marker
     * @param elasticsearch     The Elasticsearch cluster
     *
     * @return  Future with the client. The caller closes the client.
     */
    Future<ElasticsearchClient> createClient(Reconciliation reconciliation, Elasticsearch elasticsearch);
}
