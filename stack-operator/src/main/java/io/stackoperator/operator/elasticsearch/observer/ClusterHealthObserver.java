/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.observer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.stackoperator.operator.esclient.ElasticsearchClientProvider;
import io.stackoperator.operator.esclient.ElasticsearchResponse;
import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;

/**
 * Observes the health of Elasticsearch clusters through their cluster health API. The observation is best effort: when
 * the cluster cannot be reached, an empty observation is returned.
 */
public class ClusterHealthObserver {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ClusterHealthObserver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /* test */ static final String HEALTH_PATH = "/_cluster/health";

    private final ElasticsearchClientProvider clientProvider;
    private final long requestTimeoutMs;

    /**
     * Constructor
     *
     * @param clientProvider    Creates clients for the Elasticsearch clusters
     * @param requestTimeoutMs  Timeout of the health request
     */
    public ClusterHealthObserver(ElasticsearchClientProvider clientProvider, long requestTimeoutMs) {
        this.clientProvider = clientProvider;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Observes a cluster
     *
     * @param reconciliation    Reconciliation marker
     * @param elasticsearch     The Elasticsearch cluster
     *
     * @return  Future with the observed state. The future does not fail.
     */
    public Future<ObservedState> observe(Reconciliation reconciliation, Elasticsearch elasticsearch) {
        return clientProvider.createClient(reconciliation, elasticsearch)
                .compose(client -> client.request(HttpMethod.GET, HEALTH_PATH, null, requestTimeoutMs)
                        .onComplete(i -> client.close()))
                .map(response -> parse(reconciliation, response))
                .recover(error -> {
                    LOGGER.debugCr(reconciliation, "Failed to observe the cluster health", error);
                    return Future.succeededFuture(ObservedState.empty());
                });
    }

    private static ObservedState parse(Reconciliation reconciliation, ElasticsearchResponse response) {
        if (response.statusCode() != ElasticsearchResponse.OK) {
            LOGGER.debugCr(reconciliation, "Cluster health request returned status {}", response.statusCode());
            return ObservedState.empty();
        }

        try {
            JsonNode status = MAPPER.readTree(response.body()).path("status");
            return status.isTextual() ? new ObservedState(new ClusterHealth(status.asText())) : ObservedState.empty();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.debugCr(reconciliation, "Failed to parse the cluster health", e);
            return ObservedState.empty();
        }
    }
}
