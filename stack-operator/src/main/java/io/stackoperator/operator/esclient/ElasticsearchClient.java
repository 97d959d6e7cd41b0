/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;

/**
 * Client for the REST API of one Elasticsearch cluster
 */
public interface ElasticsearchClient {
    /**
     * Default timeout of a single request
     */
    long DEFAULT_REQUEST_TIMEOUT_MS = 60_000L;

    /**
     * Sends a request to the cluster. Any HTTP status code completes the future successfully; the future fails with
     * a {@link TransientRequestException} when the request could not be completed in time or at all.
     *
     * @param method        HTTP method
     * @param path          Path of the endpoint, starting with a slash
     * @param body          Request body or null
     * @param timeoutMs     Timeout of the request
     *
     * @return  Future with the response
     */
    Future<ElasticsearchResponse> request(HttpMethod method, String path, String body, long timeoutMs);

    /**
     * Releases the resources held by the client
     */
    default void close() {
    }
}
