/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Elasticsearch client answering from a table of canned responses and recording the requests it receives. Requests
 * without a canned response get a 404 for GET and a 200 for other methods.
 */
public class MockElasticsearchClient implements ElasticsearchClient {
    private final Map<String, ElasticsearchResponse> responses = new HashMap<>();
    private final Map<String, Throwable> failures = new HashMap<>();
    private final List<Request> requests = new ArrayList<>();
    private int closed = 0;

    public record Request(HttpMethod method, String path, String body, long timeoutMs) {
    }

    private static String key(HttpMethod method, String path) {
        return method.name() + " " + path;
    }

    public MockElasticsearchClient respond(HttpMethod method, String path, int statusCode, String body) {
        responses.put(key(method, path), new ElasticsearchResponse(statusCode, body));
        return this;
    }

    public MockElasticsearchClient fail(HttpMethod method, String path, Throwable error) {
        failures.put(key(method, path), error);
        return this;
    }

    @Override
    public synchronized Future<ElasticsearchResponse> request(HttpMethod method, String path, String body, long timeoutMs) {
        requests.add(new Request(method, path, body, timeoutMs));

        Throwable failure = failures.get(key(method, path));
        if (failure != null) {
            return Future.failedFuture(failure);
        }

        ElasticsearchResponse response = responses.get(key(method, path));
        if (response == null) {
            response = HttpMethod.GET.equals(method)
                    ? new ElasticsearchResponse(ElasticsearchResponse.NOT_FOUND, "{}")
                    : new ElasticsearchResponse(ElasticsearchResponse.OK, "{\"acknowledged\":true}");
        }

        return Future.succeededFuture(response);
    }

    @Override
    public synchronized void close() {
        closed++;
    }

    public synchronized List<Request> requests() {
        return List.copyOf(requests);
    }

    public synchronized List<Request> requests(HttpMethod method) {
        return requests.stream().filter(r -> r.method().equals(method)).toList();
    }

    public synchronized int closed() {
        return closed;
    }
}
