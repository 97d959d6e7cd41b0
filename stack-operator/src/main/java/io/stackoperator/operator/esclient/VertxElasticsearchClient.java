/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.net.PemTrustOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Elasticsearch client using the Vert.x HTTP client
 */
public class VertxElasticsearchClient implements ElasticsearchClient {
    private static final Logger LOGGER = LogManager.getLogger(VertxElasticsearchClient.class);

    private final Vertx vertx;
    private final HttpClient httpClient;
    private final String host;
    private final int port;
    private final String authorization;

    /**
     * Constructor
     *
     * @param vertx         Vert.x instance
     * @param host          Host of the Elasticsearch HTTP service
     * @param port          Port of the Elasticsearch HTTP service
     * @param caCert        PEM encoded CA certificate used to trust the cluster, or null for plain HTTP
     * @param username      User name for basic authentication, or null
     * @param password      Password for basic authentication
     */
    public VertxElasticsearchClient(Vertx vertx, String host, int port, String caCert, String username, String password) {
        HttpClientOptions options = new HttpClientOptions()
                .setDefaultHost(host)
                .setDefaultPort(port);

        if (caCert != null) {
            options.setSsl(true)
                    .setTrustOptions(new PemTrustOptions().addCertValue(Buffer.buffer(caCert)));
        }

        this.vertx = vertx;
        this.httpClient = vertx.createHttpClient(options);
        this.host = host;
        this.port = port;
        this.authorization = username != null
                ? "Basic " + Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8))
                : null;
    }

    @Override
    public Future<ElasticsearchResponse> request(HttpMethod method, String path, String body, long timeoutMs) {
        RequestOptions options = new RequestOptions()
                .setMethod(method)
                .setHost(host)
                .setPort(port)
                .setURI(path)
                .setConnectTimeout(timeoutMs)
                .setIdleTimeout(timeoutMs);

        if (authorization != null) {
            options.putHeader(HttpHeaders.AUTHORIZATION, authorization);
        }

        if (body != null) {
            options.putHeader(HttpHeaders.CONTENT_TYPE, "application/json");
        }

        LOGGER.trace("Sending {} {}", method, path);

        // The idle timeout does not cover a server which keeps sending data slowly
        Promise<ElasticsearchResponse> result = Promise.promise();
        AtomicReference<HttpClientRequest> sent = new AtomicReference<>();
        long timerId = vertx.setTimer(timeoutMs, id -> {
            HttpClientRequest request = sent.get();
            if (request != null) {
                request.reset();
            }

            result.tryFail(new TimeoutException("No complete response within " + timeoutMs + "ms"));
        });

        httpClient.request(options)
                .compose(request -> {
                    sent.set(request);
                    return body != null ? request.send(body) : request.send();
                })
                .compose(response -> response.body()
                        .map(responseBody -> new ElasticsearchResponse(response.statusCode(), responseBody.toString(StandardCharsets.UTF_8))))
                .onComplete(res -> {
                    vertx.cancelTimer(timerId);
                    if (res.succeeded()) {
                        result.tryComplete(res.result());
                    } else {
                        result.tryFail(res.cause());
                    }
                });

        return result.future()
                .recover(error -> Future.failedFuture(
                        new TransientRequestException("Request " + method + " " + path + " to " + host + ":" + port + " failed", error)));
    }

    @Override
    public void close() {
        httpClient.close();
    }
}
