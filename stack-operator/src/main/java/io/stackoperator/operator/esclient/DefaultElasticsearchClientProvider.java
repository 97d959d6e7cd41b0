/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

import io.fabric8.kubernetes.api.model.Secret;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.stackoperator.operator.resource.SecretOperator;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.NoSuchElementException;

/**
 * Creates clients talking HTTPS to the {@code <cluster>-es-http} service of a cluster. The cluster CA is read from
 * the {@code <cluster>-es-http-certs-public} Secret and the credentials of the built-in superuser from the
 * {@code <cluster>-es-elastic-user} Secret.
 */
public class DefaultElasticsearchClientProvider implements ElasticsearchClientProvider {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DefaultElasticsearchClientProvider.class);

    /**
     * Port of the Elasticsearch HTTP service
     */
    public static final int HTTP_PORT = 9200;

    /**
     * Name of the built-in superuser
     */
    public static final String ELASTIC_USER = "elastic";

    private static final String CA_KEY = "ca.crt";

    private final Vertx vertx;
    private final SecretOperator secretOperator;

    /**
     * Constructor
     *
     * @param vertx             Vert.x instance
     * @param secretOperator    Operator for reading the Secrets of the cluster
     */
    public DefaultElasticsearchClientProvider(Vertx vertx, SecretOperator secretOperator) {
        this.vertx = vertx;
        this.secretOperator = secretOperator;
    }

    public static String httpServiceName(String clusterName) {
        return clusterName + "-es-http";
    }

    public static String httpCertsPublicSecretName(String clusterName) {
        return clusterName + "-es-http-certs-public";
    }

    public static String elasticUserSecretName(String clusterName) {
        return clusterName + "-es-elastic-user";
    }

    @Override
    public Future<ElasticsearchClient> createClient(Reconciliation reconciliation, Elasticsearch elasticsearch) {
        String namespace = elasticsearch.getMetadata().getNamespace();
        String name = elasticsearch.getMetadata().getName();
        String host = httpServiceName(name) + "." + namespace + ".svc";

        return Future.all(secretOperator.getAsync(namespace, httpCertsPublicSecretName(name)),
                        secretOperator.getAsync(namespace, elasticUserSecretName(name)))
                .compose(secrets -> {
                    Secret caSecret = secrets.resultAt(0);
                    Secret userSecret = secrets.resultAt(1);

                    if (userSecret == null) {
                        return Future.failedFuture(new NoSuchElementException("Secret " + elasticUserSecretName(name) + " not found in namespace " + namespace));
                    }

                    String password = decode(userSecret, ELASTIC_USER);
                    if (password == null) {
                        return Future.failedFuture(new NoSuchElementException("Secret " + elasticUserSecretName(name) + " has no " + ELASTIC_USER + " key"));
                    }

                    String caCert = caSecret != null ? decode(caSecret, CA_KEY) : null;
                    if (caCert == null) {
                        LOGGER.warnCr(reconciliation, "No CA certificate found in Secret {}, using plain HTTP for {}", httpCertsPublicSecretName(name), host);
                    }

                    LOGGER.debugCr(reconciliation, "Creating Elasticsearch client for {}:{}", host, HTTP_PORT);
                    return Future.succeededFuture(new VertxElasticsearchClient(vertx, host, HTTP_PORT, caCert, ELASTIC_USER, password));
                });
    }

    private static String decode(Secret secret, String key) {
        if (secret.getData() == null || secret.getData().get(key) == null) {
            return null;
        }

        return new String(Base64.getDecoder().decode(secret.getData().get(key)), StandardCharsets.UTF_8);
    }
}
