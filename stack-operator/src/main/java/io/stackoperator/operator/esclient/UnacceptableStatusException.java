/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

import io.vertx.core.http.HttpMethod;

/**
 * Elasticsearch answered with a status code the operator cannot act on
 */
public class UnacceptableStatusException extends RuntimeException {
    private final int statusCode;

    public UnacceptableStatusException(HttpMethod method, String path, int statusCode) {
        super("Status " + statusCode + " is unacceptable for " + method + " " + path);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
