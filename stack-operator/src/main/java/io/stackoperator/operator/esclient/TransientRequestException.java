/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

/**
 * A request to Elasticsearch failed because of a timeout or a connection problem. Retrying later can succeed.
 */
public class TransientRequestException extends RuntimeException {
    public TransientRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
