/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esclient;

/**
 * Response of an Elasticsearch REST call
 *
 * @param statusCode    HTTP status code
 * @param body          Response body (empty string when there is no body)
 */
public record ElasticsearchResponse(int statusCode, String body) {
    public static final int OK = 200;
    public static final int NOT_FOUND = 404;

    /**
     * @return  True if the status code is in the 2xx range
     */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
