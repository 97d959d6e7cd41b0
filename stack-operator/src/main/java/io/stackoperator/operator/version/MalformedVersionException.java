/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.version;

/**
 * Thrown when a version string cannot be parsed
 */
public class MalformedVersionException extends RuntimeException {
    public MalformedVersionException(String version, String reason) {
        super("Malformed version '" + version + "': " + reason);
    }

    public MalformedVersionException(String version, Throwable cause) {
        super("Malformed version '" + version + "'", cause);
    }
}
