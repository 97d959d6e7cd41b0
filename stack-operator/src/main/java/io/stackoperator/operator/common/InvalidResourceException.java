/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.common;

import java.util.List;

/**
 * Thrown when a custom resource fails validation. Retrying the reconciliation cannot help until the resource changes.
 */
public class InvalidResourceException extends RuntimeException {
    private final List<String> errors;

    public InvalidResourceException(String message) {
        this(List.of(message));
    }

    public InvalidResourceException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return  All validation errors found in the resource
     */
    public List<String> getErrors() {
        return errors;
    }
}
