/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.events;

/**
 * Reasons of the events emitted by the operator
 */
public class EventReasons {
    public static final String DELAYED = "Delayed";
    public static final String STALLED = "Stalled";
    public static final String UNHEALTHY = "Unhealthy";
    public static final String VALIDATION = "Validation";
    public static final String ASSOCIATION_ERROR = "AssociationError";
    public static final String COMPATIBILITY_CHECK_ERROR = "CompatibilityCheckError";
    public static final String RECONCILIATION_ERROR = "ReconciliationError";

    private EventReasons() {
    }
}
