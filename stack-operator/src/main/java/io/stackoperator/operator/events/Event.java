/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.events;

/**
 * Kubernetes event to be emitted on a reconciled resource
 *
 * @param type      Type of the event (Normal or Warning)
 * @param reason    Short machine readable reason
 * @param message   Human readable message
 */
public record Event(String type, String reason, String message) {
    public static final String TYPE_NORMAL = "Normal";
    public static final String TYPE_WARNING = "Warning";

    /**
     * Creates a Normal event
     *
     * @param reason    Reason of the event
     * @param message   Message of the event
     *
     * @return  The event
     */
    public static Event normal(String reason, String message) {
        return new Event(TYPE_NORMAL, reason, message);
    }

    /**
     * Creates a Warning event
     *
     * @param reason    Reason of the event
     * @param message   Message of the event
     *
     * @return  The event
     */
    public static Event warning(String reason, String message) {
        return new Event(TYPE_WARNING, reason, message);
    }
}
