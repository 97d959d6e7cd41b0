/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.common;

import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identifies one reconciliation pass of a single custom resource. It is passed explicitly through the reconciliation
 * and used by the {@link ReconciliationLogger} to tag every log line with the resource it belongs to.
 */
public class Reconciliation {
    private static final AtomicInteger IDS = new AtomicInteger();

    private final String trigger;
    private final String kind;
    private final String namespace;
    private final String name;
    private final int id;
    private final Marker marker;

    /**
     * Constructs the reconciliation
     *
     * @param trigger       What triggered the reconciliation (watch, timer, requeue, ...)
     * @param kind          Kind of the reconciled resource
     * @param namespace     Namespace of the reconciled resource
     * @param name          Name of the reconciled resource
     */
    public Reconciliation(String trigger, String kind, String namespace, String name) {
        this.trigger = trigger;
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.id = IDS.getAndIncrement();
        this.marker = MarkerManager.getMarker(this.kind + "(" + this.namespace + "/" + this.name + ")");
    }

    public String kind() {
        return kind;
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    public String trigger() {
        return trigger;
    }

    /**
     * @return  The key identifying the reconciled resource, the same for all reconciliations of the resource
     */
    public String key() {
        return kind + "/" + namespace + "/" + name;
    }

    public Marker getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return "Reconciliation #" + id + "(" + trigger + ") " + kind + "(" + namespace + "/" + name + ")";
    }
}
