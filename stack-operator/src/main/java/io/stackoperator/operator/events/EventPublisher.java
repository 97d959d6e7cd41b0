/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.events;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.stackoperator.operator.common.Reconciliation;
import io.vertx.core.Future;

import java.util.List;

/**
 * Emits events about a reconciled resource
 */
public interface EventPublisher {
    /**
     * Publishes a single event
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          Resource the event is about
     * @param event             The event
     *
     * @return  Future which completes when the event is published
     */
    Future<Void> publish(Reconciliation reconciliation, HasMetadata resource, Event event);

    /**
     * Publishes the events one after the other, keeping their order. Publication stops at the first failure.
     *
     * @param reconciliation    Reconciliation marker
     * @param resource          Resource the events are about
     * @param events            The events
     *
     * @return  Future which completes when all events are published
     */
    default Future<Void> publishAll(Reconciliation reconciliation, HasMetadata resource, List<Event> events) {
        Future<Void> chain = Future.succeededFuture();

        for (Event event : events) {
            chain = chain.compose(i -> publish(reconciliation, resource, event));
        }

        return chain;
    }
}
