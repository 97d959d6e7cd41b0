/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator;

import io.stackoperator.operator.common.BackOff;
import io.stackoperator.operator.common.ReconcileResult;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the reconciliations of one kind of resource. At most one reconciliation runs for a given resource at any time;
 * triggers received while it runs are coalesced into a single follow-up reconciliation. Reconciliations asking to be
 * requeued are retried with an exponential back off which is reset once a reconciliation succeeds. Different resources
 * are reconciled concurrently.
 *
 * All the scheduling state is only accessed from the Vert.x context the scheduler was created on.
 */
public class ReconcileScheduler {
    private static final Logger LOGGER = LogManager.getLogger(ReconcileScheduler.class);
    private static final ReconciliationLogger RECONCILIATION_LOGGER = ReconciliationLogger.create(ReconcileScheduler.class);

    /* test */ static final String TRIGGER_REQUEUE = "requeue";

    private final Vertx vertx;
    private final Context context;
    private final String kind;
    private final Function<Reconciliation, Future<ReconcileResult>> reconciler;
    private final Supplier<BackOff> backOffSupplier;

    private final Map<String, KeyState> states = new HashMap<>();

    /**
     * Constructor
     *
     * @param vertx             Vert.x instance
     * @param kind              Kind of the reconciled resources
     * @param reconciler        Runs one reconciliation
     * @param backOffSupplier   Creates the back off used for the retries of one resource
     */
    public ReconcileScheduler(Vertx vertx, String kind, Function<Reconciliation, Future<ReconcileResult>> reconciler, Supplier<BackOff> backOffSupplier) {
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
        this.kind = kind;
        this.reconciler = reconciler;
        this.backOffSupplier = backOffSupplier;
    }

    /**
     * Asks for a reconciliation of a resource
     *
     * @param trigger       What triggered the reconciliation (watch, timer, ...)
     * @param namespace     Namespace of the resource
     * @param name          Name of the resource
     */
    public void enqueue(String trigger, String namespace, String name) {
        context.runOnContext(v -> schedule(trigger, namespace, name));
    }

    private void schedule(String trigger, String namespace, String name) {
        String key = namespace + "/" + name;
        KeyState state = states.computeIfAbsent(key, k -> new KeyState(namespace, name, backOffSupplier.get()));

        if (state.inFlight) {
            LOGGER.debug("{} {} is being reconciled, the {} trigger will run afterwards", kind, key, trigger);
            state.pendingTrigger = trigger;
            return;
        }

        if (state.timerId >= 0) {
            vertx.cancelTimer(state.timerId);
            state.timerId = -1;
        }

        run(key, state, trigger);
    }

    private void run(String key, KeyState state, String trigger) {
        state.inFlight = true;
        Reconciliation reconciliation = new Reconciliation(trigger, kind, state.namespace, state.name);

        Future<ReconcileResult> result;
        try {
            result = reconciler.apply(reconciliation);
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        result.onComplete(res -> context.runOnContext(v -> completed(key, state, reconciliation, res)));
    }

    private void completed(String key, KeyState state, Reconciliation reconciliation, AsyncResult<ReconcileResult> res) {
        state.inFlight = false;
        ReconcileResult result = res.succeeded() ? res.result() : ReconcileResult.requeue(res.cause());

        if (state.pendingTrigger != null) {
            String trigger = state.pendingTrigger;
            state.pendingTrigger = null;
            run(key, state, trigger);
        } else if (result.isRequeue()) {
            long delay = state.backOff.delayMs();
            RECONCILIATION_LOGGER.infoCr(reconciliation, "Reconciliation will be retried in {}ms (attempt {})", delay, state.backOff.attempts());
            state.timerId = vertx.setTimer(delay, id -> {
                state.timerId = -1;
                schedule(TRIGGER_REQUEUE, state.namespace, state.name);
            });
        } else {
            states.remove(key);
        }
    }

    /**
     * Scheduling state of one resource
     */
    private static class KeyState {
        private final String namespace;
        private final String name;
        private final BackOff backOff;
        private boolean inFlight = false;
        private String pendingTrigger = null;
        private long timerId = -1;

        KeyState(String namespace, String name, BackOff backOff) {
            this.namespace = namespace;
            this.name = name;
            this.backOff = backOff;
        }
    }
}
