/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.common;

/**
 * Outcome of a reconciliation handed back to the scheduler: either the resource is converged (or cannot be helped by
 * retrying) or the reconciliation should be retried later.
 */
public final class ReconcileResult {
    private static final ReconcileResult NO_REQUEUE = new ReconcileResult(false, false, null);
    private static final ReconcileResult SKIPPED = new ReconcileResult(false, true, null);

    private final boolean requeue;
    private final boolean skipped;
    private final Throwable cause;

    private ReconcileResult(boolean requeue, boolean skipped, Throwable cause) {
        this.requeue = requeue;
        this.skipped = skipped;
        this.cause = cause;
    }

    /**
     * @return  Result which does not ask for another reconciliation
     */
    public static ReconcileResult noRequeue() {
        return NO_REQUEUE;
    }

    /**
     * @return  Result of a reconciliation which left the resource alone (unmanaged or owned by an incompatible
     *          controller). It is not retried.
     */
    public static ReconcileResult skipped() {
        return SKIPPED;
    }

    /**
     * @param cause     The error which made the reconciliation fail
     *
     * @return  Result asking the scheduler to retry the reconciliation
     */
    public static ReconcileResult requeue(Throwable cause) {
        return new ReconcileResult(true, false, cause);
    }

    public boolean isRequeue() {
        return requeue;
    }

    public boolean isSkipped() {
        return skipped;
    }

    /**
     * @return  The error which made the reconciliation fail, or null
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        if (requeue) {
            return "ReconcileResult(requeue, cause=" + cause + ")";
        }

        return skipped ? "ReconcileResult(skipped)" : "ReconcileResult(done)";
    }
}
