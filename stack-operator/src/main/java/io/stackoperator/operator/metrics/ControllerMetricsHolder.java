/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Metrics about the reconciliations of one kind of resource
 */
public class ControllerMetricsHolder {
    /**
     * Prefix of all metric names
     */
    public static final String METRICS_PREFIX = "stackoperator.";

    private final MeterRegistry registry;
    private final String kind;

    /**
     * Constructor
     *
     * @param kind      Kind of the reconciled resource
     * @param registry  Meter registry
     */
    public ControllerMetricsHolder(String kind, MeterRegistry registry) {
        this.kind = kind;
        this.registry = registry;
    }

    private Tags tags(String namespace) {
        return Tags.of("kind", kind, "namespace", namespace);
    }

    /**
     * @param namespace     Namespace of the resource
     *
     * @return  Counter of started reconciliations
     */
    public Counter reconciliationsCounter(String namespace) {
        return registry.counter(METRICS_PREFIX + "reconciliations", tags(namespace));
    }

    /**
     * @param namespace     Namespace of the resource
     *
     * @return  Counter of successful reconciliations
     */
    public Counter successfulReconciliationsCounter(String namespace) {
        return registry.counter(METRICS_PREFIX + "reconciliations.successful", tags(namespace));
    }

    /**
     * @param namespace     Namespace of the resource
     *
     * @return  Counter of reconciliations which asked to be retried
     */
    public Counter failedReconciliationsCounter(String namespace) {
        return registry.counter(METRICS_PREFIX + "reconciliations.failed", tags(namespace));
    }

    /**
     * @param namespace     Namespace of the resource
     *
     * @return  Counter of reconciliations skipped because the resource is unmanaged or not compatible
     */
    public Counter skippedReconciliationsCounter(String namespace) {
        return registry.counter(METRICS_PREFIX + "reconciliations.skipped", tags(namespace));
    }

    /**
     * @param namespace     Namespace of the resource
     *
     * @return  Timer measuring the duration of reconciliations
     */
    public Timer reconciliationsTimer(String namespace) {
        return registry.timer(METRICS_PREFIX + "reconciliations.duration", tags(namespace));
    }

    public MeterRegistry registry() {
        return registry;
    }
}
