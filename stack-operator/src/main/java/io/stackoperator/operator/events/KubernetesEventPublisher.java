/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.events;

import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.stackoperator.operator.common.Reconciliation;
import io.stackoperator.operator.common.ReconciliationLogger;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Publishes events as core/v1 Kubernetes Events attached to the involved resource
 */
public class KubernetesEventPublisher implements EventPublisher {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(KubernetesEventPublisher.class);

    private final Vertx vertx;
    private final KubernetesClient client;
    private final String component;
    private final Clock clock;

    /**
     * Constructor
     *
     * @param vertx         Vert.x instance
     * @param client        Kubernetes client
     * @param component     Name of the component reported as event source
     * @param clock         Clock used for the event timestamps
     */
    public KubernetesEventPublisher(Vertx vertx, KubernetesClient client, String component, Clock clock) {
        this.vertx = vertx;
        this.client = client;
        this.component = component;
        this.clock = clock;
    }

    @Override
    public Future<Void> publish(Reconciliation reconciliation, HasMetadata resource, Event event) {
        String namespace = resource.getMetadata().getNamespace();
        String timestamp = DateTimeFormatter.ISO_INSTANT.format(clock.instant());

        io.fabric8.kubernetes.api.model.Event kubeEvent = new EventBuilder()
                .withNewMetadata()
                    .withGenerateName(resource.getMetadata().getName() + "-")
                    .withNamespace(namespace)
                .endMetadata()
                .withInvolvedObject(new ObjectReferenceBuilder()
                        .withApiVersion(resource.getApiVersion())
                        .withKind(resource.getKind())
                        .withName(resource.getMetadata().getName())
                        .withNamespace(namespace)
                        .withUid(resource.getMetadata().getUid())
                        .withResourceVersion(resource.getMetadata().getResourceVersion())
                        .build())
                .withType(event.type())
                .withReason(event.reason())
                .withMessage(event.message())
                .withFirstTimestamp(timestamp)
                .withLastTimestamp(timestamp)
                .withCount(1)
                .withNewSource()
                    .withComponent(component)
                .endSource()
                .build();

        return vertx.executeBlocking(() -> {
            client.v1().events().inNamespace(namespace).resource(kubeEvent).create();
            LOGGER.debugCr(reconciliation, "Published {} event {}: {}", event.type().toLowerCase(Locale.ROOT), event.reason(), event.message());
            return null;
        });
    }
}
