/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.events;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;
import io.stackoperator.operator.ResourceUtils;
import io.stackoperator.operator.common.Reconciliation;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

@EnableKubernetesMockClient(crud = true)
@ExtendWith(VertxExtension.class)
public class KubernetesEventPublisherTest {
    private static final String NAMESPACE = "events";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);

    private static KubernetesClient client;
    private static Vertx vertx;

    @BeforeAll
    public static void beforeAll() {
        vertx = Vertx.vertx();
    }

    @AfterAll
    public static void afterAll() {
        if (vertx != null) {
            vertx.close();
        }
    }

    @Test
    public void testEventsAreCreatedOnTheInvolvedResource(VertxTestContext context) {
        Elasticsearch es = ResourceUtils.elasticsearch(NAMESPACE, "my-cluster", "8.11.0", 3);
        Reconciliation reconciliation = new Reconciliation("test", Elasticsearch.RESOURCE_KIND, NAMESPACE, "my-cluster");
        EventPublisher publisher = new KubernetesEventPublisher(vertx, client, "stack-operator", CLOCK);

        publisher.publishAll(reconciliation, es, List.of(
                        Event.warning(EventReasons.UNHEALTHY, "Elasticsearch cluster health degraded"),
                        Event.normal(EventReasons.DELAYED, "Requested topology change delayed by data migration")))
                .onComplete(context.succeeding(v -> context.verify(() -> {
                    List<io.fabric8.kubernetes.api.model.Event> events = client.v1().events().inNamespace(NAMESPACE).list().getItems().stream()
                            .sorted(Comparator.comparing(io.fabric8.kubernetes.api.model.Event::getReason))
                            .collect(Collectors.toList());

                    assertThat(events, hasSize(2));

                    io.fabric8.kubernetes.api.model.Event delayed = events.get(0);
                    assertThat(delayed.getReason(), is(EventReasons.DELAYED));
                    assertThat(delayed.getType(), is(Event.TYPE_NORMAL));

                    io.fabric8.kubernetes.api.model.Event unhealthy = events.get(1);
                    assertThat(unhealthy.getType(), is(Event.TYPE_WARNING));
                    assertThat(unhealthy.getMessage(), is("Elasticsearch cluster health degraded"));
                    assertThat(unhealthy.getMetadata().getName(), startsWith("my-cluster-"));
                    assertThat(unhealthy.getInvolvedObject().getKind(), is(Elasticsearch.RESOURCE_KIND));
                    assertThat(unhealthy.getInvolvedObject().getName(), is("my-cluster"));
                    assertThat(unhealthy.getSource().getComponent(), is("stack-operator"));
                    assertThat(unhealthy.getLastTimestamp(), is("2024-03-01T10:15:30Z"));
                    context.completeNow();
                })));
    }
}
