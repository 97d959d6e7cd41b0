/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.elasticsearch.hints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stackoperator.api.model.elasticsearch.Elasticsearch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Facts about the orchestration of a cluster which cannot be derived from the observed state and have to survive
 * between reconciliations. They are stored as a flat JSON object in an annotation of the Elasticsearch resource.
 * Instances are immutable.
 */
public final class OrchestrationHints {
    /**
     * Annotation holding the serialized hints
     */
    public static final String ANNOTATION = Elasticsearch.GROUP + "/orchestration-hints";

    /**
     * Transient cluster settings have been removed from the cluster. Once recorded, this hint never changes.
     */
    public static final String NO_TRANSIENT_SETTINGS = "noTransientSettings";

    /**
     * The cluster authenticates Kibana and other clients through service accounts
     */
    public static final String SERVICE_ACCOUNTS = "serviceAccounts";

    /**
     * Hints which keep their first recorded value
     */
    public static final Set<String> SET_ONCE = Set.of(NO_TRANSIENT_SETTINGS);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private static final OrchestrationHints EMPTY = new OrchestrationHints(Map.of());

    private final Map<String, Object> hints;

    private OrchestrationHints(Map<String, Object> hints) {
        this.hints = Collections.unmodifiableMap(new LinkedHashMap<>(hints));
    }

    /**
     * @return  Hints without any entries
     */
    public static OrchestrationHints empty() {
        return EMPTY;
    }

    /**
     * Creates hints from a map of values
     *
     * @param hints     Boolean, string or number values keyed by the hint name
     *
     * @return  The hints
     */
    public static OrchestrationHints of(Map<String, Object> hints) {
        return hints == null || hints.isEmpty() ? EMPTY : new OrchestrationHints(hints);
    }

    /**
     * Loads the hints from the annotations of a resource. A missing or empty annotation means there are no hints.
     *
     * @param annotations   Annotations of the resource (can be null)
     *
     * @return  The hints
     *
     * @throws IllegalArgumentException when the annotation does not contain a JSON object
     */
    public static OrchestrationHints fromAnnotations(Map<String, String> annotations) {
        String serialized = annotations != null ? annotations.get(ANNOTATION) : null;

        if (serialized == null || serialized.isBlank()) {
            return EMPTY;
        }

        try {
            return of(MAPPER.readValue(serialized, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse annotation " + ANNOTATION + ": " + serialized, e);
        }
    }

    /**
     * Merges other hints into these ones. A hint from the other hints replaces the hint of the same name, unless it is
     * a set-once hint which is already present. Hints which are not in the other hints are kept.
     *
     * @param incoming  Hints to merge in
     *
     * @return  New merged hints
     */
    public OrchestrationHints merge(OrchestrationHints incoming) {
        Map<String, Object> merged = new LinkedHashMap<>(hints);

        for (Map.Entry<String, Object> hint : incoming.hints.entrySet()) {
            if (SET_ONCE.contains(hint.getKey()) && merged.containsKey(hint.getKey())) {
                continue;
            }

            merged.put(hint.getKey(), hint.getValue());
        }

        return of(merged);
    }

    /**
     * @param name  Name of the hint
     *
     * @return  The value of the hint or null
     */
    public Object get(String name) {
        return hints.get(name);
    }

    /**
     * @param name  Name of the hint
     *
     * @return  True if the hint is recorded with the boolean value true
     */
    public boolean isSet(String name) {
        return Boolean.TRUE.equals(hints.get(name));
    }

    public Map<String, Object> asMap() {
        return hints;
    }

    public boolean isEmpty() {
        return hints.isEmpty();
    }

    /**
     * @return  The hints serialized as a flat JSON object for the hints annotation
     */
    public String asAnnotation() {
        try {
            return MAPPER.writeValueAsString(hints);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize orchestration hints", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        }

        return hints.equals(((OrchestrationHints) o).hints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hints);
    }

    @Override
    public String toString() {
        return "OrchestrationHints" + hints;
    }
}
