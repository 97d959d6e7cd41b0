/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stackoperator.api.model.esconfig.ElasticsearchConfig;
import io.stackoperator.api.model.esconfig.ElasticsearchConfigOperation;
import io.stackoperator.api.model.esconfig.ElasticsearchConfigSpec;
import io.stackoperator.operator.common.InvalidResourceException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Semantic validation of the ElasticsearchConfig resource
 */
public class ElasticsearchConfigValidator {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ElasticsearchConfigValidator() {
    }

    /**
     * Validates the resource
     *
     * @param esc   The resource
     *
     * @throws InvalidResourceException with all errors found when the resource is not valid
     */
    public static void validate(ElasticsearchConfig esc) {
        List<String> errors = new ArrayList<>();
        ElasticsearchConfigSpec spec = esc.getSpec();

        if (spec == null) {
            throw new InvalidResourceException("ElasticsearchConfig " + esc.getMetadata().getName() + " has no spec");
        }

        if (spec.getElasticsearchRef() == null
                || spec.getElasticsearchRef().getName() == null
                || spec.getElasticsearchRef().getName().isBlank()) {
            errors.add("spec.elasticsearchRef.name is required");
        }

        List<ElasticsearchConfigOperation> operations = spec.getOperations() != null ? spec.getOperations() : List.of();
        Set<String> urls = new HashSet<>();

        for (int i = 0; i < operations.size(); i++) {
            ElasticsearchConfigOperation operation = operations.get(i);
            String field = "spec.operations[" + i + "]";

            validateUrl(field, operation.getUrl(), errors);
            validateBody(field, operation.getBody(), errors);

            if (operation.getUrl() != null && !urls.add(operation.getUrl())) {
                errors.add(field + ".url " + operation.getUrl() + " is declared more than once");
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidResourceException(errors);
        }
    }

    private static void validateUrl(String field, String url, List<String> errors) {
        if (url == null || url.isBlank()) {
            errors.add(field + ".url is required");
            return;
        }

        try {
            URI uri = new URI(url);

            if (uri.getScheme() != null || uri.getHost() != null) {
                errors.add(field + ".url " + url + " must be a path relative to the Elasticsearch endpoint");
            } else if (!url.startsWith("/")) {
                errors.add(field + ".url " + url + " must start with /");
            }
        } catch (URISyntaxException e) {
            errors.add(field + ".url " + url + " is not a valid URL: " + e.getReason());
        }
    }

    private static void validateBody(String field, String body, List<String> errors) {
        if (body == null || body.isBlank()) {
            errors.add(field + ".body is required");
            return;
        }

        try {
            JsonNode node = MAPPER.readTree(body);

            if (!node.isObject() && !node.isArray()) {
                errors.add(field + ".body must be a JSON object or array");
            }
        } catch (JsonProcessingException e) {
            errors.add(field + ".body is not valid JSON: " + e.getOriginalMessage());
        }
    }
}
