/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.esconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.Map;

/**
 * Structural comparison of JSON documents. Object keys are compared regardless of their order and the actual
 * document may contain more fields than the expected one. Arrays are compared by position and the actual array may
 * be longer than the expected one.
 */
public class JsonSupersetMatcher {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Result of the comparison of two documents
     */
    public enum Match {
        /**
         * Both documents are equal
         */
        FULL_MATCH,
        /**
         * The actual document contains everything from the expected one and more
         */
        SUPERSET_MATCH,
        /**
         * The actual document misses fields or has different values
         */
        NO_MATCH
    }

    private JsonSupersetMatcher() {
    }

    /**
     * Compares two JSON documents
     *
     * @param actual    The observed document
     * @param expected  The desired document
     *
     * @return  How the observed document matches the desired one
     *
     * @throws JsonProcessingException when any of the documents is not valid JSON
     */
    public static Match compare(String actual, String expected) throws JsonProcessingException {
        return compare(MAPPER.readTree(actual), MAPPER.readTree(expected));
    }

    /**
     * Compares two JSON trees
     *
     * @param actual    The observed document
     * @param expected  The desired document
     *
     * @return  How the observed document matches the desired one
     */
    public static Match compare(JsonNode actual, JsonNode expected) {
        if (!contains(actual, expected)) {
            return Match.NO_MATCH;
        }

        return contains(expected, actual) ? Match.FULL_MATCH : Match.SUPERSET_MATCH;
    }

    /**
     * @param actual    The observed document
     * @param expected  The desired document
     *
     * @return  True if the observed document satisfies the desired one
     *
     * @throws JsonProcessingException when any of the documents is not valid JSON
     */
    public static boolean isSatisfied(String actual, String expected) throws JsonProcessingException {
        return compare(actual, expected) != Match.NO_MATCH;
    }

    private static boolean contains(JsonNode actual, JsonNode expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        } else if (expected.isObject()) {
            if (!actual.isObject()) {
                return false;
            }

            Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();

                if (!contains(actual.get(field.getKey()), field.getValue())) {
                    return false;
                }
            }

            return true;
        } else if (expected.isArray()) {
            // Elements are compared by position, trailing actual elements are extra
            if (!actual.isArray() || actual.size() < expected.size()) {
                return false;
            }

            for (int i = 0; i < expected.size(); i++) {
                if (!contains(actual.get(i), expected.get(i))) {
                    return false;
                }
            }

            return true;
        } else if (expected.isNumber()) {
            return actual.isNumber() && actual.decimalValue().compareTo(expected.decimalValue()) == 0;
        } else {
            return expected.equals(actual);
        }
    }
}
