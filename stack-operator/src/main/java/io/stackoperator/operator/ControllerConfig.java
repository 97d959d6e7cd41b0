/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator;

import io.stackoperator.operator.common.InvalidConfigurationException;
import io.stackoperator.operator.esclient.ElasticsearchClient;
import io.stackoperator.operator.resource.AbstractNamespacedResourceOperator;
import io.stackoperator.operator.version.MalformedVersionException;
import io.stackoperator.operator.version.Version;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration of the Stack Operator, read from environment variables
 */
public class ControllerConfig {
    /**
     * Namespace to watch. When not set or set to {@code *}, all namespaces are watched.
     */
    public static final String STACK_OPERATOR_NAMESPACE = "STACK_OPERATOR_NAMESPACE";

    /**
     * Timeout of the requests sent to Elasticsearch in milliseconds
     */
    public static final String STACK_OPERATOR_REQUEST_TIMEOUT_MS = "STACK_OPERATOR_REQUEST_TIMEOUT_MS";

    /**
     * Interval of the periodic reconciliation of all resources in milliseconds
     */
    public static final String STACK_OPERATOR_FULL_RECONCILIATION_INTERVAL_MS = "STACK_OPERATOR_FULL_RECONCILIATION_INTERVAL_MS";

    /**
     * Overrides the version of the operator recorded on the reconciled resources
     */
    public static final String STACK_OPERATOR_VERSION = "STACK_OPERATOR_VERSION";

    public static final long DEFAULT_REQUEST_TIMEOUT_MS = ElasticsearchClient.DEFAULT_REQUEST_TIMEOUT_MS;
    public static final long DEFAULT_FULL_RECONCILIATION_INTERVAL_MS = 120_000L;

    private final String namespace;
    private final long requestTimeoutMs;
    private final long fullReconciliationIntervalMs;
    private final Version version;

    /**
     * Constructor
     *
     * @param namespace                     Namespace to watch or {@code *} for all namespaces
     * @param requestTimeoutMs              Timeout of the requests sent to Elasticsearch
     * @param fullReconciliationIntervalMs  Interval of the periodic reconciliation
     * @param version                       Version of the operator
     */
    public ControllerConfig(String namespace, long requestTimeoutMs, long fullReconciliationIntervalMs, Version version) {
        this.namespace = namespace;
        this.requestTimeoutMs = requestTimeoutMs;
        this.fullReconciliationIntervalMs = fullReconciliationIntervalMs;
        this.version = version;
    }

    /**
     * Loads the configuration from a map of environment variables
     *
     * @param map   Environment variables
     *
     * @return  The configuration
     *
     * @throws InvalidConfigurationException when any of the values is not valid
     */
    public static ControllerConfig buildFromMap(Map<String, String> map) {
        String namespace = map.get(STACK_OPERATOR_NAMESPACE);
        if (namespace == null || namespace.isBlank()) {
            namespace = AbstractNamespacedResourceOperator.ANY_NAMESPACE;
        }

        long requestTimeoutMs = parsePositiveLong(map, STACK_OPERATOR_REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS);
        long fullReconciliationIntervalMs = parsePositiveLong(map, STACK_OPERATOR_FULL_RECONCILIATION_INTERVAL_MS, DEFAULT_FULL_RECONCILIATION_INTERVAL_MS);

        String versionValue = map.get(STACK_OPERATOR_VERSION);
        if (versionValue == null || versionValue.isBlank()) {
            versionValue = defaultVersion();
        }

        Version version;
        try {
            version = Version.parse(versionValue.trim());
        } catch (MalformedVersionException e) {
            throw new InvalidConfigurationException("Failed to parse the operator version " + versionValue, e);
        }

        return new ControllerConfig(namespace.trim(), requestTimeoutMs, fullReconciliationIntervalMs, version);
    }

    private static long parsePositiveLong(Map<String, String> map, String name, long defaultValue) {
        String value = map.get(name);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            long parsed = Long.parseLong(value.trim());

            if (parsed <= 0) {
                throw new InvalidConfigurationException(name + " must be a positive number but was " + value);
            }

            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse " + name + " with value " + value, e);
        }
    }

    /**
     * The version of the operator: the implementation version of the jar when available, the version of the build
     * otherwise
     *
     * @return  The version of the operator
     */
    static String defaultVersion() {
        String implementationVersion = ControllerConfig.class.getPackage().getImplementationVersion();

        if (implementationVersion != null) {
            return implementationVersion;
        }

        try (InputStream is = ControllerConfig.class.getResourceAsStream("/.properties")) {
            if (is == null) {
                throw new InvalidConfigurationException("Failed to find the version of the operator");
            }

            Properties properties = new Properties();
            properties.load(is);
            String version = properties.getProperty("version");

            if (version == null) {
                throw new InvalidConfigurationException("Failed to find the version of the operator");
            }

            return version;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return  Namespace to watch or {@code *} when all namespaces are watched
     */
    public String getNamespace() {
        return namespace;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public long getFullReconciliationIntervalMs() {
        return fullReconciliationIntervalMs;
    }

    public Version getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "ControllerConfig(" +
                "namespace=" + namespace +
                ",requestTimeoutMs=" + requestTimeoutMs +
                ",fullReconciliationIntervalMs=" + fullReconciliationIntervalMs +
                ",version=" + version +
                ")";
    }
}
