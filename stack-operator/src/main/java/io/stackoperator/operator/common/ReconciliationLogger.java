/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logger used from within a reconciliation. Every message is prefixed with the reconciliation and logged with its
 * marker so the log lines of one custom resource can be filtered.
 */
public class ReconciliationLogger {
    private final Logger logger;

    private ReconciliationLogger(Logger logger) {
        this.logger = logger;
    }

    /**
     * Creates a new reconciliation logger
     *
     * @param name  Name of the logger, typically the class name
     *
     * @return  The reconciliation logger
     */
    public static ReconciliationLogger create(String name) {
        return new ReconciliationLogger(LogManager.getLogger(name));
    }

    /**
     * Creates a new reconciliation logger
     *
     * @param clazz Class using the logger
     *
     * @return  The reconciliation logger
     */
    public static ReconciliationLogger create(Class<?> clazz) {
        return create(clazz.getName());
    }

    private void logCr(Level level, Reconciliation reconciliation, String message, Object... params) {
        if (logger.isEnabled(level)) {
            logger.log(level, reconciliation.getMarker(), reconciliation + ": " + message, params);
        }
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    public void traceCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.TRACE, reconciliation, message, params);
    }

    public void debugCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.DEBUG, reconciliation, message, params);
    }

    public void infoCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.INFO, reconciliation, message, params);
    }

    public void warnCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.WARN, reconciliation, message, params);
    }

    public void errorCr(Reconciliation reconciliation, String message, Object... params) {
        logCr(Level.ERROR, reconciliation, message, params);
    }
}
