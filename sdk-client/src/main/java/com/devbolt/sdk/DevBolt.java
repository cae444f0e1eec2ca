package com.devbolt.sdk;

import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide default {@link DevBoltClient}.
 *
 * <pre>{@code
 * DevBolt.initialize(ClientOptions.fromEnvironment());
 * if (DevBolt.isEnabled("new_checkout", ctx)) { ... }
 * }</pre>
 */
public final class DevBolt {

    private static final Logger LOG = LoggerFactory.getLogger(DevBolt.class);

    static final String NOT_INITIALIZED = "DevBolt not initialized. Call initialize() first.";

    private static volatile DevBoltClient defaultInstance;

    private DevBolt() {
        // static facade: not instantiable
    }

    /**
     * Create the default client, closing any previous one first.
     *
     * @param options client configuration
     * @return the new default client
     */
    public static synchronized DevBoltClient initialize(ClientOptions options) {
        if (defaultInstance != null) {
            try {
                defaultInstance.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing previous DevBolt client: {}", e.getMessage(), e);
            }
            defaultInstance = null;
        }
        defaultInstance = new DevBoltClient(options);
        return defaultInstance;
    }

    public static DevBoltClient initialize() {
        return initialize(ClientOptions.defaults());
    }

    public static boolean isEnabled(String flagName, EvaluationContext context) {
        return getInstance().isEnabled(flagName, context);
    }

    public static boolean isEnabled(String flagName) {
        return getInstance().isEnabled(flagName);
    }

    public static EvaluationResult evaluate(String flagName, EvaluationContext context) {
        return getInstance().evaluate(flagName, context);
    }

    /**
     * @return the default client
     * @throws IllegalStateException if {@link #initialize(ClientOptions)} has
     *                               not been called
     */
    public static DevBoltClient getInstance() {
        DevBoltClient instance = defaultInstance;
        if (instance == null) {
            throw new IllegalStateException(NOT_INITIALIZED);
        }
        return instance;
    }

    /**
     * Close and forget the default client. Does nothing if there is none.
     */
    public static synchronized void destroy() {
        if (defaultInstance != null) {
            defaultInstance.close();
            defaultInstance = null;
        }
    }

    public static boolean isInitialized() {
        DevBoltClient instance = defaultInstance;
        return instance != null && instance.isInitialized();
    }
}
