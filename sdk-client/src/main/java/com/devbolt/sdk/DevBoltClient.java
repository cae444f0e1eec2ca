package com.devbolt.sdk;

import com.devbolt.core.config.ConfigParser;
import com.devbolt.core.engine.EngineOptions;
import com.devbolt.core.engine.FlagEngine;
import com.devbolt.core.exception.FlagNotFoundException;
import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationResult;
import com.devbolt.core.model.FlagConfig;
import com.devbolt.core.model.FlagsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Application-facing feature flag client backed by a YAML file.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>The constructor locates and loads the config file. A failure is passed
 * to the error callback and leaves the client uninitialized; with
 * {@code throwOnError} it is rethrown instead.</li>
 * <li>With {@code autoReload}, a {@link ConfigFileWatcher} reloads the file
 * after every change. A reload that fails keeps the previous config.</li>
 * <li>{@link #close()} stops the watcher and returns the client to the
 * uninitialized state.</li>
 * </ol>
 *
 * <h3>Never fails the caller</h3>
 * <p>
 * Unless {@code throwOnError} is set, {@link #evaluate(String, EvaluationContext)}
 * always returns a result: when it cannot evaluate a flag it answers with the
 * configured fallback for that flag, or {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
public class DevBoltClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DevBoltClient.class);

    static final String REASON_NOT_INITIALIZED = "Client not initialized, using fallback";
    static final String REASON_NOT_FOUND = "Flag not found, using fallback";
    static final String REASON_ERROR_PREFIX = "Error evaluating flag: ";

    private final ClientOptions options;
    private final Consumer<Exception> errorHandler;
    private final Clock clock = Clock.systemUTC();
    private final AtomicInteger errorCount = new AtomicInteger();

    private volatile FlagEngine engine;
    private volatile boolean initialized;
    private volatile boolean closed;
    private volatile Path configPath;
    private volatile Instant lastLoadTime;
    private ConfigFileWatcher watcher;

    public DevBoltClient() {
        this(ClientOptions.defaults());
    }

    /**
     * @param options client configuration
     * @throws RuntimeException the load failure, only when
     *                          {@code throwOnError} is set
     */
    public DevBoltClient(ClientOptions options) {
        this.options = Objects.requireNonNull(options, "ClientOptions must not be null");
        this.errorHandler = options.getOnError() != null ? options.getOnError() : this::defaultErrorHandler;

        try {
            configPath = ConfigLocator.locate(options.getConfigPath(), options.getBaseDirectory());
            loadConfig();
            initialized = true;

            if (options.isAutoReload()) {
                startWatcher();
            }

            LOG.info("DevBolt client initialized: configPath={}, autoReload={}, strict={}",
                    configPath, options.isAutoReload(), options.isStrict());
        } catch (RuntimeException e) {
            handleError(e);
        }
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate a flag for the given context merged over the default context.
     *
     * @param flagName flag to evaluate
     * @param context  evaluation subject; may be {@code null}
     * @return the engine's decision, or a fallback result
     */
    public EvaluationResult evaluate(String flagName, EvaluationContext context) {
        Objects.requireNonNull(flagName, "flagName must not be null");

        FlagEngine current = engine;
        if (!initialized || current == null) {
            return fallback(flagName, REASON_NOT_INITIALIZED);
        }

        EvaluationContext merged = context != null
                ? context.mergedOver(options.getDefaultContext())
                : options.getDefaultContext();

        EvaluationResult result;
        try {
            // one snapshot decides both existence and outcome
            Optional<EvaluationResult> found = current.evaluateIfPresent(flagName, merged);
            if (found.isPresent()) {
                result = found.get();
            } else if (options.isStrict()) {
                throw new FlagNotFoundException(flagName);
            } else {
                boolean value = fallbackValue(flagName);
                LOG.warn("Flag \"{}\" not found, using fallback: {}", flagName, value);
                result = fallback(flagName, REASON_NOT_FOUND);
            }
        } catch (RuntimeException e) {
            handleError(e);
            return fallback(flagName, REASON_ERROR_PREFIX + e.getMessage());
        }

        try {
            options.getOnFlagEvaluated().accept(result, merged);
        } catch (RuntimeException e) {
            LOG.error("Error in onFlagEvaluated callback: {}", e.getMessage(), e);
        }
        return result;
    }

    public EvaluationResult evaluate(String flagName) {
        return evaluate(flagName, null);
    }

    public boolean isEnabled(String flagName, EvaluationContext context) {
        return evaluate(flagName, context).isEnabled();
    }

    public boolean isEnabled(String flagName) {
        return evaluate(flagName, null).isEnabled();
    }

    // ---------------------------------------------------------------
    // Configuration access
    // ---------------------------------------------------------------

    /**
     * @return flag names in config order; empty when not initialized
     */
    public List<String> getAllFlagNames() {
        FlagEngine current = engine;
        return isInitialized() ? current.getAllFlagNames() : Collections.emptyList();
    }

    public Optional<FlagConfig> getFlagConfig(String flagName) {
        FlagEngine current = engine;
        return isInitialized() ? current.getFlagConfig(flagName) : Optional.empty();
    }

    public FlagsConfig getConfig() {
        FlagEngine current = engine;
        return isInitialized() ? current.getConfig() : FlagsConfig.empty();
    }

    /**
     * Re-read the config file now. On success the new config is active and
     * {@code onConfigUpdate} is notified; on failure the previous config stays
     * active and the error callback is notified. Does nothing once the client
     * is closed.
     */
    public void reload() {
        LOG.info("Manual config reload triggered");
        reloadConfig();
    }

    public boolean isInitialized() {
        return initialized && engine != null;
    }

    public ClientState getState() {
        return new ClientState(isInitialized(), configPath, lastLoadTime, errorCount.get());
    }

    public ClientOptions getOptions() {
        return options;
    }

    @Override
    public synchronized void close() {
        LOG.info("Closing DevBolt client");
        closed = true;
        if (watcher != null) {
            watcher.stop();
            watcher = null;
        }
        engine = null;
        initialized = false;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void loadConfig() {
        FlagsConfig config = ConfigParser.parseFile(configPath);
        engine = new FlagEngine(config, EngineOptions.builder()
                .strict(options.isStrict())
                .clock(clock)
                .build());
        markLoaded();
    }

    private synchronized void reloadConfig() {
        if (closed) {
            LOG.debug("Client is closed, ignoring config reload");
            return;
        }
        try {
            if (configPath == null) {
                configPath = ConfigLocator.locate(options.getConfigPath(), options.getBaseDirectory());
            }
            FlagsConfig config = ConfigParser.parseFile(configPath);

            FlagEngine current = engine;
            if (current != null) {
                current.replaceConfig(config);
                markLoaded();
            } else {
                loadConfig();
                initialized = true;
            }

            options.getOnConfigUpdate().accept(config);
            LOG.info("Config reloaded successfully from {}", configPath);
        } catch (RuntimeException e) {
            handleError(e);
        }
    }

    private synchronized void startWatcher() {
        watcher = new ConfigFileWatcher(configPath, options.getPollInterval(),
                options.getStabilityThreshold(), this::reloadConfig);
        try {
            watcher.start();
        } catch (RuntimeException e) {
            LOG.warn("Failed to set up file watcher, auto-reload disabled: {}", e.getMessage(), e);
            watcher = null;
        }
    }

    private void markLoaded() {
        lastLoadTime = clock.instant();
        errorCount.set(0);
    }

    private void handleError(RuntimeException e) {
        errorHandler.accept(e);
        if (options.isThrowOnError()) {
            throw e;
        }
    }

    private void defaultErrorHandler(Exception e) {
        LOG.error("DevBolt error: {}", e.getMessage());
        errorCount.incrementAndGet();
    }

    private EvaluationResult fallback(String flagName, String reason) {
        return EvaluationResult.of(flagName, fallbackValue(flagName), reason, clock.instant());
    }

    private boolean fallbackValue(String flagName) {
        return options.getFallbacks().getOrDefault(flagName, false);
    }
}
