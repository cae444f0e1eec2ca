package com.devbolt.sdk;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time snapshot of a {@link DevBoltClient}'s health.
 */
public final class ClientState {

    private final boolean initialized;
    private final Path configPath;
    private final Instant lastLoadTime;
    private final int errorCount;

    ClientState(boolean initialized, Path configPath, Instant lastLoadTime, int errorCount) {
        this.initialized = initialized;
        this.configPath = configPath;
        this.lastLoadTime = lastLoadTime;
        this.errorCount = errorCount;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * @return the located config file, or {@code null} if none was found
     */
    public Path getConfigPath() {
        return configPath;
    }

    /**
     * @return when the config was last loaded successfully, or {@code null}
     */
    public Instant getLastLoadTime() {
        return lastLoadTime;
    }

    /**
     * @return errors seen by the default error handler since the last
     *         successful load
     */
    public int getErrorCount() {
        return errorCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClientState that))
            return false;
        return initialized == that.initialized
                && errorCount == that.errorCount
                && Objects.equals(configPath, that.configPath)
                && Objects.equals(lastLoadTime, that.lastLoadTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialized, configPath, lastLoadTime, errorCount);
    }

    @Override
    public String toString() {
        return "ClientState{" +
                "initialized=" + initialized +
                ", configPath=" + configPath +
                ", lastLoadTime=" + lastLoadTime +
                ", errorCount=" + errorCount +
                '}';
    }
}
