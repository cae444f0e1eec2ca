package com.devbolt.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls a single file and fires a callback after it changes.
 *
 * <h3>Change detection</h3>
 * <p>
 * A change is any difference in last-modified time or size from the state
 * recorded at {@link #start()} or at the previous notification. The callback
 * fires only once the file has kept the same state for the stability
 * threshold, so an editor writing in several steps triggers one reload. A
 * missing file is not a change; the watcher waits for it to reappear.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * Polling and callbacks run on one daemon thread. A callback that throws is
 * logged and the watcher keeps running.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigFileWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigFileWatcher.class);

    private final Path file;
    private final Duration pollInterval;
    private final long stabilityNanos;
    private final Runnable onChange;

    private ScheduledExecutorService executor;

    // Touched only from the polling thread after start()
    private FileState notified;
    private FileState pending;
    private long pendingSince;

    /**
     * @param file               the file to watch
     * @param pollInterval       delay between polls; must be positive
     * @param stabilityThreshold how long a changed file must stay unchanged
     *                           before the callback fires
     * @param onChange           invoked on the polling thread
     */
    public ConfigFileWatcher(Path file, Duration pollInterval, Duration stabilityThreshold, Runnable onChange) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.stabilityNanos = Objects.requireNonNull(stabilityThreshold, "stabilityThreshold must not be null").toNanos();
        this.onChange = Objects.requireNonNull(onChange, "onChange must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
    }

    /**
     * Record the file's current state and begin polling. Calling this on an
     * active watcher logs a warning and does nothing.
     */
    public synchronized void start() {
        if (executor != null) {
            LOG.warn("File watcher already started for {}", file);
            return;
        }

        notified = readState();
        pending = null;

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "devbolt-config-watcher");
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1, pollInterval.toMillis());
        executor.scheduleWithFixedDelay(this::poll, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.debug("File watcher started for {} (poll={}ms)", file, periodMs);
    }

    /**
     * Stop polling. Safe to call more than once.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        LOG.debug("File watcher stopped for {}", file);
    }

    public synchronized boolean isActive() {
        return executor != null;
    }

    public Path getFile() {
        return file;
    }

    // ---------------------------------------------------------------
    // Polling
    // ---------------------------------------------------------------

    void poll() {
        try {
            FileState current = readState();
            if (current == null) {
                // Deleted or being replaced; keep the last notified state
                pending = null;
                return;
            }

            long now = System.nanoTime();
            if (current.equals(notified)) {
                pending = null;
                return;
            }
            if (!current.equals(pending)) {
                pending = current;
                pendingSince = now;
                return;
            }
            if (now - pendingSince < stabilityNanos) {
                return;
            }

            notified = current;
            pending = null;
            LOG.info("Config file changed: {}", file);
            onChange.run();
        } catch (RuntimeException e) {
            // Rethrowing would cancel the scheduled task
            LOG.error("Error handling change of {}: {}", file, e.getMessage(), e);
        }
    }

    private FileState readState() {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileState(attrs.lastModifiedTime().toMillis(), attrs.size());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            LOG.warn("Could not check {} for modifications: {}", file, e.getMessage());
            return null;
        }
    }

    private static final class FileState {
        private final long lastModifiedMillis;
        private final long size;

        FileState(long lastModifiedMillis, long size) {
            this.lastModifiedMillis = lastModifiedMillis;
            this.size = size;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof FileState that))
                return false;
            return lastModifiedMillis == that.lastModifiedMillis && size == that.size;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lastModifiedMillis, size);
        }
    }
}
