package com.devbolt.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for every error raised by the DevBolt engine.
 *
 * <p>
 * Each subclass carries a stable {@link #getCode() code} that tooling can
 * switch on without parsing messages, plus an optional map of details.
 * </p>
 *
 * @since 1.0.0
 */
public class DevBoltException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String code;
    private final Map<String, Object> details;

    public DevBoltException(String message, String code) {
        this(message, code, null, null);
    }

    public DevBoltException(String message, String code, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    /**
     * @return machine-readable error code, e.g. {@code VALIDATION_ERROR}
     */
    public String getCode() {
        return code;
    }

    /**
     * @return unmodifiable map of error details; never {@code null}
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
