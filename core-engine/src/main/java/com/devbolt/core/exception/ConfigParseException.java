package com.devbolt.core.exception;

import java.util.Map;

/**
 * Raised when a configuration document cannot be read or is not well-formed
 * YAML. Structural problems in a well-formed document are reported as
 * {@link ValidationException} instead.
 *
 * @since 1.0.0
 */
public class ConfigParseException extends DevBoltException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "CONFIG_PARSE_ERROR";

    public ConfigParseException(String message) {
        this(message, null);
    }

    public ConfigParseException(String message, Throwable cause) {
        super(message, CODE,
                cause != null ? Map.of("cause", String.valueOf(cause.getMessage())) : null,
                cause);
    }
}
