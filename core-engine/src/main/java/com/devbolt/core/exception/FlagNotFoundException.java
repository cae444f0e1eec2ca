package com.devbolt.core.exception;

import java.util.Map;

/**
 * Raised in strict mode when a flag name is absent from the active
 * configuration.
 *
 * @since 1.0.0
 */
public class FlagNotFoundException extends DevBoltException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "FLAG_NOT_FOUND";

    private final String flagName;

    public FlagNotFoundException(String flagName) {
        super("Flag \"" + flagName + "\" not found", CODE, Map.of("flagName", String.valueOf(flagName)), null);
        this.flagName = flagName;
    }

    public String getFlagName() {
        return flagName;
    }
}
