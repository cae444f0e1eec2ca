package com.devbolt.cli;

import com.devbolt.core.exception.DevBoltException;

/**
 * A command could not complete. The message is shown to the user as is and
 * the process exits with status 1.
 *
 * @since 1.0.0
 */
public class CliException extends DevBoltException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "CLI_ERROR";

    public CliException(String message) {
        super(message, CODE);
    }

    public CliException(String message, Throwable cause) {
        super(message, CODE, null, cause);
    }
}
