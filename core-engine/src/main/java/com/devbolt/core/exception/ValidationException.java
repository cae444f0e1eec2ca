package com.devbolt.core.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a configuration tree violates the flag data model.
 *
 * <p>
 * {@link #getField()} holds the dotted/bracketed path of the offending field
 * (for example {@code my_flag.targeting[2].operator}). The path format is
 * surfaced to users by tooling, so it must stay stable.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends DevBoltException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "VALIDATION_ERROR";

    private final String field;
    private final transient Object value;

    public ValidationException(String message) {
        this(message, null, null);
    }

    public ValidationException(String message, String field, Object value) {
        super(message, CODE, details(field, value), null);
        this.field = field;
        this.value = value;
    }

    /**
     * @return path of the invalid field, or {@code null} for whole-document
     *         errors
     */
    public String getField() {
        return field;
    }

    /**
     * @return the rejected value; may be {@code null} when the field is absent
     */
    public Object getValue() {
        return value;
    }

    private static Map<String, Object> details(String field, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("value", value);
        return details;
    }
}
