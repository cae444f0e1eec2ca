/**
 * Unchecked exception hierarchy of the DevBolt engine.
 *
 * <ul>
 * <li>{@link com.devbolt.core.exception.ValidationException}: malformed
 * configuration; always fatal to loading that configuration</li>
 * <li>{@link com.devbolt.core.exception.FlagNotFoundException}: unknown flag
 * in strict mode</li>
 * <li>{@link com.devbolt.core.exception.ConfigParseException}: unreadable or
 * syntactically broken configuration document</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.devbolt.core.exception;
