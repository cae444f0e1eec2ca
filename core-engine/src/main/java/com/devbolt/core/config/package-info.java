/**
 * Configuration loading, validation and storage.
 *
 * <p>
 * YAML is decoded by {@link com.devbolt.core.config.ConfigParser}, checked by
 * {@link com.devbolt.core.config.ConfigValidator}, converted by
 * {@link com.devbolt.core.config.FlagsConfigMapper} and held by
 * {@link com.devbolt.core.config.ConfigStore}, which swaps whole
 * configurations atomically on reload.
 * </p>
 *
 * @since 1.0.0
 */
package com.devbolt.core.config;
