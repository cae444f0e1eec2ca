/**
 * Public entry point of the evaluation engine,
 * {@link com.devbolt.core.engine.FlagEngine}, and its
 * {@link com.devbolt.core.engine.EngineOptions}.
 *
 * @since 1.0.0
 */
package com.devbolt.core.engine;
