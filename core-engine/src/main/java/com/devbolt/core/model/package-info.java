/**
 * Immutable data model of the DevBolt flag engine.
 *
 * <ul>
 * <li>{@link com.devbolt.core.model.FlagsConfig}: the whole configuration,
 * swapped atomically on reload</li>
 * <li>{@link com.devbolt.core.model.FlagConfig},
 * {@link com.devbolt.core.model.TargetingRule},
 * {@link com.devbolt.core.model.RolloutRule}: trusted per-flag settings</li>
 * <li>{@link com.devbolt.core.model.EvaluationContext}: per-call input</li>
 * <li>{@link com.devbolt.core.model.EvaluationResult} and
 * {@link com.devbolt.core.model.EvaluationMetadata}: per-call output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.devbolt.core.model;
