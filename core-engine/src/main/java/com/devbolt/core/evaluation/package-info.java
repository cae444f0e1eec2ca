/**
 * The flag decision engine.
 *
 * <ul>
 * <li>{@link com.devbolt.core.evaluation.Bucketer}: SHA-256 based sticky
 * bucketing for percentage rollouts</li>
 * <li>{@link com.devbolt.core.evaluation.RuleMatcher}: the fail-closed
 * operator sublanguage of targeting rules</li>
 * <li>{@link com.devbolt.core.evaluation.FlagEvaluator}: the fixed priority
 * chain: environment, kill switch, targeting, rollout, default</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.devbolt.core.evaluation;
