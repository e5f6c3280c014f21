/**
 * Wait and stop strategy package.
 *
 * <p>Both strategies are single-method SPIs evaluated against the last
 * {@link com.ryuqq.poller.core.attempt.Attempt}, so callers can plug in their own
 * implementation without touching the engine.</p>
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.strategy.WaitStrategy} - Delay before the next attempt</li>
 *   <li>{@link com.ryuqq.poller.core.strategy.StopStrategy} - Whether to give up retrying</li>
 * </ul>
 *
 * <h2>Built-in Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.strategy.WaitStrategies} - no wait, fixed, random, exponential, fibonacci, incrementing, join (sum)</li>
 *   <li>{@link com.ryuqq.poller.core.strategy.StopStrategies} - never, max attempts, max elapsed time, anyOf (logical OR)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * WaitStrategy wait = WaitStrategies.join(
 *     WaitStrategies.exponentialWait(Duration.ofMillis(100), 2.0, Duration.ofSeconds(5)),
 *     WaitStrategies.randomWait(Duration.ZERO, Duration.ofMillis(50)));
 *
 * StopStrategy stop = StopStrategies.anyOf(
 *     StopStrategies.stopAfterAttempt(10),
 *     StopStrategies.stopAfterDelay(Duration.ofMinutes(1)));
 * </pre>
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.core.strategy;
