/**
 * Poll failure taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.failure.FailureKind#USER_BREAK} - Operation returned Broken, not retried</li>
 *   <li>{@link com.ryuqq.poller.core.failure.FailureKind#STOP_TRIGGERED} - A stop strategy fired</li>
 *   <li>{@link com.ryuqq.poller.core.failure.FailureKind#UNCAUGHT} - Operation threw outside the Outcome protocol</li>
 *   <li>{@link com.ryuqq.poller.core.failure.FailureKind#INTERRUPTED} - The wait was interrupted or the run cancelled</li>
 * </ul>
 *
 * <p>Every terminal failure reaches the caller as a single
 * {@link com.ryuqq.poller.core.failure.PollerException} exposing its kind and original cause.</p>
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.core.failure;
