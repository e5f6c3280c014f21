/**
 * Attempt record package.
 *
 * <p>{@link com.ryuqq.poller.core.attempt.Attempt} is the immutable snapshot handed to
 * wait and stop strategies after each call of the operation: attempt number, elapsed
 * time, {@link com.ryuqq.poller.core.attempt.AttemptKind} and the captured error, if any.</p>
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.core.attempt;
