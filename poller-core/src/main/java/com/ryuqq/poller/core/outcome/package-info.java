/**
 * Attempt outcome package.
 *
 * <p>This package defines the sealed interface hierarchy an operation reports
 * after every attempt.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.outcome.Outcome} - Sealed interface (permits Finished, Continue, Broken)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.outcome.Finished} - Done, return the value</li>
 *   <li>{@link com.ryuqq.poller.core.outcome.Continue} - Not done yet, wait and retry</li>
 *   <li>{@link com.ryuqq.poller.core.outcome.Broken} - Unrecoverable, stop without waiting</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (outcome instanceof Finished&lt;V&gt; finished) {
 *     return finished.value();
 * } else if (outcome instanceof Broken&lt;V&gt; broken) {
 *     throw PollerException.userBreak(name, attempt, broken.reason(), broken.cause());
 * }
 * // Continue: evaluate stop strategy, wait, retry
 * </pre>
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.core.outcome;
