/**
 * Poll run state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.statemachine.PollState} - Poll run lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.poller.core.statemachine.PollStateTransition} - State transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * IDLE → ATTEMPTING
 * ATTEMPTING → WAITING | SUCCEEDED | USER_BROKEN | STOP_TRIGGERED | ERRORED | INTERRUPTED
 * WAITING → ATTEMPTING | INTERRUPTED
 *
 * Forbidden:
 * - any transition out of a terminal state
 * - WAITING → SUCCEEDED (a value is only produced by an attempt)
 * </pre>
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.core.statemachine;
