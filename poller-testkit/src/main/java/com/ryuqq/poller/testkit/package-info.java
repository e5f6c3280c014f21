/**
 * Test doubles for poller implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.poller.testkit.ManualTicker} - Time source advanced by hand</li>
 *   <li>{@link com.ryuqq.poller.testkit.RecordingSleeper} - Records waits, advances the ticker, simulates interrupts</li>
 *   <li>{@link com.ryuqq.poller.testkit.ScriptedOperation} - Replays scripted outcomes and counts invocations</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.testkit;
