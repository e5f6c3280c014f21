/**
 * Service Provider Interfaces (SPI) for the poller engine.
 *
 * <p>These single-method interfaces are the seams through which callers plug in
 * their operation, observe attempts, and (mainly in tests) control time.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.spi.Operation} - The polled operation, one Outcome per call</li>
 *   <li>{@link com.ryuqq.poller.core.spi.AttemptListener} - Callback after every attempt</li>
 *   <li>{@link com.ryuqq.poller.core.spi.Ticker} - Monotonic time source for elapsed-time budgets</li>
 *   <li>{@link com.ryuqq.poller.core.spi.Sleeper} - Interruptible inter-attempt wait</li>
 * </ul>
 *
 * <h2>Default Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.core.spi.SystemTicker} - {@code System.nanoTime()}</li>
 *   <li>{@link com.ryuqq.poller.core.spi.ThreadSleeper} - {@code TimeUnit.NANOSECONDS.sleep}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Poller Team
 */
package com.ryuqq.poller.core.spi;
