package com.ryuqq.poller.core.spi;

/**
 * {@link System#nanoTime()} 기반 Ticker.
 *
 * @author Poller Team
 * @since 1.0.0
 */
public final class SystemTicker implements Ticker {

    static final SystemTicker INSTANCE = new SystemTicker();

    private SystemTicker() {
    }

    @Override
    public long read() {
        return System.nanoTime();
    }
}
