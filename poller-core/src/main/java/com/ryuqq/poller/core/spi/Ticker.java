package com.ryuqq.poller.core.spi;

/**
 * 단조 증가 시간원 SPI.
 *
 * <p>poll run의 경과 시간 계산에 사용됩니다. 벽시계가 아닌 {@link System#nanoTime()}
 * 의미의 상대 시간이어야 합니다. 테스트에서는 수동으로 진행시키는 구현을 주입합니다.</p>
 *
 * @author Poller Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * 현재 시각 (나노초, 임의의 기준점).
     *
     * @return 나노초 값
     */
    long read();

    /**
     * {@link System#nanoTime()} 기반 기본 구현.
     *
     * @return SystemTicker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }
}
