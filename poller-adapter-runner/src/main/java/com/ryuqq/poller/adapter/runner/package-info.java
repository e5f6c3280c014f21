/**
 * Runner Adapter Layer - Poller 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.adapter.runner.RetryingPoller} - poll-retry-backoff 엔진</li>
 *   <li>{@link com.ryuqq.poller.adapter.runner.PollerConfig} - 불변 설정</li>
 *   <li>{@link com.ryuqq.poller.adapter.runner.PollerBuilder} - 설정/Poller 빌더</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (RetryingPoller, PollerBuilder)
 *   ↓ implements
 * application (Poller, PollHandle)
 *   ↓ depends on
 * core (Outcome, Attempt, WaitStrategy, StopStrategy, PollerException, PollState)
 * </pre>
 *
 * @author Poller Team
 * @since 1.0.0
 */
package com.ryuqq.poller.adapter.runner;
