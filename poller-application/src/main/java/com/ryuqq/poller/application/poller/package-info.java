/**
 * Poller Application Layer - poll run execution API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.poller.application.poller.Poller} - 동기/비동기 poll run 실행</li>
 *   <li>{@link com.ryuqq.poller.application.poller.PollHandle} - 결과 대기 및 취소 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 poller-adapter-runner 모듈에 위치</li>
 *   <li><strong>단일 실패 타입:</strong> 모든 종료 실패는 PollerException</li>
 * </ul>
 *
 * @author Poller Team
 * @since 1.0.0
 */
package com.ryuqq.poller.application.poller;
