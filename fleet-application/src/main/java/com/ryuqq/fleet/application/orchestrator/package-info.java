/**
 * Fleet Application Layer - 배포 실행 조정 API.
 *
 * <p>이 패키지는 평가된 Plan의 실행 포트와 실행 결과 타입을 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.application.orchestrator.Orchestrator} - 평가부터 실행까지의 조정자</li>
 *   <li>{@link com.ryuqq.fleet.application.orchestrator.ExecutionEngine} - Plan 실행 엔진</li>
 *   <li>{@link com.ryuqq.fleet.application.orchestrator.RunReport} - 최종 보고서와 종료 코드</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.application.orchestrator;
