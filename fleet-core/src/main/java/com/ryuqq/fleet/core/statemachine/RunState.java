package com.ryuqq.fleet.core.statemachine;

/**
 * 실행(run)의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼ (평가 시작)
 * EVALUATING ─────────────┐
 *    │                    │ (정의 오류, Fact 조회 실패)
 *    ▼ (Plan 동결)         │
 * PLANNED                 │
 *    │                    │
 *    ▼ (실행 시작)          │
 * EXECUTING               │
 *    │                    │
 *    ├─► COMPLETED        │
 *    │                    │
 *    └─► ABORTED ◄────────┘
 *
 * 금지된 전이:
 * - 종료 상태(COMPLETED, ABORTED)에서의 모든 전이 ❌
 * - PLANNED → EVALUATING ❌ (역방향)
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public enum RunState {

    /**
     * 생성됨 (평가 전).
     */
    IDLE,

    /**
     * Deploy 정의 평가 중 (Plan 기록 중).
     */
    EVALUATING,

    /**
     * Plan 동결 완료, 실행 대기.
     */
    PLANNED,

    /**
     * Plan 실행 중.
     */
    EXECUTING,

    /**
     * 모든 Operation을 임계치 초과 없이 실행함.
     */
    COMPLETED,

    /**
     * 중단됨.
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 ABORTED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
