package com.ryuqq.fleet.application.orchestrator;

import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.plan.Plan;

/**
 * 동결된 Plan을 Host에 적용하는 실행 엔진.
 *
 * <p><strong>실행 모드:</strong></p>
 * <ul>
 *   <li>병렬 (기본): 전역 순서의 Operation마다 적용 대상 Host에 동시 실행</li>
 *   <li>직렬: Host 하나씩, 해당 Host의 로컬 순서대로 실행</li>
 * </ul>
 *
 * <p>Host별 실패는 예외가 아니라 {@link com.ryuqq.fleet.core.outcome.Fail} 결과로 반환됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public interface ExecutionEngine {

    /**
     * Plan 실행.
     *
     * @param plan 동결된 Plan
     * @param active 실행 대상 Inventory (limit 적용 후)
     * @param gatherer 명령 생성 시 사용할 Fact 조회기
     * @param config 실행 설정
     * @return 실행 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException Plan이 동결되지 않은 경우
     */
    ExecutionResult execute(Plan plan, Inventory active, FactGatherer gatherer, RunConfig config);
}
