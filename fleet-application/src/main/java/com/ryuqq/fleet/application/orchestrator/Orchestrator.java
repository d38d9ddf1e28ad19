package com.ryuqq.fleet.application.orchestrator;

import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.inventory.Inventory;

/**
 * 배포 실행 조정자.
 *
 * <p>Deploy 정의를 평가하여 Plan을 만들고, limit이 적용된 Inventory에 Plan을 실행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunReport report = orchestrator.run(deploy, inventory, new RunConfig().withFailPercent(20));
 *
 * if (!report.isSuccess()) {
 *     System.exit(report.exitCode());
 * }
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 배포 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>IDLE → EVALUATING: 실행 단위 Fact 캐시 생성 후 전체 Inventory로 Deploy 평가</li>
     *   <li>EVALUATING → PLANNED: Plan 동결</li>
     *   <li>PLANNED → EXECUTING: limit 적용 후 실행 엔진에 위임</li>
     *   <li>EXECUTING → COMPLETED 또는 ABORTED</li>
     * </ol>
     *
     * <p>평가 중 Deploy 정의 오류나 처리되지 않은 Fact 조회 실패가 발생하면
     * EVALUATING → ABORTED로 전이하고 {@code EVALUATION_FAILED} 보고서를 반환합니다.</p>
     *
     * @param deploy Deploy 정의
     * @param inventory 전체 Inventory
     * @param config 실행 설정
     * @return 실행 보고서
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    RunReport run(Deploy deploy, Inventory inventory, RunConfig config);
}
