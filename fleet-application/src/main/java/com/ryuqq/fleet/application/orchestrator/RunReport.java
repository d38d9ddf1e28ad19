package com.ryuqq.fleet.application.orchestrator;

import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.plan.Plan;
import com.ryuqq.fleet.core.statemachine.AbortReason;
import com.ryuqq.fleet.core.statemachine.RunState;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 배포 실행 보고서.
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: {@link RunState#COMPLETED}이고 실패한 Host가 없음</li>
 *   <li>1: 중단되었거나 실패한 Host가 있음</li>
 * </ul>
 *
 * @param state 최종 실행 상태 (종료 상태)
 * @param plan 평가된 Plan (평가 실패 시 null)
 * @param operations Operation별 결과
 * @param failedHosts 실패한 Host
 * @param abortReason 중단 사유 (완료 시 null)
 * @param errorMessage 평가 실패 메시지 (없으면 null)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record RunReport(
    RunState state,
    Plan plan,
    List<OperationResult> operations,
    Set<HostName> failedHosts,
    AbortReason abortReason,
    String errorMessage
) {

    public RunReport {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("state must be terminal: " + state);
        }
        if (state == RunState.ABORTED && abortReason == null) {
            throw new IllegalArgumentException("abortReason cannot be null for aborted run");
        }
        operations = operations == null ? List.of() : List.copyOf(operations);
        failedHosts = failedHosts == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(failedHosts));
    }

    /**
     * 실행 결과로부터 보고서 생성.
     *
     * @param plan 실행한 Plan
     * @param result 실행 결과
     * @return 보고서
     */
    public static RunReport of(Plan plan, ExecutionResult result) {
        RunState state = result.isAborted() ? RunState.ABORTED : RunState.COMPLETED;
        return new RunReport(state, plan, result.operations(), result.failedHosts(), result.abortReason(), null);
    }

    /**
     * 평가 실패 보고서 생성.
     *
     * @param errorMessage 실패 메시지
     * @return 보고서
     */
    public static RunReport evaluationFailed(String errorMessage) {
        return new RunReport(RunState.ABORTED, null, List.of(), Set.of(), AbortReason.EVALUATION_FAILED, errorMessage);
    }

    public Optional<Plan> findPlan() {
        return Optional.ofNullable(plan);
    }

    public boolean isSuccess() {
        return state == RunState.COMPLETED && failedHosts.isEmpty();
    }

    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }
}
