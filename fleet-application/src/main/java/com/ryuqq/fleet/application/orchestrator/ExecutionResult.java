package com.ryuqq.fleet.application.orchestrator;

import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.statemachine.AbortReason;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 실행 엔진의 결과.
 *
 * @param operations 실행된 Operation 결과 (전역 순서)
 * @param failedHosts 한 번 이상 실패한 Host
 * @param abortReason 중단 사유 (정상 종료 시 null)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record ExecutionResult(List<OperationResult> operations, Set<HostName> failedHosts, AbortReason abortReason) {

    public ExecutionResult {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        if (failedHosts == null) {
            throw new IllegalArgumentException("failedHosts cannot be null");
        }
        operations = List.copyOf(operations);
        failedHosts = Collections.unmodifiableSet(new TreeSet<>(failedHosts));
    }

    public static ExecutionResult completed(List<OperationResult> operations, Set<HostName> failedHosts) {
        return new ExecutionResult(operations, failedHosts, null);
    }

    public static ExecutionResult aborted(
        List<OperationResult> operations,
        Set<HostName> failedHosts,
        AbortReason reason
    ) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        return new ExecutionResult(operations, failedHosts, reason);
    }

    public boolean isAborted() {
        return abortReason != null;
    }
}
