package com.ryuqq.fleet.core.plan;

import com.ryuqq.fleet.core.model.CallSite;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.NameStack;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.model.OperationArgs;
import com.ryuqq.fleet.core.operation.Operation;

import java.util.Collection;
import java.util.List;

/**
 * 평가 단계에서 Operation을 기록하여 {@link Plan}을 만듭니다.
 *
 * <p><strong>기록 규칙:</strong></p>
 * <ul>
 *   <li>OpHash = (이름 경로, 인자, 호출 위치)의 해시</li>
 *   <li>처음 보는 OpHash → 다음 전역 순서 인덱스로 새 OperationMeta 생성</li>
 *   <li>이미 있는 OpHash → Host 집합에 합집합 (이미 있는 Host는 무시)</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 평가는 단일 스레드에서 순차적으로 진행되므로
 * 이 클래스는 동기화하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationRecorder recorder = new OperationRecorder();
 * recorder.begin();
 * recorder.record(names, args, callSite, hosts, operation);
 * Plan plan = recorder.finish();
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class OperationRecorder {

    private Plan plan;

    /**
     * 새 실행을 위한 빈 Plan 초기화.
     *
     * <p>이전 Plan은 버려집니다.</p>
     */
    public void begin() {
        plan = new Plan();
    }

    /**
     * Operation 기록.
     *
     * <p>Host 집합이 비어있어도 Operation은 기록되며, 실행 단계에서 건너뜁니다.</p>
     *
     * @param names 이름 경로
     * @param args 유효 인자
     * @param callSite 호출 위치
     * @param hosts 대상 Host
     * @param operation Operation 본문
     * @return OpHash
     * @throws IllegalStateException begin() 전이거나 Plan이 동결된 경우
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public OpHash record(
        NameStack names,
        OperationArgs args,
        CallSite callSite,
        Collection<HostName> hosts,
        Operation operation
    ) {
        Plan current = requirePlan();
        if (hosts == null) {
            throw new IllegalArgumentException("hosts cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        if (current.isFrozen()) {
            throw new IllegalStateException("Plan is frozen and cannot be modified");
        }

        OpHash hash = OpHash.compute(names, args, callSite);
        OperationMeta meta = current.findOpMeta(hash)
            .orElseGet(() -> current.addOperation(
                new OperationMeta(hash, names, args, callSite, current.size(), operation)));
        for (HostName host : hosts) {
            current.addHost(meta, host);
        }
        return hash;
    }

    /**
     * 전역 실행 순서.
     *
     * @return OpHash 목록
     */
    public List<OpHash> opOrder() {
        return requirePlan().getOpOrder();
    }

    /**
     * Operation 메타데이터 조회.
     *
     * @param hash OpHash
     * @return OperationMeta
     */
    public OperationMeta opMeta(OpHash hash) {
        return requirePlan().getOpMeta(hash);
    }

    /**
     * 평가 종료. Plan을 동결하여 반환합니다.
     *
     * @return 동결된 Plan
     */
    public Plan finish() {
        Plan current = requirePlan();
        current.freeze();
        return current;
    }

    /**
     * 현재 Plan 조회.
     *
     * @return Plan
     */
    public Plan plan() {
        return requirePlan();
    }

    private Plan requirePlan() {
        if (plan == null) {
            throw new IllegalStateException("OperationRecorder not started: call begin() first");
        }
        return plan;
    }
}
