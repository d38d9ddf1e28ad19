package com.ryuqq.fleet.core.config;

import java.util.List;

/**
 * 실행(run) 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>parallel: 동시 실행 Host 수 (기본 0 = 활성 인벤토리 크기)</li>
 *   <li>serial: Host를 하나씩 처리 (기본 false)</li>
 *   <li>failPercent: 허용 실패 비율 (기본 0 = 실패 하나로 중단)</li>
 *   <li>limit: 대상 Host 패턴 (기본 빈 목록 = 전체)</li>
 *   <li>noWait: 실패한 Host가 같은 Operation의 다른 Host를 막지 않음 (기본 false)</li>
 *   <li>dryRun: 상태 변경 명령을 실행하지 않음 (기본 false)</li>
 *   <li>debugFacts / debugOperations / debugData: 조회용 출력 (Plan에 영향 없음)</li>
 *   <li>drainTimeoutMs: 중단 시 실행 중인 Host 작업을 기다리는 최대 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 * @param parallel 동시 실행 Host 수 (0 이상, 0이면 활성 인벤토리 크기)
 * @param serial serial 모드 여부
 * @param failPercent 허용 실패 비율 (0~100)
 * @param limit 대상 Host 패턴
 * @param noWait noWait 여부
 * @param dryRun dry-run 여부
 * @param debugFacts Fact 조회 내용 출력 여부
 * @param debugOperations Plan 출력 여부
 * @param debugData 인벤토리 데이터 출력 여부
 * @param drainTimeoutMs 중단 시 대기 시간 (밀리초, 양수여야 함)
 */
public record RunConfig(
    int parallel,
    boolean serial,
    int failPercent,
    List<String> limit,
    boolean noWait,
    boolean dryRun,
    boolean debugFacts,
    boolean debugOperations,
    boolean debugData,
    long drainTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: parallel=0, serial=false, failPercent=0, limit=[], noWait=false,
     * dryRun=false, debug 플래그 모두 false, drainTimeoutMs=30000ms</p>
     */
    public RunConfig() {
        this(0, false, 0, List.of(), false, false, false, false, false, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunConfig {
        if (parallel < 0) {
            throw new IllegalArgumentException(
                "parallel must be non-negative (current: " + parallel + ")"
            );
        }
        if (failPercent < 0 || failPercent > 100) {
            throw new IllegalArgumentException(
                "failPercent must be between 0 and 100 (current: " + failPercent + ")"
            );
        }
        if (drainTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "drainTimeoutMs must be positive (current: " + drainTimeoutMs + ")"
            );
        }
        limit = limit == null ? List.of() : List.copyOf(limit);
    }

    /**
     * 실제 병렬도 계산.
     *
     * @param activeHosts 활성 인벤토리 Host 수
     * @return parallel이 0이면 activeHosts (최소 1), 아니면 parallel
     */
    public int effectiveParallel(int activeHosts) {
        if (parallel > 0) {
            return parallel;
        }
        return Math.max(1, activeHosts);
    }

    public RunConfig withParallel(int parallel) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withSerial(boolean serial) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withFailPercent(int failPercent) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withLimit(List<String> limit) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withNoWait(boolean noWait) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withDryRun(boolean dryRun) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withDebugFacts(boolean debugFacts) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withDebugOperations(boolean debugOperations) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withDebugData(boolean debugData) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }

    public RunConfig withDrainTimeoutMs(long drainTimeoutMs) {
        return new RunConfig(parallel, serial, failPercent, limit, noWait, dryRun,
            debugFacts, debugOperations, debugData, drainTimeoutMs);
    }
}
