package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.exception.CommandTimeoutException;
import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.exception.TransportException;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.outcome.Changed;
import com.ryuqq.fleet.core.outcome.Fail;
import com.ryuqq.fleet.core.outcome.HostOutcome;
import com.ryuqq.fleet.core.outcome.Unchanged;
import com.ryuqq.fleet.core.plan.OperationMeta;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.spi.CommandResult;
import com.ryuqq.fleet.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Host 하나에 Operation 하나를 적용합니다.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * operation.commands(host, gatherer)
 *   ├─ Fact 조회 실패 → Fail(FACT_GATHER_ERROR)
 *   ├─ 빈 목록 → Unchanged
 *   ├─ dry-run → Changed(dryRun=true), Transport 호출 없음
 *   └─ 명령 순차 실행 (STATE_CHANGE)
 *        ├─ 0이 아닌 종료 → Fail(COMMAND_FAILED), 이후 명령 중단
 *        ├─ 타임아웃 → Fail(COMMAND_TIMEOUT)
 *        ├─ 연결 실패 → Fail(TRANSPORT_ERROR)
 *        └─ 모두 성공 → Changed
 * </pre>
 *
 * <p>어떤 경우에도 예외를 던지지 않고 결과 값을 반환합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class HostOperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(HostOperationExecutor.class);

    private final Transport transport;

    public HostOperationExecutor(Transport transport) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.transport = transport;
    }

    /**
     * Operation 적용.
     *
     * @param host 대상 Host
     * @param meta Operation 메타데이터
     * @param gatherer 명령 생성용 Fact 조회기
     * @param config 실행 설정
     * @return Host별 결과
     */
    public HostOutcome execute(Host host, OperationMeta meta, FactGatherer gatherer, RunConfig config) {
        List<String> commands;
        try {
            commands = meta.getOperation().commands(host, gatherer);
        } catch (GatherException e) {
            log.warn("Fact gathering failed for {} on {}: {}", meta.getNames(), host.getName(), e.getMessage());
            return new Fail(host.getName(), Fail.FACT_GATHER_ERROR, e.getMessage(), causeOf(e));
        } catch (RuntimeException e) {
            log.error("Operation {} could not build commands for {}", meta.getNames(), host.getName(), e);
            return new Fail(host.getName(), Fail.OPERATION_ERROR, describe(e), causeOf(e));
        }

        if (commands == null || commands.isEmpty()) {
            return new Unchanged(host.getName());
        }
        if (config.debugOperations()) {
            log.info("{} on {}: {}", meta.getNames(), host.getName(), commands);
        }
        if (config.dryRun()) {
            return new Changed(host.getName(), commands, true);
        }

        for (String command : commands) {
            CommandResult result;
            try {
                result = transport.execute(host, command, CommandKind.STATE_CHANGE);
            } catch (CommandTimeoutException e) {
                return new Fail(host.getName(), Fail.COMMAND_TIMEOUT, e.getMessage(), command);
            } catch (TransportException e) {
                return new Fail(host.getName(), Fail.TRANSPORT_ERROR, e.getMessage(), causeOf(e));
            } catch (RuntimeException e) {
                log.error("Unexpected transport failure on {}", host.getName(), e);
                return new Fail(host.getName(), Fail.OPERATION_ERROR, describe(e), causeOf(e));
            }
            if (!result.isSuccess()) {
                String stderr = result.stderr().isEmpty() ? null : String.join("\n", result.stderr());
                return new Fail(host.getName(), Fail.COMMAND_FAILED,
                    "Command exited with " + result.exitCode() + ": " + command, stderr);
            }
        }
        return new Changed(host.getName(), commands, false);
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String causeOf(Throwable e) {
        return e.getCause() == null ? null : describe(e.getCause());
    }
}
