package com.ryuqq.fleet.testkit.contract;

import com.ryuqq.fleet.core.exception.TransportException;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.spi.CommandResult;
import com.ryuqq.fleet.core.spi.Transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 응답을 미리 지정하고 모든 호출을 기록하는 테스트용 Transport.
 *
 * <p>응답 조회 순서:</p>
 * <ol>
 *   <li>도달 불가로 지정된 Host → {@link TransportException}</li>
 *   <li>Host + 명령으로 지정된 응답</li>
 *   <li>명령으로 지정된 응답 (모든 Host 공통)</li>
 *   <li>기본값: 종료 코드 0, 빈 출력</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RecordingTransport transport = new RecordingTransport()
 *     .respondLines("uname -s", "Linux")
 *     .failOn("b", "systemctl restart nginx");
 *
 * // ... 실행 ...
 *
 * assertThat(transport.invocations(CommandKind.STATE_CHANGE)).isEmpty();
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong> 실행 엔진의 워커 스레드에서 동시에 호출되어도 안전합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class RecordingTransport implements Transport {

    /**
     * 기록된 Transport 호출.
     *
     * @param host 대상 Host
     * @param command 셸 명령
     * @param kind 명령 종류
     */
    public record Invocation(HostName host, String command, CommandKind kind) {
    }

    private final List<Invocation> invocations = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, CommandResult> commandResponses = new ConcurrentHashMap<>();
    private final Map<String, CommandResult> hostResponses = new ConcurrentHashMap<>();
    private final Set<HostName> unreachable = ConcurrentHashMap.newKeySet();

    /**
     * 모든 Host에 대한 명령 응답 지정.
     *
     * @param command 셸 명령 (정확히 일치)
     * @param result 응답
     * @return this
     */
    public RecordingTransport respond(String command, CommandResult result) {
        commandResponses.put(requireCommand(command), requireResult(result));
        return this;
    }

    /**
     * 특정 Host에 대한 명령 응답 지정.
     *
     * @param host Host 이름
     * @param command 셸 명령 (정확히 일치)
     * @param result 응답
     * @return this
     */
    public RecordingTransport respond(String host, String command, CommandResult result) {
        hostResponses.put(key(HostName.of(host), requireCommand(command)), requireResult(result));
        return this;
    }

    /**
     * 모든 Host에 대해 성공 응답과 표준 출력 지정.
     *
     * @param command 셸 명령
     * @param stdout 표준 출력 줄
     * @return this
     */
    public RecordingTransport respondLines(String command, String... stdout) {
        return respond(command, CommandResult.success(List.of(stdout)));
    }

    /**
     * 특정 Host에서 명령이 종료 코드 1로 실패하도록 지정.
     *
     * @param host Host 이름
     * @param command 셸 명령
     * @return this
     */
    public RecordingTransport failOn(String host, String command) {
        return respond(host, command, CommandResult.failure(1, List.of("failed: " + command)));
    }

    /**
     * 특정 Host를 도달 불가로 지정.
     *
     * @param host Host 이름
     * @return this
     */
    public RecordingTransport unreachable(String host) {
        unreachable.add(HostName.of(host));
        return this;
    }

    @Override
    public CommandResult execute(Host host, String command, CommandKind kind) {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        invocations.add(new Invocation(host.getName(), command, kind));
        if (unreachable.contains(host.getName())) {
            throw new TransportException(host.getName(), "Host unreachable");
        }
        CommandResult hostResult = hostResponses.get(key(host.getName(), command));
        if (hostResult != null) {
            return hostResult;
        }
        return commandResponses.getOrDefault(command, CommandResult.success(List.of()));
    }

    /**
     * 기록된 모든 호출 (호출 순서).
     *
     * @return 호출 목록 사본
     */
    public List<Invocation> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    public List<Invocation> invocations(CommandKind kind) {
        return invocations().stream().filter(invocation -> invocation.kind() == kind).toList();
    }

    public List<Invocation> invocationsOn(String host) {
        HostName name = HostName.of(host);
        return invocations().stream().filter(invocation -> invocation.host().equals(name)).toList();
    }

    /**
     * 특정 Host에서 특정 명령이 호출된 횟수.
     *
     * @param host Host 이름
     * @param command 셸 명령
     * @return 호출 횟수
     */
    public long count(String host, String command) {
        return invocationsOn(host).stream().filter(invocation -> invocation.command().equals(command)).count();
    }

    /**
     * 명령이 어느 Host에서든 호출되었는지 확인.
     *
     * @param command 셸 명령
     * @return 호출되었으면 true
     */
    public boolean wasInvoked(String command) {
        return invocations().stream().anyMatch(invocation -> invocation.command().equals(command));
    }

    /**
     * 기록된 호출 삭제 (지정된 응답은 유지).
     */
    public void clear() {
        invocations.clear();
    }

    private static String key(HostName host, String command) {
        return host.getValue() + '\u0000' + command;
    }

    private static String requireCommand(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command cannot be null or blank");
        }
        return command;
    }

    private static CommandResult requireResult(CommandResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return result;
    }
}
