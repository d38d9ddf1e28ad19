package com.ryuqq.fleet.adapter.transport;

import java.util.List;

/**
 * Transport 설정.
 *
 * <p>불변 객체로 설계되었으며, with* 메서드를 통해 새로운 인스턴스를 생성합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>timeoutMs: 300000 (명령 하나당 5분)</li>
 *   <li>shell: sh</li>
 *   <li>sshExecutable: ssh</li>
 *   <li>sshOptions: BatchMode=yes, ConnectTimeout=10</li>
 * </ul>
 *
 * @param timeoutMs 명령 하나의 최대 실행 시간 (밀리초, 양수)
 * @param shell 로컬 명령 실행 셸
 * @param sshExecutable ssh 실행 파일
 * @param sshOptions ssh 공통 옵션
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record TransportConfig(long timeoutMs, String shell, String sshExecutable, List<String> sshOptions) {

    private static final List<String> DEFAULT_SSH_OPTIONS = List.of(
        "-o", "BatchMode=yes",
        "-o", "ConnectTimeout=10"
    );

    public TransportConfig() {
        this(300_000, "sh", "ssh", DEFAULT_SSH_OPTIONS);
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public TransportConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
        if (shell == null || shell.isBlank()) {
            throw new IllegalArgumentException("shell cannot be null or blank");
        }
        if (sshExecutable == null || sshExecutable.isBlank()) {
            throw new IllegalArgumentException("sshExecutable cannot be null or blank");
        }
        sshOptions = sshOptions == null ? List.of() : List.copyOf(sshOptions);
    }

    public TransportConfig withTimeoutMs(long timeoutMs) {
        return new TransportConfig(timeoutMs, shell, sshExecutable, sshOptions);
    }

    public TransportConfig withShell(String shell) {
        return new TransportConfig(timeoutMs, shell, sshExecutable, sshOptions);
    }

    public TransportConfig withSshExecutable(String sshExecutable) {
        return new TransportConfig(timeoutMs, shell, sshExecutable, sshOptions);
    }

    public TransportConfig withSshOptions(List<String> sshOptions) {
        return new TransportConfig(timeoutMs, shell, sshExecutable, sshOptions);
    }
}
