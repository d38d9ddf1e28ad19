package com.ryuqq.fleet.core.exception;

import com.ryuqq.fleet.core.model.HostName;

/**
 * 명령 실행 시간 초과.
 *
 * <p>실행 엔진은 이 예외를 해당 Host의 실패로 기록하며,
 * 그 자체로 전체 실행을 중단시키지 않습니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public class CommandTimeoutException extends TransportException {

    private final long timeoutMs;

    public CommandTimeoutException(HostName host, String command, long timeoutMs) {
        super(host, "Command timed out after " + timeoutMs + "ms on " + host + ": " + command);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
