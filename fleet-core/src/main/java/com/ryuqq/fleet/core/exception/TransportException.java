package com.ryuqq.fleet.core.exception;

import com.ryuqq.fleet.core.model.HostName;

/**
 * Transport 수준 실패 (연결 끊김, 인증 실패, 프로세스 실행 실패 등).
 *
 * <p>원격 명령이 실행되어 0이 아닌 종료 코드를 반환한 경우는 이 예외가 아니라
 * {@link com.ryuqq.fleet.core.spi.CommandResult}로 표현됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public class TransportException extends FleetException {

    private final HostName host;

    public TransportException(HostName host, String message) {
        super(message);
        this.host = host;
    }

    public TransportException(HostName host, String message, Throwable cause) {
        super(message, cause);
        this.host = host;
    }

    /**
     * 실패한 Host 조회.
     *
     * @return Host 이름
     */
    public HostName getHost() {
        return host;
    }
}
