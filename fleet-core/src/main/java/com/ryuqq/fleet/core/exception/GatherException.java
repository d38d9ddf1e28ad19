package com.ryuqq.fleet.core.exception;

import com.ryuqq.fleet.core.model.HostName;

/**
 * Fact 수집 실패.
 *
 * <p>Transport 실패 또는 Fact 명령의 비정상 종료를 나타냅니다.
 * 도구가 설치되지 않은 경우(부재)는 오류가 아니며 Fact의 기본값으로 처리되므로
 * 이 예외와 구분됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public class GatherException extends FleetException {

    private final HostName host;
    private final String factName;

    public GatherException(HostName host, String factName, String message) {
        super("Failed to gather fact " + factName + " on " + host + ": " + message);
        this.host = host;
        this.factName = factName;
    }

    public GatherException(HostName host, String factName, Throwable cause) {
        super("Failed to gather fact " + factName + " on " + host + ": " + cause.getMessage(), cause);
        this.host = host;
        this.factName = factName;
    }

    public HostName getHost() {
        return host;
    }

    public String getFactName() {
        return factName;
    }
}
