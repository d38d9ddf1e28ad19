package com.ryuqq.fleet.core.outcome;

import com.ryuqq.fleet.core.model.HostName;

/**
 * Host 단위 실패.
 *
 * <p>실패는 예외로 던지지 않고 값으로 집계되며, 실패 비율 계산에 반영됩니다.</p>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>{@link #COMMAND_FAILED}: 명령이 0이 아닌 코드로 종료</li>
 *   <li>{@link #COMMAND_TIMEOUT}: 명령 타임아웃</li>
 *   <li>{@link #TRANSPORT_ERROR}: 연결 실패 등 Transport 오류</li>
 *   <li>{@link #FACT_GATHER_ERROR}: 명령 생성 중 Fact 조회 실패</li>
 *   <li>{@link #OPERATION_ERROR}: 명령 생성 로직의 예기치 않은 오류</li>
 * </ul>
 *
 * @param host Host 이름
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record Fail(HostName host, String errorCode, String message, String cause) implements HostOutcome {

    public static final String COMMAND_FAILED = "COMMAND_FAILED";
    public static final String COMMAND_TIMEOUT = "COMMAND_TIMEOUT";
    public static final String TRANSPORT_ERROR = "TRANSPORT_ERROR";
    public static final String FACT_GATHER_ERROR = "FACT_GATHER_ERROR";
    public static final String OPERATION_ERROR = "OPERATION_ERROR";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException host, errorCode, message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(HostName host, String errorCode, String message) {
        return new Fail(host, errorCode, message, null);
    }

    /**
     * Transport 계열 실패인지 확인.
     *
     * @return TRANSPORT_ERROR 또는 COMMAND_TIMEOUT이면 true
     */
    public boolean isTransportFailure() {
        return TRANSPORT_ERROR.equals(errorCode) || COMMAND_TIMEOUT.equals(errorCode);
    }
}
