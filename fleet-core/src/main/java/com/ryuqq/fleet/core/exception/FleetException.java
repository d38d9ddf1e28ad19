package com.ryuqq.fleet.core.exception;

/**
 * Fleet 예외 계층의 최상위 타입.
 *
 * <p>모든 Fleet 예외는 unchecked 예외이며, 평가 단계와 실행 단계에서
 * 어떻게 처리되는지는 하위 타입별로 다릅니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public class FleetException extends RuntimeException {

    public FleetException(String message) {
        super(message);
    }

    public FleetException(String message, Throwable cause) {
        super(message, cause);
    }
}
