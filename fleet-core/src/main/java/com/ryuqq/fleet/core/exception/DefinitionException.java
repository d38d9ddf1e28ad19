package com.ryuqq.fleet.core.exception;

/**
 * Deploy 정의 또는 인벤토리 정의 오류.
 *
 * <p>파일이 없거나 읽을 수 없거나 형식이 잘못된 경우 발생합니다.
 * 실행 단계에 진입하기 전에 발생하는 치명적 오류이며, 종료 코드 1로 보고됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public class DefinitionException extends FleetException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
