package com.ryuqq.fleet.core.spi;

/**
 * Transport 호출의 용도 구분.
 *
 * <p>dry-run 모드에서는 {@link #STATE_CHANGE} 호출이 발생하지 않아야 하며,
 * {@link #FACT_PROBE} 호출만 허용됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public enum CommandKind {

    /**
     * 읽기 전용 Fact 조회 명령.
     */
    FACT_PROBE,

    /**
     * 상태를 변경하는 Operation 명령.
     */
    STATE_CHANGE
}
