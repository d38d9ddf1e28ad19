package com.ryuqq.fleet.core.statemachine;

/**
 * 실행 중단 사유.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public enum AbortReason {

    /**
     * Operation의 Host 실패 비율이 failPercent를 초과함.
     */
    THRESHOLD_EXCEEDED,

    /**
     * serial 모드에서 첫 Host의 Transport 오류 (noWait 아님).
     */
    TRANSPORT_FAILURE,

    /**
     * Deploy 정의 평가 실패.
     */
    EVALUATION_FAILED
}
