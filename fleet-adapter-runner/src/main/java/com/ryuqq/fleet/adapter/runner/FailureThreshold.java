package com.ryuqq.fleet.adapter.runner;

/**
 * 실패 비율 임계값 계산기.
 *
 * <p><strong>판정:</strong></p>
 * <pre>
 * failed * 100 / applicable &gt; failPercent  →  중단
 * </pre>
 *
 * <p>정수 나눗셈 대신 양변에 applicable을 곱해 비교하므로 비율이 정확히 계산됩니다.
 * failPercent가 0이면 실패가 하나라도 있으면 중단합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class FailureThreshold {

    private FailureThreshold() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 임계값 초과 여부 확인.
     *
     * @param failed 실패한 Host 수
     * @param applicable 대상 Host 수
     * @param failPercent 허용 실패 비율 (0 ~ 100)
     * @return 초과하면 true (applicable이 0이면 항상 false)
     * @throws IllegalArgumentException 음수 값이거나 failed가 applicable보다 큰 경우
     */
    public static boolean exceeded(int failed, int applicable, int failPercent) {
        if (failed < 0 || applicable < 0) {
            throw new IllegalArgumentException(
                "counts must be non-negative (failed: " + failed + ", applicable: " + applicable + ")"
            );
        }
        if (failed > applicable) {
            throw new IllegalArgumentException(
                "failed cannot exceed applicable (failed: " + failed + ", applicable: " + applicable + ")"
            );
        }
        if (applicable == 0) {
            return false;
        }
        return failed * 100L > (long) failPercent * applicable;
    }
}
