package com.ryuqq.fleet.core.outcome;

import com.ryuqq.fleet.core.model.HostName;

/**
 * 실행 중단 결정으로 시작하지 않은 Host 작업.
 *
 * @param host Host 이름
 * @param reason 건너뛴 이유
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record Skipped(HostName host, String reason) implements HostOutcome {

    public Skipped {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
