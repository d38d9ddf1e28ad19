package com.ryuqq.fleet.core.outcome;

import com.ryuqq.fleet.core.model.HostName;

/**
 * 이미 원하는 상태 (실행할 명령 없음).
 *
 * @param host Host 이름
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record Unchanged(HostName host) implements HostOutcome {

    public Unchanged {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
    }
}
