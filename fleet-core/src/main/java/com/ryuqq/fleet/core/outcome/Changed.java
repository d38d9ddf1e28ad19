package com.ryuqq.fleet.core.outcome;

import com.ryuqq.fleet.core.model.HostName;

import java.util.List;

/**
 * 상태 변경 (dry-run이면 변경 예정).
 *
 * @param host Host 이름
 * @param commands 실행한(또는 실행할) 명령
 * @param dryRun dry-run 여부
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record Changed(HostName host, List<String> commands, boolean dryRun) implements HostOutcome {

    public Changed {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (commands == null || commands.isEmpty()) {
            throw new IllegalArgumentException("commands cannot be null or empty");
        }
        commands = List.copyOf(commands);
    }
}
