package com.ryuqq.fleet.core.operation;

import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Host;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 셸 명령 실행 (server.shell).
 *
 * <p>상태를 비교하지 않고 항상 명령을 실행합니다.</p>
 *
 * @param commandLines 실행할 명령 (1개 이상)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record ShellOperation(List<String> commandLines) implements Operation {

    public static final String TYPE = "server.shell";

    public ShellOperation {
        if (commandLines == null || commandLines.isEmpty()) {
            throw new IllegalArgumentException("commandLines cannot be null or empty");
        }
        for (String line : commandLines) {
            if (line == null || line.isBlank()) {
                throw new IllegalArgumentException("command cannot be null or blank");
            }
        }
        commandLines = List.copyOf(commandLines);
    }

    public static ShellOperation of(String... commandLines) {
        return new ShellOperation(List.of(commandLines));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Map<String, Object> args() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("commands", commandLines);
        return args;
    }

    @Override
    public List<String> commands(Host host, FactGatherer facts) {
        return commandLines;
    }
}
