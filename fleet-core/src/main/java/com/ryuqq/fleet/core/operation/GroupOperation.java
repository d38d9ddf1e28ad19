package com.ryuqq.fleet.core.operation;

import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.fact.ServerFacts;
import com.ryuqq.fleet.core.fact.ShellQuote;
import com.ryuqq.fleet.core.inventory.Host;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 시스템 그룹 추가/삭제 (server.group).
 *
 * <p>{@link ServerFacts#GROUPS}와 비교하여 필요한 경우에만 groupadd/groupdel을 실행합니다.</p>
 *
 * @param group 그룹 이름
 * @param present true면 존재, false면 부재가 원하는 상태
 * @param system 시스템 그룹으로 생성할지 여부
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record GroupOperation(String group, boolean present, boolean system) implements Operation {

    public static final String TYPE = "server.group";

    public GroupOperation {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group cannot be null or blank");
        }
    }

    public static GroupOperation present(String group) {
        return new GroupOperation(group, true, false);
    }

    public static GroupOperation absent(String group) {
        return new GroupOperation(group, false, false);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Map<String, Object> args() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("group", group);
        args.put("present", present);
        args.put("system", system);
        return args;
    }

    @Override
    public List<String> commands(Host host, FactGatherer facts) {
        boolean exists = facts.get(host, ServerFacts.GROUPS).contains(group);
        if (present && !exists) {
            return List.of("groupadd " + (system ? "-r " : "") + ShellQuote.quote(group));
        }
        if (!present && exists) {
            return List.of("groupdel " + ShellQuote.quote(group));
        }
        return List.of();
    }
}
