package com.ryuqq.fleet.core.operation;

import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.fact.PackageFacts;
import com.ryuqq.fleet.core.fact.ShellQuote;
import com.ryuqq.fleet.core.inventory.Host;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * apt 패키지 설치/제거 (apt.packages).
 *
 * <p>{@link PackageFacts#DEB_PACKAGES}와 비교하여 설치되지 않은 패키지만 설치하고,
 * 설치된 패키지만 제거합니다. 패키지는 "name" 또는 "name=version" 형식입니다.</p>
 *
 * @param packages 패키지 목록
 * @param present true면 설치, false면 제거
 * @param update 설치/제거 전에 apt-get update 실행 여부
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record AptPackagesOperation(List<String> packages, boolean present, boolean update) implements Operation {

    public static final String TYPE = "apt.packages";

    private static final String APT_GET = "DEBIAN_FRONTEND=noninteractive apt-get -y";

    public AptPackagesOperation {
        if (packages == null) {
            throw new IllegalArgumentException("packages cannot be null");
        }
        packages = List.copyOf(packages);
    }

    public static AptPackagesOperation install(String... packages) {
        return new AptPackagesOperation(List.of(packages), true, false);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Map<String, Object> args() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("packages", packages);
        args.put("present", present);
        args.put("update", update);
        return args;
    }

    @Override
    public List<String> commands(Host host, FactGatherer facts) {
        List<String> commands = new ArrayList<>();
        if (update) {
            commands.add(APT_GET + " update");
        }
        if (packages.isEmpty()) {
            return commands;
        }

        Map<String, List<String>> installed = facts.get(host, PackageFacts.DEB_PACKAGES);
        List<String> pending = new ArrayList<>();
        for (String raw : packages) {
            PackageSpec spec = PackageSpec.parse(raw, '=');
            if (spec.isInstalledIn(installed) != present) {
                pending.add(present ? spec.raw() : spec.name());
            }
        }
        if (!pending.isEmpty()) {
            commands.add(APT_GET + (present ? " install " : " remove ") + ShellQuote.join(pending));
        }
        return commands;
    }
}
