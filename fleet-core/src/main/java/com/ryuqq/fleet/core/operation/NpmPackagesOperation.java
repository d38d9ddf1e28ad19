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
 * npm 패키지 설치/제거 (npm.packages).
 *
 * <p>directory가 없으면 전역(-g) 패키지를, 있으면 해당 디렉터리의 로컬 패키지를 다룹니다.
 * 패키지는 "name" 또는 "name@version" 형식입니다.</p>
 *
 * @param packages 패키지 목록
 * @param present true면 설치, false면 제거
 * @param directory 프로젝트 디렉터리 (null이면 전역)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record NpmPackagesOperation(List<String> packages, boolean present, String directory) implements Operation {

    public static final String TYPE = "npm.packages";

    public NpmPackagesOperation {
        if (packages == null) {
            throw new IllegalArgumentException("packages cannot be null");
        }
        packages = List.copyOf(packages);
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
        args.put("directory", directory);
        return args;
    }

    @Override
    public List<String> commands(Host host, FactGatherer facts) {
        if (packages.isEmpty()) {
            return List.of();
        }
        Map<String, List<String>> installed = directory == null
            ? facts.get(host, PackageFacts.NPM_PACKAGES)
            : facts.get(host, PackageFacts.NPM_PACKAGES, directory);

        List<String> pending = new ArrayList<>();
        for (String raw : packages) {
            PackageSpec spec = PackageSpec.parse(raw, '@');
            if (spec.isInstalledIn(installed) != present) {
                pending.add(present ? spec.raw() : spec.name());
            }
        }
        if (pending.isEmpty()) {
            return List.of();
        }

        String verb = present ? "install" : "uninstall";
        if (directory == null) {
            return List.of("npm " + verb + " -g " + ShellQuote.join(pending));
        }
        return List.of("cd " + ShellQuote.quote(directory) + " && npm " + verb + " " + ShellQuote.join(pending));
    }
}
