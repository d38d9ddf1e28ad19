package com.ryuqq.fleet.core.fact;

import com.ryuqq.fleet.core.fact.parser.PackageParsers;

import java.util.List;
import java.util.Map;

/**
 * 패키지 관리자 Fact 모음.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class PackageFacts {

    /** 설치된 dpkg 패키지 이름 → 버전 목록. dpkg가 없으면 빈 Map. */
    public static final Fact<Map<String, List<String>>> DEB_PACKAGES =
        Fact.<Map<String, List<String>>>of("deb_packages", "dpkg -l", PackageParsers::parseDebPackages, Map::of)
            .requiringTool("dpkg");

    /** .deb 파일 또는 설치된 패키지의 이름/버전. 인자: 파일 경로 또는 패키지 이름. */
    public static final Fact<Map<String, String>> DEB_PACKAGE =
        Fact.<Map<String, String>>withArgs("deb_package", PackageFacts::debPackageCommand, PackageParsers::parseDebPackageInfo, Map::of)
            .requiringTool("dpkg");

    /** 설치된 npm 패키지 이름 → 버전 목록. 인자(선택): 프로젝트 디렉터리, 없으면 전역. */
    public static final Fact<Map<String, List<String>>> NPM_PACKAGES =
        Fact.<Map<String, List<String>>>withArgs("npm_packages", PackageFacts::npmListCommand, PackageParsers::parseNpmPackages, Map::of)
            .requiringTool("npm");

    private PackageFacts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 패키지 Fact.
     *
     * @return 패키지 Fact 목록
     */
    public static List<Fact<?>> all() {
        return List.of(DEB_PACKAGES, DEB_PACKAGE, NPM_PACKAGES);
    }

    private static String debPackageCommand(List<String> args) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("deb_package requires a package name or file (current: " + args + ")");
        }
        String name = ShellQuote.quote(args.get(0));
        return "dpkg -I " + name + " 2> /dev/null || dpkg -s " + name + " 2> /dev/null || true";
    }

    private static String npmListCommand(List<String> args) {
        if (args.isEmpty() || args.get(0) == null || args.get(0).isBlank()) {
            return "npm list -g --depth=0";
        }
        return "cd " + ShellQuote.quote(args.get(0)) + " && npm list --depth=0";
    }
}
