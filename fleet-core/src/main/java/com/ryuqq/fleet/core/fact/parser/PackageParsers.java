package com.ryuqq.fleet.core.fact.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 패키지 관리자 Fact 출력 파서.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class PackageParsers {

    /**
     * {@code dpkg -l}의 설치된 패키지 줄.
     */
    public static final Pattern DEB_PACKAGE_LINE =
        Pattern.compile("^ii\\s+([a-zA-Z0-9+\\-.]+):?[a-zA-Z0-9]*\\s+([a-zA-Z0-9:~.\\-+]+).+$");

    /**
     * {@code npm list --depth=0}의 패키지 줄.
     */
    public static final Pattern NPM_PACKAGE_LINE =
        Pattern.compile("^[└├]──\\s([a-zA-Z0-9\\-]+)@([0-9.]+)$");

    private static final Pattern DEB_INFO_NAME = Pattern.compile("^Package: ([a-zA-Z0-9\\-]+)$");
    private static final Pattern DEB_INFO_VERSION = Pattern.compile("^Version: ([a-zA-Z0-9:~.+\\-]+)$");

    private PackageParsers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 정규식으로 패키지 목록 파싱.
     *
     * <p>첫 번째 그룹은 패키지 이름(소문자로 정규화), 두 번째 그룹은 버전입니다.
     * 같은 패키지의 여러 버전은 등장 순서대로 중복 없이 모읍니다.</p>
     *
     * @param pattern 패키지 줄 정규식
     * @param lines 출력 줄
     * @return 패키지 이름 → 버전 목록
     */
    public static Map<String, List<String>> parsePackages(Pattern pattern, List<String> lines) {
        Map<String, List<String>> packages = new LinkedHashMap<>();
        for (String line : lines) {
            Matcher matcher = pattern.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String name = matcher.group(1).toLowerCase(Locale.ROOT);
            List<String> versions = packages.computeIfAbsent(name, key -> new ArrayList<>());
            if (!versions.contains(matcher.group(2))) {
                versions.add(matcher.group(2));
            }
        }
        return packages;
    }

    public static Map<String, List<String>> parseDebPackages(List<String> lines) {
        return parsePackages(DEB_PACKAGE_LINE, lines);
    }

    public static Map<String, List<String>> parseNpmPackages(List<String> lines) {
        return parsePackages(NPM_PACKAGE_LINE, lines);
    }

    /**
     * {@code dpkg -I} / {@code dpkg -s} 출력 파싱.
     *
     * @param lines 출력 줄
     * @return "name", "version" 키를 가진 Map (찾지 못한 키는 없음)
     */
    public static Map<String, String> parseDebPackageInfo(List<String> lines) {
        Map<String, String> info = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            Matcher name = DEB_INFO_NAME.matcher(line);
            if (name.matches()) {
                info.put("name", name.group(1));
                continue;
            }
            Matcher version = DEB_INFO_VERSION.matcher(line);
            if (version.matches()) {
                info.put("version", version.group(1));
            }
        }
        return info;
    }
}
