package com.ryuqq.fleet.core.fact.parser;

import com.ryuqq.fleet.core.fact.value.CronEntry;
import com.ryuqq.fleet.core.fact.value.KernelModule;
import com.ryuqq.fleet.core.fact.value.LinuxDistribution;
import com.ryuqq.fleet.core.fact.value.MountInfo;
import com.ryuqq.fleet.core.fact.value.SelinuxStatus;
import com.ryuqq.fleet.core.fact.value.UserInfo;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 서버 Fact 출력 파서.
 *
 * <p>모든 메서드는 순수 함수이며, 명령 표준 출력의 줄 목록을 받아 구조화된 값을 반환합니다.
 * 인식할 수 없는 줄은 건너뜁니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class ServerParsers {

    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss zzz yyyy", Locale.US);

    private static final Pattern SYSCTL_SIMPLE_VALUE = Pattern.compile("^[a-zA-Z0-9_.\\s]+$");

    private static final Pattern USER_LINE = Pattern.compile(
        "^uid=[0-9]+\\(([a-zA-Z0-9_.\\-]+)\\) gid=[0-9]+\\(([a-zA-Z0-9_.\\-]+)\\) "
            + "groups=([a-zA-Z0-9_.\\-,()\\s]+) (.*)$");

    private static final Pattern USER_GROUP = Pattern.compile("^[0-9]+\\(([a-zA-Z0-9_.\\-]+)\\)$");

    private static final Pattern SELINUX_STATUS = Pattern.compile("^SELinux status:\\s+(\\S+)");

    private static final Pattern LEGACY_RELEASE =
        Pattern.compile("^(.+?) release ([0-9]+)(?:\\.([0-9]+))?.*$");

    private static final Map<String, String> PRETTY_DISTRIBUTION_NAMES = Map.of(
        "alpine", "Alpine",
        "centos", "CentOS",
        "debian", "Debian",
        "fedora", "Fedora",
        "gentoo", "Gentoo",
        "opensuse", "openSUSE",
        "rhel", "RedHat",
        "ubuntu", "Ubuntu"
    );

    private ServerParsers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 출력 전체를 하나의 문자열로 결합.
     *
     * @param lines 출력 줄
     * @return 줄바꿈으로 연결한 문자열, 출력이 없으면 null
     */
    public static String joined(List<String> lines) {
        if (lines.isEmpty()) {
            return null;
        }
        return String.join("\n", lines).strip();
    }

    /**
     * {@code LANG=C date} 출력 파싱.
     *
     * @param lines 출력 줄
     * @return 파싱된 시각
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static ZonedDateTime parseDate(List<String> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("date output is empty");
        }
        String normalized = lines.get(0).trim().replaceAll("\\s+", " ");
        try {
            return ZonedDateTime.parse(normalized, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable date output: " + normalized, e);
        }
    }

    /**
     * {@code mount} 출력 파싱.
     *
     * <p>Linux 형식({@code dev on /path type ext4 (rw,relatime)})과
     * BSD/macOS 형식({@code dev on /path (apfs, local)})을 모두 처리합니다.</p>
     *
     * @param lines 출력 줄
     * @return 마운트 경로 → 마운트 정보
     */
    public static Map<String, MountInfo> parseMounts(List<String> lines) {
        Map<String, MountInfo> devices = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw;
            boolean isMap = false;
            if (line.startsWith("map ")) {
                line = line.substring(4);
                isMap = true;
            }
            String[] parts = line.split(" ", 4);
            if (parts.length < 4) {
                continue;
            }
            String device = isMap ? "map " + parts[0] : parts[0];
            String path = parts[2];
            String otherBits = parts[3];

            String type;
            List<String> options;
            if (otherBits.startsWith("type")) {
                String[] typeParts = otherBits.split(" ", 3);
                type = typeParts.length > 1 ? typeParts[1] : "";
                options = splitOptions(typeParts.length > 2 ? typeParts[2] : "");
            } else {
                options = new ArrayList<>(splitOptions(otherBits));
                type = options.isEmpty() ? "" : options.remove(0);
            }
            devices.put(path, new MountInfo(device, type, options));
        }
        return devices;
    }

    private static List<String> splitOptions(String value) {
        String stripped = stripChars(value.trim(), "()");
        if (stripped.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(stripped.split(",")).map(String::trim).toList();
    }

    /**
     * {@code /proc/modules} 출력 파싱.
     *
     * @param lines 출력 줄
     * @return 모듈 이름 → 모듈 정보
     */
    public static Map<String, KernelModule> parseKernelModules(List<String> lines) {
        Map<String, KernelModule> modules = new LinkedHashMap<>();
        for (String line : lines) {
            String[] parts = line.split(" ", 6);
            if (parts.length < 5) {
                continue;
            }
            List<String> depends = "-".equals(parts[3])
                ? List.of()
                : Arrays.stream(parts[3].split(",")).filter(value -> !value.isEmpty()).toList();
            modules.put(parts[0], new KernelModule(parts[1], Integer.parseInt(parts[2]), parts[4], depends));
        }
        return modules;
    }

    /**
     * {@code lsb_release -ca} 출력 파싱.
     *
     * <p>키는 소문자로 바꾸며, 여러 단어 키는 마지막 단어만 사용합니다
     * ("Distributor ID" → "id").</p>
     *
     * @param lines 출력 줄
     * @return 키 → 값
     */
    public static Map<String, String> parseLsbRelease(List<String> lines) {
        Map<String, String> items = new LinkedHashMap<>();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (key.contains(" ")) {
                key = key.substring(key.lastIndexOf(' ') + 1);
            }
            items.put(key, line.substring(colon + 1).trim());
        }
        return items;
    }

    /**
     * {@code sysctl -a} 출력 파싱.
     *
     * <p>영숫자 값은 공백으로 나누어 정수 변환을 시도합니다. 값이 하나면 단일 값,
     * 여럿이면 목록이 됩니다. 그 외 값은 원문 문자열로 보관합니다.</p>
     *
     * @param lines 출력 줄
     * @return 키 → 값 (Long, String, 또는 List)
     */
    public static Map<String, Object> parseSysctl(List<String> lines) {
        Map<String, Object> sysctls = new LinkedHashMap<>();
        for (String line : lines) {
            int separator = line.indexOf('=');
            if (separator < 0) {
                separator = line.indexOf(':');
            }
            if (separator < 0) {
                continue;
            }
            String key = line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();
            if (key.isEmpty() || value.isEmpty()) {
                continue;
            }
            if (SYSCTL_SIMPLE_VALUE.matcher(value).matches()) {
                List<Object> values = Arrays.stream(value.split("\\s+"))
                    .map(ServerParsers::tryLong)
                    .toList();
                sysctls.put(key, values.size() == 1 ? values.get(0) : values);
            } else {
                sysctls.put(key, value);
            }
        }
        return sysctls;
    }

    /**
     * {@code /etc/group} 출력 파싱.
     *
     * @param lines 출력 줄
     * @return 그룹 이름 목록
     */
    public static List<String> parseGroups(List<String> lines) {
        List<String> groups = new ArrayList<>();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon >= 0) {
                groups.add(line.substring(0, colon));
            }
        }
        return groups;
    }

    /**
     * {@code crontab -l} 출력 파싱.
     *
     * <p>빈 줄과 주석은 다음 항목의 주석으로 모읍니다.</p>
     *
     * @param lines 출력 줄
     * @return 명령 → crontab 항목
     */
    public static Map<String, CronEntry> parseCrontab(List<String> lines) {
        Map<String, CronEntry> crons = new LinkedHashMap<>();
        List<String> comments = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                comments.add(line);
                continue;
            }
            String[] parts = line.split(" ", 6);
            if (parts.length < 6) {
                continue;
            }
            crons.put(parts[5], new CronEntry(parts[0], parts[1], parts[3], parts[2], parts[4], comments));
            comments = new ArrayList<>();
        }
        return crons;
    }

    /**
     * 사용자 목록 스크립트 출력 파싱.
     *
     * <p>각 줄은 {@code id <user>} 출력 뒤에 passwd의 {@code home:shell} 필드가 붙은 형식입니다.</p>
     *
     * @param lines 출력 줄
     * @return 사용자 이름 → 사용자 정보
     */
    public static Map<String, UserInfo> parseUsers(List<String> lines) {
        Map<String, UserInfo> users = new LinkedHashMap<>();
        for (String line : lines) {
            Matcher matcher = USER_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String homeShell = matcher.group(4);
            String home = null;
            String shell = null;
            if (homeShell.endsWith(":")) {
                home = homeShell.substring(0, homeShell.length() - 1);
            } else if (homeShell.startsWith(":")) {
                shell = homeShell.substring(1);
            } else if (homeShell.contains(":")) {
                int colon = homeShell.indexOf(':');
                home = homeShell.substring(0, colon);
                shell = homeShell.substring(colon + 1);
            }

            String group = matcher.group(2);
            List<String> groups = new ArrayList<>();
            for (String item : matcher.group(3).split(",")) {
                Matcher groupMatcher = USER_GROUP.matcher(item.trim());
                if (groupMatcher.matches() && !groupMatcher.group(1).equals(group)) {
                    groups.add(groupMatcher.group(1));
                }
            }
            users.put(matcher.group(1), new UserInfo(group, groups, home, shell));
        }
        return users;
    }

    /**
     * {@code /etc/*-release} 파일 덤프 파싱.
     *
     * <p>입력은 "파일 경로, 파일 내용, ---" 블록의 반복입니다. os-release 형식
     * (KEY=value)을 우선 사용하고, 없으면 "Name release X.Y" 형식을 사용합니다.</p>
     *
     * @param lines 출력 줄
     * @return 배포판 정보
     */
    public static LinuxDistribution parseLinuxDistribution(List<String> lines) {
        Map<String, String> releaseMeta = new LinkedHashMap<>();
        String legacyLine = null;
        boolean expectFilename = true;
        for (String raw : lines) {
            String line = raw.strip();
            if ("---".equals(line)) {
                expectFilename = true;
                continue;
            }
            if (expectFilename) {
                expectFilename = line.isEmpty();
                continue;
            }
            int equals = line.indexOf('=');
            if (equals > 0 && !line.startsWith("#")) {
                String key = line.substring(0, equals).trim().toUpperCase(Locale.ROOT);
                releaseMeta.putIfAbsent(key, stripChars(line.substring(equals + 1).trim(), "\"'"));
            } else if (legacyLine == null && LEGACY_RELEASE.matcher(line).matches()) {
                legacyLine = line;
            }
        }

        if (releaseMeta.isEmpty() && legacyLine == null) {
            return LinuxDistribution.unknown();
        }

        String name = null;
        Integer major = null;
        Integer minor = null;
        String id = releaseMeta.get("ID");
        if (id != null) {
            name = PRETTY_DISTRIBUTION_NAMES.getOrDefault(id.toLowerCase(Locale.ROOT), releaseMeta.get("NAME"));
            String versionId = releaseMeta.get("VERSION_ID");
            if (versionId != null) {
                String[] version = versionId.split("\\.");
                major = tryInteger(version[0]);
                minor = version.length > 1 ? tryInteger(version[1]) : null;
            }
        }
        if (legacyLine != null && (name == null || major == null)) {
            Matcher matcher = LEGACY_RELEASE.matcher(legacyLine);
            if (matcher.matches()) {
                if (name == null) {
                    String legacyName = matcher.group(1).replace(" Linux", "").trim();
                    name = PRETTY_DISTRIBUTION_NAMES.getOrDefault(legacyName.toLowerCase(Locale.ROOT), legacyName);
                }
                if (major == null) {
                    major = tryInteger(matcher.group(2));
                    minor = matcher.group(3) == null ? null : tryInteger(matcher.group(3));
                }
            }
        }
        if (minor != null && minor == 0) {
            minor = null;
        }
        return new LinuxDistribution(name, major, minor, releaseMeta);
    }

    /**
     * {@code sestatus} 출력 파싱.
     *
     * @param lines 출력 줄
     * @return SELinux 상태
     */
    public static SelinuxStatus parseSelinux(List<String> lines) {
        if (lines.isEmpty()) {
            return SelinuxStatus.unknown();
        }
        Matcher matcher = SELINUX_STATUS.matcher(String.join("\n", lines));
        if (!matcher.lookingAt()) {
            return SelinuxStatus.unknown();
        }
        return new SelinuxStatus(matcher.group(1));
    }

    static Object tryLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static Integer tryInteger(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String stripChars(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
