package com.ryuqq.fleet.core.fact;

import com.ryuqq.fleet.core.fact.parser.ServerParsers;
import com.ryuqq.fleet.core.fact.value.CronEntry;
import com.ryuqq.fleet.core.fact.value.KernelModule;
import com.ryuqq.fleet.core.fact.value.LinuxDistribution;
import com.ryuqq.fleet.core.fact.value.MountInfo;
import com.ryuqq.fleet.core.fact.value.SelinuxStatus;
import com.ryuqq.fleet.core.fact.value.UserInfo;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * 서버 기본 Fact 모음.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class ServerFacts {

    /** 현재 사용자의 홈 디렉터리. */
    public static final Fact<String> HOME =
        Fact.of("home", "echo $HOME", ServerParsers::joined, null);

    /** 호스트 이름. */
    public static final Fact<String> HOSTNAME =
        Fact.of("hostname", "hostname", ServerParsers::joined, null);

    /** {@code uname -s} 기준 OS 이름. */
    public static final Fact<String> OS =
        Fact.of("os", "uname -s", ServerParsers::joined, null);

    /** {@code uname -r} 기준 OS 버전. */
    public static final Fact<String> OS_VERSION =
        Fact.of("os_version", "uname -r", ServerParsers::joined, null);

    /** {@code uname -p} 기준 아키텍처. */
    public static final Fact<String> ARCH =
        Fact.of("arch", "uname -p", ServerParsers::joined, null);

    /** 임의 명령의 출력. 인자: 명령 문자열. */
    public static final Fact<String> COMMAND =
        Fact.withArgs("command", ServerFacts::singleArgument, ServerParsers::joined, null);

    /** 실행 파일 경로. 인자: 실행 파일 이름. 없으면 null. */
    public static final Fact<String> WHICH =
        Fact.withArgs("which",
                args -> "command -v " + ShellQuote.quote(singleArgument(args)),
                ServerParsers::joined, null)
            .withProbe(args -> "command -v " + ShellQuote.quote(singleArgument(args)));

    /** 서버의 현재 시각. */
    public static final Fact<ZonedDateTime> DATE =
        Fact.of("date", "LANG=C date", ServerParsers::parseDate, ZonedDateTime::now);

    /** 마운트 경로 → 마운트 정보. */
    public static final Fact<Map<String, MountInfo>> MOUNTS =
        Fact.of("mounts", "mount", ServerParsers::parseMounts, Map::of);

    /** 적재된 커널 모듈. */
    public static final Fact<Map<String, KernelModule>> KERNEL_MODULES =
        Fact.<Map<String, KernelModule>>of("kernel_modules", "cat /proc/modules", ServerParsers::parseKernelModules, Map::of)
            .requiringPath("/proc/modules");

    /** {@code lsb_release} 정보. */
    public static final Fact<Map<String, String>> LSB_RELEASE =
        Fact.<Map<String, String>>of("lsb_release", "lsb_release -ca", ServerParsers::parseLsbRelease, Map::of)
            .requiringTool("lsb_release");

    /** sysctl 설정. */
    public static final Fact<Map<String, Object>> SYSCTL =
        Fact.of("sysctl", "sysctl -a", ServerParsers::parseSysctl, Map::of);

    /** 시스템 그룹 이름. */
    public static final Fact<List<String>> GROUPS =
        Fact.of("groups", "cat /etc/group", ServerParsers::parseGroups, List::of);

    /** crontab 명령 → 항목. 인자(선택): 사용자. */
    public static final Fact<Map<String, CronEntry>> CRONTAB =
        Fact.<Map<String, CronEntry>>withArgs("crontab", ServerFacts::crontabCommand, ServerParsers::parseCrontab, Map::of)
            .requiringTool("crontab");

    /** 사용자 이름 → 사용자 정보. */
    public static final Fact<Map<String, UserInfo>> USERS =
        Fact.of("users",
            "for i in $(cut -d: -f1 /etc/passwd); do "
                + "ID=$(id $i); "
                + "META=$(grep ^$i: /etc/passwd | cut -d: -f6-7); "
                + "echo \"$ID $META\"; "
                + "done",
            ServerParsers::parseUsers, Map::of);

    /** /etc/*-release 기반 Linux 배포판 정보. */
    public static final Fact<LinuxDistribution> LINUX_DISTRIBUTION =
        Fact.of("linux_distribution",
            "cd /etc/ && for file in $(ls -pdL *-release 2> /dev/null | grep -v /); "
                + "do echo \"/etc/${file}\"; cat \"/etc/${file}\"; echo ---; done",
            ServerParsers::parseLinuxDistribution, LinuxDistribution::unknown);

    /** Linux 배포판 이름 ({@link #LINUX_DISTRIBUTION}의 name). */
    public static final Fact<String> LINUX_NAME =
        Fact.derived("linux_name", LINUX_DISTRIBUTION, LinuxDistribution::name);

    /** SELinux 상태. */
    public static final Fact<SelinuxStatus> SELINUX =
        Fact.of("selinux", "sestatus", ServerParsers::parseSelinux, SelinuxStatus::unknown)
            .requiringTool("sestatus");

    private ServerFacts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 서버 Fact.
     *
     * @return 서버 Fact 목록
     */
    public static List<Fact<?>> all() {
        return List.of(HOME, HOSTNAME, OS, OS_VERSION, ARCH, COMMAND, WHICH, DATE, MOUNTS,
            KERNEL_MODULES, LSB_RELEASE, SYSCTL, GROUPS, CRONTAB, USERS, LINUX_DISTRIBUTION,
            LINUX_NAME, SELINUX);
    }

    private static String singleArgument(List<String> args) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("Exactly one argument required (current: " + args + ")");
        }
        return args.get(0);
    }

    private static String crontabCommand(List<String> args) {
        if (args.isEmpty()) {
            return "crontab -l 2> /dev/null || true";
        }
        return "crontab -l -u " + ShellQuote.quote(args.get(0)) + " 2> /dev/null || true";
    }
}
