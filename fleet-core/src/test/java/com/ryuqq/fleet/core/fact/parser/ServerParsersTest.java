package com.ryuqq.fleet.core.fact.parser;

import com.ryuqq.fleet.core.fact.value.CronEntry;
import com.ryuqq.fleet.core.fact.value.KernelModule;
import com.ryuqq.fleet.core.fact.value.LinuxDistribution;
import com.ryuqq.fleet.core.fact.value.MountInfo;
import com.ryuqq.fleet.core.fact.value.UserInfo;
import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 서버 Fact 파서 테스트 (고정 출력 텍스트 기반).
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class ServerParsersTest {

    @Test
    void joined_EmptyOutput_ReturnsNull() {
        // When & Then
        assertNull(ServerParsers.joined(List.of()));
        assertEquals("Linux", ServerParsers.joined(List.of("Linux")));
    }

    @Test
    void parseDate_LangCOutput_ParsesZonedDateTime() {
        // When
        ZonedDateTime date = ServerParsers.parseDate(List.of("Thu Aug  1 15:43:12 UTC 2024"));

        // Then
        assertEquals(2024, date.getYear());
        assertEquals(8, date.getMonthValue());
        assertEquals(1, date.getDayOfMonth());
        assertEquals(15, date.getHour());
    }

    @Test
    void parseMounts_LinuxAndBsdFormats() {
        // Given
        List<String> output = List.of(
            "/dev/sda1 on / type ext4 (rw,relatime)",
            "/dev/disk1s1 on /System/Volumes/Data (apfs, local, journaled)",
            "map auto_home on /System/Volumes/Data/home (autofs, automounted, nobrowse)"
        );

        // When
        Map<String, MountInfo> mounts = ServerParsers.parseMounts(output);

        // Then
        assertEquals(new MountInfo("/dev/sda1", "ext4", List.of("rw", "relatime")), mounts.get("/"));
        assertEquals(new MountInfo("/dev/disk1s1", "apfs", List.of("local", "journaled")),
            mounts.get("/System/Volumes/Data"));
        assertEquals("map auto_home", mounts.get("/System/Volumes/Data/home").device());
    }

    @Test
    void parseKernelModules_ParsesDepends() {
        // Given
        List<String> output = List.of(
            "nf_nat 45056 2 xt_MASQUERADE,iptable_nat, Live 0x0000000000000000",
            "ip_tables 32768 1 - Live 0x0000000000000000"
        );

        // When
        Map<String, KernelModule> modules = ServerParsers.parseKernelModules(output);

        // Then
        assertEquals(new KernelModule("45056", 2, "Live", List.of("xt_MASQUERADE", "iptable_nat")),
            modules.get("nf_nat"));
        assertEquals(1, modules.get("ip_tables").instances());
        assertTrue(modules.get("ip_tables").depends().isEmpty());
    }

    @Test
    void parseLsbRelease_DistributorIdBecomesId() {
        // Given
        List<String> output = List.of(
            "Distributor ID:\tUbuntu",
            "Description:\tUbuntu 18.04.2 LTS",
            "Release:\t18.04",
            "Codename:\tbionic"
        );

        // When
        Map<String, String> release = ServerParsers.parseLsbRelease(output);

        // Then
        assertEquals(Map.of(
            "id", "Ubuntu",
            "description", "Ubuntu 18.04.2 LTS",
            "release", "18.04",
            "codename", "bionic"
        ), release);
    }

    @Test
    void parseSysctl_CoercesIntegers() {
        // Given
        List<String> output = List.of(
            "fs.inotify.max_queued_events = 16384",
            "fs.inode-state = 44565 360 0 0 0 0 0",
            "kernel.hostname = my-host",
            "kernel.ostype: Linux"
        );

        // When
        Map<String, Object> sysctl = ServerParsers.parseSysctl(output);

        // Then
        assertEquals(16384L, sysctl.get("fs.inotify.max_queued_events"));
        assertEquals(List.of(44565L, 360L, 0L, 0L, 0L, 0L, 0L), sysctl.get("fs.inode-state"));
        assertEquals("my-host", sysctl.get("kernel.hostname"));
        assertEquals("Linux", sysctl.get("kernel.ostype"));
    }

    @Test
    void parseGroups_ReturnsNames() {
        // When
        List<String> groups = ServerParsers.parseGroups(List.of("root:x:0:", "docker:x:999:deploy", "garbage"));

        // Then
        assertEquals(List.of("root", "docker"), groups);
    }

    @Test
    void parseCrontab_CollectsPrecedingComments() {
        // Given
        List<String> output = List.of(
            "# backups",
            "0 2 * * 1 /usr/local/bin/backup --full",
            "*/5 * 1 6 * /usr/bin/ping-home"
        );

        // When
        Map<String, CronEntry> crontab = ServerParsers.parseCrontab(output);

        // Then
        assertEquals(new CronEntry("0", "2", "*", "*", "1", List.of("# backups")),
            crontab.get("/usr/local/bin/backup --full"));
        CronEntry ping = crontab.get("/usr/bin/ping-home");
        assertEquals("*/5", ping.minute());
        assertEquals("1", ping.dayOfMonth());
        assertEquals("6", ping.month());
        assertTrue(ping.comments().isEmpty());
    }

    @Test
    void parseUsers_SplitsPrimaryAndSecondaryGroups() {
        // Given
        List<String> output = List.of(
            "uid=0(root) gid=0(root) groups=0(root) /root:/bin/bash",
            "uid=1000(deploy) gid=1000(deploy) groups=1000(deploy),27(sudo),999(docker) /home/deploy:",
            "uid=2(daemon) gid=2(daemon) groups=2(daemon) :/usr/sbin/nologin"
        );

        // When
        Map<String, UserInfo> users = ServerParsers.parseUsers(output);

        // Then
        assertEquals(new UserInfo("root", List.of(), "/root", "/bin/bash"), users.get("root"));
        assertEquals(new UserInfo("deploy", List.of("sudo", "docker"), "/home/deploy", null), users.get("deploy"));
        assertEquals(new UserInfo("daemon", List.of(), null, "/usr/sbin/nologin"), users.get("daemon"));
    }

    @Test
    void parseLinuxDistribution_OsRelease() {
        // Given
        List<String> output = List.of(
            "/etc/lsb-release",
            "DISTRIB_ID=Ubuntu",
            "---",
            "/etc/os-release",
            "NAME=\"Ubuntu\"",
            "ID=ubuntu",
            "VERSION_ID=\"20.04\"",
            "---"
        );

        // When
        LinuxDistribution distribution = ServerParsers.parseLinuxDistribution(output);

        // Then
        assertEquals("Ubuntu", distribution.name());
        assertEquals(20, distribution.major());
        assertEquals(4, distribution.minor());
        assertEquals("ubuntu", distribution.releaseMeta().get("ID"));
    }

    @Test
    void parseLinuxDistribution_LegacyReleaseFile() {
        // Given
        List<String> output = List.of(
            "/etc/centos-release",
            "CentOS Linux release 7.9.2009 (Core)",
            "---"
        );

        // When
        LinuxDistribution distribution = ServerParsers.parseLinuxDistribution(output);

        // Then
        assertEquals("CentOS", distribution.name());
        assertEquals(7, distribution.major());
        assertEquals(9, distribution.minor());
    }

    @Test
    void parseLinuxDistribution_NoReleaseFiles_ReturnsUnknown() {
        // When & Then
        assertEquals(LinuxDistribution.unknown(), ServerParsers.parseLinuxDistribution(List.of()));
    }

    @Test
    void parseSelinux_ReadsStatus() {
        // When & Then
        assertEquals("enabled",
            ServerParsers.parseSelinux(List.of("SELinux status:                 enabled", "Mode: enforcing")).mode());
        assertNull(ServerParsers.parseSelinux(List.of("something else")).mode());
        assertNull(ServerParsers.parseSelinux(List.of()).mode());
    }
}
