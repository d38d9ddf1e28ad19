package com.ryuqq.fleet.core.fact.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 패키지 Fact 파서 테스트.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class PackageParsersTest {

    @Test
    void parseDebPackages_InstalledLinesOnly() {
        // Given
        List<String> output = List.of(
            "Desired=Unknown/Install/Remove/Purge/Hold",
            "||/ Name           Version        Architecture Description",
            "+++-==============-==============-============-=================",
            "ii  adduser        3.118          all          add and remove users",
            "ii  libc6:amd64    2.31-0ubuntu9  amd64        GNU C Library",
            "rc  oldpkg         1.0            all          removed package"
        );

        // When
        Map<String, List<String>> packages = PackageParsers.parseDebPackages(output);

        // Then
        assertEquals(Map.of(
            "adduser", List.of("3.118"),
            "libc6", List.of("2.31-0ubuntu9")
        ), packages);
    }

    @Test
    void parseNpmPackages_TreeOutput() {
        // Given
        List<String> output = List.of(
            "/usr/lib",
            "├── npm@6.14.4",
            "└── pm2@4.4.0"
        );

        // When
        Map<String, List<String>> packages = PackageParsers.parseNpmPackages(output);

        // Then
        assertEquals(Map.of("npm", List.of("6.14.4"), "pm2", List.of("4.4.0")), packages);
    }

    @Test
    void parseDebPackageInfo_NameAndVersion() {
        // Given
        List<String> output = List.of(
            " Package: nginx",
            " Version: 1.18.0-0ubuntu1",
            " Architecture: amd64"
        );

        // When & Then
        assertEquals(Map.of("name", "nginx", "version", "1.18.0-0ubuntu1"),
            PackageParsers.parseDebPackageInfo(output));
    }
}
