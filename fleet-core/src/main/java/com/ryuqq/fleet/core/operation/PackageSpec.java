package com.ryuqq.fleet.core.operation;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * "name", "name=version", "name@version" 형식의 패키지 지정.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
record PackageSpec(String raw, String name, String version) {

    static PackageSpec parse(String raw, char separator) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("package cannot be null or blank");
        }
        int index = raw.lastIndexOf(separator);
        if (index <= 0) {
            return new PackageSpec(raw, raw.toLowerCase(Locale.ROOT), null);
        }
        return new PackageSpec(raw, raw.substring(0, index).toLowerCase(Locale.ROOT), raw.substring(index + 1));
    }

    boolean isInstalledIn(Map<String, List<String>> installed) {
        List<String> versions = installed.get(name);
        if (versions == null) {
            return false;
        }
        return version == null || versions.contains(version);
    }
}
