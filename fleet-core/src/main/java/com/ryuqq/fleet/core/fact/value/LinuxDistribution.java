package com.ryuqq.fleet.core.fact.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linux 배포판 정보.
 *
 * @param name 배포판 이름 (예: Ubuntu, CentOS), 알 수 없으면 null
 * @param major 주 버전, 알 수 없으면 null
 * @param minor 부 버전, 알 수 없으면 null
 * @param releaseMeta os-release 키/값 (키는 대문자)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record LinuxDistribution(String name, Integer major, Integer minor, Map<String, String> releaseMeta) {

    public LinuxDistribution {
        releaseMeta = releaseMeta == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(releaseMeta));
    }

    /**
     * 배포판을 알 수 없을 때의 값.
     *
     * @return 모든 필드가 비어있는 LinuxDistribution
     */
    public static LinuxDistribution unknown() {
        return new LinuxDistribution(null, null, null, Map.of());
    }
}
