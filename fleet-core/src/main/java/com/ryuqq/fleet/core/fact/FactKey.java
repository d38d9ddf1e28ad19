package com.ryuqq.fleet.core.fact;

import com.ryuqq.fleet.core.model.HostName;

import java.util.List;

/**
 * Fact 캐시 키.
 *
 * <p>같은 Host, 같은 Fact, 같은 인자 조합은 실행(run) 동안 한 번만 조회됩니다.</p>
 *
 * @param host 대상 Host
 * @param factName Fact 이름
 * @param args Fact 인자 (순서 유지)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record FactKey(HostName host, String factName, List<String> args) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public FactKey {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (factName == null || factName.isBlank()) {
            throw new IllegalArgumentException("factName cannot be null or blank");
        }
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }
        args = List.copyOf(args);
    }

    @Override
    public String toString() {
        return host + "/" + factName + (args.isEmpty() ? "" : args.toString());
    }
}
