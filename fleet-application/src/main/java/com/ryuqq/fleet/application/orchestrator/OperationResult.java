package com.ryuqq.fleet.application.orchestrator;

import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.NameStack;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.outcome.HostOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operation 하나의 Host별 실행 결과.
 *
 * @param hash Operation 해시
 * @param names Operation 이름 스택
 * @param outcomes Host → 결과 (삽입 순서 유지)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record OperationResult(OpHash hash, NameStack names, Map<HostName, HostOutcome> outcomes) {

    public OperationResult {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
        if (names == null) {
            throw new IllegalArgumentException("names cannot be null");
        }
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public long changedCount() {
        return outcomes.values().stream().filter(HostOutcome::isChanged).count();
    }

    public long unchangedCount() {
        return outcomes.values().stream().filter(HostOutcome::isUnchanged).count();
    }

    public long failedCount() {
        return outcomes.values().stream().filter(HostOutcome::isFail).count();
    }

    public long skippedCount() {
        return outcomes.values().stream().filter(HostOutcome::isSkipped).count();
    }
}
