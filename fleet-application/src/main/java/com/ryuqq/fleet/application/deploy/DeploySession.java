package com.ryuqq.fleet.application.deploy;

import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.plan.OperationRecorder;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * 한 번의 평가에서 모든 {@link DeployContext}가 공유하는 상태.
 *
 * <p>호출 위치별 Host 방문 횟수를 보관하여 CallSite의 occurrence를 계산합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
final class DeploySession {

    private final Inventory inventory;
    private final OperationRecorder recorder;
    private final FactGatherer gatherer;
    private final Map<String, Map<HostName, Integer>> visits = new HashMap<>();

    DeploySession(Inventory inventory, OperationRecorder recorder, FactGatherer gatherer) {
        this.inventory = inventory;
        this.recorder = recorder;
        this.gatherer = gatherer;
    }

    Inventory inventory() {
        return inventory;
    }

    OperationRecorder recorder() {
        return recorder;
    }

    FactGatherer gatherer() {
        return gatherer;
    }

    /**
     * 호출 위치 방문 기록.
     *
     * <p>occurrence는 범위 내 Host들이 이 호출 위치를 이미 방문한 횟수의 최댓값입니다.
     * 반환 후 범위 내 모든 Host의 방문 횟수는 occurrence + 1이 됩니다.</p>
     *
     * @param siteKey 호출 위치 키
     * @param hosts 범위 내 Host
     * @return occurrence
     */
    int visit(String siteKey, Collection<HostName> hosts) {
        Map<HostName, Integer> counts = visits.computeIfAbsent(siteKey, key -> new HashMap<>());
        int occurrence = 0;
        for (HostName host : hosts) {
            occurrence = Math.max(occurrence, counts.getOrDefault(host, 0));
        }
        for (HostName host : hosts) {
            counts.put(host, occurrence + 1);
        }
        return occurrence;
    }
}
