package com.ryuqq.fleet.core.plan;

import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.OpHash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 한 번의 실행(run)에 대한 Operation 계획.
 *
 * <p>Plan은 다음 세 가지로 구성됩니다:</p>
 * <ul>
 *   <li>OpHash → {@link OperationMeta}</li>
 *   <li>전역 실행 순서 (OpHash 목록)</li>
 *   <li>Host별 실행 순서 (전역 순서의 부분 수열)</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong> {@link OperationRecorder}가 평가 단계 동안 변경하고,
 * 평가가 끝나면 {@link #freeze()}되어 읽기 전용이 됩니다. 동결된 Plan은
 * 여러 실행 스레드가 잠금 없이 읽을 수 있습니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class Plan {

    private final Map<OpHash, OperationMeta> operations = new HashMap<>();
    private final List<OpHash> opOrder = new ArrayList<>();
    private final Map<HostName, List<OpHash>> hostOps = new LinkedHashMap<>();
    private volatile boolean frozen;

    Plan() {
    }

    OperationMeta addOperation(OperationMeta meta) {
        checkMutable();
        operations.put(meta.getHash(), meta);
        opOrder.add(meta.getHash());
        return meta;
    }

    /**
     * Host를 Operation의 Host 집합에 추가.
     *
     * <p>Host의 로컬 목록에는 전역 순서 인덱스 위치에 삽입되므로, 기존 Operation에
     * 뒤늦게 합류한 Host도 로컬 순서가 전역 순서의 부분 수열로 유지됩니다.</p>
     *
     * @return 새로 추가된 경우 true
     */
    boolean addHost(OperationMeta meta, HostName host) {
        checkMutable();
        if (!meta.addHost(host)) {
            return false;
        }
        List<OpHash> local = hostOps.computeIfAbsent(host, key -> new ArrayList<>());
        local.add(insertionPoint(local, meta.getOrderIndex()), meta.getHash());
        return true;
    }

    private int insertionPoint(List<OpHash> local, int orderIndex) {
        int low = 0;
        int high = local.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (operations.get(local.get(mid)).getOrderIndex() < orderIndex) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Plan is frozen and cannot be modified");
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * 전역 실행 순서.
     *
     * @return OpHash 목록 (불변 복사본)
     */
    public List<OpHash> getOpOrder() {
        return List.copyOf(opOrder);
    }

    /**
     * Operation 메타데이터 조회.
     *
     * @param hash OpHash
     * @return OperationMeta
     * @throws IllegalArgumentException Plan에 없는 hash인 경우
     */
    public OperationMeta getOpMeta(OpHash hash) {
        OperationMeta meta = operations.get(hash);
        if (meta == null) {
            throw new IllegalArgumentException("Unknown operation: " + hash);
        }
        return meta;
    }

    /**
     * Operation 메타데이터 조회 (선택).
     *
     * @param hash OpHash
     * @return OperationMeta (없으면 empty)
     */
    public Optional<OperationMeta> findOpMeta(OpHash hash) {
        return Optional.ofNullable(operations.get(hash));
    }

    /**
     * Host의 로컬 실행 순서.
     *
     * @param host Host 이름
     * @return OpHash 목록 (Operation이 없으면 빈 목록)
     */
    public List<OpHash> getHostOps(HostName host) {
        List<OpHash> local = hostOps.get(host);
        return local == null ? List.of() : List.copyOf(local);
    }

    /**
     * Operation이 하나 이상 할당된 Host.
     *
     * @return Host 이름 집합 (최초 할당 순서)
     */
    public Set<HostName> getHosts() {
        return Collections.unmodifiableSet(hostOps.keySet());
    }

    public int size() {
        return opOrder.size();
    }

    public boolean isEmpty() {
        return opOrder.isEmpty();
    }

    @Override
    public String toString() {
        return "Plan{operations=" + opOrder.size() + ", hosts=" + hostOps.size() + ", frozen=" + frozen + '}';
    }
}
