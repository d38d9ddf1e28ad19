package com.ryuqq.fleet.core.plan;

import com.ryuqq.fleet.core.model.CallSite;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.NameStack;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.model.OperationArgs;
import com.ryuqq.fleet.core.operation.Operation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Plan에 기록된 Operation의 메타데이터.
 *
 * <p>전역 순서 인덱스는 최초 기록 시 한 번 부여되고 바뀌지 않습니다.
 * Host 집합은 평가 단계 동안 합집합으로만 커지며, 줄어들지 않습니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class OperationMeta {

    private final OpHash hash;
    private final NameStack names;
    private final OperationArgs args;
    private final CallSite callSite;
    private final int orderIndex;
    private final Operation operation;
    private final Set<HostName> hosts = new LinkedHashSet<>();

    OperationMeta(
        OpHash hash,
        NameStack names,
        OperationArgs args,
        CallSite callSite,
        int orderIndex,
        Operation operation
    ) {
        this.hash = hash;
        this.names = names;
        this.args = args;
        this.callSite = callSite;
        this.orderIndex = orderIndex;
        this.operation = operation;
    }

    boolean addHost(HostName host) {
        return hosts.add(host);
    }

    public OpHash getHash() {
        return hash;
    }

    public NameStack getNames() {
        return names;
    }

    public OperationArgs getArgs() {
        return args;
    }

    public CallSite getCallSite() {
        return callSite;
    }

    /**
     * 전역 순서 인덱스 (0부터).
     *
     * @return 최초 기록 순서
     */
    public int getOrderIndex() {
        return orderIndex;
    }

    public Operation getOperation() {
        return operation;
    }

    /**
     * Operation을 실행할 Host 집합.
     *
     * @return 불변 뷰 (추가된 순서)
     */
    public Set<HostName> getHosts() {
        return Collections.unmodifiableSet(hosts);
    }

    @Override
    public String toString() {
        return "OperationMeta{" +
            "hash=" + hash.shortValue() +
            ", names=" + names.display() +
            ", orderIndex=" + orderIndex +
            ", hosts=" + hosts +
            '}';
    }
}
