package com.ryuqq.fleet.application.deploy;

import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.fact.Fact;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.model.CallSite;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.NameStack;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.model.OperationArgs;
import com.ryuqq.fleet.core.operation.Operation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Deploy 정의 평가 컨텍스트.
 *
 * <p>전역 상태 대신 명시적인 범위 값을 하위 블록으로 전달합니다. 각 컨텍스트는 다음을 가집니다:</p>
 * <ul>
 *   <li>범위: Operation이 적용될 Host 집합 (이름순으로 정렬되어 보관)</li>
 *   <li>이름 접두어: include 블록의 이름 경로</li>
 *   <li>호출 위치 부모: include 호출 위치 경로</li>
 * </ul>
 *
 * <p><strong>순서 보장:</strong> Host를 순회하는 API({@link #forEachHost}, {@link #hosts()})는
 * 항상 Host 이름순으로 순회합니다. 따라서 인벤토리 선언 순서가 달라도 같은 Plan이 만들어집니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 평가는 단일 스레드에서만 수행해야 합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class DeployContext {

    private final DeploySession session;
    private final Set<HostName> scope;
    private final List<String> namePrefixes;
    private final List<String> callSiteParents;

    private DeployContext(
        DeploySession session,
        Set<HostName> scope,
        List<String> namePrefixes,
        List<String> callSiteParents
    ) {
        this.session = session;
        this.scope = scope;
        this.namePrefixes = namePrefixes;
        this.callSiteParents = callSiteParents;
    }

    static DeployContext root(DeploySession session, Collection<HostName> scope) {
        return new DeployContext(session, new TreeSet<>(scope), List.of(), List.of());
    }

    /**
     * 현재 범위의 Host에 Operation 기록.
     *
     * <p>호출 위치는 이 메서드를 호출한 소스 위치로 자동 캡처됩니다.</p>
     *
     * @param name Operation 이름
     * @param operation Operation
     * @return 기록된 OpHash
     * @throws IllegalArgumentException name이 비었거나 operation이 null인 경우
     */
    public OpHash op(String name, Operation operation) {
        return record(name, operation, CallSites.capture());
    }

    /**
     * 명시적 호출 위치 라벨로 Operation 기록.
     *
     * <p>Deploy 파일 로더처럼 Java 소스 위치가 의미 없는 경우 사용합니다
     * (예: "deploy.yml#3").</p>
     *
     * @param name Operation 이름
     * @param operation Operation
     * @param callSiteLabel 호출 위치 라벨
     * @return 기록된 OpHash
     */
    public OpHash op(String name, Operation operation, String callSiteLabel) {
        if (callSiteLabel == null || callSiteLabel.isBlank()) {
            throw new IllegalArgumentException("callSiteLabel cannot be null or blank");
        }
        return record(name, operation, callSiteLabel);
    }

    private OpHash record(String name, Operation operation, String location) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        NameStack names = NameStack.of(namePrefixes, name);
        OperationArgs args = OperationArgs.of(operation.type(), operation.args());
        CallSite site = new CallSite(callSiteParents, location, 0);
        int occurrence = session.visit(site.siteKey(), scope);
        return session.recorder().record(names, args, site.withOccurrence(occurrence), scope, operation);
    }

    /**
     * 현재 범위를 패턴에 일치하는 Host로 좁힌 블록 실행.
     *
     * @param patterns Host 이름, 그룹 이름, glob
     * @param block 좁혀진 컨텍스트로 실행할 블록
     */
    public void onHosts(Collection<String> patterns, Consumer<DeployContext> block) {
        if (patterns == null) {
            throw new IllegalArgumentException("patterns cannot be null");
        }
        Set<HostName> narrowed = new TreeSet<>(session.inventory().resolve(patterns));
        narrowed.retainAll(scope);
        block.accept(withScope(narrowed));
    }

    /**
     * 단일 Host 범위의 블록 실행.
     *
     * @param host 대상 Host (현재 범위 밖이면 빈 범위)
     * @param block 실행할 블록
     */
    public void onHost(Host host, Consumer<DeployContext> block) {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        Set<HostName> narrowed = new TreeSet<>();
        if (scope.contains(host.getName())) {
            narrowed.add(host.getName());
        }
        block.accept(withScope(narrowed));
    }

    /**
     * 범위 내 Host마다 해당 Host 범위로 블록 실행 (이름순).
     *
     * <p>같은 호출 위치에 각 Host가 한 번씩 도달하면 하나의 Operation을 공유합니다.</p>
     *
     * @param block (Host, Host 범위 컨텍스트)를 받는 블록
     */
    public void forEachHost(BiConsumer<Host, DeployContext> block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        for (HostName name : List.copyOf(scope)) {
            Set<HostName> single = new TreeSet<>();
            single.add(name);
            block.accept(session.inventory().get(name), withScope(single));
        }
    }

    /**
     * 이름 접두어와 호출 위치 부모를 추가한 블록 실행.
     *
     * <p>블록 안에서 기록한 Operation의 이름은 "taskName | name" 형태가 되며,
     * include 호출 위치가 다르면 같은 Operation도 별개로 기록됩니다.</p>
     *
     * @param taskName 이름 접두어 (예: tasks/a_task)
     * @param block 실행할 블록
     */
    public void include(String taskName, Consumer<DeployContext> block) {
        include(taskName, CallSites.capture(), block);
    }

    /**
     * 명시적 호출 위치 라벨로 include.
     *
     * @param taskName 이름 접두어
     * @param callSiteLabel include 호출 위치 라벨
     * @param block 실행할 블록
     */
    public void include(String taskName, String callSiteLabel, Consumer<DeployContext> block) {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName cannot be null or blank");
        }
        if (callSiteLabel == null || callSiteLabel.isBlank()) {
            throw new IllegalArgumentException("callSiteLabel cannot be null or blank");
        }
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        List<String> prefixes = new ArrayList<>(namePrefixes);
        prefixes.add(taskName);
        List<String> parents = new ArrayList<>(callSiteParents);
        parents.add(callSiteLabel);
        block.accept(new DeployContext(session, scope, List.copyOf(prefixes), List.copyOf(parents)));
    }

    /**
     * Fact 조회.
     *
     * @param host 대상 Host
     * @param fact Fact 정의
     * @param args Fact 인자
     * @param <T> Fact 값 타입
     * @return Fact 값
     * @throws GatherException Transport 실패 또는 Fact 명령 실패
     */
    public <T> T fact(Host host, Fact<T> fact, String... args) {
        return session.gatherer().get(host, fact, args);
    }

    /**
     * 현재 범위의 Host (이름순).
     *
     * @return Host 목록
     */
    public List<Host> hosts() {
        List<Host> hosts = new ArrayList<>(scope.size());
        for (HostName name : scope) {
            hosts.add(session.inventory().get(name));
        }
        return hosts;
    }

    /**
     * 전체 인벤토리.
     *
     * @return Inventory
     */
    public Inventory inventory() {
        return session.inventory();
    }

    private DeployContext withScope(Set<HostName> narrowed) {
        return new DeployContext(session, narrowed, namePrefixes, callSiteParents);
    }
}
