package com.ryuqq.fleet.core.inventory;

import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.model.HostName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 배포 대상 Host의 순서 있는 집합.
 *
 * <p>Host 열거 순서는 정의 파일의 선언 순서이며, 출력 용도로만 사용됩니다.
 * Plan의 Operation 순서는 이 순서에 의존하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> {@link #limit(Collection)}은 새 Inventory를 반환하며
 * 원본의 Host 식별자, 그룹 소속, 순서를 변경하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Inventory inventory = Inventory.load(definition, Map.of("env", "prod"));
 * Inventory web = inventory.limit(List.of("web", "db-*"));
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class Inventory {

    private final Map<HostName, Host> hosts;
    private final Map<String, List<HostName>> groups;

    private Inventory(Map<HostName, Host> hosts, Map<String, List<HostName>> groups) {
        this.hosts = Collections.unmodifiableMap(hosts);
        this.groups = Collections.unmodifiableMap(groups);
    }

    /**
     * 정의로부터 Inventory 적재.
     *
     * <p>그룹에만 등장하는 Host도 선언된 것으로 취급하며, Host 선언 뒤에 그룹 순서대로 추가됩니다.</p>
     *
     * @param definition 인벤토리 정의
     * @param overrides 실행 시 데이터 override (가장 높은 우선순위)
     * @return Inventory
     * @throws DefinitionException 정의가 null이거나 Host/그룹 선언이 잘못된 경우
     */
    public static Inventory load(InventoryDefinition definition, Map<String, Object> overrides) {
        if (definition == null) {
            throw new DefinitionException("Inventory definition cannot be null");
        }
        Map<String, Object> runOverrides = overrides == null ? Map.of() : overrides;

        Map<HostName, Map<String, Object>> hostData = new LinkedHashMap<>();
        for (InventoryDefinition.HostDefinition hostDefinition : definition.hosts()) {
            HostName name = parseHostName(hostDefinition.name());
            if (hostData.containsKey(name)) {
                throw new DefinitionException("Duplicate host in inventory: " + name);
            }
            hostData.put(name, hostDefinition.data());
        }

        Map<String, Object> allData = new LinkedHashMap<>();
        Map<String, List<HostName>> groupMembers = new LinkedHashMap<>();
        Map<String, Map<String, Object>> groupData = new LinkedHashMap<>();
        for (InventoryDefinition.GroupDefinition group : definition.groups()) {
            if (group.name() == null || group.name().isBlank()) {
                throw new DefinitionException("Group name cannot be blank");
            }
            if (groupData.containsKey(group.name())) {
                throw new DefinitionException("Duplicate group in inventory: " + group.name());
            }
            if (InventoryDefinition.ALL_GROUP.equals(group.name())) {
                allData.putAll(group.data());
                groupData.put(group.name(), group.data());
                continue;
            }
            Set<HostName> members = new LinkedHashSet<>();
            for (String member : group.hosts()) {
                HostName name = parseHostName(member);
                hostData.putIfAbsent(name, Map.of());
                members.add(name);
            }
            groupMembers.put(group.name(), List.copyOf(members));
            groupData.put(group.name(), group.data());
        }

        Map<HostName, Host> hosts = new LinkedHashMap<>();
        for (Map.Entry<HostName, Map<String, Object>> entry : hostData.entrySet()) {
            HostName name = entry.getKey();
            List<String> memberOf = new ArrayList<>();
            Map<String, Object> merged = new LinkedHashMap<>(allData);
            for (Map.Entry<String, List<HostName>> group : groupMembers.entrySet()) {
                if (group.getValue().contains(name)) {
                    memberOf.add(group.getKey());
                    merged.putAll(groupData.get(group.getKey()));
                }
            }
            merged.putAll(entry.getValue());
            merged.putAll(runOverrides);
            hosts.put(name, new Host(name, memberOf, merged));
        }

        groupMembers.put(InventoryDefinition.ALL_GROUP, List.copyOf(hosts.keySet()));
        return new Inventory(hosts, groupMembers);
    }

    private static HostName parseHostName(String value) {
        try {
            return HostName.of(value);
        } catch (IllegalArgumentException e) {
            throw new DefinitionException("Invalid host name in inventory: " + value, e);
        }
    }

    /**
     * 선언 순서의 Host 목록.
     *
     * @return 불변 Host 목록
     */
    public List<Host> getHosts() {
        return List.copyOf(hosts.values());
    }

    /**
     * 선언 순서의 Host 이름 목록.
     *
     * @return 불변 Host 이름 목록
     */
    public List<HostName> getHostNames() {
        return List.copyOf(hosts.keySet());
    }

    /**
     * 이름순으로 정렬된 Host 목록.
     *
     * <p>평가 단계에서 Host를 순회할 때 사용하여, Plan이 인벤토리 선언 순서에
     * 영향을 받지 않도록 합니다.</p>
     *
     * @return 이름순 Host 목록
     */
    public List<Host> getHostsInCanonicalOrder() {
        List<Host> sorted = new ArrayList<>(hosts.values());
        sorted.sort(Comparator.comparing(Host::getName));
        return sorted;
    }

    /**
     * 그룹 정의 조회.
     *
     * @return 그룹 이름 → 소속 Host 이름 ("all" 포함)
     */
    public Map<String, List<HostName>> getGroups() {
        return groups;
    }

    /**
     * Host 조회.
     *
     * @param name Host 이름
     * @return Host (없으면 empty)
     */
    public Optional<Host> find(HostName name) {
        return Optional.ofNullable(hosts.get(name));
    }

    /**
     * Host 조회 (필수).
     *
     * @param name Host 이름
     * @return Host
     * @throws IllegalArgumentException 인벤토리에 없는 Host인 경우
     */
    public Host get(HostName name) {
        Host host = hosts.get(name);
        if (host == null) {
            throw new IllegalArgumentException("Host not in inventory: " + name);
        }
        return host;
    }

    public boolean contains(HostName name) {
        return hosts.containsKey(name);
    }

    public int size() {
        return hosts.size();
    }

    public boolean isEmpty() {
        return hosts.isEmpty();
    }

    /**
     * 패턴에 일치하는 Host 이름 조회 (선언 순서).
     *
     * <p>각 패턴은 Host 이름, 그룹 이름, 또는 Host 이름에 대한 glob(*, ?) 중 하나와 일치하면 됩니다.</p>
     *
     * @param patterns Host/그룹 이름 또는 glob 패턴
     * @return 일치하는 Host 이름 (선언 순서, 중복 없음)
     */
    public List<HostName> resolve(Collection<String> patterns) {
        Set<HostName> matched = new LinkedHashSet<>();
        for (HostName name : hosts.keySet()) {
            for (String pattern : patterns) {
                if (HostPatterns.matches(pattern, name, hosts.get(name).getGroups())) {
                    matched.add(name);
                    break;
                }
            }
        }
        return List.copyOf(matched);
    }

    /**
     * 패턴에 일치하는 Host로 구성된 부분 Inventory 생성.
     *
     * <p>일치하는 Host가 없으면 빈 Inventory를 반환합니다 (오류 아님).
     * 패턴 목록이 null이거나 비어있으면 이 Inventory를 그대로 반환합니다.</p>
     *
     * @param patterns Host/그룹 이름 또는 glob 패턴
     * @return 부분 Inventory
     */
    public Inventory limit(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return this;
        }
        return subset(resolve(patterns));
    }

    /**
     * 주어진 Host 이름으로 구성된 부분 Inventory 생성.
     *
     * @param names 포함할 Host 이름
     * @return 부분 Inventory (선언 순서 유지)
     */
    public Inventory subset(Collection<HostName> names) {
        Map<HostName, Host> selected = new LinkedHashMap<>();
        for (Map.Entry<HostName, Host> entry : hosts.entrySet()) {
            if (names.contains(entry.getKey())) {
                selected.put(entry.getKey(), entry.getValue());
            }
        }
        Map<String, List<HostName>> selectedGroups = new LinkedHashMap<>();
        for (Map.Entry<String, List<HostName>> group : groups.entrySet()) {
            selectedGroups.put(group.getKey(),
                group.getValue().stream().filter(selected::containsKey).toList());
        }
        return new Inventory(selected, selectedGroups);
    }

    @Override
    public String toString() {
        return "Inventory{hosts=" + hosts.keySet() + '}';
    }
}
