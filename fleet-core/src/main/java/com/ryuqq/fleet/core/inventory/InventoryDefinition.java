package com.ryuqq.fleet.core.inventory;

import java.util.List;
import java.util.Map;

/**
 * 인벤토리 원본 정의.
 *
 * <p>파일 형식(YAML 등)과 무관한 중간 표현입니다. 파일 로더가 이 타입을 만들고,
 * {@link Inventory#load(InventoryDefinition, Map)}가 이를 검증·병합합니다.</p>
 *
 * @param hosts Host 선언 (선언 순서)
 * @param groups 그룹 선언 (선언 순서)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record InventoryDefinition(List<HostDefinition> hosts, List<GroupDefinition> groups) {

    /**
     * 모든 Host에 적용되는 그룹 이름.
     */
    public static final String ALL_GROUP = "all";

    public InventoryDefinition {
        hosts = hosts == null ? List.of() : List.copyOf(hosts);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    /**
     * 데이터 없는 Host 이름 목록으로 정의 생성.
     *
     * @param hostNames Host 이름 목록
     * @return InventoryDefinition
     */
    public static InventoryDefinition ofHosts(List<String> hostNames) {
        return new InventoryDefinition(
            hostNames.stream().map(name -> new HostDefinition(name, Map.of())).toList(),
            List.of()
        );
    }

    /**
     * Host 선언.
     *
     * @param name Host 이름
     * @param data Host 데이터 (null이면 빈 Map)
     */
    public record HostDefinition(String name, Map<String, Object> data) {
        public HostDefinition {
            data = data == null ? Map.of() : data;
        }
    }

    /**
     * 그룹 선언.
     *
     * @param name 그룹 이름
     * @param hosts 소속 Host 이름 (선언 순서)
     * @param data 그룹 데이터 (null이면 빈 Map)
     */
    public record GroupDefinition(String name, List<String> hosts, Map<String, Object> data) {
        public GroupDefinition {
            hosts = hosts == null ? List.of() : hosts;
            data = data == null ? Map.of() : data;
        }
    }
}
