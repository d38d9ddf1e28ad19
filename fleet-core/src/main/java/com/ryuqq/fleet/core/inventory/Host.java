package com.ryuqq.fleet.core.inventory;

import com.ryuqq.fleet.core.model.HostName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 배포 대상 Host.
 *
 * <p>Host는 인벤토리 적재 시점에 생성되며, 이후 식별자·그룹·데이터가 변하지 않습니다.</p>
 *
 * <p><strong>데이터 병합 우선순위 (낮음 → 높음):</strong></p>
 * <pre>
 * "all" 그룹 데이터 → 그룹 데이터 (선언 순서) → Host 데이터 → 실행 시 override
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class Host {

    private final HostName name;
    private final List<String> groups;
    private final Map<String, Object> data;

    /**
     * 생성자.
     *
     * @param name Host 이름
     * @param groups 소속 그룹 (선언 순서)
     * @param data 병합된 데이터
     * @throws IllegalArgumentException name, groups, data가 null인 경우
     */
    public Host(HostName name, List<String> groups, Map<String, Object> data) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (groups == null) {
            throw new IllegalArgumentException("groups cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        this.name = name;
        this.groups = List.copyOf(groups);
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * 그룹과 데이터 없이 Host 생성.
     *
     * @param name Host 이름
     * @return Host 인스턴스
     */
    public static Host of(String name) {
        return new Host(HostName.of(name), List.of(), Map.of());
    }

    public HostName getName() {
        return name;
    }

    public List<String> getGroups() {
        return groups;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * 데이터 값 조회.
     *
     * @param key 데이터 키
     * @return 값, 없으면 null
     */
    public Object data(String key) {
        return data.get(key);
    }

    /**
     * 문자열 데이터 값 조회.
     *
     * @param key 데이터 키
     * @param defaultValue 값이 없을 때 반환할 기본값
     * @return 문자열 값 또는 기본값
     */
    public String dataAsString(String key, String defaultValue) {
        Object value = data.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    /**
     * 그룹 소속 여부 확인.
     *
     * @param group 그룹 이름
     * @return 소속되어 있으면 true
     */
    public boolean isInGroup(String group) {
        return groups.contains(group);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Host) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Host{" + name + '}';
    }
}
