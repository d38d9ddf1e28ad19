package com.ryuqq.fleet.cli.registry;

import com.ryuqq.fleet.core.exception.DefinitionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Operation 인자 Map의 타입 변환 접근자.
 *
 * <p>YAML Deploy 파일과 명령행 {@code key=value} 인자는 모두 문자열이나 느슨한 타입으로 들어오므로,
 * 여기서 Operation 생성자가 요구하는 타입으로 변환합니다. 변환할 수 없으면
 * {@link DefinitionException}을 던집니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class OperationArguments {

    private final String operationType;
    private final Map<String, Object> values;

    public OperationArguments(String operationType, Map<String, Object> values) {
        if (operationType == null || operationType.isBlank()) {
            throw new IllegalArgumentException("operationType cannot be null or blank");
        }
        this.operationType = operationType;
        this.values = values == null ? Map.of() : new LinkedHashMap<>(values);
    }

    /**
     * 문자열 목록 인자.
     *
     * <p>단일 값은 원소 하나인 목록으로 취급합니다.</p>
     *
     * @param key 인자 이름
     * @return 문자열 목록 (없으면 빈 목록)
     */
    public List<String> strings(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            List<String> strings = new ArrayList<>(collection.size());
            for (Object element : collection) {
                if (element == null) {
                    throw invalid(key, "list elements cannot be null");
                }
                strings.add(element.toString());
            }
            return strings;
        }
        return List.of(value.toString());
    }

    /**
     * 필수 문자열 인자.
     *
     * @param key 인자 이름
     * @return 값
     * @throws DefinitionException 없거나 비어있는 경우
     */
    public String requiredString(String key) {
        String value = optionalString(key);
        if (value == null || value.isBlank()) {
            throw invalid(key, "is required");
        }
        return value;
    }

    /**
     * 선택 문자열 인자.
     *
     * @param key 인자 이름
     * @return 값 (없으면 null)
     */
    public String optionalString(String key) {
        Object value = values.get(key);
        if (value instanceof Collection<?>) {
            throw invalid(key, "must be a single value");
        }
        return value == null ? null : value.toString();
    }

    /**
     * boolean 인자.
     *
     * <p>Boolean 값 또는 "true"/"false"/"yes"/"no" 문자열을 받습니다.</p>
     *
     * @param key 인자 이름
     * @param defaultValue 인자가 없을 때 값
     * @return 값
     */
    public boolean bool(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw invalid(key, "must be a boolean: " + value);
        };
    }

    private DefinitionException invalid(String key, String reason) {
        return new DefinitionException("Argument '" + key + "' of " + operationType + " " + reason);
    }
}
