package com.ryuqq.fleet.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operation 유형과 유효 인자.
 *
 * <p>인자 값은 문자열, 숫자, 불리언, null, 그리고 이들로 구성된 List/Map만 허용합니다.
 * {@link #canonical()}은 키 순서와 무관하게 동일한 인자에 대해 동일한 문자열을 반환하므로
 * {@link OpHash} 계산에 사용됩니다.</p>
 *
 * @param type Operation 유형 (예: server.shell, apt.packages)
 * @param values 인자 (키 정렬된 불변 Map)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record OperationArgs(String type, Map<String, Object> values) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 비었거나 values가 null인 경우
     */
    public OperationArgs {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    /**
     * OperationArgs 생성.
     *
     * @param type Operation 유형
     * @param values 인자
     * @return OperationArgs 인스턴스
     */
    public static OperationArgs of(String type, Map<String, ?> values) {
        return new OperationArgs(type, new LinkedHashMap<>(values));
    }

    /**
     * 정규화된 문자열 표현.
     *
     * @return type과 인자의 결정적 문자열 표현
     * @throws IllegalArgumentException 허용되지 않은 값 타입이 포함된 경우
     */
    public String canonical() {
        StringBuilder builder = new StringBuilder(type).append(':');
        appendValue(builder, values);
        return builder.toString();
    }

    private static void appendValue(StringBuilder builder, Object value) {
        if (value == null) {
            builder.append("null");
        } else if (value instanceof String text) {
            builder.append('"').append(text.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
        } else if (value instanceof Number || value instanceof Boolean) {
            builder.append(value);
        } else if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((key, item) -> sorted.put(String.valueOf(key), item));
            builder.append('{');
            Iterator<Map.Entry<String, Object>> entries = sorted.entrySet().iterator();
            while (entries.hasNext()) {
                Map.Entry<String, Object> entry = entries.next();
                appendValue(builder, entry.getKey());
                builder.append('=');
                appendValue(builder, entry.getValue());
                if (entries.hasNext()) {
                    builder.append(',');
                }
            }
            builder.append('}');
        } else if (value instanceof Collection<?> collection) {
            builder.append('[');
            Iterator<?> items = collection.iterator();
            while (items.hasNext()) {
                appendValue(builder, items.next());
                if (items.hasNext()) {
                    builder.append(',');
                }
            }
            builder.append(']');
        } else {
            throw new IllegalArgumentException(
                "Unsupported operation argument type: " + value.getClass().getName());
        }
    }

    @Override
    public String toString() {
        return canonical();
    }
}
