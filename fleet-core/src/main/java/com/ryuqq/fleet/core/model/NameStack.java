package com.ryuqq.fleet.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Operation의 사람이 읽을 수 있는 이름 경로.
 *
 * <p>include 블록의 접두어가 앞에, Operation 이름이 마지막에 위치합니다.</p>
 *
 * <pre>
 * NameStack.of(List.of("tasks/a_task"), "First task operation").display()
 *   → "tasks/a_task | First task operation"
 * </pre>
 *
 * @param segments 이름 구성 요소 (1개 이상, 비어있지 않은 문자열)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record NameStack(List<String> segments) {

    private static final String DISPLAY_SEPARATOR = " | ";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException segments가 비었거나 빈 요소를 포함한 경우
     */
    public NameStack {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("segments cannot be null or empty");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("segment cannot be null or blank");
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * 접두어 목록과 Operation 이름으로 NameStack 생성.
     *
     * @param prefixes include 접두어 (바깥쪽부터)
     * @param name Operation 이름
     * @return NameStack 인스턴스
     */
    public static NameStack of(List<String> prefixes, String name) {
        List<String> segments = new ArrayList<>(prefixes);
        segments.add(name);
        return new NameStack(segments);
    }

    /**
     * 접두어 없는 단일 이름 NameStack 생성.
     *
     * @param name Operation 이름
     * @return NameStack 인스턴스
     */
    public static NameStack of(String name) {
        return new NameStack(List.of(name));
    }

    /**
     * Operation 이름 (마지막 요소).
     *
     * @return Operation 이름
     */
    public String name() {
        return segments.get(segments.size() - 1);
    }

    /**
     * 표시용 문자열.
     *
     * @return " | "로 연결된 이름 경로
     */
    public String display() {
        return String.join(DISPLAY_SEPARATOR, segments);
    }

    @Override
    public String toString() {
        return display();
    }
}
