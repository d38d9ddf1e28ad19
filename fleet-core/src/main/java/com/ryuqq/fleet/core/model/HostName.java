package com.ryuqq.fleet.core.model;

import java.util.regex.Pattern;

/**
 * 인벤토리 내 Host의 고유 식별자.
 *
 * <p>HostName은 Plan의 호스트 집합, 호스트별 Operation 목록, Fact 캐시 키에서
 * Host를 식별하는 데 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_), 골뱅이(@), 콜론(:)만 허용</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>HostName.of("web-01.example.com")</li>
 *   <li>HostName.of("@local") - 로컬 실행 호스트</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class HostName implements Comparable<HostName> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9.\\-_@:]+$");

    private final String value;

    private HostName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("HostName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("HostName length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "HostName contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * HostName 생성.
     *
     * @param value Host 이름
     * @return HostName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static HostName of(String value) {
        return new HostName(value);
    }

    /**
     * HostName 값 조회.
     *
     * @return Host 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(HostName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HostName hostName = (HostName) o;
        return value.equals(hostName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
