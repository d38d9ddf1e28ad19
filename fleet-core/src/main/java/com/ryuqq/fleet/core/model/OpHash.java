package com.ryuqq.fleet.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Operation 식별 해시.
 *
 * <p>논리적으로 동일한 Operation 호출을 하나의 Plan 항목으로 합치기 위한 식별자입니다.
 * 해시 입력은 다음 세 가지로 구성됩니다:</p>
 * <ul>
 *   <li>{@link NameStack}: include 접두어를 포함한 이름 경로</li>
 *   <li>{@link OperationArgs}: Operation 유형과 정규화된 인자</li>
 *   <li>{@link CallSite}: 평가 순서 내 호출 위치와 재방문 횟수</li>
 * </ul>
 *
 * <p>동일한 세 값은 항상 동일한 OpHash를 만들며, 하나라도 다르면 다른 OpHash가 됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class OpHash {

    private static final String FIELD_SEPARATOR = "\u001f";

    private final String value;

    private OpHash(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OpHash cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 이미 계산된 해시 값으로 OpHash 생성.
     *
     * @param value 16진수 해시 문자열
     * @return OpHash 인스턴스
     * @throws IllegalArgumentException value가 null이거나 빈 문자열인 경우
     */
    public static OpHash of(String value) {
        return new OpHash(value);
    }

    /**
     * 이름 경로, 인자, 호출 위치로부터 OpHash 계산.
     *
     * @param names 이름 경로
     * @param args Operation 인자
     * @param callSite 호출 위치
     * @return 계산된 OpHash (SHA-1, 16진수)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static OpHash compute(NameStack names, OperationArgs args, CallSite callSite) {
        if (names == null) {
            throw new IllegalArgumentException("names cannot be null");
        }
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }
        if (callSite == null) {
            throw new IllegalArgumentException("callSite cannot be null");
        }

        String material = String.join(FIELD_SEPARATOR,
            names.display(), args.canonical(), callSite.identity());

        return new OpHash(sha1Hex(material));
    }

    private static String sha1Hex(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hashed = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK 구현은 SHA-1을 제공해야 함
            throw new IllegalStateException("SHA-1 digest unavailable", e);
        }
    }

    /**
     * 해시 값 조회.
     *
     * @return 16진수 해시 문자열
     */
    public String getValue() {
        return value;
    }

    /**
     * 로그 출력용 축약 해시.
     *
     * @return 앞 10자리
     */
    public String shortValue() {
        return value.length() <= 10 ? value : value.substring(0, 10);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OpHash opHash = (OpHash) o;
        return value.equals(opHash.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OpHash{" + shortValue() + '}';
    }
}
