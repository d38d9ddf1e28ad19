package com.ryuqq.fleet.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 평가 순서 내 Operation 호출 위치.
 *
 * <p>같은 이름과 인자를 가진 Operation이라도 서로 다른 호출 위치에서 생성되면
 * 별개의 Operation으로 취급하기 위해 사용합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>parents: 바깥쪽 include 호출 위치 목록</li>
 *   <li>location: 호출 위치 (예: "com.acme.WebDeploy.define:42" 또는 "deploy.yml#3")</li>
 *   <li>occurrence: 같은 호출 위치에 같은 Host가 다시 도달한 횟수 (0부터)</li>
 * </ul>
 *
 * @param parents include 호출 위치 (바깥쪽부터)
 * @param location 호출 위치
 * @param occurrence 재방문 횟수 (0 이상)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record CallSite(List<String> parents, String location, int occurrence) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public CallSite {
        if (parents == null) {
            throw new IllegalArgumentException("parents cannot be null");
        }
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
        if (occurrence < 0) {
            throw new IllegalArgumentException("occurrence must be non-negative (current: " + occurrence + ")");
        }
        parents = List.copyOf(parents);
    }

    /**
     * 최상위 호출 위치 생성 (include 없음, 첫 방문).
     *
     * @param location 호출 위치
     * @return CallSite 인스턴스
     */
    public static CallSite of(String location) {
        return new CallSite(List.of(), location, 0);
    }

    /**
     * 재방문 횟수를 제외한 호출 위치 키.
     *
     * <p>Host별 방문 횟수를 집계할 때 사용합니다.</p>
     *
     * @return "parent1 > parent2 > location" 형태의 문자열
     */
    public String siteKey() {
        List<String> path = new ArrayList<>(parents);
        path.add(location);
        return String.join(" > ", path);
    }

    /**
     * 해시 입력용 전체 식별 문자열.
     *
     * @return siteKey + "#" + occurrence
     */
    public String identity() {
        return siteKey() + "#" + occurrence;
    }

    /**
     * occurrence만 변경한 새 인스턴스 생성.
     */
    public CallSite withOccurrence(int occurrence) {
        return new CallSite(parents, location, occurrence);
    }
}
