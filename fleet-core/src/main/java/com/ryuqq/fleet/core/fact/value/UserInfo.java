package com.ryuqq.fleet.core.fact.value;

import java.util.List;

/**
 * 시스템 사용자 정보.
 *
 * @param group 기본 그룹
 * @param groups 보조 그룹 (기본 그룹 제외)
 * @param home 홈 디렉터리 (null 가능)
 * @param shell 로그인 셸 (null 가능)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record UserInfo(String group, List<String> groups, String home, String shell) {

    public UserInfo {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
