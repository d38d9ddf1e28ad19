package com.ryuqq.fleet.core.fact.value;

import java.util.List;

/**
 * 적재된 커널 모듈 정보 (/proc/modules 한 줄).
 *
 * @param size 메모리 크기 (바이트, 원문 문자열)
 * @param instances 적재 인스턴스 수
 * @param state 상태 (Live, Loading, Unloading)
 * @param depends 의존 모듈 (없으면 빈 목록)
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record KernelModule(String size, int instances, String state, List<String> depends) {

    public KernelModule {
        depends = depends == null ? List.of() : List.copyOf(depends);
    }
}
