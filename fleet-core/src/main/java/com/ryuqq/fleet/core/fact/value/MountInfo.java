package com.ryuqq.fleet.core.fact.value;

import java.util.List;

/**
 * 마운트된 파일 시스템 정보.
 *
 * @param device 장치 (autofs map은 "map ..." 형태)
 * @param type 파일 시스템 유형
 * @param options 마운트 옵션
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record MountInfo(String device, String type, List<String> options) {

    public MountInfo {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
