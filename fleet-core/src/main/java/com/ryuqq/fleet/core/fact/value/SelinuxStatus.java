package com.ryuqq.fleet.core.fact.value;

/**
 * SELinux 상태.
 *
 * @param mode sestatus의 "SELinux status" 값 (예: enabled, disabled), 알 수 없으면 null
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record SelinuxStatus(String mode) {

    public static SelinuxStatus unknown() {
        return new SelinuxStatus(null);
    }
}
