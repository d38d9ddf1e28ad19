package com.ryuqq.fleet.core.outcome;

import com.ryuqq.fleet.core.model.HostName;

/**
 * 한 Host에서 한 Operation을 실행한 결과.
 *
 * <p>HostOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Changed}: 명령을 실행하여 상태가 변경됨 (dry-run이면 "변경 예정")</li>
 *   <li>{@link Unchanged}: 이미 원하는 상태여서 실행할 명령이 없음</li>
 *   <li>{@link Fail}: 명령 실패, Transport 오류, 타임아웃, Fact 조회 실패</li>
 *   <li>{@link Skipped}: 실행 중단 결정으로 시작하지 않음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public sealed interface HostOutcome permits Changed, Unchanged, Fail, Skipped {

    /**
     * 결과가 속한 Host.
     *
     * @return Host 이름
     */
    HostName host();

    /**
     * 상태가 변경(또는 변경 예정)되었는지 확인.
     *
     * @return 변경 여부
     */
    default boolean isChanged() {
        return this instanceof Changed;
    }

    /**
     * 변경 없이 성공했는지 확인.
     *
     * @return 변경 없음 여부
     */
    default boolean isUnchanged() {
        return this instanceof Unchanged;
    }

    /**
     * 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 시작하지 않고 건너뛰었는지 확인.
     *
     * @return 건너뜀 여부
     */
    default boolean isSkipped() {
        return this instanceof Skipped;
    }
}
