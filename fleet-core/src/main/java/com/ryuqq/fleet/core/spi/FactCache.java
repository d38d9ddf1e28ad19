package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.fact.FactKey;

import java.util.function.Supplier;

/**
 * 실행 단위(run) Fact 캐시 SPI.
 *
 * <p>동일한 {@link FactKey}에 대한 동시 요청은 하나의 원격 조회로 합쳐져야 합니다
 * (single-flight). 먼저 도착한 호출자가 loader를 실행하고, 이후 호출자는
 * 같은 결과를 받습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>성공한 값(null 포함)은 실행이 끝날 때까지 캐시합니다.</li>
 *   <li>loader가 예외를 던지면 캐시하지 않으며, 대기 중이던 호출자도 같은 예외를 받습니다.</li>
 *   <li>실행 간에 캐시를 공유하지 않습니다.</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public interface FactCache {

    /**
     * 캐시된 값을 조회하거나, 없으면 loader로 적재.
     *
     * @param key Fact 키
     * @param loader 캐시 미스 시 실행할 조회 로직
     * @param <T> Fact 값 타입
     * @return 캐시된 값 또는 새로 적재된 값
     * @throws IllegalArgumentException key 또는 loader가 null인 경우
     */
    <T> T getOrLoad(FactKey key, Supplier<T> loader);

    /**
     * 캐시에 값이 적재되어 있는지 확인.
     *
     * @param key Fact 키
     * @return 적재 완료된 값이 있으면 true
     */
    boolean contains(FactKey key);
}
