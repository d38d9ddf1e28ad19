package com.ryuqq.fleet.core.fact;

import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.inventory.Host;

import java.util.Arrays;
import java.util.List;

/**
 * Host Fact 조회 인터페이스.
 *
 * <p>Deploy 정의와 Operation의 명령 생성 로직이 Host의 현재 상태를 읽을 때 사용합니다.
 * 구현체는 결과를 실행 단위로 캐시해야 합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public interface FactGatherer {

    /**
     * Fact 값 조회.
     *
     * @param host 대상 Host
     * @param fact Fact 정의
     * @param args Fact 인자
     * @param <T> Fact 값 타입
     * @return 파싱된 값, 필요한 도구가 없으면 Fact의 기본값
     * @throws GatherException Transport 실패 또는 Fact 명령이 비정상 종료한 경우
     */
    <T> T get(Host host, Fact<T> fact, List<String> args);

    /**
     * Fact 값 조회 (가변 인자).
     *
     * @param host 대상 Host
     * @param fact Fact 정의
     * @param args Fact 인자
     * @param <T> Fact 값 타입
     * @return 파싱된 값 또는 기본값
     * @throws GatherException Transport 실패 또는 Fact 명령이 비정상 종료한 경우
     */
    default <T> T get(Host host, Fact<T> fact, String... args) {
        return get(host, fact, Arrays.asList(args));
    }
}
