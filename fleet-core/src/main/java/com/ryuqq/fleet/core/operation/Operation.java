package com.ryuqq.fleet.core.operation;

import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Host;

import java.util.List;
import java.util.Map;

/**
 * 원하는 상태를 선언하는 작업 단위.
 *
 * <p>Operation은 Plan에 기록되는 작업의 본문입니다. 실행 단계에서 Host별로
 * {@link #commands(Host, FactGatherer)}를 호출하여 필요한 원격 명령을 생성합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>{@link #args()}는 유효 인자를 모두 포함해야 합니다 (Operation 식별 해시의 입력).</li>
 *   <li>{@link #commands(Host, FactGatherer)}는 상태를 변경하지 않아야 하며,
 *       Host 상태를 읽을 때는 FactGatherer만 사용합니다.</li>
 *   <li>빈 목록 반환은 "이미 원하는 상태"를 의미합니다.</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public interface Operation {

    /**
     * Operation 유형.
     *
     * @return 유형 이름 (예: server.shell)
     */
    String type();

    /**
     * 유효 인자.
     *
     * @return 인자 이름 → 값 (문자열, 숫자, 불리언, null, List, Map)
     */
    Map<String, Object> args();

    /**
     * Host에서 실행할 명령 생성.
     *
     * @param host 대상 Host
     * @param facts Fact 조회기
     * @return 실행할 셸 명령 (순서대로), 변경이 필요 없으면 빈 목록
     * @throws GatherException 명령 생성에 필요한 Fact 조회가 실패한 경우
     */
    List<String> commands(Host host, FactGatherer facts);
}
