package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.exception.CommandTimeoutException;
import com.ryuqq.fleet.core.exception.TransportException;
import com.ryuqq.fleet.core.inventory.Host;

/**
 * 원격 명령 실행 SPI.
 *
 * <p>Fact Gatherer와 실행 엔진이 동일하게 사용하는 명령 실행 채널입니다.
 * 구체적인 구현(로컬 셸, SSH, 컨테이너 exec)은 adapter 모듈에서 제공합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>서로 다른 Host에 대한 동시 호출에 안전해야 합니다.</li>
 *   <li>명령이 실행되어 0이 아닌 코드로 종료한 경우 예외가 아닌 {@link CommandResult}로 반환합니다.</li>
 *   <li>연결 실패 등 명령을 실행할 수 없는 경우 {@link TransportException}을 던집니다.</li>
 *   <li>명령별 타임아웃은 구현체가 관리하며, 초과 시 {@link CommandTimeoutException}을 던집니다.</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * Host에서 명령 실행.
     *
     * @param host 대상 Host
     * @param command 셸 명령 문자열
     * @param kind 호출 용도 (Fact 조회 또는 상태 변경)
     * @return 실행 결과
     * @throws TransportException 명령을 실행할 수 없는 경우
     * @throws CommandTimeoutException 명령이 타임아웃을 초과한 경우
     */
    CommandResult execute(Host host, String command, CommandKind kind);
}
