package com.ryuqq.fleet.adapter.transport;

import com.ryuqq.fleet.core.exception.CommandTimeoutException;
import com.ryuqq.fleet.core.exception.TransportException;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.spi.CommandResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LocalTransport 테스트 (로컬 sh 사용).
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class LocalTransportTest {

    private final Host host = Host.of("@local");

    @Test
    void 표준_출력을_줄_단위로_수집한다() {
        // given
        LocalTransport transport = new LocalTransport();

        // when
        CommandResult result = transport.execute(host, "echo one; echo two", CommandKind.FACT_PROBE);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.stdout()).containsExactly("one", "two");
        assertThat(result.stderr()).isEmpty();
    }

    @Test
    void 종료_코드와_표준_에러를_반환한다() {
        // given
        LocalTransport transport = new LocalTransport();

        // when
        CommandResult result = transport.execute(host, "echo oops >&2; exit 3", CommandKind.STATE_CHANGE);

        // then
        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stderr()).containsExactly("oops");
    }

    @Test
    void 시간_초과는_CommandTimeoutException() {
        // given
        LocalTransport transport = new LocalTransport(new TransportConfig().withTimeoutMs(200));

        // when & then
        assertThatThrownBy(() -> transport.execute(host, "sleep 5", CommandKind.STATE_CHANGE))
            .isInstanceOf(CommandTimeoutException.class)
            .isInstanceOf(TransportException.class);
    }

    @Test
    void 셸을_시작할_수_없으면_TransportException() {
        // given
        LocalTransport transport = new LocalTransport(new TransportConfig().withShell("/nonexistent/fleet-shell"));

        // when & then
        assertThatThrownBy(() -> transport.execute(host, "echo hi", CommandKind.FACT_PROBE))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Failed to start /nonexistent/fleet-shell");
    }

    @Test
    void 셸_명령줄은_shell_c_형태다() {
        // given
        LocalTransport transport = new LocalTransport(new TransportConfig().withShell("bash"));

        // when
        List<String> commandLine = transport.buildCommandLine(host, "echo hi");

        // then
        assertThat(commandLine).containsExactly("bash", "-c", "echo hi");
    }
}
