package com.ryuqq.fleet.testkit.contract;

import com.ryuqq.fleet.adapter.inmemory.cache.InMemoryFactCache;
import com.ryuqq.fleet.adapter.runner.DeployOrchestrator;
import com.ryuqq.fleet.application.orchestrator.Orchestrator;
import com.ryuqq.fleet.application.orchestrator.RunReport;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.plan.Plan;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.spi.CommandResult;
import com.ryuqq.fleet.core.spi.Transport;
import com.ryuqq.fleet.core.statemachine.AbortReason;
import com.ryuqq.fleet.core.statemachine.RunState;
import com.ryuqq.fleet.testkit.contract.RecordingTransport.Invocation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Fact 캐시 계약 테스트 (시나리오 D).
 *
 * <p>한 실행 안에서 같은 (Host, Fact, 인자) 조회는 Transport를 최대 한 번 호출하고,
 * 실행이 바뀌면 캐시도 새로 만들어집니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class FactCacheContractTest extends AbstractEngineContractTest {

    private static final String OS_COMMAND = "uname -s";

    @Override
    protected Orchestrator createOrchestrator(Transport transport) {
        return new DeployOrchestrator(transport, InMemoryFactCache::new);
    }

    @Test
    void 시나리오_D_같은_Fact를_두번_조회해도_Transport는_한번만_호출된다() {
        // given
        Inventory inventory = inventoryOf("a", "b");
        transport.respondLines(OS_COMMAND, "Linux");

        // when
        Plan plan = planOf(ContractDeploys.factTwice(), inventory);

        // then
        assertThat(transport.count("a", OS_COMMAND)).isEqualTo(1);
        assertThat(transport.count("b", OS_COMMAND)).isEqualTo(1);
        assertThat(operationNames(plan)).containsExactly("Same os");
        assertThat(plan.getOpMeta(plan.getOpOrder().get(0)).getHosts())
            .containsExactlyInAnyOrder(hostName("a"), hostName("b"));
    }

    @Test
    void Fact_조회는_FACT_PROBE로_표시된다() {
        // given
        Inventory inventory = inventoryOf("a");
        transport.respondLines(OS_COMMAND, "Linux");

        // when
        run(ContractDeploys.factTwice(), inventory);

        // then
        List<Invocation> probes = transport.invocations().stream()
            .filter(invocation -> invocation.command().equals(OS_COMMAND))
            .toList();
        assertThat(probes).hasSize(1);
        assertThat(probes.get(0).kind()).isEqualTo(CommandKind.FACT_PROBE);
        assertThat(transport.count("a", "echo Linux")).isEqualTo(1);
    }

    @Test
    void Host마다_다른_Fact_값은_별개의_Operation을_만든다() {
        // given
        Inventory inventory = inventoryOf("a", "b");
        transport.respondLines(OS_COMMAND, "Linux");
        transport.respond("b", OS_COMMAND, CommandResult.success(List.of("FreeBSD")));

        // when
        Plan plan = planOf(ContractDeploys.factTwice(), inventory);

        // then
        assertThat(plan.getOpOrder()).hasSize(2);
        assertThat(transport.count("b", OS_COMMAND)).isEqualTo(1);
    }

    @Test
    void 실행이_바뀌면_Fact를_다시_조회한다() {
        // given
        Inventory inventory = inventoryOf("a");
        transport.respondLines(OS_COMMAND, "Linux");

        // when
        run(ContractDeploys.factTwice(), inventory);
        run(ContractDeploys.factTwice(), inventory);

        // then
        assertThat(transport.count("a", OS_COMMAND)).isEqualTo(2);
    }

    @Test
    void 평가_중_Fact_조회가_실패하면_평가_실패로_중단한다() {
        // given
        Inventory inventory = inventoryOf("a", "b");
        transport.respondLines(OS_COMMAND, "Linux");
        transport.unreachable("b");

        // when
        RunReport report = run(ContractDeploys.factTwice(), inventory);

        // then
        assertThat(report.state()).isEqualTo(RunState.ABORTED);
        assertThat(report.abortReason()).isEqualTo(AbortReason.EVALUATION_FAILED);
        assertThat(report.findPlan()).isEmpty();
        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(transport.invocations(CommandKind.STATE_CHANGE)).isEmpty();
    }
}
