package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.adapter.inmemory.cache.InMemoryFactCache;
import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.application.deploy.PlanEvaluator;
import com.ryuqq.fleet.application.fact.DefaultFactGatherer;
import com.ryuqq.fleet.application.orchestrator.ExecutionResult;
import com.ryuqq.fleet.application.orchestrator.OperationResult;
import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.inventory.InventoryDefinition;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.operation.ShellOperation;
import com.ryuqq.fleet.core.outcome.Changed;
import com.ryuqq.fleet.core.outcome.Fail;
import com.ryuqq.fleet.core.outcome.HostOutcome;
import com.ryuqq.fleet.core.plan.OperationRecorder;
import com.ryuqq.fleet.core.plan.Plan;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.statemachine.AbortReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PlanRunner 테스트.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class PlanRunnerTest {

    private static final Deploy X_THEN_Y = ctx -> {
        ctx.op("X", ShellOperation.of("echo x"));
        ctx.op("Y", ShellOperation.of("echo y"));
    };

    private FakeTransport transport;
    private FactGatherer gatherer;
    private PlanRunner runner;
    private Inventory inventory;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        gatherer = new DefaultFactGatherer(transport, new InMemoryFactCache());
        runner = new PlanRunner(transport);
        inventory = Inventory.load(InventoryDefinition.ofHosts(List.of("a", "b", "c")), Map.of());
    }

    // ============================================================
    // 병렬 모드
    // ============================================================

    @Test
    void 범위가_좁은_Operation은_해당_Host에만_실행된다() {
        // given
        Plan plan = plan(ctx -> {
            ctx.op("X", ShellOperation.of("echo x"));
            ctx.onHosts(List.of("b"), scoped -> scoped.op("Y", ShellOperation.of("echo y")));
        });

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig());

        // then
        assertThat(result.isAborted()).isFalse();
        assertThat(result.failedHosts()).isEmpty();
        assertThat(transport.commandsOn("a")).containsExactly("echo x");
        assertThat(transport.commandsOn("b")).containsExactly("echo x", "echo y");
        assertThat(transport.commandsOn("c")).containsExactly("echo x");
        assertThat(result.operations()).hasSize(2);
        assertThat(result.operations().get(1).outcomes()).containsOnlyKeys(host("b"));
    }

    @Test
    void 다음_Operation은_이전_Operation이_끝난_뒤에_시작한다() {
        // given
        transport.withDelay(20);
        Plan plan = plan(ctx -> {
            ctx.op("X", ShellOperation.of("echo x"));
            ctx.op("Y", ShellOperation.of("echo y"));
            ctx.op("Z", ShellOperation.of("echo z"));
        });

        // when
        runner.execute(plan, inventory, gatherer, new RunConfig().withParallel(2));

        // then
        List<String> commands = transport.calls().stream().map(FakeTransport.Call::command).toList();
        assertThat(commands).hasSize(9);
        assertThat(commands.subList(0, 3)).containsOnly("echo x");
        assertThat(commands.subList(3, 6)).containsOnly("echo y");
        assertThat(commands.subList(6, 9)).containsOnly("echo z");
    }

    @Test
    void failPercent_0에서_실패하면_중단되고_이후_Operation은_실행되지_않는다() {
        // given
        transport.failOn("b", "echo x");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig());

        // then
        assertThat(result.isAborted()).isTrue();
        assertThat(result.abortReason()).isEqualTo(AbortReason.THRESHOLD_EXCEEDED);
        assertThat(result.failedHosts()).containsExactly(host("b"));
        assertThat(transport.calls()).noneMatch(call -> call.command().equals("echo y"));
        assertThat(result.operations()).hasSize(1);
    }

    @Test
    void 임계값_이내의_실패는_계속_진행하고_실패한_Host는_제외된다() {
        // given
        transport.failOn("b", "echo x");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig().withFailPercent(50));

        // then
        assertThat(result.isAborted()).isFalse();
        assertThat(result.failedHosts()).containsExactly(host("b"));
        assertThat(transport.commandsOn("b")).containsExactly("echo x");
        assertThat(transport.commandsOn("a")).containsExactly("echo x", "echo y");
        assertThat(result.operations().get(1).outcomes()).containsOnlyKeys(host("a"), host("c"));
    }

    @Test
    void 임계값을_넘으면_아직_시작하지_않은_Host는_Skipped() {
        // given
        transport.failOn("a", "echo x");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig().withParallel(1));

        // then
        OperationResult first = result.operations().get(0);
        assertThat(first.outcomes().get(host("a")).isFail()).isTrue();
        assertThat(first.outcomes().get(host("b")).isSkipped()).isTrue();
        assertThat(first.outcomes().get(host("c")).isSkipped()).isTrue();
        assertThat(transport.commandsOn("b")).isEmpty();
        assertThat(result.isAborted()).isTrue();
    }

    @Test
    void noWait이면_형제_Host는_끝까지_실행되고_비율은_나중에_계산된다() {
        // given
        transport.failOn("a", "echo x");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer,
            new RunConfig().withParallel(1).withNoWait(true));

        // then
        OperationResult first = result.operations().get(0);
        assertThat(first.outcomes().get(host("b")).isChanged()).isTrue();
        assertThat(first.outcomes().get(host("c")).isChanged()).isTrue();
        assertThat(first.skippedCount()).isZero();
        assertThat(result.isAborted()).isTrue();
        assertThat(transport.calls()).noneMatch(call -> call.command().equals("echo y"));
    }

    @Test
    void drain_시간_안에_끝나지_않은_Host는_실패로_기록된다() {
        // given
        transport.failOn("a", "echo x").slow("a", 200).slow("b", 3000);
        Plan plan = plan(ctx -> ctx.op("X", ShellOperation.of("echo x")));

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer,
            new RunConfig().withDrainTimeoutMs(100));

        // then
        HostOutcome slow = result.operations().get(0).outcomes().get(host("b"));
        assertThat(slow.isFail()).isTrue();
        assertThat(((Fail) slow).message()).contains("drain timeout");
        assertThat(result.isAborted()).isTrue();
    }

    @Test
    void drain_시간이_지나도록_시작하지_못한_Host는_Skipped이고_실패로_세지_않는다() {
        // given
        transport.failOn("a", "echo x").slow("a", 200);
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer,
            new RunConfig().withParallel(1).withDrainTimeoutMs(1));

        // then
        OperationResult first = result.operations().get(0);
        assertThat(first.outcomes().get(host("a")).isFail()).isTrue();
        assertThat(first.outcomes().get(host("b")).isSkipped()).isTrue();
        assertThat(first.outcomes().get(host("c")).isSkipped()).isTrue();
        assertThat(result.failedHosts()).containsExactly(host("a"));
        assertThat(result.abortReason()).isEqualTo(AbortReason.THRESHOLD_EXCEEDED);
        assertThat(transport.commandsOn("b")).isEmpty();
    }

    @Test
    void dry_run이면_상태_변경_명령을_실행하지_않는다() {
        // given
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig().withDryRun(true));

        // then
        assertThat(transport.calls(CommandKind.STATE_CHANGE)).isEmpty();
        assertThat(result.operations()).hasSize(2);
        for (OperationResult operation : result.operations()) {
            for (HostOutcome outcome : operation.outcomes().values()) {
                assertThat(outcome).isInstanceOf(Changed.class);
                assertThat(((Changed) outcome).dryRun()).isTrue();
            }
        }
    }

    @Test
    void limit_밖의_Operation은_오류_없이_건너뛴다() {
        // given
        Plan plan = plan(ctx -> {
            ctx.op("X", ShellOperation.of("echo x"));
            ctx.onHosts(List.of("b"), scoped -> scoped.op("Y", ShellOperation.of("echo y")));
        });
        Inventory active = inventory.limit(List.of("a"));

        // when
        ExecutionResult result = runner.execute(plan, active, gatherer, new RunConfig());

        // then
        assertThat(result.isAborted()).isFalse();
        assertThat(result.operations()).hasSize(1);
        assertThat(transport.calls()).extracting(FakeTransport.Call::host).containsOnly("a");
        assertThat(transport.commandsOn("a")).containsExactly("echo x");
    }

    @Test
    void 타임아웃은_Host_실패로_기록되고_실행을_즉시_중단하지_않는다() {
        // given
        transport.timingOut("c");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig().withFailPercent(50));

        // then
        assertThat(result.isAborted()).isFalse();
        assertThat(result.failedHosts()).containsExactly(host("c"));
        Fail fail = (Fail) result.operations().get(0).outcomes().get(host("c"));
        assertThat(fail.errorCode()).isEqualTo(Fail.COMMAND_TIMEOUT);
    }

    @Test
    void 동결되지_않은_Plan은_실행할_수_없다() {
        // given
        OperationRecorder recorder = new OperationRecorder();
        recorder.begin();

        // when & then
        assertThatThrownBy(() -> runner.execute(recorder.plan(), inventory, gatherer, new RunConfig()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Plan must be frozen before execution");
    }

    // ============================================================
    // 직렬 모드
    // ============================================================

    @Test
    void 직렬_모드는_Host를_하나씩_모든_Operation까지_실행한다() {
        // given
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig().withSerial(true));

        // then
        assertThat(transport.calls()).extracting(call -> call.host() + ":" + call.command())
            .containsExactly("a:echo x", "a:echo y", "b:echo x", "b:echo y", "c:echo x", "c:echo y");
        assertThat(result.operations()).hasSize(2);
        assertThat(result.operations().get(0).changedCount()).isEqualTo(3);
    }

    @Test
    void 직렬_모드에서_실패한_Host는_남은_Operation을_중단한다() {
        // given
        transport.failOn("a", "echo x");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer,
            new RunConfig().withSerial(true).withFailPercent(50));

        // then
        assertThat(result.isAborted()).isFalse();
        assertThat(transport.commandsOn("a")).containsExactly("echo x");
        assertThat(transport.commandsOn("b")).containsExactly("echo x", "echo y");
        assertThat(result.failedHosts()).containsExactly(host("a"));
    }

    @Test
    void 직렬_모드_failPercent_0이면_첫_실패_Host_뒤에_중단한다() {
        // given
        transport.failOn("b", "echo y");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer, new RunConfig().withSerial(true));

        // then
        assertThat(result.abortReason()).isEqualTo(AbortReason.THRESHOLD_EXCEEDED);
        assertThat(transport.commandsOn("c")).isEmpty();
    }

    @Test
    void 직렬_모드에서_첫_Host의_연결_실패는_즉시_중단한다() {
        // given
        transport.unreachable("a");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer,
            new RunConfig().withSerial(true).withFailPercent(100));

        // then
        assertThat(result.abortReason()).isEqualTo(AbortReason.TRANSPORT_FAILURE);
        assertThat(transport.commandsOn("b")).isEmpty();
    }

    @Test
    void 직렬_모드에서_첫_Host의_타임아웃은_연결_실패로_보지_않는다() {
        // given
        transport.timingOut("a");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer,
            new RunConfig().withSerial(true).withFailPercent(50));

        // then
        assertThat(result.isAborted()).isFalse();
        assertThat(result.abortReason()).isNull();
        assertThat(result.failedHosts()).containsExactly(host("a"));
        Fail fail = (Fail) result.operations().get(0).outcomes().get(host("a"));
        assertThat(fail.errorCode()).isEqualTo(Fail.COMMAND_TIMEOUT);
        assertThat(transport.commandsOn("b")).containsExactly("echo x", "echo y");
    }

    @Test
    void 직렬_모드_noWait이면_첫_Host의_연결_실패도_기록만_한다() {
        // given
        transport.unreachable("a");
        Plan plan = plan(X_THEN_Y);

        // when
        ExecutionResult result = runner.execute(plan, inventory, gatherer,
            new RunConfig().withSerial(true).withNoWait(true).withFailPercent(100));

        // then
        assertThat(result.isAborted()).isFalse();
        assertThat(result.failedHosts()).containsExactly(host("a"));
        assertThat(transport.commandsOn("c")).containsExactly("echo x", "echo y");
    }

    private Plan plan(Deploy deploy) {
        return new PlanEvaluator().evaluate(deploy, inventory, gatherer);
    }

    private static HostName host(String name) {
        return HostName.of(name);
    }
}
