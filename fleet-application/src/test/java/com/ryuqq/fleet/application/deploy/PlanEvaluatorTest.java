package com.ryuqq.fleet.application.deploy;

import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.inventory.InventoryDefinition;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.operation.ShellOperation;
import com.ryuqq.fleet.core.plan.Plan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PlanEvaluator 테스트.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class PlanEvaluatorTest {

    private final PlanEvaluator evaluator = new PlanEvaluator();
    private final Inventory inventory =
        Inventory.load(InventoryDefinition.ofHosts(List.of("a", "b")), Map.of());

    @Test
    void 평가가_끝나면_Plan이_동결된다() {
        // when
        Plan plan = evaluator.evaluate(ctx -> ctx.op("X", ShellOperation.of("echo x")),
            inventory, new FixedFactGatherer());

        // then
        assertThat(plan.isFrozen()).isTrue();
        assertThat(plan.size()).isEqualTo(1);
    }

    @Test
    void 매_평가는_새_Plan에서_시작한다() {
        // given
        Deploy deploy = ctx -> ctx.op("X", ShellOperation.of("echo x"));

        // when
        Plan first = evaluator.evaluate(deploy, inventory, new FixedFactGatherer());
        Plan second = evaluator.evaluate(deploy, inventory, new FixedFactGatherer());

        // then
        assertThat(second).isNotSameAs(first);
        assertThat(second.getOpOrder()).isEqualTo(first.getOpOrder());
        assertThat(second.size()).isEqualTo(1);
    }

    @Test
    void 빈_Deploy는_빈_Plan을_만든다() {
        // when
        Plan plan = evaluator.evaluate(ctx -> { }, inventory, new FixedFactGatherer());

        // then
        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getHostOps(HostName.of("a"))).isEmpty();
    }

    @Test
    void 정의_오류는_그대로_전파된다() {
        // given
        Deploy deploy = ctx -> {
            throw new DefinitionException("bad deploy");
        };

        // when & then
        assertThatThrownBy(() -> evaluator.evaluate(deploy, inventory, new FixedFactGatherer()))
            .isInstanceOf(DefinitionException.class)
            .hasMessage("bad deploy");
    }

    @Test
    void 처리되지_않은_Fact_조회_실패는_평가를_중단한다() {
        // given
        Deploy deploy = ctx -> {
            throw new GatherException(HostName.of("a"), "os", "connection refused");
        };

        // when & then
        assertThatThrownBy(() -> evaluator.evaluate(deploy, inventory, new FixedFactGatherer()))
            .isInstanceOf(GatherException.class);
    }

    @Test
    void null_인자는_예외() {
        assertThatThrownBy(() -> evaluator.evaluate(null, inventory, new FixedFactGatherer()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("deploy cannot be null");
    }
}
