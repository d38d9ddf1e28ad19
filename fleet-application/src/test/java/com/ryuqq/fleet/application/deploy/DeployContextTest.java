package com.ryuqq.fleet.application.deploy;

import com.ryuqq.fleet.core.fact.ServerFacts;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.inventory.InventoryDefinition;
import com.ryuqq.fleet.core.inventory.InventoryDefinition.GroupDefinition;
import com.ryuqq.fleet.core.inventory.InventoryDefinition.HostDefinition;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.operation.ShellOperation;
import com.ryuqq.fleet.core.plan.OperationMeta;
import com.ryuqq.fleet.core.plan.Plan;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeployContext 평가 테스트.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class DeployContextTest {

    private final PlanEvaluator evaluator = new PlanEvaluator();

    private static final Deploy WEB_DEPLOY = ctx -> {
        ctx.op("Install base", ShellOperation.of("echo base"));
        ctx.forEachHost((host, hostCtx) -> {
            if (host.isInGroup("web")) {
                hostCtx.op("Configure web", ShellOperation.of("echo web"));
            }
            hostCtx.op("Write hostname", ShellOperation.of("echo " + host.getName().getValue()));
        });
        ctx.op("Finish", ShellOperation.of("echo done"));
    };

    @Test
    void 인벤토리_순서가_달라도_같은_Plan이_만들어진다() {
        // given
        Inventory forward = inventory(List.of("a", "b", "c", "d"), List.of("b", "d"));
        Inventory reversed = inventory(List.of("d", "c", "b", "a"), List.of("d", "b"));
        Inventory shuffled = inventory(List.of("c", "a", "d", "b"), List.of("b", "d"));

        // when
        Plan first = evaluator.evaluate(WEB_DEPLOY, forward, new FixedFactGatherer());
        Plan second = evaluator.evaluate(WEB_DEPLOY, reversed, new FixedFactGatherer());
        Plan third = evaluator.evaluate(WEB_DEPLOY, shuffled, new FixedFactGatherer());

        // then
        assertThat(second.getOpOrder()).isEqualTo(first.getOpOrder());
        assertThat(third.getOpOrder()).isEqualTo(first.getOpOrder());
        assertThat(first.getOpOrder()).hasSize(7);
        assertThat(names(first)).containsExactly(
            "Install base", "Write hostname", "Configure web", "Write hostname",
            "Write hostname", "Write hostname", "Finish");
    }

    @Test
    void 전체_범위에서_한번_호출한_Operation은_하나로_기록된다() {
        // given
        Inventory inventory = inventory(List.of("a", "b", "c"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> ctx.op("Install", ShellOperation.of("echo x")),
            inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(1);
        OperationMeta meta = plan.getOpMeta(plan.getOpOrder().get(0));
        assertThat(meta.getHosts()).containsExactlyInAnyOrder(host("a"), host("b"), host("c"));
    }

    @Test
    void 좁혀진_범위의_Operation은_해당_Host만_가진다() {
        // given
        Inventory inventory = inventory(List.of("a", "b", "c"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> {
            ctx.op("X", ShellOperation.of("echo x"));
            ctx.onHosts(List.of("b"), scoped -> scoped.op("Y", ShellOperation.of("echo y")));
        }, inventory, new FixedFactGatherer());

        // then
        OpHash x = plan.getOpOrder().get(0);
        OpHash y = plan.getOpOrder().get(1);
        assertThat(plan.getOpMeta(y).getHosts()).containsExactly(host("b"));
        assertThat(plan.getHostOps(host("a"))).containsExactly(x);
        assertThat(plan.getHostOps(host("b"))).containsExactly(x, y);
        assertThat(plan.getHostOps(host("c"))).containsExactly(x);
    }

    @Test
    void forEachHost_같은_호출_위치는_하나의_Operation을_공유한다() {
        // given
        Inventory inventory = inventory(List.of("a", "b", "c"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> ctx.forEachHost(
            (host, hostCtx) -> hostCtx.op("Shared", ShellOperation.of("echo same"))),
            inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(1);
        assertThat(plan.getOpMeta(plan.getOpOrder().get(0)).getHosts()).hasSize(3);
    }

    @Test
    void 같은_Host가_같은_위치를_다시_지나면_별개의_Operation이_된다() {
        // given
        Inventory inventory = inventory(List.of("a", "b"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> {
            for (int i = 0; i < 2; i++) {
                ctx.op("Repeat", ShellOperation.of("echo again"));
            }
        }, inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(2);
        assertThat(plan.getHostOps(host("a"))).containsExactlyElementsOf(plan.getOpOrder());
    }

    @Test
    void 두_위치에서_호출한_helper는_Host별_호출_순서를_지킨다() {
        // given
        Inventory inventory = inventory(List.of("a", "b"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> ctx.forEachHost((host, hostCtx) -> {
            if (host.getName().getValue().equals("a")) {
                installCommon(hostCtx);
                hostCtx.op("Configure", ShellOperation.of("echo configure"));
            } else {
                hostCtx.op("Configure", ShellOperation.of("echo configure"));
                installCommon(hostCtx);
            }
        }), inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(4);
        assertThat(hostOpNames(plan, "a")).containsExactly("Install", "Configure");
        assertThat(hostOpNames(plan, "b")).containsExactly("Configure", "Install");
    }

    @Test
    void helper_호출_위치는_바깥_프레임까지_포함한다() {
        // given
        Inventory inventory = inventory(List.of("a"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> {
            installCommon(ctx);
            installCommon(ctx);
        }, inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(2);
        String first = plan.getOpMeta(plan.getOpOrder().get(0)).getCallSite().location();
        String second = plan.getOpMeta(plan.getOpOrder().get(1)).getCallSite().location();
        assertThat(first).contains("installCommon").contains(CallSites.FRAME_SEPARATOR);
        assertThat(first).isNotEqualTo(second);
        assertThat(plan.getOpMeta(plan.getOpOrder().get(1)).getCallSite().occurrence()).isZero();
    }

    @Test
    void include_이름_접두어가_Operation_이름에_붙는다() {
        // given
        Inventory inventory = inventory(List.of("a"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> ctx.include("tasks/a_task",
            task -> task.op("First task operation", ShellOperation.of("echo first"))),
            inventory, new FixedFactGatherer());

        // then
        OperationMeta meta = plan.getOpMeta(plan.getOpOrder().get(0));
        assertThat(meta.getNames().display()).isEqualTo("tasks/a_task | First task operation");
        assertThat(meta.getNames().name()).isEqualTo("First task operation");
    }

    @Test
    void 다른_위치에서_include한_같은_작업은_별개로_기록된다() {
        // given
        Inventory inventory = inventory(List.of("a"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> {
            ctx.include("tasks/common", DeployContextTest::commonTask);
            ctx.include("tasks/common", DeployContextTest::commonTask);
        }, inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(2);
        List<String> parents = plan.getOpOrder().stream()
            .map(hash -> plan.getOpMeta(hash).getCallSite().siteKey())
            .collect(Collectors.toList());
        assertThat(parents.get(0)).isNotEqualTo(parents.get(1));
    }

    @Test
    void 명시적_라벨이_같으면_다른_소스_위치에서도_같은_Operation이다() {
        // given
        Inventory inventory = inventory(List.of("a", "b"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> {
            ctx.onHosts(List.of("a"), scoped -> scoped.op("Label", ShellOperation.of("echo l"), "deploy.yml#1"));
            ctx.onHosts(List.of("b"), scoped -> scoped.op("Label", ShellOperation.of("echo l"), "deploy.yml#1"));
        }, inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(1);
        assertThat(plan.getOpMeta(plan.getOpOrder().get(0)).getHosts()).containsExactly(host("a"), host("b"));
    }

    @Test
    void 각_Host의_로컬_순서는_전역_순서의_부분열이다() {
        // given
        Inventory inventory = inventory(List.of("c", "a", "d", "b"), List.of("b", "d"));

        // when
        Plan plan = evaluator.evaluate(ctx -> {
            ctx.onHosts(List.of("web"), web -> web.op("Web first", ShellOperation.of("echo w")));
            WEB_DEPLOY.define(ctx);
            ctx.onHosts(List.of("a", "c"), scoped -> scoped.op("Late", ShellOperation.of("echo late")));
        }, inventory, new FixedFactGatherer());

        // then
        for (HostName name : inventory.getHostNames()) {
            List<OpHash> expected = new ArrayList<>();
            for (OpHash hash : plan.getOpOrder()) {
                if (plan.getOpMeta(hash).getHosts().contains(name)) {
                    expected.add(hash);
                }
            }
            assertThat(plan.getHostOps(name)).containsExactlyElementsOf(expected);
        }
    }

    @Test
    void 범위에_일치하는_Host가_없어도_Operation은_기록된다() {
        // given
        Inventory inventory = inventory(List.of("a"), List.of());

        // when
        Plan plan = evaluator.evaluate(ctx -> ctx.onHosts(List.of("missing"),
            scoped -> scoped.op("Nobody", ShellOperation.of("echo none"))),
            inventory, new FixedFactGatherer());

        // then
        assertThat(plan.getOpOrder()).hasSize(1);
        assertThat(plan.getOpMeta(plan.getOpOrder().get(0)).getHosts()).isEmpty();
        assertThat(plan.getHostOps(host("a"))).isEmpty();
    }

    @Test
    void Fact_값에_따라_분기할_수_있다() {
        // given
        Inventory inventory = inventory(List.of("a", "b"), List.of());
        FixedFactGatherer gatherer = new FixedFactGatherer()
            .with("a", ServerFacts.OS, "Linux")
            .with("b", ServerFacts.OS, "FreeBSD");

        // when
        Plan plan = evaluator.evaluate(ctx -> ctx.forEachHost((host, hostCtx) -> {
            if ("Linux".equals(hostCtx.fact(host, ServerFacts.OS))) {
                hostCtx.op("Linux only", ShellOperation.of("echo linux"));
            }
        }), inventory, gatherer);

        // then
        assertThat(plan.getOpOrder()).hasSize(1);
        assertThat(plan.getHostOps(host("a"))).hasSize(1);
        assertThat(plan.getHostOps(host("b"))).isEmpty();
    }

    @Test
    void onHost_범위_밖_Host는_빈_범위가_된다() {
        // given
        Inventory inventory = inventory(List.of("a", "b"), List.of());
        List<List<Host>> seen = new ArrayList<>();

        // when
        evaluator.evaluate(ctx -> ctx.onHosts(List.of("a"), scoped -> {
            scoped.onHost(inventory.get(host("b")), inner -> seen.add(inner.hosts()));
            scoped.onHost(inventory.get(host("a")), inner -> seen.add(inner.hosts()));
        }), inventory, new FixedFactGatherer());

        // then
        assertThat(seen.get(0)).isEmpty();
        assertThat(seen.get(1)).extracting(Host::getName).containsExactly(host("a"));
    }

    @Test
    void Operation_이름이_비어있으면_예외() {
        // given
        Inventory inventory = inventory(List.of("a"), List.of());

        // when & then
        assertThatThrownBy(() -> evaluator.evaluate(
            ctx -> ctx.op(" ", ShellOperation.of("echo x")), inventory, new FixedFactGatherer()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name cannot be null or blank");
    }

    private static void commonTask(DeployContext ctx) {
        ctx.op("Common", ShellOperation.of("echo common"));
    }

    private static void installCommon(DeployContext ctx) {
        ctx.op("Install", ShellOperation.of("echo install"));
    }

    private static List<String> hostOpNames(Plan plan, String hostName) {
        return plan.getHostOps(host(hostName)).stream()
            .map(hash -> plan.getOpMeta(hash).getNames().name())
            .collect(Collectors.toList());
    }

    private static List<String> names(Plan plan) {
        return plan.getOpOrder().stream()
            .map(hash -> plan.getOpMeta(hash).getNames().name())
            .collect(Collectors.toList());
    }

    private static HostName host(String name) {
        return HostName.of(name);
    }

    private static Inventory inventory(List<String> hosts, List<String> webHosts) {
        List<HostDefinition> definitions = hosts.stream()
            .map(name -> new HostDefinition(name, Map.of()))
            .collect(Collectors.toList());
        List<GroupDefinition> groups = webHosts.isEmpty()
            ? List.of()
            : List.of(new GroupDefinition("web", webHosts, Map.of()));
        return Inventory.load(new InventoryDefinition(definitions, groups), Map.of());
    }
}
