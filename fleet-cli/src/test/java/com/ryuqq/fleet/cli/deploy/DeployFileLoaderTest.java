package com.ryuqq.fleet.cli.deploy;

import com.ryuqq.fleet.adapter.inmemory.cache.InMemoryFactCache;
import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.application.deploy.PlanEvaluator;
import com.ryuqq.fleet.application.fact.DefaultFactGatherer;
import com.ryuqq.fleet.cli.registry.OperationRegistry;
import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.inventory.InventoryDefinition;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.operation.ShellOperation;
import com.ryuqq.fleet.core.plan.Plan;
import com.ryuqq.fleet.testkit.contract.RecordingTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeployFileLoader 테스트.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
class DeployFileLoaderTest {

    private final DeployFileLoader loader = new DeployFileLoader(OperationRegistry.defaults());
    private final PlanEvaluator evaluator = new PlanEvaluator();

    @TempDir
    Path tempDir;

    @Test
    void Operation_단계를_파일_순서대로_기록한다() throws IOException {
        // given
        Path deploy = write("deploy.yml", """
            operations:
              - name: First main operation
                op: server.shell
                args:
                  commands: [echo first]
              - name: Second main operation
                op: server.shell
                hosts: [somehost]
                args:
                  commands: echo second
            """);

        // when
        Plan plan = evaluate(loader.load(deploy), "somehost", "anotherhost");

        // then
        assertThat(names(plan)).containsExactly("First main operation", "Second main operation");
        OpHash second = plan.getOpOrder().get(1);
        assertThat(plan.getOpMeta(second).getHosts()).containsExactly(HostName.of("somehost"));
        assertThat(plan.getOpMeta(second).getOperation()).isEqualTo(ShellOperation.of("echo second"));
        assertThat(plan.getOpMeta(second).getCallSite().location()).isEqualTo("deploy.yml#2");
    }

    @Test
    void include한_파일의_Operation은_include_경로가_접두어로_붙는다() throws IOException {
        // given
        Files.createDirectories(tempDir.resolve("tasks"));
        write("tasks/a_task.yml", """
            - name: First task operation
              op: server.shell
              args:
                commands: [echo task]
            """);
        Path deploy = write("deploy.yml", """
            - include: tasks/a_task.yml
              hosts: anotherhost
            - include: tasks/a_task.yml
            """);

        // when
        Plan plan = evaluate(loader.load(deploy), "somehost", "anotherhost");

        // then
        assertThat(names(plan)).containsExactly(
            "tasks/a_task.yml | First task operation",
            "tasks/a_task.yml | First task operation");
        assertThat(plan.getOpMeta(plan.getOpOrder().get(0)).getHosts())
            .containsExactly(HostName.of("anotherhost"));
        assertThat(plan.getOpMeta(plan.getOpOrder().get(1)).getHosts()).hasSize(2);
    }

    @Test
    void 이름이_없으면_Operation_타입을_이름으로_쓴다() throws IOException {
        // given
        Path deploy = write("deploy.yml", """
            - op: apt.packages
              args:
                packages: [nginx]
            """);

        // when
        List<DeployStep> steps = loader.loadSteps(deploy);

        // then
        assertThat(steps).hasSize(1);
        DeployStep.OperationStep step = (DeployStep.OperationStep) steps.get(0);
        assertThat(step.name()).isEqualTo("apt.packages");
        assertThat(step.label()).isEqualTo("deploy.yml#1");
    }

    @Test
    void 빈_Deploy_파일은_Operation이_없다() throws IOException {
        // given
        Path deploy = write("empty.yml", "operations:\n");

        // when & then
        assertThat(loader.loadSteps(deploy)).isEmpty();
    }

    @Test
    void 없는_파일은_DefinitionException() {
        // when & then
        assertThatThrownBy(() -> loader.load(tempDir.resolve("not-a-file.yml")))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("No deploy file");
    }

    @Test
    void 순환_include는_DefinitionException() throws IOException {
        // given
        write("a.yml", "- include: b.yml\n");
        write("b.yml", "- include: a.yml\n");

        // when & then
        assertThatThrownBy(() -> loader.load(tempDir.resolve("a.yml")))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("Circular include");
    }

    @Test
    void op가_없는_단계는_DefinitionException() throws IOException {
        // given
        Path deploy = write("deploy.yml", """
            - name: Nothing to do
            """);

        // when & then
        assertThatThrownBy(() -> loader.load(deploy))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("'op'")
            .hasMessageContaining("deploy.yml#1");
    }

    @Test
    void 알_수_없는_Operation은_파일을_읽을_때_실패한다() throws IOException {
        // given
        Path deploy = write("deploy.yml", """
            - op: files.template
            """);

        // when & then
        assertThatThrownBy(() -> loader.load(deploy))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("Unknown operation: files.template");
    }

    private Plan evaluate(Deploy deploy, String... hosts) {
        Inventory inventory = Inventory.load(InventoryDefinition.ofHosts(List.of(hosts)), Map.of());
        return evaluator.evaluate(deploy, inventory,
            new DefaultFactGatherer(new RecordingTransport(), new InMemoryFactCache()));
    }

    private static List<String> names(Plan plan) {
        return plan.getOpOrder().stream()
            .map(hash -> plan.getOpMeta(hash).getNames().display())
            .toList();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
