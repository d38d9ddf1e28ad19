package com.ryuqq.fleet.testkit.contract;

import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.application.orchestrator.OperationResult;
import com.ryuqq.fleet.application.orchestrator.Orchestrator;
import com.ryuqq.fleet.application.orchestrator.RunReport;
import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.inventory.InventoryDefinition;
import com.ryuqq.fleet.core.inventory.InventoryDefinition.GroupDefinition;
import com.ryuqq.fleet.core.inventory.InventoryDefinition.HostDefinition;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.plan.Plan;
import com.ryuqq.fleet.core.spi.Transport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract base class for execution engine contract tests.
 *
 * <p>Subclasses supply the {@link Orchestrator} under test; the base class owns a fresh
 * {@link RecordingTransport} per test and offers inventory builders and plan assertions.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyEngineContractTest extends AbstractEngineContractTest {
 *     {@literal @}Override
 *     protected Orchestrator createOrchestrator(Transport transport) {
 *         return new DeployOrchestrator(transport, InMemoryFactCache::new);
 *     }
 *
 *     {@literal @}Test
 *     void scenario() {
 *         RunReport report = run(ContractDeploys.scopedFollowUp(), inventoryOf("a", "b", "c"));
 *         assertHostOps(report.plan(), "b", 2);
 *     }
 * }
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public abstract class AbstractEngineContractTest {

    protected RecordingTransport transport;
    protected Orchestrator orchestrator;

    /**
     * Creates the orchestrator under test.
     *
     * <p>Called once per test with the fresh recording transport.</p>
     *
     * @param transport the transport every command must go through
     * @return orchestrator under test
     */
    protected abstract Orchestrator createOrchestrator(Transport transport);

    @BeforeEach
    void setUpEngine() {
        transport = new RecordingTransport();
        orchestrator = createOrchestrator(transport);
    }

    @AfterEach
    void tearDownEngine() {
        if (transport != null) {
            transport.clear();
        }
    }

    /**
     * Runs a deploy with the default configuration.
     *
     * @param deploy deploy definition
     * @param inventory full inventory
     * @return run report
     */
    protected RunReport run(Deploy deploy, Inventory inventory) {
        return run(deploy, inventory, new RunConfig());
    }

    protected RunReport run(Deploy deploy, Inventory inventory, RunConfig config) {
        return orchestrator.run(deploy, inventory, config);
    }

    /**
     * Runs a deploy in dry-run mode and returns its plan.
     *
     * @param deploy deploy definition
     * @param inventory full inventory
     * @return frozen plan
     */
    protected Plan planOf(Deploy deploy, Inventory inventory) {
        RunReport report = run(deploy, inventory, new RunConfig().withDryRun(true));
        assertThat(report.findPlan())
            .as("evaluation failed: %s", report.errorMessage())
            .isPresent();
        return report.plan();
    }

    /**
     * Creates an inventory of data-less hosts in the given order.
     *
     * @param hosts host names
     * @return inventory
     */
    protected Inventory inventoryOf(String... hosts) {
        return Inventory.load(InventoryDefinition.ofHosts(List.of(hosts)), Map.of());
    }

    /**
     * Creates an inventory with groups, both in the given declaration order.
     *
     * @param hosts host names
     * @param groups group name to member host names
     * @return inventory
     */
    protected Inventory inventoryOf(List<String> hosts, Map<String, List<String>> groups) {
        List<HostDefinition> hostDefinitions = new ArrayList<>();
        for (String host : hosts) {
            hostDefinitions.add(new HostDefinition(host, Map.of()));
        }
        List<GroupDefinition> groupDefinitions = new ArrayList<>();
        groups.forEach((name, members) -> groupDefinitions.add(new GroupDefinition(name, members, Map.of())));
        return Inventory.load(new InventoryDefinition(hostDefinitions, groupDefinitions), Map.of());
    }

    protected static HostName hostName(String value) {
        return HostName.of(value);
    }

    /**
     * Operation display names in global order.
     *
     * @param plan plan
     * @return names
     */
    protected static List<String> operationNames(Plan plan) {
        return plan.getOpOrder().stream()
            .map(hash -> plan.getOpMeta(hash).getNames().display())
            .toList();
    }

    /**
     * Asserts the number of operations recorded for a host.
     *
     * @param plan plan
     * @param host host name
     * @param expected expected operation count
     */
    protected static void assertHostOps(Plan plan, String host, int expected) {
        assertThat(plan.getHostOps(hostName(host)))
            .as("operations of host %s", host)
            .hasSize(expected);
    }

    /**
     * Asserts that every host's local list is the global order filtered to its operations.
     *
     * @param plan plan
     */
    protected static void assertLocalOrderIsSubsequence(Plan plan) {
        for (HostName host : plan.getHosts()) {
            List<OpHash> expected = plan.getOpOrder().stream()
                .filter(hash -> plan.getOpMeta(hash).getHosts().contains(host))
                .toList();
            assertThat(plan.getHostOps(host))
                .as("local order of host %s", host)
                .containsExactlyElementsOf(expected);
        }
    }

    /**
     * Finds the result of an operation by display name.
     *
     * @param report run report
     * @param displayName operation display name
     * @return operation result (empty if the operation was never dispatched)
     */
    protected static Optional<OperationResult> findResult(RunReport report, String displayName) {
        return report.operations().stream()
            .filter(result -> result.names().display().equals(displayName))
            .findFirst();
    }
}
