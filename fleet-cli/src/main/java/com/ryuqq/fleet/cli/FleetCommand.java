package com.ryuqq.fleet.cli;

import com.ryuqq.fleet.adapter.inmemory.cache.InMemoryFactCache;
import com.ryuqq.fleet.adapter.runner.DeployOrchestrator;
import com.ryuqq.fleet.adapter.transport.SshTransport;
import com.ryuqq.fleet.adapter.transport.TransportConfig;
import com.ryuqq.fleet.adapter.transport.TransportRouter;
import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.application.fact.DefaultFactGatherer;
import com.ryuqq.fleet.application.orchestrator.RunReport;
import com.ryuqq.fleet.cli.deploy.DeployFileLoader;
import com.ryuqq.fleet.cli.inventory.InventoryFileLoader;
import com.ryuqq.fleet.cli.output.FactResultWriter;
import com.ryuqq.fleet.cli.output.ReportPrinter;
import com.ryuqq.fleet.cli.registry.FactRegistry;
import com.ryuqq.fleet.cli.registry.OperationRegistry;
import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.fact.Fact;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.operation.Operation;
import com.ryuqq.fleet.core.operation.ShellOperation;
import com.ryuqq.fleet.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * fleet 명령행 진입점.
 *
 * <p><strong>사용 형식:</strong></p>
 * <pre>
 * fleet INVENTORY deploy.yml [more.yml ...]     Deploy 파일 실행
 * fleet INVENTORY server.shell 'echo hi'         Operation 하나 실행
 * fleet INVENTORY exec -- uptime                 셸 명령 실행
 * fleet INVENTORY fact os                        Host별 Fact를 JSON으로 출력
 * </pre>
 *
 * <p>INVENTORY는 YAML 파일 경로, {@code @local}, 또는 쉼표로 구분한 Host 이름 목록입니다.</p>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 실패한 Host 없이 완료</li>
 *   <li>1: 중단, 실패한 Host 존재, Deploy 파일 없음, 정의 오류</li>
 *   <li>2: 명령행 사용법 오류</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
@Command(
    name = "fleet",
    mixinStandardHelpOptions = true,
    version = "fleet 1.0.0",
    description = "Evaluate a deploy into an ordered plan and run it across an inventory."
)
public class FleetCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FleetCommand.class);

    static final String FACT_COMMAND = "fact";
    static final String EXEC_COMMAND = "exec";

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "INVENTORY",
        description = "Inventory YAML file, @local, or comma separated host names")
    String inventory;

    @Parameters(index = "1..*", arity = "0..*", paramLabel = "OPERATIONS",
        description = "Deploy files, an operation name with arguments, exec -- COMMAND, or fact NAME [ARGS]")
    List<String> operations = new ArrayList<>();

    @Option(names = "--facts", description = "List available facts and exit")
    boolean listFacts;

    @Option(names = "--operations", description = "List available operations and exit")
    boolean listOperations;

    @Option(names = "--parallel", paramLabel = "N", description = "Worker threads per operation (default: one per host)")
    int parallel;

    @Option(names = "--serial", description = "Run hosts one after another")
    boolean serial;

    @Option(names = "--fail-percent", paramLabel = "PERCENT", description = "Tolerated failed host percentage (default: 0)")
    int failPercent;

    @Option(names = "--limit", split = ",", paramLabel = "PATTERN", description = "Restrict execution to matching hosts or groups")
    List<String> limit = new ArrayList<>();

    @Option(names = "--no-wait",
        description = "Let sibling hosts finish before checking the failure threshold")
    boolean noWait;

    @Option(names = "--dry", description = "Compute commands without running state changes")
    boolean dry;

    @Option(names = "--debug-facts", description = "Log gathered fact values")
    boolean debugFacts;

    @Option(names = "--debug-operations", description = "Log the plan and operation commands")
    boolean debugOperations;

    @Option(names = "--debug-data", description = "Log merged host data")
    boolean debugData;

    @Option(names = "--data", paramLabel = "KEY=VALUE", description = "Override host data for this run")
    Map<String, String> data = new LinkedHashMap<>();

    @Option(names = "--user", description = "SSH user")
    String user;

    @Option(names = "--port", description = "SSH port")
    Integer port;

    @Option(names = "--key", description = "SSH private key file")
    String key;

    @Option(names = "--shell-executable", defaultValue = "sh", description = "Shell for local commands (default: ${DEFAULT-VALUE})")
    String shellExecutable;

    @Option(names = "--timeout", paramLabel = "SECONDS", description = "Per command timeout")
    Long timeoutSeconds;

    @Option(names = "--drain-timeout", paramLabel = "MILLIS", description = "Wait for in-flight hosts after an abort")
    Long drainTimeoutMs;

    private final Function<TransportConfig, Transport> transportFactory;
    private final OperationRegistry operationRegistry;
    private final FactRegistry factRegistry;
    private final InventoryFileLoader inventoryLoader;
    private final DeployFileLoader deployLoader;

    public FleetCommand() {
        this(TransportRouter::of);
    }

    /**
     * 생성자 (Transport 생성기 주입).
     *
     * @param transportFactory Transport 설정 → Transport
     */
    public FleetCommand(Function<TransportConfig, Transport> transportFactory) {
        if (transportFactory == null) {
            throw new IllegalArgumentException("transportFactory cannot be null");
        }
        this.transportFactory = transportFactory;
        this.operationRegistry = OperationRegistry.defaults();
        this.factRegistry = FactRegistry.defaults();
        this.inventoryLoader = new InventoryFileLoader();
        this.deployLoader = new DeployFileLoader(operationRegistry);
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new FleetCommand()).execute(args);
        System.exit(exitCode);
    }

    /**
     * picocli CommandLine 생성.
     *
     * <p>{@code @local} 인벤토리가 인자 파일로 해석되지 않도록 {@code @file} 확장을 끕니다.</p>
     *
     * @param command 명령 객체
     * @return CommandLine
     */
    public static CommandLine commandLine(FleetCommand command) {
        return new CommandLine(command).setExpandAtFiles(false);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (listFacts) {
            factRegistry.names().forEach(out::println);
            out.flush();
            return 0;
        }
        if (listOperations) {
            operationRegistry.types().forEach(out::println);
            out.flush();
            return 0;
        }
        if (inventory == null || operations.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing required parameters: INVENTORY OPERATIONS");
        }

        try {
            RunConfig config = runConfig();
            String command = operations.get(0);
            List<String> rest = operations.subList(1, operations.size());
            if (FACT_COMMAND.equals(command)) {
                Inventory loaded = inventoryLoader.load(inventory, overrides());
                return printFacts(loaded, rest, config, out);
            }

            Deploy deploy;
            if (EXEC_COMMAND.equals(command)) {
                deploy = execDeploy(rest);
            } else if (operationRegistry.contains(command)) {
                Operation operation = operationRegistry.createFromTokens(command, rest);
                deploy = ctx -> ctx.op(command, operation, "cli");
            } else {
                for (String file : operations) {
                    if (!Files.isRegularFile(Path.of(file))) {
                        out.println("No deploy file: " + file);
                        out.flush();
                        return 1;
                    }
                }
                deploy = fileDeploy(operations);
            }

            Inventory loaded = inventoryLoader.load(inventory, overrides());
            Transport transport = transportFactory.apply(transportConfig());
            RunReport report = new DeployOrchestrator(transport, InMemoryFactCache::new).run(deploy, loaded, config);
            new ReportPrinter(out).print(report, config.dryRun());
            return report.exitCode();
        } catch (DefinitionException e) {
            log.debug("Definition error", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private int printFacts(Inventory loaded, List<String> args, RunConfig config, PrintWriter out) {
        if (args.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing fact name");
        }
        Fact<?> fact = factRegistry.get(args.get(0));
        List<String> factArgs = List.copyOf(args.subList(1, args.size()));
        Transport transport = transportFactory.apply(transportConfig());
        FactGatherer gatherer = new DefaultFactGatherer(transport, new InMemoryFactCache(), config.debugFacts());

        Map<String, Object> values = new LinkedHashMap<>();
        for (Host host : loaded.limit(config.limit()).getHosts()) {
            Object value;
            try {
                value = gatherer.get(host, fact, factArgs);
            } catch (GatherException e) {
                log.warn("Fact {} failed on {}: {}", fact.getName(), host.getName(), e.getMessage());
                value = null;
            }
            values.put(host.getName().getValue(), value);
        }
        new FactResultWriter().write(values, out);
        return 0;
    }

    private Deploy execDeploy(List<String> commandWords) {
        if (commandWords.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing command after exec");
        }
        String commandLine = String.join(" ", commandWords);
        Operation operation = ShellOperation.of(commandLine);
        return ctx -> ctx.op("Exec: " + commandLine, operation, "exec");
    }

    private Deploy fileDeploy(List<String> files) {
        List<Deploy> deploys = new ArrayList<>();
        for (String file : files) {
            deploys.add(deployLoader.load(Path.of(file)));
        }
        return ctx -> {
            for (Deploy deploy : deploys) {
                deploy.define(ctx);
            }
        };
    }

    RunConfig runConfig() {
        RunConfig config = new RunConfig()
            .withParallel(parallel)
            .withSerial(serial)
            .withFailPercent(failPercent)
            .withLimit(limit)
            .withNoWait(noWait)
            .withDryRun(dry)
            .withDebugFacts(debugFacts)
            .withDebugOperations(debugOperations)
            .withDebugData(debugData);
        if (drainTimeoutMs != null) {
            config = config.withDrainTimeoutMs(drainTimeoutMs);
        }
        return config;
    }

    TransportConfig transportConfig() {
        TransportConfig config = new TransportConfig().withShell(shellExecutable);
        if (timeoutSeconds != null) {
            config = config.withTimeoutMs(timeoutSeconds * 1000L);
        }
        return config;
    }

    Map<String, Object> overrides() {
        Map<String, Object> overrides = new LinkedHashMap<>(data);
        if (user != null) {
            overrides.put(SshTransport.DATA_USER, user);
        }
        if (port != null) {
            overrides.put(SshTransport.DATA_PORT, port);
        }
        if (key != null) {
            overrides.put(SshTransport.DATA_KEY, key);
        }
        return overrides;
    }
}
