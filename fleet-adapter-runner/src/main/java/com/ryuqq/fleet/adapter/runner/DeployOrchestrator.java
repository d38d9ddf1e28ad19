package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.application.deploy.PlanEvaluator;
import com.ryuqq.fleet.application.fact.DefaultFactGatherer;
import com.ryuqq.fleet.application.orchestrator.ExecutionEngine;
import com.ryuqq.fleet.application.orchestrator.ExecutionResult;
import com.ryuqq.fleet.application.orchestrator.Orchestrator;
import com.ryuqq.fleet.application.orchestrator.RunReport;
import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.plan.OperationMeta;
import com.ryuqq.fleet.core.plan.Plan;
import com.ryuqq.fleet.core.spi.FactCache;
import com.ryuqq.fleet.core.spi.Transport;
import com.ryuqq.fleet.core.statemachine.RunState;
import com.ryuqq.fleet.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * {@link Orchestrator} 구현체.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>실행마다 새 Fact 캐시와 새 Plan 생성 (실행 간 상태 공유 없음)</li>
 *   <li>RunState 상태 전이 관리</li>
 *   <li>limit으로 평가와 실행 대상을 함께 좁힘 (패턴 조회는 전체 인벤토리 기준)</li>
 *   <li>{@link ExecutionEngine}에 실행 위임</li>
 *   <li>debug 플래그에 따른 Plan/Host 데이터 출력</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Orchestrator orchestrator = new DeployOrchestrator(transport, InMemoryFactCache::new);
 * RunReport report = orchestrator.run(deploy, inventory, new RunConfig());
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class DeployOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeployOrchestrator.class);

    private final Transport transport;
    private final Supplier<? extends FactCache> cacheFactory;
    private final ExecutionEngine engine;
    private final PlanEvaluator evaluator;

    /**
     * 생성자 (기본 {@link PlanRunner} 사용).
     *
     * @param transport 명령 실행 Transport
     * @param cacheFactory 실행마다 호출되는 Fact 캐시 생성기
     */
    public DeployOrchestrator(Transport transport, Supplier<? extends FactCache> cacheFactory) {
        this(transport, cacheFactory, new PlanRunner(transport));
    }

    /**
     * 생성자 (커스텀 ExecutionEngine 주입).
     *
     * @param transport 명령 실행 Transport
     * @param cacheFactory 실행마다 호출되는 Fact 캐시 생성기
     * @param engine 실행 엔진
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeployOrchestrator(Transport transport, Supplier<? extends FactCache> cacheFactory, ExecutionEngine engine) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (cacheFactory == null) {
            throw new IllegalArgumentException("cacheFactory cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.transport = transport;
        this.cacheFactory = cacheFactory;
        this.engine = engine;
        this.evaluator = new PlanEvaluator();
    }

    @Override
    public RunReport run(Deploy deploy, Inventory inventory, RunConfig config) {
        if (deploy == null) {
            throw new IllegalArgumentException("deploy cannot be null");
        }
        if (inventory == null) {
            throw new IllegalArgumentException("inventory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        RunState state = StateTransition.transition(RunState.IDLE, RunState.EVALUATING);
        if (config.debugData()) {
            dumpData(inventory);
        }
        FactGatherer gatherer = new DefaultFactGatherer(transport, cacheFactory.get(), config.debugFacts());

        Inventory active = inventory.limit(config.limit());
        if (active.isEmpty()) {
            log.warn("No hosts match limit {}", config.limit());
        }

        Plan plan;
        try {
            plan = evaluator.evaluate(deploy, inventory, active.getHostNames(), gatherer);
        } catch (DefinitionException | GatherException e) {
            StateTransition.transition(state, RunState.ABORTED);
            log.error("Deploy evaluation failed: {}", e.getMessage());
            return RunReport.evaluationFailed(e.getMessage());
        }
        state = StateTransition.transition(state, RunState.PLANNED);
        if (config.debugOperations()) {
            dumpPlan(plan);
        }

        state = StateTransition.transition(state, RunState.EXECUTING);
        ExecutionResult result = engine.execute(plan, active, gatherer, config);
        state = StateTransition.transition(state, result.isAborted() ? RunState.ABORTED : RunState.COMPLETED);

        log.info("Run {}: {} operations executed, {} hosts failed", state,
            result.operations().size(), result.failedHosts().size());
        return RunReport.of(plan, result);
    }

    private static void dumpPlan(Plan plan) {
        for (OpHash hash : plan.getOpOrder()) {
            OperationMeta meta = plan.getOpMeta(hash);
            log.info("[{}] {} {} hosts={} at {}", hash.shortValue(), meta.getNames(), meta.getArgs(),
                meta.getHosts(), meta.getCallSite().identity());
        }
        for (HostName host : plan.getHosts()) {
            log.info("{}: {} operations", host, plan.getHostOps(host).size());
        }
    }

    private static void dumpData(Inventory inventory) {
        for (Host host : inventory.getHosts()) {
            log.info("{} groups={} data={}", host.getName(), host.getGroups(), host.getData());
        }
    }
}
