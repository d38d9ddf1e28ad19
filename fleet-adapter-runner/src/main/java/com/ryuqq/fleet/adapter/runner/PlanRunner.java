package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.orchestrator.ExecutionEngine;
import com.ryuqq.fleet.application.orchestrator.ExecutionResult;
import com.ryuqq.fleet.application.orchestrator.OperationResult;
import com.ryuqq.fleet.core.config.RunConfig;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.model.OpHash;
import com.ryuqq.fleet.core.outcome.Fail;
import com.ryuqq.fleet.core.outcome.HostOutcome;
import com.ryuqq.fleet.core.outcome.Skipped;
import com.ryuqq.fleet.core.plan.OperationMeta;
import com.ryuqq.fleet.core.plan.Plan;
import com.ryuqq.fleet.core.spi.Transport;
import com.ryuqq.fleet.core.statemachine.AbortReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plan 실행 엔진 구현체.
 *
 * <p><strong>병렬 모드 (기본):</strong></p>
 * <pre>
 * For each OpHash in global order:
 *   1. applicable = Operation Host ∩ active Inventory - 이미 실패한 Host
 *   2. applicable이 비어있으면 건너뜀 (오류 아님)
 *   3. 고정 크기 Worker Pool에 Host별 작업 제출
 *   4. 모든 Host 결과 수집 (중단 시 drainTimeoutMs까지만 대기)
 *   5. 실패 비율 &gt; failPercent → ABORTED (다음 Operation 시작 안 함)
 * </pre>
 *
 * <p><strong>직렬 모드:</strong></p>
 * <pre>
 * For each Host in Inventory order:
 *   1. Host의 로컬 순서대로 모든 Operation 실행
 *   2. 실패하면 해당 Host의 남은 Operation 중단
 *   3. 첫 Host의 연결 실패 (TRANSPORT_ERROR, noWait 아님) → 즉시 ABORTED
 *   4. 실패 Host 비율 &gt; failPercent → ABORTED
 * </pre>
 *
 * <p><strong>중단 처리 (noWait 아님):</strong> 첫 임계값 초과 시점에 아직 시작하지 않은
 * Host 작업은 {@link Skipped}로 기록됩니다. 이미 시작한 작업은 drainTimeoutMs 동안 완료를 기다리며,
 * 그때까지 끝나지 않은 작업만 COMMAND_TIMEOUT 실패가 됩니다. 그때까지 큐에서 시작하지 못한 작업도 Skipped입니다.
 * noWait이면 모든 Host가 끝난 뒤 실패 비율을 계산합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class PlanRunner implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanRunner.class);

    private static final long DEFAULT_POLLING_INTERVAL_MS = 50;
    private static final String SKIPPED_REASON = "Dispatch aborted before start";

    private final HostOperationExecutor hostExecutor;

    public PlanRunner(Transport transport) {
        this(new HostOperationExecutor(transport));
    }

    /**
     * 생성자 (커스텀 HostOperationExecutor 주입).
     *
     * @param hostExecutor Host별 실행기
     * @throws IllegalArgumentException hostExecutor가 null인 경우
     */
    public PlanRunner(HostOperationExecutor hostExecutor) {
        if (hostExecutor == null) {
            throw new IllegalArgumentException("hostExecutor cannot be null");
        }
        this.hostExecutor = hostExecutor;
    }

    @Override
    public ExecutionResult execute(Plan plan, Inventory active, FactGatherer gatherer, RunConfig config) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (active == null) {
            throw new IllegalArgumentException("active cannot be null");
        }
        if (gatherer == null) {
            throw new IllegalArgumentException("gatherer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (!plan.isFrozen()) {
            throw new IllegalStateException("Plan must be frozen before execution");
        }

        log.info("Executing {} operations on {} hosts ({} mode{})",
            plan.size(), active.size(), config.serial() ? "serial" : "parallel",
            config.dryRun() ? ", dry run" : "");

        if (config.serial()) {
            return executeSerial(plan, active, gatherer, config);
        }
        return executeParallel(plan, active, gatherer, config);
    }

    // ========== 병렬 모드 ==========

    private ExecutionResult executeParallel(Plan plan, Inventory active, FactGatherer gatherer, RunConfig config) {
        List<OperationResult> results = new ArrayList<>();
        Set<HostName> failedHosts = new TreeSet<>();
        int poolSize = config.effectiveParallel(active.size());
        ExecutorService workers = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());

        try {
            for (OpHash hash : plan.getOpOrder()) {
                OperationMeta meta = plan.getOpMeta(hash);
                List<Host> applicable = applicableHosts(meta, active, failedHosts);
                if (applicable.isEmpty()) {
                    log.debug("Skipping {}: no applicable hosts", meta.getNames());
                    continue;
                }

                Dispatch dispatch = dispatch(workers, meta, applicable, gatherer, config);
                results.add(new OperationResult(hash, meta.getNames(), dispatch.outcomes()));
                failedHosts.addAll(dispatch.failedHosts());

                if (dispatch.thresholdExceeded()) {
                    log.warn("Failure threshold exceeded at {}: {} of {} hosts failed (fail percent {})",
                        meta.getNames(), dispatch.failedHosts().size(), applicable.size(), config.failPercent());
                    return ExecutionResult.aborted(results, failedHosts, AbortReason.THRESHOLD_EXCEEDED);
                }
            }
            return ExecutionResult.completed(results, failedHosts);
        } finally {
            workers.shutdownNow();
        }
    }

    private Dispatch dispatch(
        ExecutorService workers,
        OperationMeta meta,
        List<Host> applicable,
        FactGatherer gatherer,
        RunConfig config
    ) {
        AtomicBoolean abort = new AtomicBoolean(false);
        AtomicInteger failures = new AtomicInteger();
        ExecutorCompletionService<HostOutcome> completion = new ExecutorCompletionService<>(workers);
        Map<Future<HostOutcome>, HostName> pending = new HashMap<>();
        Map<HostName, AtomicBoolean> started = new HashMap<>();

        for (Host host : applicable) {
            AtomicBoolean claim = new AtomicBoolean(false);
            started.put(host.getName(), claim);
            Future<HostOutcome> future = completion.submit(() -> {
                if (abort.get() || !claim.compareAndSet(false, true)) {
                    return new Skipped(host.getName(), SKIPPED_REASON);
                }
                HostOutcome outcome = hostExecutor.execute(host, meta, gatherer, config);
                if (outcome.isFail() && !config.noWait()
                    && FailureThreshold.exceeded(failures.incrementAndGet(), applicable.size(), config.failPercent())) {
                    abort.set(true);
                }
                return outcome;
            });
            pending.put(future, host.getName());
        }

        Map<HostName, HostOutcome> collected = collect(completion, pending, started, abort, config.drainTimeoutMs());

        Map<HostName, HostOutcome> outcomes = new LinkedHashMap<>();
        Set<HostName> failed = new TreeSet<>();
        for (Host host : applicable) {
            HostOutcome outcome = collected.get(host.getName());
            outcomes.put(host.getName(), outcome);
            if (outcome.isFail()) {
                failed.add(host.getName());
            }
        }
        boolean exceeded = abort.get()
            || FailureThreshold.exceeded(failed.size(), applicable.size(), config.failPercent());
        return new Dispatch(outcomes, failed, exceeded);
    }

    private Map<HostName, HostOutcome> collect(
        ExecutorCompletionService<HostOutcome> completion,
        Map<Future<HostOutcome>, HostName> pending,
        Map<HostName, AtomicBoolean> started,
        AtomicBoolean abort,
        long drainTimeoutMs
    ) {
        Map<HostName, HostOutcome> collected = new HashMap<>();
        long drainDeadline = -1;

        try {
            while (!pending.isEmpty()) {
                long waitMs = DEFAULT_POLLING_INTERVAL_MS;
                if (abort.get()) {
                    long now = System.currentTimeMillis();
                    if (drainDeadline < 0) {
                        drainDeadline = now + drainTimeoutMs;
                    }
                    waitMs = drainDeadline - now;
                    if (waitMs <= 0) {
                        break;
                    }
                }

                Future<HostOutcome> done = completion.poll(waitMs, TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                HostName host = pending.remove(done);
                collected.put(host, outcomeOf(done, host));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.keySet().forEach(future -> future.cancel(true));
            throw new IllegalStateException("Execution interrupted", e);
        }

        for (Map.Entry<Future<HostOutcome>, HostName> entry : pending.entrySet()) {
            HostName host = entry.getValue();
            entry.getKey().cancel(true);
            // 선점에 성공하면 작업은 시작되지 않은 것
            if (started.get(host).compareAndSet(false, true)) {
                collected.put(host, new Skipped(host, SKIPPED_REASON));
                continue;
            }
            log.warn("Host {} did not finish within drain timeout of {}ms", host, drainTimeoutMs);
            collected.put(host, Fail.of(host, Fail.COMMAND_TIMEOUT,
                "Did not finish within drain timeout of " + drainTimeoutMs + "ms"));
        }
        return collected;
    }

    private static HostOutcome outcomeOf(Future<HostOutcome> done, HostName host) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            log.error("Worker failed on {}", host, e.getCause());
            return Fail.of(host, Fail.OPERATION_ERROR, "Worker failed: " + e.getCause());
        }
    }

    // ========== 직렬 모드 ==========

    private ExecutionResult executeSerial(Plan plan, Inventory active, FactGatherer gatherer, RunConfig config) {
        Map<OpHash, Map<HostName, HostOutcome>> byOperation = new LinkedHashMap<>();
        for (OpHash hash : plan.getOpOrder()) {
            byOperation.put(hash, new LinkedHashMap<>());
        }
        Set<HostName> failedHosts = new TreeSet<>();
        List<Host> hosts = active.getHosts();

        for (int index = 0; index < hosts.size(); index++) {
            Host host = hosts.get(index);
            for (OpHash hash : plan.getHostOps(host.getName())) {
                OperationMeta meta = plan.getOpMeta(hash);
                HostOutcome outcome = hostExecutor.execute(host, meta, gatherer, config);
                byOperation.get(hash).put(host.getName(), outcome);
                if (!outcome.isFail()) {
                    continue;
                }

                failedHosts.add(host.getName());
                // 타임아웃은 연결 실패로 보지 않음
                boolean unreachable = Fail.TRANSPORT_ERROR.equals(((Fail) outcome).errorCode());
                if (index == 0 && !config.noWait() && unreachable) {
                    log.error("Transport failure on first host {}, aborting run: {}",
                        host.getName(), ((Fail) outcome).message());
                    return ExecutionResult.aborted(
                        toResults(plan, byOperation), failedHosts, AbortReason.TRANSPORT_FAILURE);
                }
                break;
            }

            if (FailureThreshold.exceeded(failedHosts.size(), hosts.size(), config.failPercent())) {
                log.warn("Failure threshold exceeded after {}: {} of {} hosts failed (fail percent {})",
                    host.getName(), failedHosts.size(), hosts.size(), config.failPercent());
                return ExecutionResult.aborted(
                    toResults(plan, byOperation), failedHosts, AbortReason.THRESHOLD_EXCEEDED);
            }
        }
        return ExecutionResult.completed(toResults(plan, byOperation), failedHosts);
    }

    private static List<OperationResult> toResults(Plan plan, Map<OpHash, Map<HostName, HostOutcome>> byOperation) {
        List<OperationResult> results = new ArrayList<>();
        for (Map.Entry<OpHash, Map<HostName, HostOutcome>> entry : byOperation.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            OperationMeta meta = plan.getOpMeta(entry.getKey());
            results.add(new OperationResult(entry.getKey(), meta.getNames(), entry.getValue()));
        }
        return results;
    }

    private static List<Host> applicableHosts(OperationMeta meta, Inventory active, Set<HostName> failedHosts) {
        List<Host> applicable = new ArrayList<>();
        for (HostName name : new TreeSet<>(meta.getHosts())) {
            if (!failedHosts.contains(name)) {
                active.find(name).ifPresent(applicable::add);
            }
        }
        return applicable;
    }

    private record Dispatch(Map<HostName, HostOutcome> outcomes, Set<HostName> failedHosts, boolean thresholdExceeded) {
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "fleet-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
