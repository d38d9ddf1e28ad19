/**
 * Execution engine and run orchestration.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.DeployOrchestrator} - evaluates a deploy and runs the plan</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.PlanRunner} - parallel and serial plan execution</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.HostOperationExecutor} - applies one operation to one host</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.FailureThreshold} - fail percent evaluation</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>Operations are dispatched strictly in global order. Within one operation the
 * hosts run on a fixed worker pool; operation N+1 never starts before the dispatch
 * of operation N has concluded.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.adapter.runner;
