/**
 * Plan recorder: deduplicates and orders operations discovered during evaluation.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>The global order is a creation-time order; indexes are never reassigned.</li>
 *   <li>Each host's local order is the global order filtered to the operations
 *       whose host set contains that host.</li>
 *   <li>Host sets only grow.</li>
 *   <li>The plan is mutable only until {@link com.ryuqq.fleet.core.plan.OperationRecorder#finish()}.</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.plan;
