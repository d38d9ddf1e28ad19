/**
 * Per-host execution outcomes.
 *
 * <p>{@link com.ryuqq.fleet.core.outcome.HostOutcome} is a sealed interface with
 * four cases: Changed, Unchanged, Fail and Skipped. Failures are values folded
 * into the failure threshold, never exceptions thrown across the dispatch loop.</p>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.outcome;
