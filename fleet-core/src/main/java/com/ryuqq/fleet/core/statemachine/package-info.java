/**
 * Run state machine.
 *
 * <p>{@code IDLE -> EVALUATING -> PLANNED -> EXECUTING -> COMPLETED | ABORTED},
 * with {@code EVALUATING -> ABORTED} when the deploy definition fails.
 * {@link com.ryuqq.fleet.core.statemachine.StateTransition} rejects every other
 * transition.</p>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.statemachine;
