/**
 * Identity value objects used by the plan recorder.
 *
 * <h2>Operation identity</h2>
 * <p>An {@link com.ryuqq.fleet.core.model.OpHash} is computed from a
 * {@link com.ryuqq.fleet.core.model.NameStack}, the canonical
 * {@link com.ryuqq.fleet.core.model.OperationArgs} and a
 * {@link com.ryuqq.fleet.core.model.CallSite}.</p>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.model;
