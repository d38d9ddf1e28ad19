/**
 * Deploy definition API and evaluation.
 *
 * <p>A {@link com.ryuqq.fleet.application.deploy.Deploy} is evaluated once, on a
 * single thread, against a {@link com.ryuqq.fleet.application.deploy.DeployContext}
 * that carries an explicit host scope. The
 * {@link com.ryuqq.fleet.application.deploy.PlanEvaluator} turns that pass into a
 * frozen plan.</p>
 *
 * <h2>Operation identity</h2>
 * <ul>
 *   <li>Name: include prefixes followed by the operation name.</li>
 *   <li>Arguments: the operation type and its canonical effective arguments.</li>
 *   <li>Call site: the include chain, the calling source location (or an explicit
 *       label) and an occurrence index counting repeated visits by the same hosts.</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.application.deploy;
