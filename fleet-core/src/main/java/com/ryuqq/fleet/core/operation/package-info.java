/**
 * Operation contract and the built-in operation library.
 *
 * <p>An {@link com.ryuqq.fleet.core.operation.Operation} declares a desired
 * state. At execution time it turns into the shell commands needed on one host,
 * consulting facts to skip work that is already done.</p>
 *
 * <h2>Built-in operations</h2>
 * <ul>
 *   <li>{@code server.shell} - {@link com.ryuqq.fleet.core.operation.ShellOperation}</li>
 *   <li>{@code server.group} - {@link com.ryuqq.fleet.core.operation.GroupOperation}</li>
 *   <li>{@code apt.packages} - {@link com.ryuqq.fleet.core.operation.AptPackagesOperation}</li>
 *   <li>{@code npm.packages} - {@link com.ryuqq.fleet.core.operation.NpmPackagesOperation}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.operation;
