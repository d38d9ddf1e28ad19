/**
 * Fact contract and the built-in fact library.
 *
 * <p>A {@link com.ryuqq.fleet.core.fact.Fact} is a value carrying a capability
 * set: command construction, output parsing, a default value and an optional
 * existence probe. Facts are gathered through a
 * {@link com.ryuqq.fleet.core.fact.FactGatherer}; results are cached per run
 * under a {@link com.ryuqq.fleet.core.fact.FactKey}.</p>
 *
 * <h2>Built-in facts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.fact.ServerFacts} - uname, mounts, users, groups, distribution, ...</li>
 *   <li>{@link com.ryuqq.fleet.core.fact.PackageFacts} - dpkg and npm package listings</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.fact;
