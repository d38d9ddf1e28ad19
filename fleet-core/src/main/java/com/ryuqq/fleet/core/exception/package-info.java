/**
 * Fleet exception hierarchy.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.exception.FleetException} - Root of all Fleet exceptions (unchecked)</li>
 *   <li>{@link com.ryuqq.fleet.core.exception.DefinitionException} - Missing or malformed deploy/inventory definition (fatal, exit 1)</li>
 *   <li>{@link com.ryuqq.fleet.core.exception.GatherException} - Fact probe failed (transport failure or non-zero exit)</li>
 *   <li>{@link com.ryuqq.fleet.core.exception.TransportException} - Connectivity failure while executing a command</li>
 *   <li>{@link com.ryuqq.fleet.core.exception.CommandTimeoutException} - Command exceeded the transport timeout</li>
 * </ul>
 *
 * <h2>Propagation Policy</h2>
 * <ul>
 *   <li><strong>Evaluation phase:</strong> DefinitionException and GatherException abort evaluation</li>
 *   <li><strong>Execution phase:</strong> TransportException and GatherException become a per-host Fail outcome</li>
 *   <li><strong>Absent tools:</strong> never raised, resolved through the fact default</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.exception;
