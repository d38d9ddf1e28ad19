/**
 * Command line entry point.
 *
 * <p>{@link com.ryuqq.fleet.cli.FleetCommand} parses the inventory and operations
 * arguments with picocli, builds a {@link com.ryuqq.fleet.application.deploy.Deploy}
 * from deploy files, a single operation or an exec command, and runs it through
 * the runner adapter. The {@code fact} form prints fact values as JSON instead.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.cli;
