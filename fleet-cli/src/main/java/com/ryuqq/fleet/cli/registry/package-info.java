/**
 * Name based lookup of operations and facts for the command line and deploy files.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.cli.registry;
