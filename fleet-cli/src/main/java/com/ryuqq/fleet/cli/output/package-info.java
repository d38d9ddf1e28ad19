/**
 * Console output: run reports and JSON fact values.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.cli.output;
