/**
 * Inventory arguments: YAML files, {@code @local} and comma separated host lists.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.cli.inventory;
