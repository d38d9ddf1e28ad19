/**
 * Inventory and host registry.
 *
 * <p>{@link com.ryuqq.fleet.core.inventory.Inventory} holds the ordered target
 * hosts, their group memberships and merged data. Enumeration order follows the
 * definition and is used for display only; plan ordering never depends on it.</p>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.inventory;
