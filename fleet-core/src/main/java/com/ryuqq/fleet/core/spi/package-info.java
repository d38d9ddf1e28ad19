/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement
 * to give the Core SDK concrete behaviour.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.spi.Transport} - Command execution channel to a host</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.FactCache} - Per-run, single-flight fact cache</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (fleet-adapter-transport, fleet-adapter-inmemory) provide the
 * production implementations; fleet-testkit provides recording fakes.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleet Team
 */
package com.ryuqq.fleet.core.spi;
