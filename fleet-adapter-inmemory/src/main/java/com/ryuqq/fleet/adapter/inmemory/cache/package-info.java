/**
 * In-memory fact cache for a single run.
 *
 * <p>A fresh {@link com.ryuqq.fleet.adapter.inmemory.cache.InMemoryFactCache} is created
 * for every run; nothing is persisted between runs.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.adapter.inmemory.cache;
