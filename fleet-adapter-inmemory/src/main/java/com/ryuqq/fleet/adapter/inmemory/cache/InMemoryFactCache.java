package com.ryuqq.fleet.adapter.inmemory.cache;

import com.ryuqq.fleet.core.fact.FactKey;
import com.ryuqq.fleet.core.spi.FactCache;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link FactCache}, scoped to a single run.
 *
 * <p>Each key maps to a {@link CompletableFuture}. The first caller for a key
 * installs the future with {@link ConcurrentHashMap#putIfAbsent} and runs the
 * loader; concurrent callers for the same key wait on that future instead of
 * probing the host again.</p>
 *
 * <p><strong>Single-Flight Guarantee:</strong></p>
 * <ul>
 *   <li>At most one loader runs per key at any time</li>
 *   <li>A successful value (including {@code null}) is cached for the rest of the run</li>
 *   <li>A failed load is removed, so a later call retries; callers waiting on it
 *       receive the same exception</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * FactCache cache = new InMemoryFactCache();
 * FactGatherer gatherer = new DefaultFactGatherer(transport, cache);
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public class InMemoryFactCache implements FactCache {

    private final ConcurrentHashMap<FactKey, CompletableFuture<Object>> entries;

    /**
     * Creates a new InMemoryFactCache with empty storage.
     */
    public InMemoryFactCache() {
        this.entries = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if key or loader is null
     */
    @Override
    @SuppressWarnings("unchecked")
    public <T> T getOrLoad(FactKey key, Supplier<T> loader) {
        if (key == null) {
            throw new IllegalArgumentException("FactKey cannot be null");
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }

        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing = entries.putIfAbsent(key, created);
        if (existing != null) {
            return (T) await(existing);
        }

        try {
            T value = loader.get();
            created.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            entries.remove(key, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns true only for keys whose load completed successfully.</p>
     */
    @Override
    public boolean contains(FactKey key) {
        if (key == null) {
            throw new IllegalArgumentException("FactKey cannot be null");
        }
        CompletableFuture<Object> future = entries.get(key);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * Returns the number of cached or in-flight keys.
     *
     * @return the number of entries
     */
    public int size() {
        return entries.size();
    }

    /**
     * Clears all cached facts.
     */
    public void clear() {
        entries.clear();
    }
}
