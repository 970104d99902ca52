package edu.harvard.hms.dbmi.avillach.cohort.processing;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Predicate;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Memoizes identifier sets and data tables per predicate, included identifiers and limit. Both caches are unbounded unless
 * COHORT_CACHE_MAXIMUM_SIZE or COHORT_CACHE_EXPIRE_MINUTES is set. Concurrent requests for the same uncached key wait for a
 * single load.
 */
@Component
public class ResolutionCache {

    private static final Logger log = LoggerFactory.getLogger(ResolutionCache.class);

    private final Cache<CacheKey, Set<String>> identifierCache;

    private final Cache<CacheKey, Table> dataCache;

    @Autowired
    public ResolutionCache(
        @Value("${COHORT_CACHE_MAXIMUM_SIZE:-1}") long maximumSize, @Value("${COHORT_CACHE_EXPIRE_MINUTES:-1}") long expireMinutes
    ) {
        this.identifierCache = buildCache(maximumSize, expireMinutes);
        this.dataCache = buildCache(maximumSize, expireMinutes);
        log.info("Resolution caches created, maximum size {}, expiry {} minutes", maximumSize < 0 ? "unbounded" : maximumSize,
            expireMinutes <= 0 ? "never" : expireMinutes);
    }

    // Constructor for testing only
    public ResolutionCache(Cache<CacheKey, Set<String>> identifierCache, Cache<CacheKey, Table> dataCache) {
        this.identifierCache = identifierCache;
        this.dataCache = dataCache;
    }

    private static <V> Cache<CacheKey, V> buildCache(long maximumSize, long expireMinutes) {
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder();
        if (maximumSize >= 0) {
            builder.maximumSize(maximumSize);
        }
        if (expireMinutes > 0) {
            builder.expireAfterAccess(expireMinutes, TimeUnit.MINUTES);
        }
        return builder.build();
    }

    public Set<String> identifiers(CacheKey key, Callable<Set<String>> loader) {
        return load(identifierCache, key, loader);
    }

    public Table data(CacheKey key, Callable<Table> loader) {
        return load(dataCache, key, loader);
    }

    public Optional<Set<String>> cachedIdentifiers(CacheKey key) {
        return Optional.ofNullable(identifierCache.getIfPresent(key));
    }

    public long identifierCacheSize() {
        return identifierCache.size();
    }

    public long dataCacheSize() {
        return dataCache.size();
    }

    /**
     * Drops every cached result. Only meant for an explicit reset, e.g. after the warehouse was reloaded.
     */
    public void invalidateAll() {
        log.info("Invalidating {} identifier sets and {} data tables", identifierCache.size(), dataCache.size());
        identifierCache.invalidateAll();
        dataCache.invalidateAll();
    }

    private static <V> V load(Cache<CacheKey, V> cache, CacheKey key, Callable<V> loader) {
        V cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit for {}", key);
            return cached;
        }
        try {
            return cache.get(key, loader);
        } catch (UncheckedExecutionException | ExecutionError e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Resolution failed for " + key, e.getCause());
        }
    }

    /**
     * Cache key of one resolution. A missing set of included identifiers is stored as the empty set.
     */
    public record CacheKey(String structuralKey, Set<String> includeIdentifiers, Integer limit) {

        public CacheKey {
            includeIdentifiers = includeIdentifiers == null ? ImmutableSet.of() : ImmutableSet.copyOf(includeIdentifiers);
        }

        public static CacheKey of(Predicate predicate, Set<String> includeIdentifiers, Integer limit) {
            return new CacheKey(predicate.structuralKey(), includeIdentifiers, limit);
        }

        @Override
        public String toString() {
            return structuralKey + " [" + includeIdentifiers.size() + " included, limit " + limit + "]";
        }
    }
}
