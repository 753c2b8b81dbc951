package com.dmarket.arb.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Response cache in front of the request executor: Caffeine in process (L1, size bounded, per-entry
 * TTL) and an optional remote store (L2). L2 is read only on an L1 miss and a hit there is copied
 * back into L1. L2 problems are logged and treated as a miss.
 */
@Slf4j
public class TieredCache {

    private final Cache<String, CacheEntry> local;
    private final RemoteCacheStore remote;
    private final Map<CachePolicy, Duration> policyTtls;
    private final Clock clock;

    private final AtomicLong localHits = new AtomicLong();
    private final AtomicLong remoteHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public TieredCache(long maxEntries, Duration listingTtl, Duration referenceTtl, RemoteCacheStore remote, Clock clock) {
        this(maxEntries, listingTtl, referenceTtl, remote, clock, Ticker.systemTicker(), ForkJoinPool.commonPool());
    }

    public TieredCache(long maxEntries, Duration listingTtl, Duration referenceTtl, RemoteCacheStore remote, Clock clock,
                       Ticker ticker, Executor maintenanceExecutor) {
        this.local = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryTtl())
                .ticker(ticker)
                .executor(maintenanceExecutor)
                .build();
        this.remote = remote;
        this.clock = clock;
        this.policyTtls = new EnumMap<>(CachePolicy.class);
        this.policyTtls.put(CachePolicy.NONE, Duration.ZERO);
        this.policyTtls.put(CachePolicy.LISTING, listingTtl);
        this.policyTtls.put(CachePolicy.REFERENCE, referenceTtl);
    }

    /**
     * Looks the request up regardless of its policy, so an entry stored with an explicit TTL is
     * found even for a {@link CachePolicy#NONE} request.
     */
    public Optional<String> get(RequestSpec spec) {
        String key = spec.cacheKey();
        CacheEntry entry = local.getIfPresent(key);
        if (entry != null) {
            localHits.incrementAndGet();
            log.debug("[API] L1 hit {} {}", spec.getMethod(), spec.getPath());
            return Optional.of(entry.getValue());
        }

        Optional<String> promoted = Optional.empty();
        try {
            promoted = remote.get(key);
        } catch (RuntimeException e) {
            log.warn("[API] L2 read failed for {}, treating as miss: {}", spec.getPath(), e.getMessage());
        }
        if (promoted.isPresent()) {
            remoteHits.incrementAndGet();
            log.debug("[API] L2 hit {} {}, promoting", spec.getMethod(), spec.getPath());
            Duration ttl = ttlFor(spec.getCachePolicy());
            if (!ttl.isZero()) {
                putLocal(key, promoted.get(), ttl);
            }
            return promoted;
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /** Stores under the TTL of the request's cache policy. No-op for {@link CachePolicy#NONE}. */
    public void put(RequestSpec spec, String value) {
        put(spec, value, ttlFor(spec.getCachePolicy()));
    }

    public void put(RequestSpec spec, String value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        String key = spec.cacheKey();
        putLocal(key, value, ttl);
        try {
            remote.put(key, value, ttl);
        } catch (RuntimeException e) {
            log.warn("[API] L2 write failed for {}: {}", spec.getPath(), e.getMessage());
        }
    }

    public void invalidate(RequestSpec spec) {
        String key = spec.cacheKey();
        local.invalidate(key);
        try {
            remote.delete(key);
        } catch (RuntimeException e) {
            log.warn("[API] L2 delete failed for {}: {}", spec.getPath(), e.getMessage());
        }
    }

    public Duration ttlFor(CachePolicy policy) {
        return policyTtls.get(policy);
    }

    public Stats stats() {
        return new Stats(localHits.get(), remoteHits.get(), misses.get(), local.estimatedSize());
    }

    void cleanUp() {
        local.cleanUp();
    }

    private void putLocal(String key, String value, Duration ttl) {
        local.put(key, new CacheEntry(key, value, clock.instant(), ttl));
    }

    private static final class EntryTtl implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Value
    public static class Stats {
        long localHits;
        long remoteHits;
        long misses;
        long localSize;
    }
}
