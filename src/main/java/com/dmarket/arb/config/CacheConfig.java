package com.dmarket.arb.config;

import com.dmarket.arb.infra.RedisRemoteCacheStore;
import com.dmarket.arb.infra.RemoteCacheStore;
import com.dmarket.arb.infra.TieredCache;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    public RemoteCacheStore remoteCacheStore(ScannerProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate) {
        ScannerProperties.Cache cache = properties.getCache();
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (!cache.isL2Enabled() || template == null) {
            return RemoteCacheStore.NONE;
        }
        return new RedisRemoteCacheStore(template, cache.getKeyPrefix());
    }

    @Bean
    public TieredCache tieredCache(ScannerProperties properties, RemoteCacheStore remoteCacheStore, Clock clock) {
        ScannerProperties.Cache cache = properties.getCache();
        return new TieredCache(cache.getL1MaxEntries(), cache.getListingTtl(), cache.getReferenceTtl(), remoteCacheStore, clock);
    }
}
