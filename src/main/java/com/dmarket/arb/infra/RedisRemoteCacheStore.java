package com.dmarket.arb.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

@RequiredArgsConstructor
public class RedisRemoteCacheStore implements RemoteCacheStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    @Override
    public Optional<String> get(String key) {
        String json = redisTemplate.opsForValue().get(keyPrefix + key);
        return json == null || json.isEmpty() ? Optional.empty() : Optional.of(json);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(keyPrefix + key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(keyPrefix + key);
    }
}
