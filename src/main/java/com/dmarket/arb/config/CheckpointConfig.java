package com.dmarket.arb.config;

import com.dmarket.arb.infra.CheckpointStore;
import com.dmarket.arb.infra.FileCheckpointStore;
import com.dmarket.arb.infra.RedisCheckpointStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class CheckpointConfig {

    @Bean
    @ConditionalOnProperty(name = "scanner.checkpoint.store", havingValue = "file", matchIfMissing = true)
    public CheckpointStore fileCheckpointStore(ScannerProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new FileCheckpointStore(Path.of(properties.getCheckpoint().getDirectory()), objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "scanner.checkpoint.store", havingValue = "redis")
    public CheckpointStore redisCheckpointStore(ScannerProperties properties, StringRedisTemplate redisTemplate,
                                                ObjectMapper objectMapper, Clock clock) {
        return new RedisCheckpointStore(redisTemplate, objectMapper, properties.getCheckpoint().getKeyPrefix(), clock);
    }
}
