package com.dmarket.arb.infra;

import com.dmarket.arb.domain.ScanCheckpoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checkpoints as JSON strings under {@code prefix + scanId}, indexed by a sorted set scored with
 * the last update time so that retention purges are a range query.
 */
@Slf4j
public class RedisCheckpointStore implements CheckpointStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final String indexKey;
    private final Clock clock;

    public RedisCheckpointStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.indexKey = keyPrefix + "index";
        this.clock = clock;
    }

    @Override
    public void save(ScanCheckpoint checkpoint) {
        try {
            String json = objectMapper.writeValueAsString(checkpoint);
            redisTemplate.opsForValue().set(keyPrefix + checkpoint.getScanId(), json);
            redisTemplate.opsForZSet().add(indexKey, checkpoint.getScanId(), checkpoint.getUpdatedAt().toEpochMilli());
            log.debug("[CHECKPOINT] Saved {} at cursor {}", checkpoint.getScanId(), checkpoint.getCursor());
        } catch (JsonProcessingException | DataAccessException e) {
            throw new CheckpointException("Failed to save checkpoint " + checkpoint.getScanId(), e);
        }
    }

    @Override
    public Optional<ScanCheckpoint> load(String scanId) {
        try {
            String json = redisTemplate.opsForValue().get(keyPrefix + scanId);
            if (json == null || json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, ScanCheckpoint.class));
        } catch (JsonProcessingException | DataAccessException e) {
            throw new CheckpointException("Failed to read checkpoint " + scanId, e);
        }
    }

    @Override
    public void delete(String scanId) {
        try {
            redisTemplate.delete(keyPrefix + scanId);
            redisTemplate.opsForZSet().remove(indexKey, scanId);
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to delete checkpoint " + scanId, e);
        }
    }

    @Override
    public int purgeOlderThan(Duration retention) {
        long cutoff = clock.instant().minus(retention).toEpochMilli();
        try {
            // scores are inclusive, stop just before the cutoff
            Set<String> expired = redisTemplate.opsForZSet().rangeByScore(indexKey, Double.NEGATIVE_INFINITY, cutoff - 1);
            if (expired == null || expired.isEmpty()) {
                return 0;
            }
            List<String> keys = new ArrayList<>(expired.size());
            expired.forEach(scanId -> keys.add(keyPrefix + scanId));
            redisTemplate.delete(keys);
            redisTemplate.opsForZSet().remove(indexKey, expired.toArray());
            return expired.size();
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to purge checkpoints", e);
        }
    }
}
