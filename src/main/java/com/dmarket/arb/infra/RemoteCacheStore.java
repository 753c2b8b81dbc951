package com.dmarket.arb.infra;

import java.time.Duration;
import java.util.Optional;

/**
 * Second cache tier. Implementations may throw on connectivity problems; {@link TieredCache}
 * treats any failure as a miss.
 */
public interface RemoteCacheStore {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    void delete(String key);

    RemoteCacheStore NONE = new RemoteCacheStore() {
        @Override
        public Optional<String> get(String key) {
            return Optional.empty();
        }

        @Override
        public void put(String key, String value, Duration ttl) {
        }

        @Override
        public void delete(String key) {
        }
    };
}
