package com.dmarket.arb.infra;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class CacheEntry {
    String key;
    String value;
    Instant insertedAt;
    Duration ttl;
}
