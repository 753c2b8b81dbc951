package com.dmarket.arb.infra;

/**
 * How long a response may be served from cache. Listing pages move fast, aggregates slowly.
 */
public enum CachePolicy {
    NONE,
    LISTING,
    REFERENCE
}
