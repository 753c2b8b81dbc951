package com.dmarket.arb.infra;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * One upstream call: method, path, query and optional JSON body.
 *
 * <p>Query parameters keep insertion order on the wire; the cache key sorts them so that the same
 * logical request always maps to the same key.
 */
@Value
@Builder
public class RequestSpec {
    @Builder.Default
    String method = "GET";
    String path;
    @Singular("query")
    Map<String, String> query;
    String body;
    @Builder.Default
    CachePolicy cachePolicy = CachePolicy.NONE;

    public String bodyOrEmpty() {
        return body == null ? "" : body;
    }

    public String cacheKey() {
        StringBuilder normalized = new StringBuilder()
                .append(method.toUpperCase()).append('\n')
                .append(path).append('\n');
        new TreeMap<>(query).forEach((k, v) -> normalized.append(k).append('=').append(v).append('&'));
        normalized.append('\n').append(bodyOrEmpty());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Hex.toHexString(digest.digest(normalized.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
