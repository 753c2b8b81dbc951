package com.dmarket.arb.infra;

import lombok.Value;

@Value
public class ApiError {
    Kind kind;
    int status; // 0 when no HTTP response was received
    String message;

    public enum Kind {
        RATE_LIMITED, // 429 persisted through every attempt
        UNAVAILABLE, // 5xx, timeout or network failure after every attempt
        CLIENT_ERROR, // 4xx other than 429, never retried
        CIRCUIT_OPEN, // rejected by the breaker, no upstream call made
        MALFORMED_RESPONSE // 2xx whose body failed strict decoding
    }

    public static ApiError rateLimited(String message) {
        return new ApiError(Kind.RATE_LIMITED, 429, message);
    }

    public static ApiError unavailable(int status, String message) {
        return new ApiError(Kind.UNAVAILABLE, status, message);
    }

    public static ApiError clientError(int status, String message) {
        return new ApiError(Kind.CLIENT_ERROR, status, message);
    }

    public static ApiError circuitOpen(String message) {
        return new ApiError(Kind.CIRCUIT_OPEN, 0, message);
    }

    public static ApiError malformed(String message) {
        return new ApiError(Kind.MALFORMED_RESPONSE, 200, message);
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return status > 0 ? kind + "(" + status + "): " + message : kind + ": " + message;
    }
}
