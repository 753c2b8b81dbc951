package com.dmarket.arb.infra;

import lombok.Getter;

import java.time.Instant;

/**
 * Thrown by {@link CircuitBreaker#execute} when the gate rejects a call without attempting it.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final Instant openUntil;

    public CircuitOpenException(String breakerName, Instant openUntil) {
        super("Circuit '" + breakerName + "' is open until " + openUntil);
        this.breakerName = breakerName;
        this.openUntil = openUntil;
    }
}
