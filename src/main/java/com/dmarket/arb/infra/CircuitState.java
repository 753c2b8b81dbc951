package com.dmarket.arb.infra;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
