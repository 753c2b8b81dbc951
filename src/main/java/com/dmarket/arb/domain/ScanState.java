package com.dmarket.arb.domain;

public enum ScanState {
    STARTING,
    PAGINATING,
    COMPUTING,
    COMPLETED,
    ABORTED
}
