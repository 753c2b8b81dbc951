package com.dmarket.arb.core;

import lombok.Value;

@Value
public class BatchFailure {
    int position; // absolute
    Throwable error;
}
