package com.dmarket.arb.infra;

import lombok.Value;

/** Raw 2xx response: status and body text. Decoding is the caller's job. */
@Value
public class ApiResponse {
    int status;
    String body;
}
