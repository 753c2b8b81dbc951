package com.dmarket.arb.infra;

import lombok.Getter;

@Getter
public class ApiException extends RuntimeException {

    private final ApiError error;

    public ApiException(ApiError error) {
        super(error.toString());
        this.error = error;
    }
}
