package com.dmarket.arb.infra;

import lombok.ToString;
import lombok.Value;

@Value
public class ApiCredentials {
    String publicKey;
    @ToString.Exclude
    String secretKey;

    public boolean isPresent() {
        return publicKey != null && !publicKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }

    public String maskedPublicKey() {
        if (publicKey == null || publicKey.length() < 8) {
            return "***";
        }
        return publicKey.substring(0, 8) + "***";
    }
}
