package com.dmarket.arb.infra;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs marketplace requests with the account's Ed25519 key.
 *
 * <p>Signed string: {@code method + pathWithQuery + body + timestamp}. The secret is the hex private
 * key; when it is the 64-byte seed+public form only the seed is used.
 */
@Slf4j
public class RequestSigner {

    public static final String HEADER_API_KEY = "X-Api-Key";
    public static final String HEADER_SIGN_DATE = "X-Sign-Date";
    public static final String HEADER_SIGNATURE = "X-Request-Sign";
    static final String SIGNATURE_PREFIX = "dmar ed25519 ";

    private final ApiCredentials credentials;
    private final Ed25519PrivateKeyParameters privateKey;

    public RequestSigner(ApiCredentials credentials) {
        this.credentials = credentials;
        if (credentials.isPresent()) {
            this.privateKey = parsePrivateKey(credentials.getSecretKey());
            log.info("[API] Request signing enabled for key {}", credentials.maskedPublicKey());
        } else {
            this.privateKey = null;
            log.warn("[API] No API credentials configured, requests will be sent unsigned");
        }
    }

    public boolean isEnabled() {
        return privateKey != null;
    }

    /**
     * Headers to attach to one request. Empty when signing is disabled.
     *
     * @param timestamp unix seconds
     */
    public Map<String, String> sign(String method, String pathWithQuery, String body, long timestamp) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (privateKey == null) {
            return headers;
        }
        String payload = method.toUpperCase() + pathWithQuery + (body == null ? "" : body) + timestamp;
        headers.put(HEADER_API_KEY, credentials.getPublicKey());
        headers.put(HEADER_SIGN_DATE, Long.toString(timestamp));
        headers.put(HEADER_SIGNATURE, SIGNATURE_PREFIX + Hex.toHexString(signBytes(payload.getBytes(StandardCharsets.UTF_8))));
        return headers;
    }

    byte[] publicKeyBytes() {
        return privateKey.generatePublicKey().getEncoded();
    }

    private byte[] signBytes(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    private static Ed25519PrivateKeyParameters parsePrivateKey(String secretHex) {
        byte[] raw;
        try {
            raw = Hex.decode(secretHex.trim());
        } catch (DecoderException e) {
            throw new IllegalArgumentException("API secret key is not valid hex", e);
        }
        if (raw.length != Ed25519PrivateKeyParameters.KEY_SIZE && raw.length != 2 * Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("API secret key must be 32 or 64 bytes, got " + raw.length);
        }
        return new Ed25519PrivateKeyParameters(Arrays.copyOf(raw, Ed25519PrivateKeyParameters.KEY_SIZE), 0);
    }
}
