package com.dmarket.arb.infra;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestSignerTest {

    // RFC 8032 test vector 1
    private static final String SEED = "9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60";
    private static final String PUBLIC = "d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a";

    @Test
    void signatureVerifiesAgainstPublicKey() {
        RequestSigner signer = new RequestSigner(new ApiCredentials(PUBLIC, SEED));

        Map<String, String> headers = signer.sign("GET", "/exchange/v1/market/items?gameId=a8db&limit=100", "", 1700000000L);

        assertEquals(PUBLIC, headers.get(RequestSigner.HEADER_API_KEY));
        assertEquals("1700000000", headers.get(RequestSigner.HEADER_SIGN_DATE));
        String signature = headers.get(RequestSigner.HEADER_SIGNATURE);
        assertTrue(signature.startsWith("dmar ed25519 "));
        String hex = signature.substring("dmar ed25519 ".length());
        assertEquals(128, hex.length());

        byte[] message = "GET/exchange/v1/market/items?gameId=a8db&limit=1001700000000".getBytes(StandardCharsets.UTF_8);
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new Ed25519PublicKeyParameters(Hex.decode(PUBLIC), 0));
        verifier.update(message, 0, message.length);
        assertTrue(verifier.verifySignature(Hex.decode(hex)));
    }

    @Test
    void acceptsSeedFollowedByPublicKey() {
        RequestSigner shortForm = new RequestSigner(new ApiCredentials(PUBLIC, SEED));
        RequestSigner longForm = new RequestSigner(new ApiCredentials(PUBLIC, SEED + PUBLIC));

        assertArrayEquals(Hex.decode(PUBLIC), longForm.publicKeyBytes());
        assertEquals(shortForm.sign("POST", "/x", "{}", 1L), longForm.sign("POST", "/x", "{}", 1L));
    }

    @Test
    void bodyIsPartOfSignedString() {
        RequestSigner signer = new RequestSigner(new ApiCredentials(PUBLIC, SEED));

        String a = signer.sign("POST", "/marketplace-api/v1/aggregated-prices", "{\"limit\":\"100\"}", 5L).get(RequestSigner.HEADER_SIGNATURE);
        String b = signer.sign("POST", "/marketplace-api/v1/aggregated-prices", "{\"limit\":\"50\"}", 5L).get(RequestSigner.HEADER_SIGNATURE);

        assertNotEquals(a, b);
    }

    @Test
    void withoutCredentialsRequestsAreUnsigned() {
        RequestSigner signer = new RequestSigner(new ApiCredentials("", ""));

        assertFalse(signer.isEnabled());
        assertTrue(signer.sign("GET", "/x", "", 1L).isEmpty());
    }

    @Test
    void rejectsMalformedSecret() {
        assertThrows(IllegalArgumentException.class, () -> new RequestSigner(new ApiCredentials(PUBLIC, "not-hex")));
        assertThrows(IllegalArgumentException.class, () -> new RequestSigner(new ApiCredentials(PUBLIC, "abcd")));
    }

    @Test
    void secretNeverAppearsInToString() {
        assertFalse(new ApiCredentials(PUBLIC, SEED).toString().contains(SEED));
    }
}
