package kmsjwt.adapter.out.jose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.keys.HmacKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import kmsjwt.core.exception.MalformedTokenException;
import kmsjwt.core.exception.TokenSigningException;

@DisplayName("Jose4jTokenCodec")
class Jose4jTokenCodecTest {

    private static final byte[] SECRET = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15};

    private final Jose4jTokenCodec codec = new Jose4jTokenCodec();

    private static Map<String, String> envelopeHeaders() {
        var headers = new LinkedHashMap<String, String>();
        headers.put("aid", "app-42");
        headers.put("kid", "key-1");
        headers.put("kct", "/+4=");
        return headers;
    }

    private static Map<String, Object> claims() {
        var claims = new LinkedHashMap<String, Object>();
        claims.put("aud", List.of("svc-a"));
        claims.put("sub", "user-7");
        claims.put("iat", 1000L);
        claims.put("exp", 2000L);
        return claims;
    }

    private static String encode(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("sign() and parse()")
    class SignAndParse {

        @Test
        @DisplayName("should sign with HS256 and a 128-bit secret")
        void shouldSignWithShortSecret() {
            var compact = codec.sign(envelopeHeaders(), claims(), SECRET, "sign-1");

            var token = codec.parse(compact);
            assertEquals("HS256", token.headers().get("alg"));
            assertEquals("sign-1", token.headers().get("skid"));
            assertEquals("app-42", token.headers().get("aid"));
            assertEquals(compact, token.compact());
            assertTrue(compact.endsWith("." + token.signature()));
        }

        @Test
        @DisplayName("should keep a single audience as a list")
        void shouldKeepSingleAudienceAsList() {
            var token = codec.parse(codec.sign(envelopeHeaders(), claims(), SECRET, "sign-1"));

            assertEquals(List.of("svc-a"), token.claims().get("aud"));
            assertEquals(List.of("svc-a"), token.audience());
        }

        @Test
        @DisplayName("should read numeric claims as numbers")
        void shouldReadNumericClaims() {
            var token = codec.parse(codec.sign(envelopeHeaders(), claims(), SECRET, "sign-1"));

            assertEquals(1000L, token.issuedAt().orElseThrow());
            assertEquals(2000L, token.expiresAt().orElseThrow());
        }

        @Test
        @DisplayName("should leave out headers that are not strings")
        void shouldLeaveOutNonStringHeaders() {
            var header = "{\"alg\":\"HS256\",\"aid\":null,\"kid\":42,\"kct\":{\"a\":1},\"skid\":\"sign-1\"}";
            var compact = encode(header) + "." + encode("{\"exp\":2000}") + ".c2ln";

            var token = codec.parse(compact);

            assertFalse(token.headers().containsKey("aid"));
            assertFalse(token.headers().containsKey("kid"));
            assertFalse(token.headers().containsKey("kct"));
            assertEquals("sign-1", token.headers().get("skid"));
        }

        @Test
        @DisplayName("should report an empty secret as a signing failure")
        void shouldReportEmptySecretAsSigningFailure() {
            var error = assertThrows(
                    TokenSigningException.class, () -> codec.sign(envelopeHeaders(), claims(), new byte[0], "sign-1"));

            assertTrue(error.getMessage().startsWith("Failed to sign token"));
        }

        @Test
        @DisplayName("should reject input that is not a compact JWS")
        void shouldRejectMalformedInput() {
            assertThrows(MalformedTokenException.class, () -> codec.parse("abc"));
            assertThrows(MalformedTokenException.class, () -> codec.parse("a.b.c"));
            assertThrows(MalformedTokenException.class, () -> codec.parse(""));
            assertThrows(MalformedTokenException.class, () -> codec.parse(null));
        }
    }

    @Nested
    @DisplayName("verifySignature()")
    class VerifySignature {

        @Test
        @DisplayName("should accept the right secret and signing key id")
        void shouldAcceptRightSecret() {
            var token = codec.parse(codec.sign(envelopeHeaders(), claims(), SECRET, "sign-1"));

            assertTrue(codec.verifySignature(token, "sign-1", SECRET));
        }

        @Test
        @DisplayName("should reject a different secret")
        void shouldRejectDifferentSecret() {
            var token = codec.parse(codec.sign(envelopeHeaders(), claims(), SECRET, "sign-1"));
            var other = SECRET.clone();
            other[0] = 42;

            assertFalse(codec.verifySignature(token, "sign-1", other));
        }

        @Test
        @DisplayName("should reject a different signing key id")
        void shouldRejectDifferentSigningKeyId() {
            var token = codec.parse(codec.sign(envelopeHeaders(), claims(), SECRET, "sign-1"));

            assertFalse(codec.verifySignature(token, "sign-2", SECRET));
        }

        @Test
        @DisplayName("should reject algorithms other than HS256")
        void shouldRejectOtherAlgorithms() throws Exception {
            var jws = new JsonWebSignature();
            jws.setPayload("{\"exp\":2000}");
            jws.setHeader("skid", "sign-1");
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA512);
            jws.setKey(new HmacKey(SECRET));
            jws.setDoKeyValidation(false);
            var token = codec.parse(jws.getCompactSerialization());

            assertFalse(codec.verifySignature(token, "sign-1", SECRET));
        }

        @Test
        @DisplayName("should require a signing key id")
        void shouldRequireSigningKeyId() {
            var token = codec.parse(codec.sign(envelopeHeaders(), claims(), SECRET, "sign-1"));

            assertThrows(IllegalArgumentException.class, () -> codec.verifySignature(token, " ", SECRET));
        }
    }
}
