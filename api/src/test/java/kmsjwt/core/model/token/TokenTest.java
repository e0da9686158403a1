package kmsjwt.core.model.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Token")
class TokenTest {

    @Test
    @DisplayName("should read standard claims")
    void shouldReadStandardClaims() {
        var claims = new LinkedHashMap<String, Object>();
        claims.put("aud", List.of("a", "b"));
        claims.put("sub", "user");
        claims.put("iat", 100L);
        claims.put("exp", 200);
        var token = new Token(Map.of("aid", "app"), claims, "sig", "h.p.sig");

        assertEquals(List.of("a", "b"), token.audience());
        assertEquals(Optional.of("user"), token.subject());
        assertEquals(Optional.of(100L), token.issuedAt());
        assertEquals(Optional.of(200L), token.expiresAt());
        assertEquals(Optional.of("app"), token.header("aid"));
    }

    @Test
    @DisplayName("should read a single string audience as a list")
    void shouldReadSingleAudienceAsList() {
        var token = new Token(Map.of(), Map.of("aud", "only"), "sig", "h.p.sig");

        assertEquals(List.of("only"), token.audience());
    }

    @Test
    @DisplayName("should treat a non-numeric exp as absent")
    void shouldTreatNonNumericExpAsAbsent() {
        var token = new Token(Map.of(), Map.of("exp", "tomorrow"), "sig", "h.p.sig");

        assertTrue(token.claim("exp").isPresent());
        assertFalse(token.expiresAt().isPresent());
    }

    @Test
    @DisplayName("should read an integral floating point date as a long")
    void shouldReadIntegralDoubleDate() {
        var token = new Token(Map.of(), Map.of("exp", 2000.0), "sig", "h.p.sig");

        assertEquals(Optional.of(2000L), token.expiresAt());
    }

    @Test
    @DisplayName("should treat fractional and non-finite dates as absent")
    void shouldTreatFractionalDatesAsAbsent() {
        assertFalse(new Token(Map.of(), Map.of("exp", 2000.5), "sig", "h.p.sig").expiresAt().isPresent());
        assertFalse(new Token(Map.of(), Map.of("exp", Double.NaN), "sig", "h.p.sig").expiresAt().isPresent());
        assertFalse(new Token(Map.of(), Map.of("exp", 1.0e300), "sig", "h.p.sig").expiresAt().isPresent());
    }

    @Test
    @DisplayName("should keep claim order")
    void shouldKeepClaimOrder() {
        var claims = new LinkedHashMap<String, Object>();
        claims.put("z", 1);
        claims.put("a", 2);
        var token = new Token(Map.of(), claims, "sig", "h.p.sig");

        assertEquals(List.of("z", "a"), List.copyOf(token.claims().keySet()));
    }

    @Test
    @DisplayName("should be immutable")
    void shouldBeImmutable() {
        var token = new Token(Map.of("aid", "app"), Map.of("sub", "user"), "sig", "h.p.sig");

        assertThrows(UnsupportedOperationException.class, () -> token.claims().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> token.headers().put("x", "y"));
    }

    @Test
    @DisplayName("should freeze nested claim values")
    @SuppressWarnings("unchecked")
    void shouldFreezeNestedClaimValues() {
        var audience = new ArrayList<Object>(List.of("svc-a"));
        var profile = new HashMap<String, Object>();
        profile.put("roles", new ArrayList<>(List.of("admin")));
        var claims = new LinkedHashMap<String, Object>();
        claims.put("aud", audience);
        claims.put("profile", profile);
        var token = new Token(Map.of(), claims, "sig", "h.p.sig");

        audience.add("svc-b");
        var frozenAudience = (List<Object>) token.claims().get("aud");
        var frozenProfile = (Map<String, Object>) token.claims().get("profile");
        var frozenRoles = (List<Object>) frozenProfile.get("roles");

        assertEquals(List.of("svc-a"), token.audience());
        assertThrows(UnsupportedOperationException.class, () -> frozenAudience.add("svc-c"));
        assertThrows(UnsupportedOperationException.class, () -> frozenProfile.put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> frozenRoles.clear());
    }

    @Test
    @DisplayName("should keep null elements of claim arrays")
    void shouldKeepNullArrayElements() {
        var values = new ArrayList<Object>();
        values.add("a");
        values.add(null);
        var token = new Token(Map.of(), Map.of("list", values), "sig", "h.p.sig");

        assertEquals(values, token.claims().get("list"));
    }

    @Test
    @DisplayName("should not print the compact token")
    void shouldNotPrintCompactToken() {
        var token = new Token(Map.of(), Map.of(), "sig", "secret.compact.token");

        assertFalse(token.toString().contains("secret.compact.token"));
    }
}
