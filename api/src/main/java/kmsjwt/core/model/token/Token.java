package kmsjwt.core.model.token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed, signed token.
 *
 * <p>Headers are the protected header of the token, so every entry is covered
 * by the signature. Header and claim order is preserved as read. Instances are
 * deeply immutable: nested JSON arrays and objects in claims are copied into
 * unmodifiable lists and maps.
 *
 * @param headers   protected headers
 * @param claims    payload claims
 * @param signature the encoded signature
 * @param compact   the compact serialization this token was read from
 */
public record Token(Map<String, String> headers, Map<String, Object> claims, String signature, String compact) {

    public Token {
        if (headers == null) {
            headers = Map.of();
        }
        if (claims == null) {
            claims = Map.of();
        }
        if (compact == null || compact.isBlank()) {
            throw new IllegalArgumentException("Compact serialization cannot be null or blank");
        }
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        claims = freezeMap(claims);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public Optional<Object> claim(String name) {
        return Optional.ofNullable(claims.get(name));
    }

    public Optional<String> subject() {
        return claim(ClaimNames.SUBJECT).map(String::valueOf);
    }

    /**
     * The {@code aud} claim. A single string audience reads as a one element list.
     */
    public List<String> audience() {
        final Object aud = claims.get(ClaimNames.AUDIENCE);
        if (aud instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        if (aud instanceof String single) {
            return List.of(single);
        }
        return List.of();
    }

    public Optional<Long> issuedAt() {
        return numericClaim(ClaimNames.ISSUED_AT);
    }

    public Optional<Long> expiresAt() {
        return numericClaim(ClaimNames.EXPIRES_AT);
    }

    /**
     * A claim holding an integral JSON number, as a long. Empty when absent, not
     * numeric, fractional, or too large for a long.
     */
    public Optional<Long> numericClaim(String name) {
        final Object value = claims.get(name);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? Optional.of(big.longValue()) : Optional.empty();
        }
        if (value instanceof Number number) {
            try {
                return Optional.of(new BigDecimal(number.toString()).longValueExact());
            } catch (NumberFormatException | ArithmeticException e) {
                // NaN, infinite, fractional or out of range
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((name, value) -> copy.put(String.valueOf(name), freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    // JSON arrays may hold nulls, so List.copyOf is not an option
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof Collection<?> values) {
            final List<Object> copy = new ArrayList<>(values.size());
            values.forEach(element -> copy.add(freeze(element)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public String toString() {
        // The compact form is a bearer credential
        return "Token[headers=" + headers + ", claims=" + claims.keySet() + "]";
    }
}
