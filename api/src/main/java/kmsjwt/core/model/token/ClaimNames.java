package kmsjwt.core.model.token;

import java.time.Instant;
import java.util.Set;

/**
 * Registered claim names written by token issuance.
 */
public final class ClaimNames {

    public static final String AUDIENCE = "aud";
    public static final String SUBJECT = "sub";
    public static final String ISSUED_AT = "iat";
    public static final String EXPIRES_AT = "exp";

    /** Claims that custom claims may not override. */
    public static final Set<String> STANDARD = Set.of(AUDIENCE, SUBJECT, ISSUED_AT, EXPIRES_AT);

    /** Latest numeric date, in Unix seconds, that an {@code iat} or {@code exp} claim may carry. */
    public static final long MAX_NUMERIC_DATE = Instant.MAX.getEpochSecond();

    /** Earliest numeric date, in Unix seconds, that an {@code iat} or {@code exp} claim may carry. */
    public static final long MIN_NUMERIC_DATE = Instant.MIN.getEpochSecond();

    private ClaimNames() {}

    public static boolean isStandard(String claimName) {
        return STANDARD.contains(claimName);
    }

    public static boolean isNumericDateInRange(long epochSeconds) {
        return epochSeconds >= MIN_NUMERIC_DATE && epochSeconds <= MAX_NUMERIC_DATE;
    }
}
