package kmsjwt.core.exception;

import java.util.List;

/**
 * Thrown when a token lacks the envelope headers or the {@code exp} claim, or
 * carries them in an unusable form.
 */
public class MalformedEnvelopeException extends EnvelopeTokenException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MalformedEnvelopeException missingHeaders(List<String> headerNames) {
        return new MalformedEnvelopeException("Token is missing envelope headers: " + String.join(", ", headerNames));
    }

    @Override
    public FailureType failureType() {
        return FailureType.MALFORMED_ENVELOPE;
    }
}
