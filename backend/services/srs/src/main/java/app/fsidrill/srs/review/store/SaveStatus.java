package app.fsidrill.srs.review.store;

import java.time.Instant;

/**
 * Advisory persistence signal. {@code ok == false} means progress may not have been saved.
 */
public record SaveStatus(
        boolean ok,
        String lastError,
        Instant lastFailureAt,
        Instant lastSuccessAt
) {
    public static final SaveStatus INITIAL = new SaveStatus(true, null, null, null);

    SaveStatus succeeded(Instant at) {
        return new SaveStatus(true, lastError, lastFailureAt, at);
    }

    SaveStatus failed(String error, Instant at) {
        return new SaveStatus(false, error, at, lastSuccessAt);
    }
}
