package app.fsidrill.srs.review.domain;

import java.time.Instant;

public record ErrorRecord(
        String type,
        Instant timestamp
) {
}
