package app.fsidrill.srs.analytics.domain;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of the response log.
 */
public record AnalyticsSnapshot(
        String userId,
        List<ResponseEntry> responses,
        Instant lastUpdated
) {
}
