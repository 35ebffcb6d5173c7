package app.fsidrill.srs.analytics.domain;

import java.time.Instant;
import java.util.List;

public record AnalyticsExport(
        String userId,
        Instant exportedAt,
        AnalyticsSummary summary,
        List<ResponseEntry> responses
) {
}
