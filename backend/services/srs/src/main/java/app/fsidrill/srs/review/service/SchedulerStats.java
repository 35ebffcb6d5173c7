package app.fsidrill.srs.review.service;

import app.fsidrill.srs.review.domain.SessionStats;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SchedulerStats(
        int total,
        @JsonProperty("new") int newCount,
        int learning,
        int review,
        int relearning,
        int dueToday,
        int mastered,
        double avgStability,
        double avgDifficulty,
        long totalReviews,
        long totalLapses,
        SessionStats session
) {
}
