package app.fsidrill.srs.analytics.domain;

import app.fsidrill.srs.review.domain.CardState;
import app.fsidrill.srs.review.domain.Rating;

import java.time.Instant;
import java.util.List;

public record ResponseEntry(
        Instant timestamp,
        Long responseTimeMs,
        String cardId,
        Integer unit,
        String drillType,
        String promptEn,
        String expectedFr,
        String userAnswer,
        boolean correct,
        Rating grade,
        List<ResponseError> errors,
        String mode,
        String register,
        String userId,
        CardState cardState,
        Integer cardReps,
        Integer cardLapses
) {
    public ResponseEntry {
        errors = (errors == null) ? List.of() : List.copyOf(errors);
    }

    public static ResponseEntry from(ResponseInput in, Instant timestamp, Long responseTimeMs, String userId) {
        return new ResponseEntry(
                timestamp,
                responseTimeMs,
                in.cardId(),
                in.unit(),
                in.drillType(),
                in.promptEn(),
                in.expectedFr(),
                in.userAnswer(),
                in.correct(),
                in.grade(),
                in.errors(),
                (in.mode() == null || in.mode().isBlank()) ? "srs" : in.mode(),
                (in.register() == null || in.register().isBlank()) ? "formal" : in.register(),
                userId,
                in.cardState(),
                in.cardReps(),
                in.cardLapses()
        );
    }
}
