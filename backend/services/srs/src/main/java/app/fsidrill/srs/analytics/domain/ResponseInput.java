package app.fsidrill.srs.analytics.domain;

import app.fsidrill.srs.review.domain.CardState;
import app.fsidrill.srs.review.domain.Rating;

import java.util.List;

public record ResponseInput(
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
        CardState cardState,
        Integer cardReps,
        Integer cardLapses
) {
}
