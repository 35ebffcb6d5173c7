package app.fsidrill.srs.review.controller.dto;

import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.Rating;
import app.fsidrill.srs.review.store.SaveStatus;

import java.time.Instant;

public record ReviewAnswerResponse(
        String cardId,
        Rating rating,
        Card card,
        double interval,
        String intervalDisplay,
        Instant nextDue,
        SaveStatus saveStatus
) {
}
