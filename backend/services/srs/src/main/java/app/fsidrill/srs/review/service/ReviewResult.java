package app.fsidrill.srs.review.service;

import app.fsidrill.srs.review.domain.Card;

import java.time.Instant;

public record ReviewResult(
        Card card,
        double interval,
        String intervalDisplay,
        Instant nextDue
) {
}
