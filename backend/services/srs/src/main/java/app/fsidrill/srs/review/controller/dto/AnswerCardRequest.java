package app.fsidrill.srs.review.controller.dto;

import app.fsidrill.srs.review.domain.ErrorInfo;

public record AnswerCardRequest(
        String rating,
        ErrorInfo error
) {}
