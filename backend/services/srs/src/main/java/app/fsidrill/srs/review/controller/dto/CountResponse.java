package app.fsidrill.srs.review.controller.dto;

public record CountResponse(int count) {
}
