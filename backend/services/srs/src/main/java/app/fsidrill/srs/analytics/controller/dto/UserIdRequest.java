package app.fsidrill.srs.analytics.controller.dto;

public record UserIdRequest(String userId) {
}
