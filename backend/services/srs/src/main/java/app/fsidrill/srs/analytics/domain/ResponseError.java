package app.fsidrill.srs.analytics.domain;

public record ResponseError(
        String type,
        String detail,
        Integer position
) {
}
