package app.fsidrill.srs.web;

public record ApiErrorResponse(
        int status,
        String message
) {
}
