package app.fsidrill.srs.review.domain;

/**
 * Error classification produced by the answer checker for a single response.
 */
public record ErrorInfo(String type) {
}
