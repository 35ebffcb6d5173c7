package app.fsidrill.srs.review.service;

public record GraduationStats(
        int total,
        int graduated,
        int active,
        int patterns,
        double percentGraduated
) {
}
