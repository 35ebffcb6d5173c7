package app.fsidrill.srs.review.domain;

public record SessionStats(
        int reviewed,
        int correct,
        int incorrect
) {
    public static final SessionStats EMPTY = new SessionStats(0, 0, 0);

    public SessionStats record(Rating rating) {
        return rating.isCorrect()
                ? new SessionStats(reviewed + 1, correct + 1, incorrect)
                : new SessionStats(reviewed + 1, correct, incorrect + 1);
    }
}
