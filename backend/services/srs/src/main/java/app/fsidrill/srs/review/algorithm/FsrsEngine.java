package app.fsidrill.srs.review.algorithm;

import app.fsidrill.srs.review.domain.Rating;
import org.springframework.stereotype.Component;

/**
 * FSRS memory model. All functions are pure over the configured weight vector.
 */
@Component
public class FsrsEngine {

    private final SchedulerParameters params;

    public FsrsEngine(SchedulerParameters params) {
        this.params = params;
    }

    // R(t, S) = (1 + t / 9S)^-1
    public double retrievability(double elapsedDays, double stability) {
        if (stability <= 0) return 0;
        return Math.pow(1 + elapsedDays / (9 * stability), -1);
    }

    public long nextInterval(double stability) {
        return nextInterval(stability, params.requestRetention());
    }

    public long nextInterval(double stability, double retention) {
        if (stability <= 0) return 1;
        return Math.round(9 * stability * (1 / retention - 1));
    }

    public double initStability(Rating rating) {
        return params.w(rating.code() - 1);
    }

    public double initDifficulty(Rating rating) {
        return clamp(params.w(4) - (rating.code() - 3) * params.w(5));
    }

    public double nextReviewStability(double d, double s, double r, Rating rating) {
        double hardPenalty = (rating == Rating.HARD) ? params.w(15) : 1;
        double easyBonus = (rating == Rating.EASY) ? params.w(16) : 1;

        double inc = Math.exp(params.w(8))
                * (11 - d)
                * Math.pow(s, -params.w(9))
                * (Math.exp(params.w(10) * (1 - r)) - 1)
                * hardPenalty
                * easyBonus;

        return s * (inc + 1);
    }

    public double nextForgetStability(double d, double s, double r) {
        return params.w(11)
                * Math.pow(d, -params.w(12))
                * (Math.pow(s + 1, params.w(13)) - 1)
                * Math.exp(params.w(14) * (1 - r));
    }

    public double nextDifficulty(double d, Rating rating) {
        double d0 = initDifficulty(Rating.GOOD);
        double next = params.w(7) * d0 + (1 - params.w(7)) * (d - params.w(6) * (rating.code() - 3));
        return clamp(next);
    }

    private static double clamp(double d) {
        return Math.max(1, Math.min(10, d));
    }
}
