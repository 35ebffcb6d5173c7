package app.fsidrill.srs.review.algorithm;

import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.CardState;
import app.fsidrill.srs.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Applies a grade to a card: Anki-style short steps while New/Learning/Relearning, FSRS in Review.
 */
@Component
public class ReviewStateMachine {

    private static final double MINUTES_PER_DAY = 24 * 60;

    private final FsrsEngine fsrs;
    private final SchedulerParameters params;

    public ReviewStateMachine(FsrsEngine fsrs, SchedulerParameters params) {
        this.fsrs = fsrs;
        this.params = params;
    }

    public Transition apply(Card card, Rating rating, Instant now) {
        Instant lastReview = card.getLastReview() == null ? now : card.getLastReview();
        double elapsedDays = Math.max(0.0, Duration.between(lastReview, now).toMillis() / 86_400_000.0);

        Transition transition = card.getState().isStepped()
                ? applySteps(card, rating, now)
                : applyReview(card, rating, elapsedDays, now);

        card.setScheduledDays(transition.intervalDays());
        card.setElapsedDays(elapsedDays);
        card.setReps(card.getReps() + 1);
        card.setLastReview(now);
        card.setDue(transition.nextDue());
        return transition;
    }

    private Transition applySteps(Card card, Rating rating, Instant now) {
        CardState state = card.getState();
        List<Integer> steps = (state == CardState.RELEARNING)
                ? params.relearningStepsMinutes()
                : params.learningStepsMinutes();

        if (rating == Rating.AGAIN) {
            card.setLearningStep(0);
            card.setState(state == CardState.NEW ? CardState.LEARNING : state);
            return Transition.minutes(steps.get(0), now);
        }

        if (rating == Rating.EASY) {
            graduateToReview(card, rating);
            return Transition.days(params.easyIntervalDays(), now);
        }

        int step = card.getLearningStep() + 1;
        if (step >= steps.size()) {
            graduateToReview(card, rating);
            int days = (rating == Rating.HARD) ? 1 : params.graduatingIntervalDays();
            return Transition.days(days, now);
        }

        card.setLearningStep(step);
        card.setState(state == CardState.NEW ? CardState.LEARNING : state);
        return Transition.minutes(steps.get(step), now);
    }

    private Transition applyReview(Card card, Rating rating, double elapsedDays, Instant now) {
        double r = fsrs.retrievability(elapsedDays, card.getStability());

        if (rating == Rating.AGAIN) {
            card.setStability(fsrs.nextForgetStability(card.getDifficulty(), card.getStability(), r));
            card.setLapses(card.getLapses() + 1);
            card.setState(CardState.RELEARNING);
            card.setLearningStep(0);
            return Transition.minutes(params.relearningStepsMinutes().get(0), now);
        }

        card.setStability(fsrs.nextReviewStability(card.getDifficulty(), card.getStability(), r, rating));
        card.setDifficulty(fsrs.nextDifficulty(card.getDifficulty(), rating));
        long days = Math.min(fsrs.nextInterval(card.getStability()), params.maximumIntervalDays());
        return Transition.days(days, now);
    }

    private void graduateToReview(Card card, Rating rating) {
        card.setState(CardState.REVIEW);
        card.setLearningStep(0);
        card.setStability(fsrs.initStability(rating));
        card.setDifficulty(fsrs.initDifficulty(rating));
    }

    /**
     * Outcome of one transition. Exactly one of {@code minutes} / {@code days} is the effective unit.
     */
    public record Transition(
            long minutes,
            long days,
            Instant nextDue
    ) {
        static Transition minutes(long minutes, Instant now) {
            return new Transition(minutes, 0, now.plus(Duration.ofMinutes(minutes)));
        }

        static Transition days(long days, Instant now) {
            return new Transition(0, days, now.plus(Duration.ofDays(days)));
        }

        public boolean stepInterval() {
            return minutes > 0;
        }

        public double intervalDays() {
            return stepInterval() ? minutes / MINUTES_PER_DAY : days;
        }

        public String display() {
            return stepInterval() ? minutes + "m" : days + "d";
        }
    }
}
