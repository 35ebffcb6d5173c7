package app.fsidrill.srs.review.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Memory record of a single drill. Serialized with snake_case names, which is the persisted schema.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Card {

    public static final String DEFAULT_POS_PATTERN = "";
    public static final double DEFAULT_COMMONALITY = 0.5;
    public static final int DEFAULT_UNIT = 1;

    private String id;
    private Instant due;
    private double stability;
    private double difficulty;
    private double elapsedDays;
    private double scheduledDays;
    private int reps;
    private int lapses;
    private CardState state = CardState.NEW;
    private Instant lastReview;
    private int learningStep;

    private String posPattern = DEFAULT_POS_PATTERN;
    private double commonality = DEFAULT_COMMONALITY;
    private int unit = DEFAULT_UNIT;

    private List<ErrorRecord> errorHistory = new ArrayList<>();

    private boolean graduated;
    private Instant graduationDate;
    private int consecutiveCorrect;

    public Card() {
    }

    public static Card newCard(String id,
                               String posPattern,
                               Double commonality,
                               Integer unit,
                               double initialDifficulty,
                               Instant now) {
        Card card = new Card();
        card.id = id;
        card.due = now;
        card.difficulty = initialDifficulty;
        card.posPattern = (posPattern == null) ? DEFAULT_POS_PATTERN : posPattern;
        card.commonality = (commonality == null) ? DEFAULT_COMMONALITY : commonality;
        card.unit = (unit == null) ? DEFAULT_UNIT : unit;
        return card;
    }

    /**
     * Detached copy for callers outside the scheduler; later reviews do not show through it.
     */
    public Card copy() {
        Card c = new Card();
        c.id = id;
        c.due = due;
        c.stability = stability;
        c.difficulty = difficulty;
        c.elapsedDays = elapsedDays;
        c.scheduledDays = scheduledDays;
        c.reps = reps;
        c.lapses = lapses;
        c.state = state;
        c.lastReview = lastReview;
        c.learningStep = learningStep;
        c.posPattern = posPattern;
        c.commonality = commonality;
        c.unit = unit;
        c.errorHistory = new ArrayList<>(errorHistory);
        c.graduated = graduated;
        c.graduationDate = graduationDate;
        c.consecutiveCorrect = consecutiveCorrect;
        return c;
    }

    public void recordError(String type, Instant at, int maxHistory) {
        errorHistory.add(new ErrorRecord(type, at));
        while (errorHistory.size() > maxHistory) {
            errorHistory.remove(0);
        }
    }

    public long errorsSince(Instant since) {
        return errorHistory.stream()
                .filter(e -> e.timestamp() != null && e.timestamp().isAfter(since))
                .count();
    }

    public void graduate(Instant at) {
        graduated = true;
        graduationDate = at;
    }

    public void returnToRotation(CardState nextState, Instant dueAt) {
        graduated = false;
        graduationDate = null;
        consecutiveCorrect = 0;
        learningStep = 0;
        state = nextState;
        due = dueAt;
    }

    public boolean isDue(Instant now) {
        return state == CardState.NEW || (due != null && !due.isAfter(now));
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getDue() {
        return due;
    }

    public void setDue(Instant due) {
        this.due = due;
    }

    public double getStability() {
        return stability;
    }

    public void setStability(double stability) {
        this.stability = stability;
    }

    public double getDifficulty() {
        return difficulty;
    }

    public void setDifficulty(double difficulty) {
        this.difficulty = difficulty;
    }

    public double getElapsedDays() {
        return elapsedDays;
    }

    public void setElapsedDays(double elapsedDays) {
        this.elapsedDays = elapsedDays;
    }

    public double getScheduledDays() {
        return scheduledDays;
    }

    public void setScheduledDays(double scheduledDays) {
        this.scheduledDays = scheduledDays;
    }

    public int getReps() {
        return reps;
    }

    public void setReps(int reps) {
        this.reps = reps;
    }

    public int getLapses() {
        return lapses;
    }

    public void setLapses(int lapses) {
        this.lapses = lapses;
    }

    public CardState getState() {
        return state;
    }

    public void setState(CardState state) {
        this.state = state;
    }

    public Instant getLastReview() {
        return lastReview;
    }

    public void setLastReview(Instant lastReview) {
        this.lastReview = lastReview;
    }

    public int getLearningStep() {
        return learningStep;
    }

    public void setLearningStep(int learningStep) {
        this.learningStep = learningStep;
    }

    public String getPosPattern() {
        return posPattern;
    }

    public void setPosPattern(String posPattern) {
        this.posPattern = posPattern;
    }

    public double getCommonality() {
        return commonality;
    }

    public void setCommonality(double commonality) {
        this.commonality = commonality;
    }

    public int getUnit() {
        return unit;
    }

    public void setUnit(int unit) {
        this.unit = unit;
    }

    public List<ErrorRecord> getErrorHistory() {
        return errorHistory;
    }

    public void setErrorHistory(List<ErrorRecord> errorHistory) {
        this.errorHistory = (errorHistory == null) ? new ArrayList<>() : new ArrayList<>(errorHistory);
    }

    public boolean isGraduated() {
        return graduated;
    }

    public void setGraduated(boolean graduated) {
        this.graduated = graduated;
    }

    public Instant getGraduationDate() {
        return graduationDate;
    }

    public void setGraduationDate(Instant graduationDate) {
        this.graduationDate = graduationDate;
    }

    public int getConsecutiveCorrect() {
        return consecutiveCorrect;
    }

    public void setConsecutiveCorrect(int consecutiveCorrect) {
        this.consecutiveCorrect = consecutiveCorrect;
    }
}
