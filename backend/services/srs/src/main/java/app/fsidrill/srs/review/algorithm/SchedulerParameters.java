package app.fsidrill.srs.review.algorithm;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public record SchedulerParameters(
        double[] w,
        double requestRetention,
        int maximumIntervalDays,
        List<Integer> learningStepsMinutes,
        List<Integer> relearningStepsMinutes,
        int graduatingIntervalDays,
        int easyIntervalDays,
        int graduationConsecutive,
        double graduationMinIntervalDays,
        int reactivationLapseThreshold,
        int reactivationWindowDays,
        int reactivationBatchSize,
        int maxErrorHistory,
        int sessionSize,
        double masteredStabilityDays
) {
    public static final int WEIGHT_COUNT = 17;

    static final double[] DEFAULT_W = new double[]{
            0.4, 0.6, 2.4, 5.8, 4.93, 0.94, 0.86, 0.01,
            1.49, 0.14, 0.94, 2.18, 0.05, 0.34, 1.26, 0.29, 2.61
    };

    public SchedulerParameters {
        if (w == null || w.length != WEIGHT_COUNT) {
            throw new IllegalArgumentException("Expected " + WEIGHT_COUNT + " weights");
        }
        w = w.clone();
        if (requestRetention <= 0.0 || requestRetention >= 1.0) {
            throw new IllegalArgumentException("requestRetention must be in (0, 1): " + requestRetention);
        }
        if (learningStepsMinutes == null || learningStepsMinutes.isEmpty()) {
            throw new IllegalArgumentException("learningStepsMinutes must not be empty");
        }
        if (relearningStepsMinutes == null || relearningStepsMinutes.isEmpty()) {
            throw new IllegalArgumentException("relearningStepsMinutes must not be empty");
        }
        requirePositiveSteps("learningStepsMinutes", learningStepsMinutes);
        requirePositiveSteps("relearningStepsMinutes", relearningStepsMinutes);
        learningStepsMinutes = List.copyOf(learningStepsMinutes);
        relearningStepsMinutes = List.copyOf(relearningStepsMinutes);
        if (maximumIntervalDays < 1) {
            throw new IllegalArgumentException("maximumIntervalDays must be positive");
        }
        if (maxErrorHistory < 1 || sessionSize < 1) {
            throw new IllegalArgumentException("maxErrorHistory and sessionSize must be positive");
        }
    }

    public static SchedulerParameters defaults() {
        return new SchedulerParameters(
                DEFAULT_W,
                0.9,
                36500,
                List.of(1, 10),
                List.of(1, 10),
                1,
                4,
                5,
                16,
                2,
                30,
                3,
                10,
                20,
                21
        );
    }

    @Override
    public double[] w() {
        return w.clone();
    }

    public double w(int index) {
        return w[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchedulerParameters other)) return false;
        return Arrays.equals(w, other.w)
                && Double.compare(requestRetention, other.requestRetention) == 0
                && maximumIntervalDays == other.maximumIntervalDays
                && learningStepsMinutes.equals(other.learningStepsMinutes)
                && relearningStepsMinutes.equals(other.relearningStepsMinutes)
                && graduatingIntervalDays == other.graduatingIntervalDays
                && easyIntervalDays == other.easyIntervalDays
                && graduationConsecutive == other.graduationConsecutive
                && Double.compare(graduationMinIntervalDays, other.graduationMinIntervalDays) == 0
                && reactivationLapseThreshold == other.reactivationLapseThreshold
                && reactivationWindowDays == other.reactivationWindowDays
                && reactivationBatchSize == other.reactivationBatchSize
                && maxErrorHistory == other.maxErrorHistory
                && sessionSize == other.sessionSize
                && Double.compare(masteredStabilityDays, other.masteredStabilityDays) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(w) + Objects.hash(requestRetention, maximumIntervalDays, learningStepsMinutes,
                relearningStepsMinutes, graduatingIntervalDays, easyIntervalDays, graduationConsecutive,
                graduationMinIntervalDays, reactivationLapseThreshold, reactivationWindowDays,
                reactivationBatchSize, maxErrorHistory, sessionSize, masteredStabilityDays);
    }

    @Override
    public String toString() {
        return "SchedulerParameters[w=" + Arrays.toString(w)
                + ", requestRetention=" + requestRetention
                + ", maximumIntervalDays=" + maximumIntervalDays
                + ", learningStepsMinutes=" + learningStepsMinutes
                + ", relearningStepsMinutes=" + relearningStepsMinutes
                + ", sessionSize=" + sessionSize + "]";
    }

    private static void requirePositiveSteps(String name, List<Integer> steps) {
        for (Integer step : steps) {
            if (step == null || step < 1) {
                throw new IllegalArgumentException(name + " entries must be at least 1 minute: " + steps);
            }
        }
    }
}
