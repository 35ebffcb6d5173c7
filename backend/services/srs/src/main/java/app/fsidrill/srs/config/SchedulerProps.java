package app.fsidrill.srs.config;

import app.fsidrill.srs.review.algorithm.SchedulerParameters;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Overrides for {@link SchedulerParameters#defaults()}; any property left out keeps its default.
 */
@Validated
@ConfigurationProperties(prefix = "app.srs.scheduler")
public record SchedulerProps(
        @Size(min = 17, max = 17) List<Double> weights,
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) Double requestRetention,
        @Positive Integer maximumIntervalDays,
        List<@Positive Integer> learningStepsMinutes,
        List<@Positive Integer> relearningStepsMinutes,
        @Positive Integer graduatingIntervalDays,
        @Positive Integer easyIntervalDays,
        @Positive Integer graduationConsecutive,
        Double graduationMinIntervalDays,
        @Positive Integer reactivationLapseThreshold,
        @Positive Integer reactivationWindowDays,
        @Positive Integer reactivationBatchSize,
        @Positive Integer maxErrorHistory,
        @Positive Integer sessionSize,
        Double masteredStabilityDays
) {

    public SchedulerParameters toParameters() {
        SchedulerParameters d = SchedulerParameters.defaults();

        double[] w = new double[SchedulerParameters.WEIGHT_COUNT];
        for (int i = 0; i < w.length; i++) {
            w[i] = (weights != null && i < weights.size() && weights.get(i) != null) ? weights.get(i) : d.w(i);
        }

        return new SchedulerParameters(
                w,
                or(requestRetention, d.requestRetention()),
                or(maximumIntervalDays, d.maximumIntervalDays()),
                (learningStepsMinutes == null || learningStepsMinutes.isEmpty()) ? d.learningStepsMinutes() : learningStepsMinutes,
                (relearningStepsMinutes == null || relearningStepsMinutes.isEmpty()) ? d.relearningStepsMinutes() : relearningStepsMinutes,
                or(graduatingIntervalDays, d.graduatingIntervalDays()),
                or(easyIntervalDays, d.easyIntervalDays()),
                or(graduationConsecutive, d.graduationConsecutive()),
                or(graduationMinIntervalDays, d.graduationMinIntervalDays()),
                or(reactivationLapseThreshold, d.reactivationLapseThreshold()),
                or(reactivationWindowDays, d.reactivationWindowDays()),
                or(reactivationBatchSize, d.reactivationBatchSize()),
                or(maxErrorHistory, d.maxErrorHistory()),
                or(sessionSize, d.sessionSize()),
                or(masteredStabilityDays, d.masteredStabilityDays())
        );
    }

    private static <T> T or(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
