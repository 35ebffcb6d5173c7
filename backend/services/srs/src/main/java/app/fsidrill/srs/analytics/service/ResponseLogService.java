package app.fsidrill.srs.analytics.service;

import app.fsidrill.srs.analytics.domain.AnalyticsExport;
import app.fsidrill.srs.analytics.domain.AnalyticsSnapshot;
import app.fsidrill.srs.analytics.domain.AnalyticsSummary;
import app.fsidrill.srs.analytics.domain.ResponseEntry;
import app.fsidrill.srs.analytics.domain.ResponseError;
import app.fsidrill.srs.analytics.domain.ResponseInput;
import app.fsidrill.srs.config.StorageProps;
import app.fsidrill.srs.review.store.SnapshotPersister;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Log of every answered prompt, kept for offline pattern analysis.
 */
@Service
public class ResponseLogService {

    static final int MAX_RESPONSES = 10_000;
    static final int TOP_MISTAKES = 20;

    private static final TypeReference<AnalyticsSnapshot> SNAPSHOT = new TypeReference<>() {
    };

    private final SnapshotPersister persister;
    private final String key;
    private final Clock clock;

    private String userId;
    private List<ResponseEntry> responses = new ArrayList<>();
    private Instant promptStartedAt;

    public ResponseLogService(SnapshotPersister persister, StorageProps storageProps, Clock clock) {
        this.persister = persister;
        this.key = storageProps.analyticsKey();
        this.clock = clock;
    }

    @PostConstruct
    public synchronized void loadAnalytics() {
        Optional<AnalyticsSnapshot> saved = persister.load(key, SNAPSHOT);
        userId = saved.map(AnalyticsSnapshot::userId).orElse(null);
        responses = saved.map(AnalyticsSnapshot::responses)
                .map(list -> new ArrayList<>(list))
                .orElseGet(ArrayList::new);
    }

    public synchronized void setUserId(String userId) {
        this.userId = userId;
        save();
    }

    public synchronized String userId() {
        return userId;
    }

    public synchronized void startPromptTimer() {
        promptStartedAt = clock.instant();
    }

    public synchronized ResponseEntry logResponse(ResponseInput input) {
        Instant now = clock.instant();
        Long responseTimeMs = (promptStartedAt == null) ? null : Duration.between(promptStartedAt, now).toMillis();

        ResponseEntry entry = ResponseEntry.from(input, now, responseTimeMs, userId);
        responses.add(entry);
        if (responses.size() > MAX_RESPONSES) {
            responses = new ArrayList<>(responses.subList(responses.size() - MAX_RESPONSES, responses.size()));
        }
        save();
        return entry;
    }

    public synchronized List<ResponseEntry> responses() {
        return List.copyOf(responses);
    }

    public synchronized Optional<AnalyticsSummary> getAnalyticsSummary() {
        if (responses.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Integer> errorTypes = new TreeMap<>();
        Map<Integer, Integer> errorsByUnit = new TreeMap<>();
        Map<String, MistakeAccumulator> mistakesByCard = new LinkedHashMap<>();
        long correctTimeTotal = 0, incorrectTimeTotal = 0;
        int correctTimed = 0, incorrectTimed = 0, correctCount = 0;

        for (ResponseEntry r : responses) {
            if (r.correct()) correctCount++;

            if (r.responseTimeMs() != null && r.responseTimeMs() > 0) {
                if (r.correct()) {
                    correctTimeTotal += r.responseTimeMs();
                    correctTimed++;
                } else {
                    incorrectTimeTotal += r.responseTimeMs();
                    incorrectTimed++;
                }
            }

            for (ResponseError err : r.errors()) {
                errorTypes.merge(String.valueOf(err.type()), 1, Integer::sum);
            }

            if (!r.correct() && r.unit() != null) {
                errorsByUnit.merge(r.unit(), 1, Integer::sum);
            }

            if (!r.correct() && r.cardId() != null) {
                MistakeAccumulator acc = mistakesByCard.computeIfAbsent(r.cardId(), id -> new MistakeAccumulator());
                acc.count++;
                acc.errors.addAll(r.errors());
                acc.lastAnswer = r.userAnswer();
            }
        }

        List<AnalyticsSummary.CardMistakes> topMistakes = mistakesByCard.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, MistakeAccumulator> e) -> e.getValue().count).reversed())
                .limit(TOP_MISTAKES)
                .map(e -> new AnalyticsSummary.CardMistakes(
                        e.getKey(), e.getValue().count, List.copyOf(e.getValue().errors), e.getValue().lastAnswer))
                .toList();

        int total = responses.size();
        return Optional.of(new AnalyticsSummary(
                total,
                correctCount,
                total - correctCount,
                BigDecimal.valueOf(correctCount * 100.0 / total).setScale(1, RoundingMode.HALF_UP).doubleValue(),
                average(correctTimeTotal, correctTimed),
                average(incorrectTimeTotal, incorrectTimed),
                errorTypes,
                errorsByUnit,
                topMistakes
        ));
    }

    public synchronized AnalyticsExport exportAnalytics() {
        return new AnalyticsExport(userId, clock.instant(), getAnalyticsSummary().orElse(null), List.copyOf(responses));
    }

    public synchronized void clearAnalytics() {
        responses = new ArrayList<>();
        save();
    }

    private void save() {
        persister.saveAsync(key, new AnalyticsSnapshot(userId, List.copyOf(responses), clock.instant()));
    }

    private static long average(long total, int count) {
        return count == 0 ? 0 : Math.round((double) total / count);
    }

    private static final class MistakeAccumulator {
        private int count;
        private final List<ResponseError> errors = new ArrayList<>();
        private String lastAnswer;
    }
}
