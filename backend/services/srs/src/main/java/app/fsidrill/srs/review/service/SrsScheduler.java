package app.fsidrill.srs.review.service;

import app.fsidrill.srs.review.algorithm.FsrsEngine;
import app.fsidrill.srs.review.algorithm.ReviewStateMachine;
import app.fsidrill.srs.review.algorithm.SchedulerParameters;
import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.DrillDefinition;
import app.fsidrill.srs.review.domain.DrillItem;
import app.fsidrill.srs.review.domain.ErrorInfo;
import app.fsidrill.srs.review.domain.ErrorRecord;
import app.fsidrill.srs.review.domain.Rating;
import app.fsidrill.srs.review.domain.SessionStats;
import app.fsidrill.srs.review.graduation.DrillMetaRegistry;
import app.fsidrill.srs.review.graduation.GraduationService;
import app.fsidrill.srs.review.queue.SessionQueue;
import app.fsidrill.srs.review.store.CardStore;
import app.fsidrill.srs.review.store.SaveStatus;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The learner session: owns the card store, drill metadata, session queue, last drawn pattern and
 * session counters. Operations run to completion one at a time; persistence is the only asynchronous
 * step and never affects the returned outcome.
 */
@Service
public class SrsScheduler {

    static final String UNKNOWN_PATTERN = "unknown";

    private final CardStore cardStore;
    private final DrillMetaRegistry metaRegistry;
    private final ReviewStateMachine stateMachine;
    private final GraduationService graduationService;
    private final FsrsEngine fsrs;
    private final SchedulerParameters params;
    private final Clock clock;
    private final SessionQueue sessionQueue;

    private SessionStats sessionStats = SessionStats.EMPTY;

    public SrsScheduler(CardStore cardStore,
                        DrillMetaRegistry metaRegistry,
                        ReviewStateMachine stateMachine,
                        GraduationService graduationService,
                        FsrsEngine fsrs,
                        SchedulerParameters params,
                        Clock clock) {
        this.cardStore = cardStore;
        this.metaRegistry = metaRegistry;
        this.stateMachine = stateMachine;
        this.graduationService = graduationService;
        this.fsrs = fsrs;
        this.params = params;
        this.clock = clock;
        this.sessionQueue = new SessionQueue(params.sessionSize());
    }

    @PostConstruct
    public synchronized void loadCards() {
        cardStore.load();
        sessionQueue.clear();
    }

    public synchronized int initializeCards(Collection<DrillItem> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        List<DrillItem> sorted = items.stream()
                .filter(Objects::nonNull)
                .filter(i -> i.id() != null && !i.id().isBlank())
                .sorted(Comparator.comparingDouble((DrillItem i) ->
                        i.commonality() == null ? Card.DEFAULT_COMMONALITY : i.commonality()).reversed())
                .toList();

        int created = 0;
        for (DrillItem item : sorted) {
            if (cardStore.contains(item.id())) continue;
            cardStore.put(newCard(item.id(), item.posPattern(), item.commonality(), item.unit(), now));
            created++;
        }
        cardStore.persist();
        return created;
    }

    public synchronized int loadDrillMeta(Collection<DrillDefinition> definitions) {
        return metaRegistry.load(definitions);
    }

    public synchronized Optional<ReviewResult> processReview(String cardId, Rating rating, ErrorInfo errorInfo) {
        Objects.requireNonNull(rating, "rating");
        Optional<Card> found = (cardId == null) ? Optional.empty() : cardStore.find(cardId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Card card = found.get();
        Instant now = clock.instant();

        if (errorInfo != null) {
            card.recordError(errorInfo.type(), now, params.maxErrorHistory());
        }

        ReviewStateMachine.Transition transition = stateMachine.apply(card, rating, now);

        sessionQueue.recordPattern(card.getPosPattern());
        sessionStats = sessionStats.record(rating);
        card.setConsecutiveCorrect(rating.isCorrect() ? card.getConsecutiveCorrect() + 1 : 0);

        graduationService.checkGraduation(card, rating, now);
        if (rating == Rating.AGAIN) {
            graduationService.checkReactivation(card, now);
        }

        cardStore.persist();

        return Optional.of(new ReviewResult(card.copy(), transition.intervalDays(), transition.display(), card.getDue()));
    }

    public synchronized List<Card> buildSessionQueue() {
        return detached(sessionQueue.build(cardStore.all(), clock.instant()));
    }

    public synchronized List<Card> buildSessionQueue(int maxCards) {
        return detached(sessionQueue.build(cardStore.all(), clock.instant(), maxCards));
    }

    public synchronized Optional<Card> getNextCard() {
        return sessionQueue.next(cardStore::all, clock.instant()).map(Card::copy);
    }

    public synchronized List<Card> getDueCards() {
        return detached(SessionQueue.dueCards(cardStore.all(), clock.instant()));
    }

    public synchronized Optional<Card> getCard(String cardId) {
        return cardStore.find(cardId).map(Card::copy);
    }

    public synchronized boolean resetCard(String cardId) {
        if (!resetOne(cardId)) {
            return false;
        }
        sessionQueue.clear();
        cardStore.persist();
        return true;
    }

    public synchronized int resetAllCards() {
        int reset = 0;
        for (String id : cardStore.ids()) {
            if (resetOne(id)) reset++;
        }
        sessionQueue.clear();
        cardStore.persist();
        return reset;
    }

    public synchronized void resetSessionStats() {
        sessionStats = SessionStats.EMPTY;
    }

    public synchronized SchedulerStats getStats() {
        Instant now = clock.instant();
        int newCount = 0, learning = 0, review = 0, relearning = 0, dueToday = 0, mastered = 0;
        double totalStability = 0, totalDifficulty = 0;
        int reviewedCount = 0;
        long totalReviews = 0, totalLapses = 0;

        for (Card card : cardStore.all()) {
            switch (card.getState()) {
                case NEW -> newCount++;
                case LEARNING -> learning++;
                case REVIEW -> review++;
                case RELEARNING -> relearning++;
            }
            if (card.getDue() != null && !card.getDue().isAfter(now)) {
                dueToday++;
            }
            if (card.getStability() > params.masteredStabilityDays()) {
                mastered++;
            }
            if (card.getReps() > 0) {
                totalStability += card.getStability();
                totalDifficulty += card.getDifficulty();
                reviewedCount++;
            }
            totalReviews += card.getReps();
            totalLapses += card.getLapses();
        }

        return new SchedulerStats(
                cardStore.size(),
                newCount,
                learning,
                review,
                relearning,
                dueToday,
                mastered,
                reviewedCount > 0 ? totalStability / reviewedCount : 0,
                reviewedCount > 0 ? totalDifficulty / reviewedCount : 0,
                totalReviews,
                totalLapses,
                sessionStats
        );
    }

    public synchronized GraduationStats getGraduationStats() {
        int total = cardStore.size();
        int graduated = (int) cardStore.all().stream().filter(Card::isGraduated).count();
        double percent = total == 0
                ? 0
                : BigDecimal.valueOf(graduated * 100.0 / total).setScale(1, RoundingMode.HALF_UP).doubleValue();
        return new GraduationStats(total, graduated, total - graduated, metaRegistry.patternGroups().size(), percent);
    }

    public synchronized Map<String, List<Card>> getPatternGroups() {
        Map<String, List<Card>> groups = new LinkedHashMap<>();
        for (Card card : cardStore.all()) {
            String pattern = (card.getPosPattern() == null || card.getPosPattern().isEmpty())
                    ? UNKNOWN_PATTERN
                    : card.getPosPattern();
            groups.computeIfAbsent(pattern, k -> new ArrayList<>()).add(card.copy());
        }
        return groups;
    }

    public synchronized List<Card> getProblematicCards(int limit) {
        return cardStore.all().stream()
                .filter(c -> !c.getErrorHistory().isEmpty())
                .sorted(Comparator.comparingInt((Card c) -> c.getErrorHistory().size()).reversed())
                .limit(Math.max(limit, 0))
                .map(Card::copy)
                .toList();
    }

    public synchronized Map<String, Integer> getErrorDistribution() {
        Map<String, Integer> dist = new TreeMap<>();
        for (Card card : cardStore.all()) {
            for (ErrorRecord error : card.getErrorHistory()) {
                String type = error.type() == null ? UNKNOWN_PATTERN : error.type();
                dist.merge(type, 1, Integer::sum);
            }
        }
        return dist;
    }

    public synchronized List<Card> sessionQueue() {
        return detached(sessionQueue.snapshot());
    }

    public synchronized SessionStats sessionStats() {
        return sessionStats;
    }

    public SaveStatus saveStatus() {
        return cardStore.saveStatus();
    }

    // callers never see live cards
    private static List<Card> detached(List<Card> cards) {
        return cards.stream().map(Card::copy).toList();
    }

    private boolean resetOne(String cardId) {
        Optional<Card> old = (cardId == null) ? Optional.empty() : cardStore.find(cardId);
        if (old.isEmpty()) {
            return false;
        }
        Card previous = old.get();
        cardStore.put(newCard(cardId, previous.getPosPattern(), previous.getCommonality(), previous.getUnit(),
                clock.instant()));
        return true;
    }

    private Card newCard(String id, String posPattern, Double commonality, Integer unit, Instant now) {
        return Card.newCard(id, posPattern, commonality, unit, fsrs.initDifficulty(Rating.GOOD), now);
    }
}
