package app.fsidrill.srs.review.graduation;

import app.fsidrill.srs.review.algorithm.SchedulerParameters;
import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.CardState;
import app.fsidrill.srs.review.domain.DrillMeta;
import app.fsidrill.srs.review.domain.Rating;
import app.fsidrill.srs.review.store.CardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Retires mastered drill variants from rotation while every pattern group keeps one active canonical,
 * and brings retired variants back when the canonical starts lapsing.
 */
@Service
public class GraduationService {

    private static final Logger log = LoggerFactory.getLogger(GraduationService.class);

    private final SchedulerParameters params;
    private final SiblingSelector selector;
    private final CardStore cardStore;
    private final DrillMetaRegistry metaRegistry;

    public GraduationService(SchedulerParameters params,
                             SiblingSelector selector,
                             CardStore cardStore,
                             DrillMetaRegistry metaRegistry) {
        this.params = params;
        this.selector = selector;
        this.cardStore = cardStore;
        this.metaRegistry = metaRegistry;
    }

    public GraduationOutcome checkGraduation(Card card, Rating rating, Instant now) {
        if (!rating.isCorrect() || card.isGraduated()) {
            return GraduationOutcome.NONE;
        }
        Optional<DrillMeta> meta = metaRegistry.find(card.getId());
        if (meta.isEmpty() || !meta.get().grouped()) {
            return GraduationOutcome.NONE;
        }
        if (card.getConsecutiveCorrect() < params.graduationConsecutive()
                || card.getScheduledDays() < params.graduationMinIntervalDays()) {
            return GraduationOutcome.NONE;
        }

        String group = meta.get().patternGroup();
        List<Card> siblings = siblings(card, group);

        if (meta.get().canonical()) {
            List<Card> graduatedSiblings = siblings.stream().filter(Card::isGraduated).toList();
            if (graduatedSiblings.isEmpty()) {
                // the group needs an active representative
                return GraduationOutcome.NONE;
            }
            Card successor = selector.shuffle(graduatedSiblings).get(0);

            card.graduate(now);
            metaRegistry.setCanonical(card.getId(), false);

            successor.returnToRotation(CardState.REVIEW, now);
            metaRegistry.setCanonical(successor.getId(), true);

            log.info("Canonical swap: {} -> {} in {}", card.getId(), successor.getId(), group);
            return new GraduationOutcome(true, successor.getId());
        }

        boolean activeSiblingRemains = siblings.stream().anyMatch(s -> !s.isGraduated());
        if (!activeSiblingRemains) {
            return GraduationOutcome.NONE;
        }
        card.graduate(now);
        log.info("Graduated: {} from pattern {}", card.getId(), group);
        return new GraduationOutcome(true, null);
    }

    public List<Card> checkReactivation(Card card, Instant now) {
        Optional<DrillMeta> meta = metaRegistry.find(card.getId());
        if (meta.isEmpty() || !meta.get().canonical() || !meta.get().grouped()) {
            return List.of();
        }

        Instant windowStart = now.minus(Duration.ofDays(params.reactivationWindowDays()));
        long recentLapses = card.errorsSince(windowStart);
        if (recentLapses < params.reactivationLapseThreshold()) {
            return List.of();
        }

        List<Card> graduated = siblings(card, meta.get().patternGroup()).stream()
                .filter(Card::isGraduated)
                .toList();
        if (graduated.isEmpty()) {
            return List.of();
        }

        List<Card> reactivated = selector.shuffle(graduated).stream()
                .limit(params.reactivationBatchSize())
                .toList();
        for (Card sibling : reactivated) {
            sibling.returnToRotation(CardState.RELEARNING, now);
            log.info("Reactivated: {} due to canonical lapse on {}", sibling.getId(), card.getId());
        }
        return reactivated;
    }

    public List<Card> siblings(Card card, String patternGroup) {
        return cardStore.all().stream()
                .filter(c -> !c.getId().equals(card.getId()))
                .filter(c -> metaRegistry.inGroup(c.getId(), patternGroup))
                .toList();
    }

    public record GraduationOutcome(
            boolean graduated,
            String promotedCardId
    ) {
        public static final GraduationOutcome NONE = new GraduationOutcome(false, null);
    }
}
