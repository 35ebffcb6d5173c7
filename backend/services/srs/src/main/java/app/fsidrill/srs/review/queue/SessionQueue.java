package app.fsidrill.srs.review.queue;

import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.CardState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Transient session queue: new cards by commonality first, then reviews by due date. Drawing avoids
 * showing the same grammatical pattern twice in a row when the queue allows it.
 */
public class SessionQueue {

    static final Comparator<Card> ORDER = (a, b) -> {
        boolean aNew = a.getState() == CardState.NEW;
        boolean bNew = b.getState() == CardState.NEW;
        if (aNew != bNew) {
            return aNew ? -1 : 1;
        }
        if (aNew) {
            return Double.compare(b.getCommonality(), a.getCommonality());
        }
        return a.getDue().compareTo(b.getDue());
    };

    private final int defaultSize;
    private List<Card> queue = new ArrayList<>();
    private String lastPattern;

    public SessionQueue(int defaultSize) {
        this.defaultSize = defaultSize;
    }

    public static List<Card> dueCards(Collection<Card> cards, Instant now) {
        List<Card> due = new ArrayList<>();
        for (Card card : cards) {
            if (card.isGraduated()) continue;
            if (card.isDue(now)) {
                due.add(card);
            }
        }
        return due;
    }

    public List<Card> build(Collection<Card> cards, Instant now) {
        return build(cards, now, defaultSize);
    }

    public List<Card> build(Collection<Card> cards, Instant now, int maxCards) {
        List<Card> due = dueCards(cards, now);
        due.sort(ORDER);
        queue = new ArrayList<>(due.subList(0, Math.min(Math.max(maxCards, 0), due.size())));
        return List.copyOf(queue);
    }

    public Optional<Card> next(Supplier<Collection<Card>> cards, Instant now) {
        if (queue.isEmpty()) {
            build(cards.get(), now);
        }
        if (queue.isEmpty()) {
            return Optional.empty();
        }

        if (lastPattern != null && !lastPattern.isEmpty()) {
            int idx = -1;
            for (int i = 0; i < queue.size(); i++) {
                if (!lastPattern.equals(queue.get(i).getPosPattern())) {
                    idx = i;
                    break;
                }
            }
            if (idx > 0) {
                queue.add(0, queue.remove(idx));
            }
        }

        return Optional.of(queue.remove(0));
    }

    public void recordPattern(String pattern) {
        this.lastPattern = pattern;
    }

    public String lastPattern() {
        return lastPattern;
    }

    public List<Card> snapshot() {
        return List.copyOf(queue);
    }

    public void clear() {
        queue = new ArrayList<>();
    }
}
