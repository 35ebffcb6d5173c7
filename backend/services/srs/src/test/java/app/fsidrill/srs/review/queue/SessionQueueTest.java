package app.fsidrill.srs.review.queue;

import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.CardState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionQueueTest {

    private static final Instant NOW = Instant.parse("2024-01-02T00:00:00Z");

    @Test
    void build_ordersNewByCommonalityThenReviewsByDue() {
        Card rare = card("rare", "A", 0.3);
        Card common = card("common", "B", 0.8);
        Card overdue = review("overdue", "C", NOW.minus(Duration.ofDays(1)));
        Card notYet = review("notYet", "D", NOW.plus(Duration.ofDays(1)));

        List<Card> queue = new SessionQueue(20).build(List.of(rare, overdue, notYet, common), NOW);

        assertThat(queue).extracting(Card::getId).containsExactly("common", "rare", "overdue");
    }

    @Test
    void build_sortsReviewsByEarliestDue() {
        Card later = review("later", "A", NOW.minus(Duration.ofHours(1)));
        Card earlier = review("earlier", "A", NOW.minus(Duration.ofDays(3)));

        List<Card> queue = new SessionQueue(20).build(List.of(later, earlier), NOW);

        assertThat(queue).extracting(Card::getId).containsExactly("earlier", "later");
    }

    @Test
    void build_truncatesToMax() {
        List<Card> cards = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            cards.add(card("c" + i, "P", i / 100.0));
        }

        SessionQueue queue = new SessionQueue(20);

        assertThat(queue.build(cards, NOW)).hasSize(20);
        assertThat(queue.build(cards, NOW, 5)).hasSize(5)
                .extracting(Card::getId)
                .containsExactly("c29", "c28", "c27", "c26", "c25");
    }

    @Test
    void dueCards_excludesGraduated() {
        Card active = card("active", "A", 0.5);
        Card retired = card("retired", "A", 0.9);
        retired.graduate(NOW);

        assertThat(SessionQueue.dueCards(List.of(active, retired), NOW))
                .extracting(Card::getId)
                .containsExactly("active");
    }

    @Test
    void next_onEmptyCollection_returnsEmpty() {
        SessionQueue queue = new SessionQueue(20);

        assertThat(queue.next(List::of, NOW)).isEmpty();
    }

    @Test
    void next_rebuildsLazilyAndPopsFront() {
        Card a = card("a", "X", 0.9);
        Card b = card("b", "Y", 0.1);
        SessionQueue queue = new SessionQueue(20);

        assertThat(queue.next(() -> List.of(a, b), NOW)).contains(a);
        assertThat(queue.snapshot()).containsExactly(b);
    }

    @Test
    void next_movesFirstDifferentPatternToFront() {
        Card first = card("first", "PRON VERB", 0.9);
        Card second = card("second", "PRON VERB", 0.8);
        Card third = card("third", "DET NOUN", 0.7);
        SessionQueue queue = new SessionQueue(20);
        queue.build(List.of(first, second, third), NOW);
        queue.recordPattern("PRON VERB");

        assertThat(queue.next(List::of, NOW)).contains(third);
        assertThat(queue.snapshot()).extracting(Card::getId).containsExactly("first", "second");
    }

    @Test
    void next_keepsOrderWhenEveryCardSharesPattern() {
        Card first = card("first", "PRON VERB", 0.9);
        Card second = card("second", "PRON VERB", 0.8);
        SessionQueue queue = new SessionQueue(20);
        queue.build(List.of(first, second), NOW);
        queue.recordPattern("PRON VERB");

        assertThat(queue.next(List::of, NOW)).contains(first);
    }

    @Test
    void next_ignoresEmptyLastPattern() {
        Card first = card("first", "", 0.9);
        Card second = card("second", "DET NOUN", 0.8);
        SessionQueue queue = new SessionQueue(20);
        queue.build(List.of(first, second), NOW);
        queue.recordPattern("");

        assertThat(queue.next(List::of, NOW)).contains(first);
    }

    private static Card card(String id, String pattern, double commonality) {
        return Card.newCard(id, pattern, commonality, 1, 4.93, NOW);
    }

    private static Card review(String id, String pattern, Instant due) {
        Card card = card(id, pattern, 0.5);
        card.setState(CardState.REVIEW);
        card.setStability(3.0);
        card.setDue(due);
        return card;
    }
}
