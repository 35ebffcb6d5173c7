package app.fsidrill.srs.review.graduation;

import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.DrillDefinition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class DrillMetaRegistryTest {

    @Test
    void load_toleratesMissingFieldsAndDefaultsCanonical() {
        DrillMetaRegistry registry = new DrillMetaRegistry();

        int loaded = registry.load(Arrays.asList(
                new DrillDefinition("a", "G1", null),
                new DrillDefinition("b", "G1", false),
                new DrillDefinition("c", " ", false),
                new DrillDefinition(null, "G2", true),
                null));

        assertThat(loaded).isEqualTo(3);
        assertThat(registry.isCanonical("a")).isTrue();
        assertThat(registry.isCanonical("b")).isFalse();
        assertThat(registry.find("c")).hasValueSatisfying(m -> assertThat(m.grouped()).isFalse());
        assertThat(registry.inGroup("b", "G1")).isTrue();
        assertThat(registry.inGroup("unknown", "G1")).isFalse();
        assertThat(registry.patternGroups()).containsExactly("G1");
        assertThat(registry.load(null)).isZero();
    }

    @Test
    void setCanonical_ignoresUnknownIds() {
        DrillMetaRegistry registry = new DrillMetaRegistry();
        registry.load(List.of(new DrillDefinition("a", "G1", false)));

        registry.setCanonical("a", true);
        registry.setCanonical("ghost", true);

        assertThat(registry.isCanonical("a")).isTrue();
        assertThat(registry.find("ghost")).isEmpty();
    }

    @Test
    void randomSelector_isAPermutation() {
        Instant now = Instant.parse("2024-01-02T00:00:00Z");
        List<Card> cards = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            cards.add(Card.newCard("c" + i, "P", 0.5, 1, 4.93, now));
        }

        List<Card> shuffled = new RandomSiblingSelector(new Random(7)).shuffle(cards);

        assertThat(shuffled).containsExactlyInAnyOrderElementsOf(cards);
        assertThat(cards).extracting(Card::getId).containsExactly("c0", "c1", "c2", "c3", "c4", "c5");
    }
}
