package app.fsidrill.srs.review.store;

import app.fsidrill.srs.config.StorageProps;
import app.fsidrill.srs.review.domain.Card;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative {@code id -> Card} map. Single writer; not thread-safe.
 */
@Component
public class CardStore {

    private static final Logger log = LoggerFactory.getLogger(CardStore.class);
    private static final TypeReference<LinkedHashMap<String, Card>> CARD_MAP = new TypeReference<>() {
    };

    private final SnapshotPersister persister;
    private final String key;
    private final Map<String, Card> cards = new LinkedHashMap<>();

    public CardStore(SnapshotPersister persister, StorageProps storageProps) {
        this.persister = persister;
        this.key = storageProps.cardsKey();
    }

    public void load() {
        cards.clear();
        persister.load(key, CARD_MAP).ifPresent(loaded -> loaded.forEach((id, card) -> {
            if (card == null) {
                return;
            }
            if (card.getId() == null) {
                card.setId(id);
            }
            cards.put(id, card);
        }));
        log.info("Loaded {} cards from {}", cards.size(), key);
    }

    public void persist() {
        persister.saveAsync(key, new LinkedHashMap<>(cards));
    }

    public Optional<Card> find(String id) {
        return Optional.ofNullable(cards.get(id));
    }

    public boolean contains(String id) {
        return cards.containsKey(id);
    }

    public void put(Card card) {
        cards.put(card.getId(), card);
    }

    public Collection<Card> all() {
        return Collections.unmodifiableCollection(cards.values());
    }

    public List<String> ids() {
        return new ArrayList<>(cards.keySet());
    }

    public int size() {
        return cards.size();
    }

    public SaveStatus saveStatus() {
        return persister.status();
    }
}
