package app.fsidrill.srs.review.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> load(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean save(String key, String blob) {
        entries.put(key, blob);
        return true;
    }
}
