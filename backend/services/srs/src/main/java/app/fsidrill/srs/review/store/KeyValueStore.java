package app.fsidrill.srs.review.store;

import java.util.Optional;

/**
 * Storage capability the scheduler persists through. Implementations may throw or return {@code false}
 * on save; callers treat both as a non-fatal failure.
 */
public interface KeyValueStore {

    Optional<String> load(String key);

    boolean save(String key, String blob);
}
