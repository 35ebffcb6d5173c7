package app.fsidrill.srs.review.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Serializes snapshots on the calling thread and hands the write to the persistence executor.
 * A failed write is logged and reflected in {@link #status()}; it never reaches the caller.
 */
@Component
public class SnapshotPersister {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPersister.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;

    private volatile SaveStatus status = SaveStatus.INITIAL;

    public SnapshotPersister(KeyValueStore store,
                             ObjectMapper objectMapper,
                             @Qualifier("srsPersistenceExecutor") Executor executor,
                             Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
    }

    public <T> Optional<T> load(String key, TypeReference<T> type) {
        try {
            Optional<String> blob = store.load(key);
            if (blob.isEmpty() || blob.get().isBlank()) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(blob.get(), type));
        } catch (JsonProcessingException ex) {
            log.warn("Stored snapshot {} is unreadable, starting empty: {}", key, ex.getOriginalMessage());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Loading snapshot {} failed, starting empty: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    public void saveAsync(String key, Object snapshot) {
        String blob;
        try {
            blob = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException ex) {
            markFailed(key, "serialization failed: " + ex.getOriginalMessage());
            return;
        }

        try {
            executor.execute(() -> write(key, blob));
        } catch (RejectedExecutionException ex) {
            markFailed(key, "persistence executor rejected the write");
        }
    }

    public SaveStatus status() {
        return status;
    }

    private void write(String key, String blob) {
        try {
            if (store.save(key, blob)) {
                status = status.succeeded(clock.instant());
            } else {
                markFailed(key, "store reported failure");
            }
        } catch (RuntimeException ex) {
            markFailed(key, ex.getMessage());
        }
    }

    private void markFailed(String key, String reason) {
        log.warn("Saving {} failed, progress may not be saved: {}", key, reason);
        status = status.failed(reason, clock.instant());
    }
}
