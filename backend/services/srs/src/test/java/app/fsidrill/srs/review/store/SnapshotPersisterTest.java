package app.fsidrill.srs.review.store;

import app.fsidrill.srs.support.MutableClock;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static app.fsidrill.srs.support.SchedulerFixture.MAPPER;
import static app.fsidrill.srs.support.SchedulerFixture.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotPersisterTest {

    private static final TypeReference<Map<String, Integer>> MAP = new TypeReference<>() {
    };

    @Mock
    KeyValueStore store;

    private final MutableClock clock = new MutableClock(T0);

    @Test
    void saveAsync_success_updatesStatus() {
        when(store.save("k", "{\"a\":1}")).thenReturn(true);
        SnapshotPersister persister = new SnapshotPersister(store, MAPPER, Runnable::run, clock);

        persister.saveAsync("k", Map.of("a", 1));

        assertThat(persister.status().ok()).isTrue();
        assertThat(persister.status().lastSuccessAt()).isEqualTo(T0);
    }

    @Test
    void saveAsync_storeReturnsFalse_marksFailureThenRecovers() {
        when(store.save(anyString(), anyString())).thenReturn(false, true);
        SnapshotPersister persister = new SnapshotPersister(store, MAPPER, Runnable::run, clock);

        persister.saveAsync("k", Map.of("a", 1));
        assertThat(persister.status().ok()).isFalse();
        assertThat(persister.status().lastFailureAt()).isEqualTo(T0);

        clock.advance(Duration.ofMinutes(1));
        persister.saveAsync("k", Map.of("a", 1));
        assertThat(persister.status().ok()).isTrue();
        assertThat(persister.status().lastFailureAt()).isEqualTo(T0);
        assertThat(persister.status().lastSuccessAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
    }

    @Test
    void saveAsync_rejectedByExecutor_isReportedNotThrown() {
        SnapshotPersister persister = new SnapshotPersister(store, MAPPER, task -> {
            throw new RejectedExecutionException("shut down");
        }, clock);

        persister.saveAsync("k", Map.of("a", 1));

        assertThat(persister.status().ok()).isFalse();
        verify(store, never()).save(anyString(), anyString());
    }

    @Test
    void load_readsStoredSnapshot() {
        when(store.load("k")).thenReturn(Optional.of("{\"a\":3}"));
        SnapshotPersister persister = new SnapshotPersister(store, MAPPER, Runnable::run, clock);

        assertThat(persister.load("k", MAP)).contains(Map.of("a", 3));
    }

    @Test
    void load_failures_areEmpty() {
        when(store.load("broken")).thenReturn(Optional.of("[1,"));
        when(store.load("io")).thenThrow(new IllegalStateException("unreadable"));
        when(store.load("blank")).thenReturn(Optional.of(" "));
        SnapshotPersister persister = new SnapshotPersister(store, MAPPER, Runnable::run, clock);

        assertThat(persister.load("broken", MAP)).isEmpty();
        assertThat(persister.load("io", MAP)).isEmpty();
        assertThat(persister.load("blank", MAP)).isEmpty();
    }
}
