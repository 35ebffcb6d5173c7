package app.fsidrill.srs.review.store;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Single writer thread for snapshots, so writes land in submission order. On shutdown, queued writes
 * are drained for up to {@code drainTimeout} before the thread is interrupted.
 */
public class PersistenceExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(PersistenceExecutor.class);

    private final ExecutorService delegate;
    private final Duration drainTimeout;

    public PersistenceExecutor(String threadName, Duration drainTimeout) {
        this.delegate = Executors.newSingleThreadExecutor(r -> new Thread(r, threadName));
        this.drainTimeout = drainTimeout;
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(command);
    }

    @PreDestroy
    public void shutdown() {
        if (delegate.isTerminated()) {
            return;
        }
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = delegate.shutdownNow();
                log.warn("Persistence did not drain within {}, {} pending writes dropped", drainTimeout, dropped.size());
            }
        } catch (InterruptedException ex) {
            List<Runnable> dropped = delegate.shutdownNow();
            log.warn("Interrupted while draining persistence, {} pending writes dropped", dropped.size());
            Thread.currentThread().interrupt();
        }
    }

    public boolean isTerminated() {
        return delegate.isTerminated();
    }
}
