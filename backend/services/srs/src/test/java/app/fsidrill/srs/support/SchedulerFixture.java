package app.fsidrill.srs.support;

import app.fsidrill.srs.config.StorageProps;
import app.fsidrill.srs.review.algorithm.FsrsEngine;
import app.fsidrill.srs.review.algorithm.ReviewStateMachine;
import app.fsidrill.srs.review.algorithm.SchedulerParameters;
import app.fsidrill.srs.review.graduation.DrillMetaRegistry;
import app.fsidrill.srs.review.graduation.GraduationService;
import app.fsidrill.srs.review.graduation.SiblingSelector;
import app.fsidrill.srs.review.store.CardStore;
import app.fsidrill.srs.review.store.InMemoryKeyValueStore;
import app.fsidrill.srs.review.store.KeyValueStore;
import app.fsidrill.srs.review.store.SnapshotPersister;
import app.fsidrill.srs.review.service.SrsScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.ArrayList;

/**
 * Wires a scheduler the way the application context does, with a controllable clock,
 * a same-thread persistence executor and an identity sibling selector.
 */
public class SchedulerFixture {

    public static final Instant T0 = Instant.parse("2024-01-02T00:00:00Z");

    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public final MutableClock clock;
    public final SchedulerParameters params;
    public final KeyValueStore store;
    public final SnapshotPersister persister;
    public final CardStore cardStore;
    public final DrillMetaRegistry metaRegistry;
    public final FsrsEngine fsrs;
    public final ReviewStateMachine stateMachine;
    public final GraduationService graduationService;
    public final SrsScheduler scheduler;

    public SchedulerFixture() {
        this(new InMemoryKeyValueStore(), ArrayList::new);
    }

    public SchedulerFixture(KeyValueStore store, SiblingSelector selector) {
        this.clock = new MutableClock(T0);
        this.params = SchedulerParameters.defaults();
        this.store = store;
        this.persister = new SnapshotPersister(store, MAPPER, Runnable::run, clock);
        this.cardStore = new CardStore(persister, StorageProps.inMemory());
        this.metaRegistry = new DrillMetaRegistry();
        this.fsrs = new FsrsEngine(params);
        this.stateMachine = new ReviewStateMachine(fsrs, params);
        this.graduationService = new GraduationService(params, selector, cardStore, metaRegistry);
        this.scheduler = new SrsScheduler(cardStore, metaRegistry, stateMachine, graduationService, fsrs, params, clock);
    }
}
