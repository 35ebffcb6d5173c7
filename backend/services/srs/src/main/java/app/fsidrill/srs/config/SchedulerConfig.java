package app.fsidrill.srs.config;

import app.fsidrill.srs.review.algorithm.SchedulerParameters;
import app.fsidrill.srs.review.graduation.RandomSiblingSelector;
import app.fsidrill.srs.review.graduation.SiblingSelector;
import app.fsidrill.srs.review.store.FileKeyValueStore;
import app.fsidrill.srs.review.store.InMemoryKeyValueStore;
import app.fsidrill.srs.review.store.KeyValueStore;
import app.fsidrill.srs.review.store.PersistenceExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchedulerParameters schedulerParameters(SchedulerProps props) {
        SchedulerParameters params = props.toParameters();
        log.info("Scheduler configured: retention={}, learningSteps={}, relearningSteps={}, sessionSize={}",
                params.requestRetention(), params.learningStepsMinutes(), params.relearningStepsMinutes(),
                params.sessionSize());
        return params;
    }

    @Bean
    public SiblingSelector siblingSelector() {
        return new RandomSiblingSelector(new SecureRandom());
    }

    @Bean
    public KeyValueStore keyValueStore(StorageProps props) {
        return switch (props.type()) {
            case MEMORY -> new InMemoryKeyValueStore();
            case FILE -> new FileKeyValueStore(Path.of(props.directory()));
        };
    }

    @Bean(name = "srsPersistenceExecutor")
    public PersistenceExecutor srsPersistenceExecutor(StorageProps props) {
        return new PersistenceExecutor("srs-persistence", props.drainTimeout());
    }
}
