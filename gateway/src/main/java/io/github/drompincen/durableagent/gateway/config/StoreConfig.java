package io.github.drompincen.durableagent.gateway.config;

import io.github.drompincen.durableagent.persistence.repository.CheckpointRepository;
import io.github.drompincen.durableagent.persistence.repository.ConversationIndexRepository;
import io.github.drompincen.durableagent.persistence.repository.LockRepository;
import io.github.drompincen.durableagent.runtime.checkpoint.InMemoryStateStore;
import io.github.drompincen.durableagent.runtime.checkpoint.MongoStateStore;
import io.github.drompincen.durableagent.runtime.checkpoint.StateStore;
import io.github.drompincen.durableagent.runtime.index.DisabledSearchIndex;
import io.github.drompincen.durableagent.runtime.index.MongoSearchIndex;
import io.github.drompincen.durableagent.runtime.index.SearchIndex;
import io.github.drompincen.durableagent.runtime.lock.MongoThreadLeaseStore;
import io.github.drompincen.durableagent.runtime.lock.ThreadLeaseStore;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Chooses the checkpoint store, the thread lease store and the search index at startup.
 * <p>
 * All three live in MongoDB. When Mongo does not answer a ping the checkpoint store falls back to
 * memory only if {@code durableagent.store.allow-memory-fallback} is set, otherwise startup fails.
 * Thread leases follow the checkpoint store: with checkpoints in memory only this process can
 * see them, so the in-process lock is enough. The search index is switched off instead, since
 * turns never depend on it.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    StateStore stateStore(CheckpointRepository checkpointRepository,
                          MongoTemplate mongoTemplate,
                          Clock clock,
                          @Value("${durableagent.store.namespace:customer_service}") String namespace,
                          @Value("${durableagent.store.allow-memory-fallback:false}") boolean allowMemoryFallback) {
        StateStore store;
        if (isReachable(mongoTemplate)) {
            store = new MongoStateStore(checkpointRepository, mongoTemplate, namespace, clock);
        } else if (allowMemoryFallback) {
            log.warn("MongoDB unreachable, checkpoints are kept in memory and lost on exit");
            store = new InMemoryStateStore();
        } else {
            throw new IllegalStateException("MongoDB is unreachable and durableagent.store.allow-memory-fallback"
                    + " is not set");
        }
        store.setup();
        log.info("Checkpoint store: {}", store.isDurable() ? "mongodb (" + namespace + ")" : "in-memory");
        return store;
    }

    @Bean
    ThreadLeaseStore threadLeaseStore(StateStore stateStore,
                                      LockRepository lockRepository,
                                      MongoTemplate mongoTemplate,
                                      Clock clock,
                                      @Value("${durableagent.store.namespace:customer_service}") String namespace,
                                      @Value("${durableagent.lock.ttl-seconds:120}") long ttlSeconds) {
        if (!stateStore.isDurable()) {
            log.info("Thread locks are held in this process only");
            return ThreadLeaseStore.none();
        }
        ThreadLeaseStore leases = new MongoThreadLeaseStore(lockRepository, mongoTemplate, namespace, clock,
                Duration.ofSeconds(ttlSeconds));
        leases.setup();
        return leases;
    }

    @Bean
    SearchIndex searchIndex(ConversationIndexRepository indexRepository,
                            MongoTemplate mongoTemplate,
                            @Value("${durableagent.search.enabled:true}") boolean enabled) {
        if (!enabled) {
            log.info("Conversation search disabled by configuration");
            return new DisabledSearchIndex();
        }
        if (!isReachable(mongoTemplate)) {
            log.warn("MongoDB unreachable, conversation search disabled");
            return new DisabledSearchIndex();
        }
        MongoSearchIndex index = new MongoSearchIndex(indexRepository, mongoTemplate);
        try {
            index.setup();
        } catch (RuntimeException e) {
            log.warn("Could not prepare conversation index, search disabled: {}", e.getMessage());
            return new DisabledSearchIndex();
        }
        return index;
    }

    static boolean isReachable(MongoTemplate mongoTemplate) {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            return true;
        } catch (RuntimeException e) {
            log.debug("MongoDB ping failed: {}", e.getMessage());
            return false;
        }
    }
}
