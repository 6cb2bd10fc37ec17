package pixel.tracking.app.config;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.repository.InMemoryTrackingStore;
import pixel.tracking.app.repository.JpaTrackingStore;
import pixel.tracking.app.repository.TrackingRecordRepository;
import pixel.tracking.app.repository.TrackingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Configuration to switch between tracking store backends.
 * Set tracking.store=memory (single instance) or tracking.store=jpa (shared database) in application.properties
 */
@Slf4j
@Configuration
public class TrackingStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "tracking.store", havingValue = "memory", matchIfMissing = true)
    public TrackingStore inMemoryTrackingStore() {
        log.info("Using in-memory tracking store");
        return new InMemoryTrackingStore();
    }

    @Bean
    @ConditionalOnProperty(name = "tracking.store", havingValue = "jpa")
    public TrackingStore jpaTrackingStore(TrackingRecordRepository trackingRecordRepository,
                                          PlatformTransactionManager transactionManager) {
        log.info("Using JPA tracking store");
        return new JpaTrackingStore(trackingRecordRepository, new TransactionTemplate(transactionManager));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
