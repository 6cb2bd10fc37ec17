package pixel.tracking.app.repository;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.entity.TrackingRecordEntity;
import pixel.tracking.app.model.TrackingRecord;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Relational store for multi-instance deployments.
 * Each upsert runs in its own transaction holding a row lock on the identifier.
 * Two nodes creating the same record at once collide on the primary key (new rows are
 * persisted, never merged); the loser retries and then reads the winner's row under the lock.
 */
@Slf4j
public class JpaTrackingStore implements TrackingStore {
    private static final int MAX_ATTEMPTS = 5;

    private final TrackingRecordRepository trackingRecordRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaTrackingStore(TrackingRecordRepository trackingRecordRepository, TransactionTemplate transactionTemplate) {
        this.trackingRecordRepository = trackingRecordRepository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public TrackingRecord upsert(String identifier, RecordMutation mutation) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return transactionTemplate.execute(status -> applyLocked(identifier, mutation));
            } catch (DataIntegrityViolationException e) {
                // Another node inserted the same identifier first
                log.debug("Insert conflict for {} on attempt {}, retrying", identifier, attempt);
                lastFailure = e;
            } catch (ConcurrencyFailureException e) {
                log.debug("Lock conflict for {} on attempt {}: {}", identifier, attempt, e.getMessage());
                lastFailure = e;
            }
        }
        throw new TrackingStoreException("Could not upsert " + identifier + " after " + MAX_ATTEMPTS + " attempts", lastFailure);
    }

    private TrackingRecord applyLocked(String identifier, RecordMutation mutation) {
        Optional<TrackingRecordEntity> existing = trackingRecordRepository.findForUpdate(identifier);
        TrackingRecord current = existing.map(TrackingRecordEntity::toRecord).orElse(null);

        TrackingRecord next = mutation.apply(current);
        if (next == null || !identifier.equals(next.getIdentifier())) {
            throw new TrackingStoreException("Mutation for " + identifier + " returned a record for another identifier");
        }

        TrackingRecordEntity entity = existing.orElseGet(TrackingRecordEntity::forInsert);
        entity.copyFrom(next);
        trackingRecordRepository.saveAndFlush(entity);
        return next;
    }

    @Override
    public Optional<TrackingRecord> findByIdentifier(String identifier) {
        return trackingRecordRepository.findById(identifier).map(TrackingRecordEntity::toRecord);
    }

    @Override
    public List<TrackingRecord> findByCampaignId(String campaignId) {
        return trackingRecordRepository.findByCampaignId(campaignId).stream()
            .map(TrackingRecordEntity::toRecord)
            .collect(Collectors.toList());
    }
}
