package pixel.tracking.app.repository;

import pixel.tracking.app.model.TrackingRecord;

import java.util.List;
import java.util.Optional;

/**
 * Backing store for tracking records.
 * Implementations must apply {@link #upsert} atomically per identifier: two concurrent
 * upserts for the same identifier never observe the same {@code current} value.
 * Operations on different identifiers must not contend with each other.
 */
public interface TrackingStore {
    /**
     * Thrown when a backend cannot complete an operation.
     */
    class TrackingStoreException extends RuntimeException {
        public TrackingStoreException(String message) {
            super(message);
        }

        public TrackingStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Creates or updates the record for an identifier in one indivisible step.
     * @param identifier The tracking identifier
     * @param mutation Receives the current record (null if absent) and returns the next one
     * @return The stored record
     * @throws TrackingStoreException if the backend fails
     */
    TrackingRecord upsert(String identifier, RecordMutation mutation);

    Optional<TrackingRecord> findByIdentifier(String identifier);

    /**
     * Records sharing a campaign id. Order is unspecified, and the result may or may
     * not reflect upserts running concurrently with the query.
     */
    List<TrackingRecord> findByCampaignId(String campaignId);
}
