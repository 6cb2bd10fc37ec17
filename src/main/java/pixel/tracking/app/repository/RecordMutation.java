package pixel.tracking.app.repository;

import pixel.tracking.app.model.TrackingRecord;

/**
 * State transition applied by {@link TrackingStore#upsert}.
 */
@FunctionalInterface
public interface RecordMutation {
    /**
     * @param current the stored record, or null if none exists yet
     * @return the record to store; must keep the same identifier
     */
    TrackingRecord apply(TrackingRecord current);
}
