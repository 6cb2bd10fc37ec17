package pixel.tracking.app.repository;

import pixel.tracking.app.model.TrackingRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Single-instance store. {@link ConcurrentHashMap#compute} locks only the bin holding
 * the key, so upserts for different identifiers run in parallel.
 */
public class InMemoryTrackingStore implements TrackingStore {
    private final ConcurrentMap<String, TrackingRecord> records = new ConcurrentHashMap<>();

    @Override
    public TrackingRecord upsert(String identifier, RecordMutation mutation) {
        Objects.requireNonNull(identifier, "identifier");
        return records.compute(identifier, (key, current) -> {
            TrackingRecord next = mutation.apply(current);
            if (next == null || !key.equals(next.getIdentifier())) {
                throw new TrackingStoreException("Mutation for " + key + " returned a record for another identifier");
            }
            return next;
        });
    }

    @Override
    public Optional<TrackingRecord> findByIdentifier(String identifier) {
        return Optional.ofNullable(records.get(identifier));
    }

    @Override
    public List<TrackingRecord> findByCampaignId(String campaignId) {
        return records.values().stream()
            .filter(record -> campaignId.equals(record.getCampaignId()))
            .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }
}
