package pixel.tracking.app.model;

import lombok.Builder;
import lombok.Value;
import pixel.tracking.app.entity.DeviceType;

import java.time.Instant;

/**
 * Open statistics for one tracking identifier. Instances are immutable; every
 * recorded open produces a new instance through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class TrackingRecord {
    String identifier;
    String emailId;
    String campaignId;
    long opens;
    Instant firstOpen;
    Instant lastOpen;
    DeviceType device; // null when the first open carried no client signature

    // Snapshot of the most recent open
    String ipAddress;
    String userAgent;
    String location;
}
