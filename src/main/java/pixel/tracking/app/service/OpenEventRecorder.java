package pixel.tracking.app.service;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.entity.DeviceType;
import pixel.tracking.app.model.OpenContext;
import pixel.tracking.app.model.PixelOpenedEvent;
import pixel.tracking.app.model.TrackingRecord;
import pixel.tracking.app.repository.TrackingStore;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Records pixel fetches. Every fetch counts as an open; near-simultaneous fetches
 * from prefetching proxies or multiple previews are not collapsed.
 * Recording is best effort: failures are logged and never reach the caller.
 */
@Slf4j
@Service
public class OpenEventRecorder {
    private final TrackingStore trackingStore;
    private final DeviceClassifier deviceClassifier;
    private final LocationResolver locationResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public OpenEventRecorder(
            TrackingStore trackingStore,
            DeviceClassifier deviceClassifier,
            LocationResolver locationResolver,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.trackingStore = trackingStore;
        this.deviceClassifier = deviceClassifier;
        this.locationResolver = locationResolver;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Records one open for an identifier, creating its record on the first open.
     * @param identifier The pixel identifier from the fetched URL
     * @param context Request context, may be null
     * @return The updated record, or empty if the open could not be recorded
     */
    public Optional<TrackingRecord> recordOpen(String identifier, OpenContext context) {
        if (!StringUtils.hasText(identifier)) {
            log.debug("Pixel fetched without identifier, nothing to record");
            return Optional.empty();
        }
        OpenContext ctx = context != null ? context : OpenContext.empty();

        TrackingRecord record;
        try {
            Instant now = clock.instant();
            String location = ctx.getLocation() != null ? ctx.getLocation() : locationResolver.resolve(ctx.getIpAddress());
            record = trackingStore.upsert(identifier, current -> current == null
                    ? firstOpen(identifier, ctx, location, now)
                    : repeatOpen(current, ctx, location, now));
        } catch (Exception e) {
            log.error("Failed to record open for {}: {}", identifier, e.getMessage(), e);
            return Optional.empty();
        }

        if (record.getOpens() == 1) {
            log.info("First open recorded for {} (campaign {})", identifier, record.getCampaignId());
        } else {
            log.debug("Open #{} recorded for {}", record.getOpens(), identifier);
        }

        try {
            eventPublisher.publishEvent(new PixelOpenedEvent(record));
        } catch (Exception e) {
            log.warn("Failed to publish open event for {}: {}", identifier, e.getMessage());
        }
        return Optional.of(record);
    }

    private TrackingRecord firstOpen(String identifier, OpenContext ctx, String location, Instant now) {
        DeviceType device = StringUtils.hasText(ctx.getUserAgent()) ? deviceClassifier.classify(ctx.getUserAgent()) : null;
        return TrackingRecord.builder()
            .identifier(identifier)
            .emailId(ctx.getEmailId())
            .campaignId(ctx.getCampaignId())
            .opens(1)
            .firstOpen(now)
            .lastOpen(now)
            .device(device)
            .ipAddress(ctx.getIpAddress())
            .userAgent(ctx.getUserAgent())
            .location(location)
            .build();
    }

    private TrackingRecord repeatOpen(TrackingRecord current, OpenContext ctx, String location, Instant now) {
        // lastOpen never moves backwards, even if the clock does
        Instant lastOpen = now.isAfter(current.getLastOpen()) ? now : current.getLastOpen();
        return current.toBuilder()
            .emailId(current.getEmailId() != null ? current.getEmailId() : ctx.getEmailId())
            .campaignId(current.getCampaignId() != null ? current.getCampaignId() : ctx.getCampaignId())
            .opens(current.getOpens() + 1)
            .lastOpen(lastOpen)
            .ipAddress(ctx.getIpAddress())
            .userAgent(ctx.getUserAgent())
            .location(location)
            .build();
    }

    public Optional<TrackingRecord> get(String identifier) {
        return trackingStore.findByIdentifier(identifier);
    }

    public List<TrackingRecord> listByCampaign(String campaignId) {
        return trackingStore.findByCampaignId(campaignId);
    }
}
