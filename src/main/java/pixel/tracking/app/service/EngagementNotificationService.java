package pixel.tracking.app.service;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.model.EngagementSignal;
import pixel.tracking.app.model.PixelOpenedEvent;
import pixel.tracking.app.model.TrackingRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns recorded opens into engagement signals for the sender.
 * Runs off the request thread, so a slow or failing listener never delays the pixel response.
 */
@Slf4j
@Service
public class EngagementNotificationService {
    private final Duration revivalAfter;
    private final Duration burstWindow;
    private final int burstThreshold;

    public EngagementNotificationService(
            @Value("${tracking.engagement.revival-after:P7D}") Duration revivalAfter,
            @Value("${tracking.engagement.burst-window:PT30M}") Duration burstWindow,
            @Value("${tracking.engagement.burst-threshold:3}") int burstThreshold) {
        this.revivalAfter = revivalAfter;
        this.burstWindow = burstWindow;
        this.burstThreshold = burstThreshold;
    }

    @Async("trackingEventExecutor")
    @EventListener
    public void onPixelOpened(PixelOpenedEvent event) {
        try {
            TrackingRecord record = event.getRecord();
            classify(record).ifPresent(signal -> notifySender(signal, record));
        } catch (Exception e) {
            log.error("Error handling open event: {}", e.getMessage(), e);
        }
    }

    /**
     * @return the signal for this open, if it is worth telling the sender about
     */
    public Optional<EngagementSignal> classify(TrackingRecord record) {
        if (record.getOpens() == 1) {
            return Optional.of(EngagementSignal.FIRST_OPEN);
        }
        Duration sinceFirstOpen = Duration.between(record.getFirstOpen(), record.getLastOpen());
        if (record.getOpens() == burstThreshold && sinceFirstOpen.compareTo(burstWindow) <= 0) {
            return Optional.of(EngagementSignal.BURST);
        }
        if (sinceFirstOpen.compareTo(revivalAfter) >= 0) {
            return Optional.of(EngagementSignal.REVIVAL);
        }
        return Optional.empty();
    }

    private void notifySender(EngagementSignal signal, TrackingRecord record) {
        switch (signal) {
            case FIRST_OPEN:
                log.info("Email {} (campaign {}) opened for the first time on {}",
                        record.getEmailId(), record.getCampaignId(), record.getDevice());
                break;
            case BURST:
                log.info("Email {} opened {} times within {} of first open",
                        record.getEmailId(), record.getOpens(), burstWindow);
                break;
            case REVIVAL:
                log.info("Email {} opened again {} days after first open",
                        record.getEmailId(), Duration.between(record.getFirstOpen(), record.getLastOpen()).toDays());
                break;
            default:
                break;
        }
    }
}
