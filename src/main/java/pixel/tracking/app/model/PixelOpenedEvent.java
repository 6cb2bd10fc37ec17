package pixel.tracking.app.model;

import lombok.Value;

/**
 * Published after an open has been stored.
 */
@Value
public class PixelOpenedEvent {
    TrackingRecord record;
}
