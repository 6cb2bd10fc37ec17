package pixel.tracking.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call injection options. Unset fields fall back to the configured defaults.
 */
@Value
@Builder
public class PixelOptions {
    String pixelUrl;
    PixelSize pixelSize;
    PixelPosition position;
    String campaignId;
    String emailId;
    String recipient;

    public static PixelOptions defaults() {
        return PixelOptions.builder().build();
    }
}
