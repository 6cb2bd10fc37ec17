package pixel.tracking.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Request context of a single pixel fetch. Every field is optional.
 */
@Value
@Builder
public class OpenContext {
    String emailId;
    String campaignId;
    String ipAddress;
    String userAgent;
    String location;

    public static OpenContext empty() {
        return OpenContext.builder().build();
    }
}
