package pixel.tracking.app.model;

import lombok.Value;

@Value
public class InjectionResult {
    String content;
    String pixelId;
    String pixelUrl;
}
