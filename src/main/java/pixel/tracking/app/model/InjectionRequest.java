package pixel.tracking.app.model;

import lombok.Data;

@Data
public class InjectionRequest {
    private String content;
    private String format = "html"; // "html" or "plain"
    private String pixelUrl;
    private String pixelSize;
    private String position;
    private String campaignId;
    private String emailId;
    private String recipient;
}
