package pixel.tracking.app.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.model.OpenContext;
import pixel.tracking.app.service.OpenEventRecorder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;

/**
 * Serves tracking pixels. The image is returned with 200 whether or not the open
 * could be recorded, so tracking never breaks how the email renders.
 */
@Slf4j
@RestController
@RequestMapping("/track")
public class PixelController {
    // 1x1 transparent PNG
    static final byte[] TRACKING_PIXEL = Base64.getDecoder().decode(
        "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAQAAAC1HAwCAAAAC0lEQVR42mNkYAAAAAYAAjCB0C8AAAAASUVORK5CYII=");

    private final OpenEventRecorder openEventRecorder;

    public PixelController(OpenEventRecorder openEventRecorder) {
        this.openEventRecorder = openEventRecorder;
    }

    @GetMapping("/open")
    public ResponseEntity<byte[]> open(
            @RequestParam(required = false) String pixelId,
            @RequestParam(required = false) String campaignId,
            @RequestParam(required = false) String emailId,
            HttpServletRequest request) {
        return servePixel(pixelId, campaignId, emailId, request);
    }

    @GetMapping("/pixel/{pixelId}")
    public ResponseEntity<byte[]> pixel(
            @PathVariable String pixelId,
            @RequestParam(required = false) String campaignId,
            @RequestParam(required = false) String emailId,
            HttpServletRequest request) {
        return servePixel(pixelId, campaignId, emailId, request);
    }

    private ResponseEntity<byte[]> servePixel(String pixelId, String campaignId, String emailId, HttpServletRequest request) {
        try {
            OpenContext context = OpenContext.builder()
                .campaignId(campaignId)
                .emailId(emailId)
                .ipAddress(clientAddress(request))
                .userAgent(request.getHeader(HttpHeaders.USER_AGENT))
                .build();
            openEventRecorder.recordOpen(pixelId, context);
        } catch (Exception e) {
            log.error("Error recording pixel fetch for {}: {}", pixelId, e.getMessage(), e);
        }

        return ResponseEntity.ok()
            .contentType(MediaType.IMAGE_PNG)
            .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
            .header(HttpHeaders.PRAGMA, "no-cache")
            .header(HttpHeaders.EXPIRES, "0")
            .body(TRACKING_PIXEL);
    }

    /**
     * First X-Forwarded-For hop when behind a proxy, otherwise the socket address.
     */
    private String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
