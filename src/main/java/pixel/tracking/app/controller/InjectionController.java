package pixel.tracking.app.controller;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.model.InjectionRequest;
import pixel.tracking.app.model.InjectionResult;
import pixel.tracking.app.model.PixelOptions;
import pixel.tracking.app.model.PixelPosition;
import pixel.tracking.app.model.PixelSize;
import pixel.tracking.app.service.PixelInjectionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Injection endpoint for the delivery side: takes message content, returns it with a pixel
 * and the issued identifier.
 */
@Slf4j
@RestController
@RequestMapping("/api/tracking")
public class InjectionController {
    private final PixelInjectionService pixelInjectionService;

    public InjectionController(PixelInjectionService pixelInjectionService) {
        this.pixelInjectionService = pixelInjectionService;
    }

    @PostMapping("/inject")
    public ResponseEntity<?> inject(@RequestBody InjectionRequest request) {
        try {
            PixelOptions options = PixelOptions.builder()
                .pixelUrl(request.getPixelUrl())
                .pixelSize(request.getPixelSize() != null ? PixelSize.fromValue(request.getPixelSize()) : null)
                .position(request.getPosition() != null ? PixelPosition.fromValue(request.getPosition()) : null)
                .campaignId(request.getCampaignId())
                .emailId(request.getEmailId())
                .recipient(request.getRecipient())
                .build();

            InjectionResult result = "plain".equalsIgnoreCase(request.getFormat())
                ? pixelInjectionService.injectIntoPlainContent(request.getContent(), options)
                : pixelInjectionService.injectIntoStructuredDocument(request.getContent(), options);
            return ResponseEntity.ok(result);
        } catch (PixelInjectionService.InjectionException | IllegalArgumentException e) {
            log.warn("Rejected pixel injection: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
