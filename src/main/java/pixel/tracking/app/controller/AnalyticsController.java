package pixel.tracking.app.controller;

import pixel.tracking.app.model.OpenRate;
import pixel.tracking.app.model.OpeningHour;
import pixel.tracking.app.model.TrackingRecord;
import pixel.tracking.app.service.AnalyticsService;
import pixel.tracking.app.service.OpenEventRecorder;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class AnalyticsController {
    private final AnalyticsService analyticsService;
    private final OpenEventRecorder openEventRecorder;

    public AnalyticsController(AnalyticsService analyticsService, OpenEventRecorder openEventRecorder) {
        this.analyticsService = analyticsService;
        this.openEventRecorder = openEventRecorder;
    }

    @GetMapping("/tracking/pixels/{pixelId}")
    public ResponseEntity<TrackingRecord> record(@PathVariable String pixelId) {
        return openEventRecorder.get(pixelId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/tracking/pixels/{pixelId}/engagement")
    public ResponseEntity<Map<String, Integer>> engagement(@PathVariable String pixelId) {
        return analyticsService.engagementScore(pixelId)
            .map(score -> ResponseEntity.ok(Map.of("score", score)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/campaigns/{campaignId}/open-rate")
    public ResponseEntity<?> openRate(@PathVariable String campaignId, @RequestParam(defaultValue = "0") long sent) {
        try {
            OpenRate openRate = analyticsService.openRate(campaignId, sent);
            return ResponseEntity.ok(openRate);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping(value = "/campaigns/{campaignId}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@PathVariable String campaignId, @RequestParam(defaultValue = "0") long sent) {
        try {
            return ResponseEntity.ok(analyticsService.generateReport(campaignId, sent));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @GetMapping("/campaigns/{campaignId}/devices")
    public Map<String, Long> devices(@PathVariable String campaignId) {
        return analyticsService.deviceBreakdown(campaignId);
    }

    @GetMapping("/campaigns/{campaignId}/locations")
    public Map<String, Long> locations(@PathVariable String campaignId) {
        return analyticsService.locationBreakdown(campaignId);
    }

    @GetMapping("/campaigns/{campaignId}/opening-hours")
    public List<OpeningHour> openingHours(@PathVariable String campaignId) {
        return analyticsService.bestOpeningHours(campaignId);
    }
}
