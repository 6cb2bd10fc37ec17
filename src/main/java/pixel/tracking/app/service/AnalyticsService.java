package pixel.tracking.app.service;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.model.OpenRate;
import pixel.tracking.app.model.OpeningHour;
import pixel.tracking.app.model.TrackingRecord;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Campaign-level open analytics. The number of messages sent is not known here and
 * must come from the caller.
 */
@Slf4j
@Service
public class AnalyticsService {
    static final String UNKNOWN_BUCKET = "unknown";
    static final int TOP_OPENING_HOURS = 3;

    private final OpenEventRecorder openEventRecorder;

    public AnalyticsService(OpenEventRecorder openEventRecorder) {
        this.openEventRecorder = openEventRecorder;
    }

    /**
     * Open rate of a campaign. {@code opened} counts distinct email ids with at least one open.
     * @param campaignId The campaign
     * @param sentCount Messages sent for the campaign, as known by the caller
     * @return sent, opened and rate in percent; rate is 0 when nothing was sent
     * @throws IllegalArgumentException if sentCount is negative
     */
    public OpenRate openRate(String campaignId, long sentCount) {
        if (sentCount < 0) {
            throw new IllegalArgumentException("sentCount must not be negative: " + sentCount);
        }
        return openRate(openEventRecorder.listByCampaign(campaignId), sentCount);
    }

    private OpenRate openRate(List<TrackingRecord> records, long sentCount) {
        long opened = records.stream()
            .map(TrackingRecord::getEmailId)
            .filter(Objects::nonNull)
            .distinct()
            .count();
        double rate = sentCount > 0 ? (double) opened / sentCount * 100 : 0;
        return new OpenRate(sentCount, opened, rate);
    }

    /**
     * Number of records per device category, with unclassified records under "unknown".
     */
    public Map<String, Long> deviceBreakdown(String campaignId) {
        return deviceBreakdown(openEventRecorder.listByCampaign(campaignId));
    }

    private Map<String, Long> deviceBreakdown(List<TrackingRecord> records) {
        return countBy(records, record -> record.getDevice() != null ? record.getDevice().label() : UNKNOWN_BUCKET);
    }

    public Map<String, Long> locationBreakdown(String campaignId) {
        return countBy(openEventRecorder.listByCampaign(campaignId),
            record -> record.getLocation() != null ? record.getLocation() : UNKNOWN_BUCKET);
    }

    /**
     * The busiest hours of day (UTC) for first opens in a campaign, busiest first, at most three.
     * Ties go to the earlier hour.
     */
    public List<OpeningHour> bestOpeningHours(String campaignId) {
        Map<Integer, Long> byHour = openEventRecorder.listByCampaign(campaignId).stream()
            .filter(record -> record.getFirstOpen() != null)
            .collect(Collectors.groupingBy(record -> record.getFirstOpen().atZone(ZoneOffset.UTC).getHour(),
                Collectors.counting()));
        return byHour.entrySet().stream()
            .map(entry -> new OpeningHour(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingLong(OpeningHour::getFirstOpens).reversed()
                .thenComparingInt(OpeningHour::getHour))
            .limit(TOP_OPENING_HOURS)
            .collect(Collectors.toList());
    }

    /**
     * Engagement score of one pixel, see {@link #engagementScore(TrackingRecord)}.
     * @return empty if the pixel was never opened
     */
    public Optional<Integer> engagementScore(String pixelId) {
        return openEventRecorder.get(pixelId).map(AnalyticsService::engagementScore);
    }

    /**
     * 0-100: 10 points per open, plus up to 50 points when repeat opens come quickly
     * (50 minus the average minutes between opens).
     */
    static int engagementScore(TrackingRecord record) {
        long score = record.getOpens() * 10;
        if (record.getOpens() > 1 && record.getFirstOpen() != null && record.getLastOpen() != null) {
            double minutesBetweenOpens = Duration.between(record.getFirstOpen(), record.getLastOpen()).toMillis()
                / 60_000.0 / (record.getOpens() - 1);
            score += Math.max(0, 50 - Math.round(minutesBetweenOpens));
        }
        return (int) Math.min(100, Math.max(0, score));
    }

    /**
     * Human-readable campaign report: sent, opens, open rate and opens by device.
     * @throws IllegalArgumentException if sentCount is negative
     */
    public String generateReport(String campaignId, long sentCount) {
        if (sentCount < 0) {
            throw new IllegalArgumentException("sentCount must not be negative: " + sentCount);
        }
        // One snapshot for both figures so they agree with each other
        List<TrackingRecord> records = openEventRecorder.listByCampaign(campaignId);
        OpenRate openRate = openRate(records, sentCount);
        Map<String, Long> byDevice = deviceBreakdown(records);

        StringBuilder report = new StringBuilder();
        report.append("Campaign: ").append(campaignId).append('\n');
        report.append("Sent: ").append(openRate.getSent()).append('\n');
        report.append("Opens: ").append(openRate.getOpened()).append('\n');
        report.append(String.format(Locale.ROOT, "Open Rate: %.2f%%", openRate.getRate())).append('\n');
        report.append('\n');
        report.append("Opens by Device:").append('\n');
        byDevice.forEach((device, count) -> report.append("  ").append(device).append(": ").append(count).append('\n'));

        log.debug("Generated report for campaign {} over {} records", campaignId, records.size());
        return report.toString();
    }

    private static Map<String, Long> countBy(List<TrackingRecord> records, Function<TrackingRecord, String> key) {
        return records.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }
}
