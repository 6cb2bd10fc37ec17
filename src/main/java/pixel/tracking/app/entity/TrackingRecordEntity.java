package pixel.tracking.app.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.domain.Persistable;
import pixel.tracking.app.model.TrackingRecord;

import java.time.Instant;

@Entity
@Table(name = "tracking_records",
       indexes = @Index(name = "idx_tracking_records_campaign", columnList = "campaignId"))
@Getter
@Setter
@ToString
public class TrackingRecordEntity implements Persistable<String> {
    @Id
    @Column(length = 64)
    private String identifier;

    private String emailId;

    private String campaignId;

    private long opens;

    private Instant firstOpen;

    private Instant lastOpen;

    @Enumerated(EnumType.STRING)
    private DeviceType device;

    private String ipAddress;

    @Column(length = 1024)
    private String userAgent;

    private String location;

    // True only for rows from forInsert(); they are persisted, never merged
    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    private boolean newRecord;

    public static TrackingRecordEntity forInsert() {
        TrackingRecordEntity entity = new TrackingRecordEntity();
        entity.newRecord = true;
        return entity;
    }

    @Override
    public String getId() {
        return identifier;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newRecord = false;
    }

    public TrackingRecord toRecord() {
        return TrackingRecord.builder()
            .identifier(identifier)
            .emailId(emailId)
            .campaignId(campaignId)
            .opens(opens)
            .firstOpen(firstOpen)
            .lastOpen(lastOpen)
            .device(device)
            .ipAddress(ipAddress)
            .userAgent(userAgent)
            .location(location)
            .build();
    }

    public void copyFrom(TrackingRecord record) {
        this.identifier = record.getIdentifier();
        this.emailId = record.getEmailId();
        this.campaignId = record.getCampaignId();
        this.opens = record.getOpens();
        this.firstOpen = record.getFirstOpen();
        this.lastOpen = record.getLastOpen();
        this.device = record.getDevice();
        this.ipAddress = record.getIpAddress();
        this.userAgent = truncate(record.getUserAgent(), 1024);
        this.location = record.getLocation();
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
