package pixel.tracking.app.model;

public enum EngagementSignal {
    FIRST_OPEN,
    BURST,
    REVIVAL
}
