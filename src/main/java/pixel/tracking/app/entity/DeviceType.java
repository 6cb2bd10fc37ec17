package pixel.tracking.app.entity;

public enum DeviceType {
    DESKTOP,
    MOBILE,
    TABLET;

    /**
     * Lower-case label used in reports and breakdowns.
     */
    public String label() {
        return name().toLowerCase();
    }
}
