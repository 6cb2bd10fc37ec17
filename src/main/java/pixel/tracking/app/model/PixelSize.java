package pixel.tracking.app.model;

/**
 * Inline styling of the injected image.
 */
public enum PixelSize {
    ONE_BY_ONE("1x1"),
    HIDDEN("hidden");

    private final String value;

    PixelSize(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static PixelSize fromValue(String value) {
        for (PixelSize size : values()) {
            if (size.value.equalsIgnoreCase(value)) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unknown pixel size: " + value);
    }
}
