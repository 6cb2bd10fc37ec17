package pixel.tracking.app.model;

/**
 * Where the pixel goes when the content has no closing body marker.
 */
public enum PixelPosition {
    TOP,
    BOTTOM;

    public static PixelPosition fromValue(String value) {
        for (PixelPosition position : values()) {
            if (position.name().equalsIgnoreCase(value)) {
                return position;
            }
        }
        throw new IllegalArgumentException("Unknown pixel position: " + value);
    }
}
