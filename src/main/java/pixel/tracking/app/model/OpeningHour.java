package pixel.tracking.app.model;

import lombok.Value;

/**
 * Hour of day (UTC, 0-23) and the number of recipients whose first open fell in it.
 */
@Value
public class OpeningHour {
    int hour;
    long firstOpens;
}
