package pixel.tracking.app.model;

import lombok.Value;

/**
 * Campaign open rate. {@code rate} is a percentage of {@code sent}.
 */
@Value
public class OpenRate {
    long sent;
    long opened;
    double rate;
}
