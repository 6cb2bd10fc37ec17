package pixel.tracking.app.service;

import pixel.tracking.app.entity.DeviceType;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps a User-Agent string to a coarse device category.
 */
@Component
public class DeviceClassifier {

    public DeviceType classify(String signature) {
        if (signature == null) {
            return DeviceType.DESKTOP;
        }
        String ua = signature.toLowerCase(Locale.ROOT);
        // Tablet first: iPad and Android tablet agents often also say "mobile"
        if (ua.contains("tablet") || ua.contains("ipad")) {
            return DeviceType.TABLET;
        }
        if (ua.contains("mobile") || ua.contains("iphone") || ua.contains("android")) {
            return DeviceType.MOBILE;
        }
        return DeviceType.DESKTOP;
    }
}
