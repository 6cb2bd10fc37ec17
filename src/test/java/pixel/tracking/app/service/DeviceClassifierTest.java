package pixel.tracking.app.service;

import pixel.tracking.app.entity.DeviceType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceClassifierTest {

    private final DeviceClassifier deviceClassifier = new DeviceClassifier();

    @Test
    void classify_IPhone_ShouldBeMobile() {
        assertEquals(DeviceType.MOBILE, deviceClassifier.classify(
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X) AppleWebKit/605.1.15"));
    }

    @Test
    void classify_IPad_ShouldBeTablet() {
        // iPad agents also carry "Mobile"; tablet wins
        assertEquals(DeviceType.TABLET, deviceClassifier.classify(
            "Mozilla/5.0 (iPad; CPU OS 17_0 like Mac OS X) AppleWebKit/605.1.15 Mobile/15E148"));
    }

    @Test
    void classify_Android_ShouldBeMobile() {
        assertEquals(DeviceType.MOBILE, deviceClassifier.classify("Mozilla/5.0 (Linux; Android 14; Pixel 8)"));
    }

    @Test
    void classify_IsCaseInsensitive() {
        assertEquals(DeviceType.TABLET, deviceClassifier.classify("SOME-TABLET-CLIENT"));
        assertEquals(DeviceType.MOBILE, deviceClassifier.classify("generic MOBILE agent"));
    }

    @Test
    void classify_DesktopAgent_ShouldBeDesktop() {
        assertEquals(DeviceType.DESKTOP, deviceClassifier.classify(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 Chrome/126.0 Safari/537.36"));
        assertEquals(DeviceType.DESKTOP, deviceClassifier.classify("Microsoft Outlook 16.0"));
    }
}
