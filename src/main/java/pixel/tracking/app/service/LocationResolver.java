package pixel.tracking.app.service;

import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Coarse location from a client address, without any network lookup.
 */
@Component
public class LocationResolver {
    public static final String LOCAL = "Local";
    public static final String UNKNOWN = "Unknown";

    /**
     * @return "Local" for loopback, private and link-local addresses, "Unknown" for
     *         anything else, null when there is no address
     */
    public String resolve(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return null;
        }
        if (!looksLikeLiteral(ipAddress)) {
            return UNKNOWN;
        }
        try {
            // A literal address never triggers DNS resolution
            InetAddress address = InetAddress.getByName(ipAddress.trim());
            if (address.isLoopbackAddress() || address.isSiteLocalAddress() || address.isLinkLocalAddress()) {
                return LOCAL;
            }
            return UNKNOWN;
        } catch (UnknownHostException e) {
            return UNKNOWN;
        }
    }

    private boolean looksLikeLiteral(String ipAddress) {
        String value = ipAddress.trim();
        if (value.indexOf(':') >= 0) {
            for (char c : value.toCharArray()) {
                if (Character.digit(c, 16) < 0 && c != ':' && c != '.') {
                    return false;
                }
            }
            return true;
        }
        if (!value.matches("\\d{1,3}(\\.\\d{1,3}){3}")) {
            return false;
        }
        for (String octet : value.split("\\.")) {
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }
}
