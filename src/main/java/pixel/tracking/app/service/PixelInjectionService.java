package pixel.tracking.app.service;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.model.InjectionResult;
import pixel.tracking.app.model.PixelOptions;
import pixel.tracking.app.model.PixelPosition;
import pixel.tracking.app.model.PixelSize;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Embeds a tracking pixel into outgoing message content.
 * The pixel only ever goes at a boundary the content already defines: right before the
 * closing body tag, or at the very start or end of the content. It is never placed at an
 * arbitrary offset, where it could split a tag or attribute.
 */
@Slf4j
@Service
public class PixelInjectionService {
    // Comments and scripts are consumed whole, so a </body> inside them never matches the body group
    private static final Pattern BODY_CLOSE = Pattern.compile(
            "<!--.*?(?:-->|\\z)|<script\\b.*?(?:</script\\s*>|\\z)|(?<body></body\\s*>)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TAG_OPEN = Pattern.compile("<[A-Za-z/!?]");

    private final IdentifierGenerator identifierGenerator;
    private final String defaultPixelUrl;
    private final PixelSize defaultSize;
    private final PixelPosition defaultPosition;

    public PixelInjectionService(
            IdentifierGenerator identifierGenerator,
            @Value("${tracking.pixel.base-url:http://localhost:8080/track/open}") String defaultPixelUrl,
            @Value("${tracking.pixel.default-size:1x1}") String defaultSize,
            @Value("${tracking.pixel.default-position:bottom}") String defaultPosition) {
        this.identifierGenerator = identifierGenerator;
        this.defaultPixelUrl = defaultPixelUrl;
        this.defaultSize = PixelSize.fromValue(defaultSize);
        this.defaultPosition = PixelPosition.fromValue(defaultPosition);
    }

    /**
     * Thrown when content cannot be tracked safely. The message must not be sent as-is.
     */
    public static class InjectionException extends RuntimeException {
        public InjectionException(String message) {
            super(message);
        }

        public InjectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Inject a pixel into HTML content.
     * If the document has a closing body tag the pixel goes right before the last one,
     * whatever the configured position. Body tags inside comments and script blocks are ignored.
     * Otherwise it is prepended or appended.
     * @param document The HTML document
     * @param options Per-call options, may be null
     * @return The modified document and the issued identifier
     * @throws InjectionException if the base URL is malformed or the document cannot be modified safely
     */
    public InjectionResult injectIntoStructuredDocument(String document, PixelOptions options) {
        if (document == null) {
            throw new InjectionException("Document is null");
        }
        PixelOptions opts = options != null ? options : PixelOptions.defaults();
        PixelPosition position = opts.getPosition() != null ? opts.getPosition() : defaultPosition;

        int bodyClose = lastBodyClose(document);
        if (bodyClose < 0 && position == PixelPosition.BOTTOM && endsInsideTag(document)) {
            throw new InjectionException("Document ends inside an unterminated tag");
        }

        String pixelId = identifierGenerator.generate();
        String pixelUrl = buildPixelUrl(resolveBaseUrl(opts), pixelId, opts);
        String pixelHtml = pixelHtml(pixelUrl, opts);

        String modified;
        if (bodyClose >= 0) {
            modified = document.substring(0, bodyClose) + pixelHtml + document.substring(bodyClose);
        } else {
            modified = insertAtBoundary(document, pixelHtml, position);
        }

        log.debug("Injected pixel {} into HTML document (body tag found: {})", pixelId, bodyClose >= 0);
        return new InjectionResult(modified, pixelId, pixelUrl);
    }

    /**
     * Inject a pixel into content without HTML structure, at the start or end per the configured position.
     * @throws InjectionException if the base URL is malformed or the content is null
     */
    public InjectionResult injectIntoPlainContent(String content, PixelOptions options) {
        if (content == null) {
            throw new InjectionException("Content is null");
        }
        PixelOptions opts = options != null ? options : PixelOptions.defaults();
        PixelPosition position = opts.getPosition() != null ? opts.getPosition() : defaultPosition;

        String pixelId = identifierGenerator.generate();
        String pixelUrl = buildPixelUrl(resolveBaseUrl(opts), pixelId, opts);
        String modified = insertAtBoundary(content, pixelHtml(pixelUrl, opts), position);

        log.debug("Injected pixel {} into plain content at {}", pixelId, position);
        return new InjectionResult(modified, pixelId, pixelUrl);
    }

    /**
     * Build the pixel URL: base endpoint plus pixelId, and campaignId, emailId and recipient when set.
     * Values are percent-encoded as UTF-8, so any Unicode recipient survives the round trip.
     * @throws InjectionException if the base URL is not an absolute http(s) URL
     */
    String buildPixelUrl(String baseUrl, String pixelId, PixelOptions options) {
        URI base = parseBaseUrl(baseUrl);
        StringBuilder url = new StringBuilder(baseUrl.trim());

        String query = base.getRawQuery();
        if (query == null) {
            url.append('?');
        } else if (!query.isEmpty()) {
            url.append('&');
        }

        url.append("pixelId=").append(encode(pixelId));
        appendIfPresent(url, "campaignId", options.getCampaignId());
        appendIfPresent(url, "emailId", options.getEmailId());
        appendIfPresent(url, "recipient", options.getRecipient());
        return url.toString();
    }

    private URI parseBaseUrl(String baseUrl) {
        if (!StringUtils.hasText(baseUrl)) {
            throw new InjectionException("Pixel base URL is empty");
        }
        URI uri;
        try {
            uri = new URI(baseUrl.trim());
        } catch (URISyntaxException e) {
            throw new InjectionException("Malformed pixel base URL: " + baseUrl, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new InjectionException("Pixel base URL must be http or https: " + baseUrl);
        }
        if (uri.getHost() == null) {
            throw new InjectionException("Pixel base URL has no host: " + baseUrl);
        }
        if (uri.getRawFragment() != null) {
            throw new InjectionException("Pixel base URL must not have a fragment: " + baseUrl);
        }
        return uri;
    }

    private String resolveBaseUrl(PixelOptions options) {
        return StringUtils.hasText(options.getPixelUrl()) ? options.getPixelUrl() : defaultPixelUrl;
    }

    private static void appendIfPresent(StringBuilder url, String name, String value) {
        if (StringUtils.hasText(value)) {
            url.append('&').append(name).append('=').append(encode(value));
        }
    }

    private static String encode(String value) {
        // URLEncoder does form encoding; spaces must be %20, not '+'
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private String pixelHtml(String pixelUrl, PixelOptions options) {
        PixelSize size = options.getPixelSize() != null ? options.getPixelSize() : defaultSize;
        String src = HtmlUtils.htmlEscape(pixelUrl);
        if (size == PixelSize.HIDDEN) {
            return "<img src=\"" + src + "\" alt=\"\" style=\"display:none;width:0;height:0;border:0;\" aria-hidden=\"true\" />";
        }
        return "<img src=\"" + src + "\" width=\"1\" height=\"1\" alt=\"\" "
                + "style=\"display:none;width:1px;height:1px;border:0;\" aria-hidden=\"true\" />";
    }

    private static String insertAtBoundary(String content, String pixelHtml, PixelPosition position) {
        return position == PixelPosition.TOP ? pixelHtml + content : content + pixelHtml;
    }

    private static int lastBodyClose(String document) {
        Matcher matcher = BODY_CLOSE.matcher(document);
        int last = -1;
        while (matcher.find()) {
            if (matcher.group("body") != null) {
                last = matcher.start();
            }
        }
        return last;
    }

    /**
     * True when a tag or comment is opened after the last '>'. A bare '<' in text does not count.
     */
    private static boolean endsInsideTag(String document) {
        Matcher matcher = TAG_OPEN.matcher(document);
        int lastTagOpen = -1;
        while (matcher.find()) {
            lastTagOpen = matcher.start();
        }
        return lastTagOpen > document.lastIndexOf('>');
    }
}
