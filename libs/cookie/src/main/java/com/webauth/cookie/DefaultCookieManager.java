package com.webauth.cookie;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link CookieManager}.
 * <p>
 * Creation and deletion share a single code path: a cookie is always "baked" with a signed
 * offset from now. A positive offset stores it, {@link #DELETION_OFFSET_SECONDS} expires it.
 * Both {@code Expires} and {@code Max-Age} are derived from the same offset, capped at the
 * last second of year 9999.
 * <p>
 * Values are URL-encoded on write and decoded on read, so opaque tokens may contain any
 * character.
 */
public class DefaultCookieManager implements CookieManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultCookieManager.class);

    /** Offset used to expire a cookie; far enough in the past to survive any clock skew. */
    public static final long DELETION_OFFSET_SECONDS = -123_456_789L;

    /** Latest instant {@code Expires} can carry; RFC 1123 dates have a four-digit year. */
    static final Instant LATEST_EXPIRES = Instant.parse("9999-12-31T23:59:59Z");

    private static final DateTimeFormatter EXPIRES_FORMAT = DateTimeFormatter.RFC_1123_DATE_TIME;

    private final CookieProperties properties;
    private final Clock clock;

    public DefaultCookieManager(CookieProperties properties) {
        this(properties, Clock.systemUTC());
    }

    /**
     * @param properties cookie prefix and attributes
     * @param clock      source of "now" for the {@code Expires} attribute
     * @throws IllegalArgumentException if the prefix contains characters not allowed in a cookie name
     */
    public DefaultCookieManager(CookieProperties properties, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (!CookieNames.isToken(properties.prefix())) {
            throw new IllegalArgumentException("cookie prefix is not a valid cookie name: " + properties.prefix());
        }
    }

    @Override
    public void setCookie(ResponseHeaderWriter response, String name, String value, long expiresInSeconds) {
        requireName(name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("cookie value must not be empty");
        }
        if (expiresInSeconds <= 0) {
            throw new IllegalArgumentException("expiresInSeconds must be positive, got " + expiresInSeconds);
        }
        bake(response, name, value, expiresInSeconds);
    }

    @Override
    public Optional<String> getCookie(RequestCookies request, String name) {
        requireName(name);
        Objects.requireNonNull(request, "request must not be null");

        String cookieName = cookieName(name);
        return request.get(cookieName)
                .filter(value -> !value.isEmpty())
                .flatMap(value -> decode(cookieName, value));
    }

    @Override
    public void deleteCookie(ResponseHeaderWriter response, String name) {
        requireName(name);
        bake(response, name, "", DELETION_OFFSET_SECONDS);
    }

    /**
     * Returns the full cookie name, prefix included.
     */
    public String cookieName(String name) {
        return properties.prefix() + name;
    }

    public CookieProperties properties() {
        return properties;
    }

    // ── Private Helpers ──

    private void bake(ResponseHeaderWriter response, String name, String value, long offsetSeconds) {
        Objects.requireNonNull(response, "response must not be null");
        String header = formatSetCookie(cookieName(name), value, offsetSeconds);
        response.addHeader(ResponseHeaderWriter.SET_COOKIE, header);
        log.debug("{} cookie {} (offset {}s)",
                offsetSeconds > 0 ? "Issued" : "Expired", cookieName(name), offsetSeconds);
    }

    private String formatSetCookie(String cookieName, String value, long offsetSeconds) {
        Instant now = Instant.now(clock);
        long maxAge = Math.min(offsetSeconds, Duration.between(now, LATEST_EXPIRES).getSeconds());
        Instant expires = now.plusSeconds(maxAge);

        StringBuilder header = new StringBuilder()
                .append(cookieName).append('=').append(encode(value))
                .append("; Expires=").append(EXPIRES_FORMAT.format(expires.atOffset(ZoneOffset.UTC)))
                .append("; Max-Age=").append(maxAge);
        if (properties.domain() != null) {
            header.append("; Domain=").append(properties.domain());
        }
        if (properties.path() != null) {
            header.append("; Path=").append(properties.path());
        }
        if (properties.secure()) {
            header.append("; Secure");
        }
        if (properties.httpOnly()) {
            header.append("; HttpOnly");
        }
        if (properties.sameSite() != null) {
            header.append("; SameSite=").append(properties.sameSite().attributeValue());
        }
        return header.toString();
    }

    private void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("cookie name must not be empty");
        }
        if (!CookieNames.isToken(name)) {
            throw new IllegalArgumentException("cookie name contains characters not allowed in a cookie: " + name);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static Optional<String> decode(String cookieName, String value) {
        try {
            return Optional.of(URLDecoder.decode(value, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring cookie {} with malformed encoding", cookieName);
            return Optional.empty();
        }
    }
}
