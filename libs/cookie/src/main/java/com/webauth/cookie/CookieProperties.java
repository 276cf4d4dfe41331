package com.webauth.cookie;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Process-wide cookie settings bound from {@code webauth.cookie.*}.
 * <p>
 * Every cookie issued by one {@link CookieManager} shares the prefix and the attribute set.
 * Attributes left unset are omitted from the {@code Set-Cookie} header.
 *
 * <pre>
 * webauth:
 *   cookie:
 *     prefix: web_authenticate_
 *     domain: example.com
 *     path: /
 *     secure: true
 *     http-only: true
 *     same-site: lax
 * </pre>
 *
 * @param prefix   namespace prepended to every cookie name (default {@value #DEFAULT_PREFIX})
 * @param domain   {@code Domain} attribute, or null to omit
 * @param path     {@code Path} attribute, or null to omit
 * @param secure   whether to send the {@code Secure} flag
 * @param httpOnly whether to send the {@code HttpOnly} flag
 * @param sameSite {@code SameSite} attribute, or null to omit
 */
@Validated
@ConfigurationProperties(prefix = "webauth.cookie")
public record CookieProperties(
        @Pattern(regexp = CookieNames.TOKEN_PATTERN) String prefix,
        String domain,
        String path,
        boolean secure,
        boolean httpOnly,
        SameSite sameSite
) {

    public static final String DEFAULT_PREFIX = "web_authenticate_";

    /**
     * Compact constructor, applies the default prefix and normalizes blank attributes to unset.
     */
    public CookieProperties {
        if (prefix == null || prefix.isBlank()) {
            prefix = DEFAULT_PREFIX;
        }
        if (domain != null && domain.isBlank()) {
            domain = null;
        }
        if (path != null && path.isBlank()) {
            path = null;
        }
    }

    /**
     * Returns properties with the default prefix and no attributes.
     */
    public static CookieProperties defaults() {
        return new CookieProperties(null, null, null, false, false, null);
    }
}
