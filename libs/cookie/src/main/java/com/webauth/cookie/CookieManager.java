package com.webauth.cookie;

import java.util.Optional;

/**
 * Issues, reads and deletes browser cookies under one configured name prefix.
 * <p>
 * Implementations hold no per-request state: the request and response boundaries are passed
 * into every call, so one instance serves all requests concurrently.
 */
public interface CookieManager {

    /**
     * Writes a {@code Set-Cookie} header for {@code prefix + name}.
     *
     * @param response          where the header is written
     * @param name              cookie name without the prefix (must not be empty)
     * @param value             cookie value (must not be empty)
     * @param expiresInSeconds  lifetime from now in seconds (must be positive)
     * @throws IllegalArgumentException if any argument is missing or the lifetime is not positive
     */
    void setCookie(ResponseHeaderWriter response, String name, String value, long expiresInSeconds);

    /**
     * Reads the inbound cookie {@code prefix + name}.
     *
     * @param request the inbound request's cookies
     * @param name    cookie name without the prefix (must not be empty)
     * @return the value, or empty if the browser did not send the cookie
     * @throws IllegalArgumentException if the name is empty
     */
    Optional<String> getCookie(RequestCookies request, String name);

    /**
     * Instructs the browser to drop the cookie {@code prefix + name} by re-issuing it already
     * expired.
     *
     * @param response where the header is written
     * @param name     cookie name without the prefix (must not be empty)
     * @throws IllegalArgumentException if the name is empty
     */
    void deleteCookie(ResponseHeaderWriter response, String name);
}
