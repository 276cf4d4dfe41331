package com.webauth.cookie;

import java.util.Optional;

/**
 * Inbound cookie jar of the current request.
 */
@FunctionalInterface
public interface RequestCookies {

    /**
     * Looks up a cookie by its full name (prefix included).
     *
     * @param cookieName exact cookie name as sent by the browser
     * @return the raw cookie value, or empty if the request carries no such cookie
     */
    Optional<String> get(String cookieName);
}
