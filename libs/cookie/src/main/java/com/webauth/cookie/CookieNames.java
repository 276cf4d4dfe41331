package com.webauth.cookie;

import java.util.regex.Pattern;

/**
 * Cookie name rules shared by the manager and its configuration.
 */
final class CookieNames {

    /** RFC 6265 {@code token}: visible ASCII without separators. */
    static final String TOKEN_PATTERN = "[!#$%&'*+\\-.^_`|~0-9A-Za-z]+";

    private static final Pattern TOKEN = Pattern.compile(TOKEN_PATTERN);

    private CookieNames() {
        // utility class
    }

    static boolean isToken(String name) {
        return name != null && TOKEN.matcher(name).matches();
    }
}
