package com.webauth.cookie.servlet;

import com.webauth.cookie.RequestCookies;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RequestCookies} over a Jakarta Servlet request.
 * <p>
 * When the browser sends the same name twice (e.g. for two paths), the first one wins, which is
 * the most specific path per RFC 6265 ordering.
 */
public final class ServletRequestCookies implements RequestCookies {

    private final HttpServletRequest request;

    public ServletRequestCookies(HttpServletRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    @Override
    public Optional<String> get(String cookieName) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> cookie.getName().equals(cookieName))
                .map(Cookie::getValue)
                .filter(Objects::nonNull)
                .findFirst();
    }
}
