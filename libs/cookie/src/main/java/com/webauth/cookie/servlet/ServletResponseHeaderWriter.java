package com.webauth.cookie.servlet;

import com.webauth.cookie.ResponseHeaderWriter;
import jakarta.servlet.http.HttpServletResponse;

import java.util.Objects;

/**
 * {@link ResponseHeaderWriter} over a Jakarta Servlet response.
 */
public final class ServletResponseHeaderWriter implements ResponseHeaderWriter {

    private final HttpServletResponse response;

    public ServletResponseHeaderWriter(HttpServletResponse response) {
        this.response = Objects.requireNonNull(response, "response must not be null");
    }

    @Override
    public void addHeader(String name, String value) {
        response.addHeader(name, value);
    }
}
