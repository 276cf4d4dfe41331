package com.webauth.cookie;

/**
 * Outbound side of an HTTP exchange, as far as cookies are concerned.
 */
@FunctionalInterface
public interface ResponseHeaderWriter {

    /** Header name used for every cookie this library issues. */
    String SET_COOKIE = "Set-Cookie";

    /**
     * Appends a response header, keeping any header of the same name already written.
     */
    void addHeader(String name, String value);
}
