package com.webauth.cookie;

/**
 * Values of the {@code SameSite} cookie attribute.
 */
public enum SameSite {
    STRICT("Strict"),
    LAX("Lax"),
    NONE("None");

    private final String attributeValue;

    SameSite(String attributeValue) {
        this.attributeValue = attributeValue;
    }

    /**
     * Returns the value as written in a {@code Set-Cookie} header.
     */
    public String attributeValue() {
        return attributeValue;
    }
}
