package com.webauth.userstore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An authenticated principal as loaded by a {@link UserStore}.
 * <p>
 * {@code row} holds the configured extra columns in selection order. It never carries the
 * password hash; the store strips it before constructing the user. Column values may be null.
 *
 * @param id  value of the configured id column (type as returned by the database)
 * @param row extra column values keyed by configured column name
 */
public record User(Object id, Map<String, Object> row) {

    public User {
        Objects.requireNonNull(id, "id must not be null");
        row = row == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }

    /**
     * Returns the id as a string, e.g. for binding it to a session token.
     */
    public String idAsString() {
        return String.valueOf(id);
    }
}
