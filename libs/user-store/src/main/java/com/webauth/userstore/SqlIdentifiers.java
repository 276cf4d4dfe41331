package com.webauth.userstore;

import java.util.regex.Pattern;

/**
 * Guards table and column names, which are the only parts of a statement not passed as bound
 * parameters.
 */
final class SqlIdentifiers {

    /** Plain SQL identifier, also used as the Bean Validation pattern on {@link UserStoreProperties}. */
    static final String PATTERN = "[A-Za-z_][A-Za-z0-9_]*";

    private static final Pattern IDENTIFIER = Pattern.compile(PATTERN);

    private SqlIdentifiers() {
        // utility class
    }

    /**
     * @param identifier the table or column name
     * @param role       what the identifier names, used in the error message
     * @return the identifier, unchanged
     * @throws IllegalArgumentException if the identifier is not a plain SQL identifier
     */
    static String require(String identifier, String role) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(role + " is not a valid SQL identifier: " + identifier);
        }
        return identifier;
    }
}
