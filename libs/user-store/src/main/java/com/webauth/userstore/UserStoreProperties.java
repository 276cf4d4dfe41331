package com.webauth.userstore;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Schema mapping for {@link JdbcUserStore}, bound from {@code webauth.user-store.*}.
 * <p>
 * Every name must be a plain SQL identifier. Binding rejects anything else, and
 * {@link JdbcUserStore} checks again before splicing the names into statements.
 *
 * <pre>
 * webauth:
 *   user-store:
 *     users-table: users
 *     id-field: id
 *     username-field: username
 *     password-field: password
 *     columns: [name, age]
 *     migrate: false
 * </pre>
 *
 * @param usersTable    table holding the credential records (default {@code users})
 * @param idField       primary-key-like column (default {@code id})
 * @param usernameField unique login column (default {@code username})
 * @param passwordField password hash column (default {@code password})
 * @param columns       extra columns returned in {@link User#row()} (default none)
 * @param migrate       whether to create the table with Flyway on startup (default false)
 */
@Validated
@ConfigurationProperties(prefix = "webauth.user-store")
public record UserStoreProperties(
        @Pattern(regexp = SqlIdentifiers.PATTERN) String usersTable,
        @Pattern(regexp = SqlIdentifiers.PATTERN) String idField,
        @Pattern(regexp = SqlIdentifiers.PATTERN) String usernameField,
        @Pattern(regexp = SqlIdentifiers.PATTERN) String passwordField,
        List<@Pattern(regexp = SqlIdentifiers.PATTERN) String> columns,
        boolean migrate
) {

    /**
     * Compact constructor, applies defaults.
     *
     * @throws IllegalArgumentException if the password field doubles as the id or username field
     */
    public UserStoreProperties {
        usersTable = orDefault(usersTable, "users");
        idField = orDefault(idField, "id");
        usernameField = orDefault(usernameField, "username");
        passwordField = orDefault(passwordField, "password");
        columns = columns == null ? List.of() : List.copyOf(columns);

        if (passwordField.equalsIgnoreCase(idField) || passwordField.equalsIgnoreCase(usernameField)) {
            throw new IllegalArgumentException("password field must differ from the id and username fields");
        }
    }

    /**
     * Returns the default mapping ({@code users(id, username, password)}, no extra columns).
     */
    public static UserStoreProperties defaults() {
        return new UserStoreProperties(null, null, null, null, null, false);
    }

    /**
     * Returns a copy selecting the given extra columns.
     */
    public UserStoreProperties withColumns(String... extraColumns) {
        return new UserStoreProperties(
                usersTable, idField, usernameField, passwordField, List.of(extraColumns), migrate);
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
