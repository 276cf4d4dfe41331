package com.webauth.userstore;

import com.webauth.digest.Digest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link UserStore} over a relational table, using Spring JDBC.
 * <p>
 * Expected table shape (names configurable through {@link UserStoreProperties}):
 *
 * <pre>{@code
 * CREATE TABLE users (
 *     id       BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
 *     username VARCHAR(255) NOT NULL UNIQUE,
 *     password VARCHAR(255) NOT NULL
 * );
 * }</pre>
 *
 * Other columns may exist and are returned when listed in {@link UserStoreProperties#columns()}.
 * The id does not have to be numeric; it may even be the username.
 * <p>
 * Every statement selects the id column (plus the password column for credential checks)
 * followed by the extra columns, and binds all values as parameters. Rows are read into a
 * mapping keyed by the configured column names, whatever case the driver reports.
 */
public class JdbcUserStore implements UserStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcUserStore.class);

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final Digest digest;
    private final UserStoreProperties properties;
    private final List<String> extraColumns;

    /**
     * Creates a store with its own template and transaction manager over {@code dataSource}.
     */
    public JdbcUserStore(DataSource dataSource, Digest digest, UserStoreProperties properties) {
        this(new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
                digest, properties);
    }

    /**
     * @throws IllegalArgumentException if a configured table or column name is not a plain SQL identifier
     */
    public JdbcUserStore(
            JdbcTemplate jdbc,
            TransactionTemplate transactions,
            Digest digest,
            UserStoreProperties properties) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.transactions = Objects.requireNonNull(transactions, "transactions must not be null");
        this.digest = Objects.requireNonNull(digest, "digest must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        SqlIdentifiers.require(properties.usersTable(), "users table");
        SqlIdentifiers.require(properties.idField(), "id field");
        SqlIdentifiers.require(properties.usernameField(), "username field");
        SqlIdentifiers.require(properties.passwordField(), "password field");
        properties.columns().forEach(column -> SqlIdentifiers.require(column, "column"));
        this.extraColumns = properties.columns().stream()
                .filter(column -> !column.equalsIgnoreCase(properties.idField()))
                .filter(column -> !column.equalsIgnoreCase(properties.passwordField()))
                .distinct()
                .toList();
    }

    @Override
    public Optional<User> loadUser(String username, String password) {
        requireText(username, "username");
        requireText(password, "password");

        List<String> selection = selection(properties.idField(), properties.passwordField());
        Optional<Map<String, Object>> row = queryForRow(selection, properties.usernameField(), username);

        Object id = row.map(r -> r.get(properties.idField())).orElse(null);
        String storedHash = row.map(r -> r.get(properties.passwordField())).map(Object::toString).orElse(null);
        if (id == null || storedHash == null || storedHash.isEmpty() || !digest.validate(storedHash, password)) {
            // same message for unknown user and wrong password
            log.warn("Unable to load user {}: invalid username or password", username);
            return Optional.empty();
        }
        return Optional.of(toUser(row.get()));
    }

    @Override
    public Optional<User> loadUserById(Object userId) {
        if (userId == null || (userId instanceof CharSequence text && text.isEmpty())) {
            throw new IllegalArgumentException("userId must not be empty");
        }

        Optional<Map<String, Object>> row =
                queryForRow(selection(properties.idField()), properties.idField(), userId);
        if (row.isEmpty()) {
            log.warn("Unable to load user by id {}: no such user", userId);
            return Optional.empty();
        }
        return Optional.of(toUser(row.get()));
    }

    @Override
    public Optional<User> storeUser(String username, String password, Map<String, Object> extraValues) {
        requireText(username, "username");
        requireText(password, "password");

        Map<String, Object> values = new LinkedHashMap<>();
        if (extraValues != null) {
            values.putAll(extraValues);
        }
        values.keySet().forEach(column -> SqlIdentifiers.require(column, "column"));
        values.put(properties.usernameField(), username);
        values.put(properties.passwordField(), digest.generate(password));

        return Objects.requireNonNull(transactions.execute(status -> insertAndReadBack(values, username)));
    }

    public UserStoreProperties properties() {
        return properties;
    }

    // ── Private Helpers ──

    /**
     * Inserts the row and reads it back by its id, inside the caller's transaction. An id passed
     * in the values wins over a generated key. A duplicate username fails the insert with the
     * driver's constraint violation.
     */
    private Optional<User> insertAndReadBack(Map<String, Object> values, String username) {
        List<String> columns = new ArrayList<>(values.keySet());
        String sql = "INSERT INTO " + properties.usersTable()
                + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", columns.stream().map(column -> "?").toList()) + ")";
        Object[] args = values.values().toArray();

        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            new ArgumentPreparedStatementSetter(args).setValues(ps);
            return ps;
        }, keys);

        Object id = Optional.ofNullable(values.get(properties.idField()))
                .or(() -> generatedId(keys))
                .orElse(null);
        Optional<Map<String, Object>> row = id != null
                ? queryForRow(selection(properties.idField()), properties.idField(), id)
                : queryForRow(selection(properties.idField()), properties.usernameField(), username);
        if (row.isEmpty()) {
            log.warn("Unable to load user {} after insert", username);
            return Optional.empty();
        }
        log.info("Stored user {} with id {}", username, row.get().get(properties.idField()));
        return Optional.of(toUser(row.get()));
    }

    /**
     * Picks the id out of the generated keys. Drivers differ: some return only identity
     * columns, some the whole row, and column-name case varies.
     */
    private Optional<Object> generatedId(KeyHolder keys) {
        List<Map<String, Object>> keyList = keys.getKeyList();
        if (keyList.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> generated = keyList.get(0);
        for (Map.Entry<String, Object> entry : generated.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(properties.idField())) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        if (generated.size() == 1) {
            return Optional.ofNullable(generated.values().iterator().next());
        }
        return Optional.empty();
    }

    /**
     * Mandatory columns first, then the configured extra columns.
     */
    private List<String> selection(String... mandatory) {
        Set<String> columns = new LinkedHashSet<>(List.of(mandatory));
        columns.addAll(extraColumns);
        return List.copyOf(columns);
    }

    private Optional<Map<String, Object>> queryForRow(List<String> selection, String whereField, Object value) {
        String sql = "SELECT " + String.join(", ", selection)
                + " FROM " + properties.usersTable()
                + " WHERE " + whereField + " = ?";
        List<Map<String, Object>> rows = jdbc.queryForList(sql, value);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        // ColumnMapRowMapper keys are case-insensitive; re-key by the configured names
        Map<String, Object> raw = rows.get(0);
        Map<String, Object> record = new LinkedHashMap<>();
        for (String column : selection) {
            record.put(column, raw.get(column));
        }
        return Optional.of(record);
    }

    private User toUser(Map<String, Object> record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : extraColumns) {
            row.put(column, record.get(column));
        }
        return new User(record.get(properties.idField()), row);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
