package com.webauth.userstore;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;

/**
 * Creates the users table described by {@link UserStoreProperties} with Flyway.
 * <p>
 * Migrations live in {@value #LOCATION} and use placeholders for the table and column names.
 * History is kept in its own table ({@value #HISTORY_TABLE}) so this runs alongside an
 * application's own Flyway setup without interfering with it.
 */
public class UserSchemaMigration {

    private static final Logger log = LoggerFactory.getLogger(UserSchemaMigration.class);

    /** Classpath location of the users-table migrations. */
    public static final String LOCATION = "classpath:db/migration/webauth";

    /** Flyway history table used for these migrations. */
    public static final String HISTORY_TABLE = "webauth_schema_history";

    private final Flyway flyway;

    public UserSchemaMigration(DataSource dataSource, UserStoreProperties properties) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(LOCATION)
                .table(HISTORY_TABLE)
                .placeholders(Map.of(
                        "users_table", properties.usersTable(),
                        "id_field", properties.idField(),
                        "username_field", properties.usernameField(),
                        "password_field", properties.passwordField()))
                // existing schemas get a baseline below V1 so the users table is still created
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .cleanDisabled(true)
                .load();
    }

    /**
     * Applies pending migrations.
     *
     * @return the number of migrations executed
     */
    public int migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Users schema migration applied {} migration(s), now at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return result.migrationsExecuted;
    }
}
