package com.webauth.userstore;

import com.webauth.digest.Digest;
import com.webauth.digest.DigestConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;

/**
 * Wires a {@link JdbcUserStore} over the application's {@link DataSource} and {@link Digest}.
 * <p>
 * With {@code webauth.user-store.migrate=true} the users table is created on startup.
 */
@Configuration
@Import(DigestConfig.class)
@EnableConfigurationProperties(UserStoreProperties.class)
public class UserStoreConfig {

    @Bean
    @ConditionalOnMissingBean(UserStore.class)
    public UserStore userStore(DataSource dataSource, Digest digest, UserStoreProperties properties) {
        return new JdbcUserStore(dataSource, digest, properties);
    }

    @Bean(initMethod = "migrate")
    @ConditionalOnProperty(prefix = "webauth.user-store", name = "migrate", havingValue = "true")
    public UserSchemaMigration userSchemaMigration(DataSource dataSource, UserStoreProperties properties) {
        return new UserSchemaMigration(dataSource, properties);
    }
}
