package com.webauth.digest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the configured {@link Digest} as a bean.
 * <p>
 * An application that declares its own {@code Digest} bean replaces the built-in one.
 */
@Configuration
@EnableConfigurationProperties(DigestProperties.class)
public class DigestConfig {

    private static final Logger log = LoggerFactory.getLogger(DigestConfig.class);

    @Bean
    @ConditionalOnMissingBean(Digest.class)
    public Digest digest(DigestProperties properties) {
        log.info("Using {} password digest", properties.algorithm());
        return properties.algorithm().create(properties.strength());
    }
}
