package com.webauth.cookie;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes a {@link CookieManager} built from {@link CookieProperties}.
 */
@Configuration
@EnableConfigurationProperties(CookieProperties.class)
public class CookieConfig {

    @Bean
    @ConditionalOnMissingBean(CookieManager.class)
    public CookieManager cookieManager(CookieProperties properties) {
        return new DefaultCookieManager(properties);
    }
}
