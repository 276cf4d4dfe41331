package com.webauth.cookie;

import com.webauth.cookie.testing.SimulatedBrowser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CookieConfig")
class CookieConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CookieConfig.class));

    @Test
    @DisplayName("creates a manager with default properties")
    void defaultManager() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(CookieManager.class);
            assertThat(context.getBean(CookieProperties.class).prefix()).isEqualTo("web_authenticate_");
        });
    }

    @Test
    @DisplayName("binds webauth.cookie properties")
    void bindsProperties() {
        runner.withPropertyValues(
                        "webauth.cookie.prefix=shop_",
                        "webauth.cookie.domain=shop.example",
                        "webauth.cookie.path=/",
                        "webauth.cookie.secure=true",
                        "webauth.cookie.http-only=true",
                        "webauth.cookie.same-site=strict")
                .run(context -> {
                    var props = context.getBean(CookieProperties.class);
                    assertThat(props.prefix()).isEqualTo("shop_");
                    assertThat(props.domain()).isEqualTo("shop.example");
                    assertThat(props.path()).isEqualTo("/");
                    assertThat(props.secure()).isTrue();
                    assertThat(props.httpOnly()).isTrue();
                    assertThat(props.sameSite()).isEqualTo(SameSite.STRICT);

                    var browser = new SimulatedBrowser();
                    context.getBean(CookieManager.class).setCookie(browser, "cart", "42", 60);
                    assertThat(browser.cookieNames()).containsExactly("shop_cart");
                });
    }

    @Test
    @DisplayName("fails to start with an invalid prefix")
    void invalidPrefixFailsStartup() {
        runner.withPropertyValues("webauth.cookie.prefix=bad prefix")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
                });
    }
}
