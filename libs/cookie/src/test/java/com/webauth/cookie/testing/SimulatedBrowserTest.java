package com.webauth.cookie.testing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SimulatedBrowser")
class SimulatedBrowserTest {

    private final SimulatedBrowser browser =
            new SimulatedBrowser(Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("ignores headers other than Set-Cookie")
    void ignoresOtherHeaders() {
        browser.addHeader("Content-Type", "text/html");

        assertThat(browser.cookieNames()).isEmpty();
    }

    @Test
    @DisplayName("falls back to Expires when Max-Age is absent")
    void usesExpires() {
        browser.addHeader("Set-Cookie", "a=1; Expires=Thu, 15 Jan 2026 10:10:00 GMT");

        assertThat(browser.get("a")).contains("1");
        browser.advance(Duration.ofMinutes(10));
        assertThat(browser.get("a")).isEmpty();
    }

    @Test
    @DisplayName("Max-Age wins over Expires")
    void maxAgeWins() {
        browser.addHeader("Set-Cookie", "a=1; Expires=Thu, 15 Jan 2026 10:10:00 GMT; Max-Age=3600");

        browser.advance(Duration.ofMinutes(30));

        assertThat(browser.get("a")).contains("1");
    }

    @Test
    @DisplayName("keeps a cookie without expiry as a session cookie")
    void sessionCookie() {
        browser.addHeader("Set-Cookie", "a=1; Path=/");

        browser.advance(Duration.ofDays(365));

        assertThat(browser.get("a")).contains("1");
    }

    @Test
    @DisplayName("rejects a header without name=value")
    void rejectsMalformedHeader() {
        assertThatThrownBy(() -> browser.addHeader("Set-Cookie", "garbage"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
