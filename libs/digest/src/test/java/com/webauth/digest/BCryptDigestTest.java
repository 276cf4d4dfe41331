package com.webauth.digest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BCryptDigest")
class BCryptDigestTest {

    // Lowest cost keeps the suite fast; the algorithm is identical at every cost.
    private final BCryptDigest digest = new BCryptDigest(BCryptDigest.MIN_STRENGTH);

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("produces a BCrypt hash that does not contain the plaintext")
        void producesBcryptHash() {
            String hash = digest.generate("secret");

            assertThat(hash).startsWith("$2a$04$");
            assertThat(hash).doesNotContain("secret");
        }

        @Test
        @DisplayName("salts every hash, so the same password hashes differently")
        void saltsEveryHash() {
            assertThat(digest.generate("secret")).isNotEqualTo(digest.generate("secret"));
        }

        @Test
        @DisplayName("rejects null and empty passwords")
        void rejectsEmptyPassword() {
            assertThatThrownBy(() -> digest.generate(""))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> digest.generate(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @ParameterizedTest
        @ValueSource(strings = {"secret", "correct horse battery staple", "pässwörd", "  spaced  "})
        @DisplayName("accepts the password the hash was generated from")
        void acceptsOriginalPassword(String password) {
            assertThat(digest.validate(digest.generate(password), password)).isTrue();
        }

        @Test
        @DisplayName("rejects a different password")
        void rejectsDifferentPassword() {
            String hash = digest.generate("secret");

            assertThat(digest.validate(hash, "Secret")).isFalse();
            assertThat(digest.validate(hash, "secret ")).isFalse();
        }

        @Test
        @DisplayName("returns false rather than throwing for missing or malformed hashes")
        void falseForBadHash() {
            assertThat(digest.validate(null, "secret")).isFalse();
            assertThat(digest.validate("", "secret")).isFalse();
            assertThat(digest.validate("not-a-bcrypt-hash", "secret")).isFalse();
        }

        @Test
        @DisplayName("returns false for an empty candidate")
        void falseForEmptyCandidate() {
            String hash = digest.generate("secret");

            assertThat(digest.validate(hash, "")).isFalse();
            assertThat(digest.validate(hash, null)).isFalse();
        }

        @Test
        @DisplayName("validates hashes generated at a different cost factor")
        void validatesAcrossStrengths() {
            String hash = new BCryptDigest(5).generate("secret");

            assertThat(digest.validate(hash, "secret")).isTrue();
        }
    }

    @Nested
    @DisplayName("strength")
    class Strength {

        @Test
        @DisplayName("defaults to 12")
        void defaultsTo12() {
            assertThat(new BCryptDigest().strength()).isEqualTo(12);
        }

        @Test
        @DisplayName("rejects out-of-range cost factors")
        void rejectsOutOfRange() {
            assertThatThrownBy(() -> new BCryptDigest(3))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("between 4 and 31");
            assertThatThrownBy(() -> new BCryptDigest(32))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
