package com.webauth.digest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Objects;

/**
 * {@link Digest} backed by a Spring Security {@link PasswordEncoder}.
 * <p>
 * Any encoder from {@code spring-security-crypto} (BCrypt, PBKDF2, SCrypt, Argon2, or a
 * {@code DelegatingPasswordEncoder}) can be plugged in here.
 */
public class PasswordEncoderDigest implements Digest {

    private static final Logger log = LoggerFactory.getLogger(PasswordEncoderDigest.class);

    private final PasswordEncoder encoder;

    /**
     * @param encoder the encoder that does the hashing (must not be null)
     */
    public PasswordEncoderDigest(PasswordEncoder encoder) {
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
    }

    @Override
    public String generate(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password must not be null or empty");
        }
        return encoder.encode(password);
    }

    @Override
    public boolean validate(String storedHash, String candidatePassword) {
        if (storedHash == null || storedHash.isEmpty()
                || candidatePassword == null || candidatePassword.isEmpty()) {
            return false;
        }
        try {
            return encoder.matches(candidatePassword, storedHash);
        } catch (IllegalArgumentException e) {
            // Encoders reject hashes they cannot parse; for the caller that is still a mismatch.
            log.warn("Stored hash could not be parsed by {}: {}",
                    encoder.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    /**
     * Returns the underlying encoder.
     */
    public PasswordEncoder encoder() {
        return encoder;
    }
}
