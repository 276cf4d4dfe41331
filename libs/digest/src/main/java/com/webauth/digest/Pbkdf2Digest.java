package com.webauth.digest;

import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

/**
 * PBKDF2-HMAC-SHA256 {@link Digest} using Spring Security's current recommended parameters
 * (16-byte salt, 310,000 iterations). Hashes are hex encoded with the salt prepended.
 */
public class Pbkdf2Digest extends PasswordEncoderDigest {

    public Pbkdf2Digest() {
        super(Pbkdf2PasswordEncoder.defaultsForSpringSecurity_v5_8());
    }
}
