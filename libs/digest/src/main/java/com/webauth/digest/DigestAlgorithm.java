package com.webauth.digest;

/**
 * Built-in digest algorithms selectable through {@code webauth.digest.algorithm}.
 */
public enum DigestAlgorithm {

    /** Adaptive BCrypt, the default. */
    BCRYPT,

    /** PBKDF2 with HMAC-SHA256. */
    PBKDF2;

    /**
     * Creates the digest for this algorithm.
     *
     * @param strength BCrypt cost factor; ignored by algorithms without one
     * @return a new digest instance
     */
    public Digest create(int strength) {
        return switch (this) {
            case BCRYPT -> new BCryptDigest(strength);
            case PBKDF2 -> new Pbkdf2Digest();
        };
    }
}
