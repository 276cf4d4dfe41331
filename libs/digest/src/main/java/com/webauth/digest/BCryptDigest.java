package com.webauth.digest;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * Default {@link Digest}: BCrypt with a random 16-byte salt per password and an adaptive cost.
 */
public class BCryptDigest extends PasswordEncoderDigest {

    /** Cost factor used when none is configured (2^12 rounds). */
    public static final int DEFAULT_STRENGTH = 12;

    /** Lowest cost factor BCrypt accepts. */
    public static final int MIN_STRENGTH = 4;

    /** Highest cost factor BCrypt accepts. */
    public static final int MAX_STRENGTH = 31;

    private final int strength;

    /**
     * Creates a BCrypt digest with {@link #DEFAULT_STRENGTH}.
     */
    public BCryptDigest() {
        this(DEFAULT_STRENGTH);
    }

    /**
     * Creates a BCrypt digest with the given cost factor.
     *
     * @param strength log2 of the number of rounds, between {@value #MIN_STRENGTH} and {@value #MAX_STRENGTH}
     * @throws IllegalArgumentException if the strength is out of range
     */
    public BCryptDigest(int strength) {
        super(new BCryptPasswordEncoder(checkStrength(strength)));
        this.strength = strength;
    }

    public int strength() {
        return strength;
    }

    private static int checkStrength(int strength) {
        if (strength < MIN_STRENGTH || strength > MAX_STRENGTH) {
            throw new IllegalArgumentException(
                    "BCrypt strength must be between " + MIN_STRENGTH + " and " + MAX_STRENGTH
                            + ", got " + strength);
        }
        return strength;
    }
}
