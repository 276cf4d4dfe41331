package com.webauth.digest;

/**
 * One-way password hashing and verification.
 * <p>
 * {@link #generate(String)} and {@link #validate(String, String)} form a pair: a hash produced by
 * one implementation is only meaningful to the same implementation. A mismatch is a normal
 * outcome, so {@code validate} answers {@code false} instead of throwing.
 * <p>
 * Implementations must be stateless and safe to share between threads.
 */
public interface Digest {

    /**
     * Hashes a plaintext password with a fresh per-password salt.
     *
     * @param password the plaintext password (must not be null or empty)
     * @return an encoded hash that embeds everything {@link #validate} needs
     * @throws IllegalArgumentException if the password is null or empty
     */
    String generate(String password);

    /**
     * Checks a candidate password against a previously generated hash.
     *
     * @param storedHash        the hash produced by {@link #generate(String)}
     * @param candidatePassword the plaintext password to check
     * @return true iff the candidate hashes to a value consistent with {@code storedHash}
     */
    boolean validate(String storedHash, String candidatePassword);
}
