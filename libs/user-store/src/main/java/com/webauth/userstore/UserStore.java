package com.webauth.userstore;

import java.util.Map;
import java.util.Optional;

/**
 * Maps credentials and ids to {@link User}s.
 * <p>
 * Authentication failures and unknown ids are expected outcomes and come back as
 * {@link Optional#empty()}. Missing arguments fail with {@link IllegalArgumentException} before
 * any storage access. Storage errors propagate unchanged.
 */
public interface UserStore {

    /**
     * Loads a user by username, provided the password matches.
     * <p>
     * "Unknown user" and "wrong password" are deliberately indistinguishable.
     *
     * @return the user, or empty if the username is unknown or the password does not match
     * @throws IllegalArgumentException if username or password is empty
     */
    Optional<User> loadUser(String username, String password);

    /**
     * Loads a user by id without checking credentials.
     *
     * @param userId the id column value; a string is converted by the database if needed
     * @return the user, or empty if no row has this id
     * @throws IllegalArgumentException if the id is null or an empty string
     */
    Optional<User> loadUserById(Object userId);

    /**
     * Creates a user with no extra column values.
     *
     * @see #storeUser(String, String, Map)
     */
    default Optional<User> storeUser(String username, String password) {
        return storeUser(username, password, null);
    }

    /**
     * Creates a user, hashing the password, and returns it as it reads back from storage.
     *
     * @param extraValues additional column values to insert; may be null, is never modified
     * @return the created user, or empty if it could not be read back
     * @throws IllegalArgumentException if username or password is empty, or a column name is invalid
     */
    Optional<User> storeUser(String username, String password, Map<String, Object> extraValues);
}
