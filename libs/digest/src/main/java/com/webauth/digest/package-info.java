/**
 * Password digest contract and its default implementations.
 *
 * <ul>
 *   <li>{@link com.webauth.digest.Digest}: the two-operation capability every caller depends on
 *   <li>{@link com.webauth.digest.BCryptDigest}: default, salted adaptive hash
 *   <li>{@link com.webauth.digest.Pbkdf2Digest}: PBKDF2 alternative
 *   <li>{@link com.webauth.digest.PasswordEncoderDigest}: adapter for any Spring Security encoder
 * </ul>
 */
package com.webauth.digest;
