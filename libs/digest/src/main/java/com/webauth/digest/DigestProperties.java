package com.webauth.digest;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Digest configuration bound from {@code webauth.digest.*}.
 *
 * <pre>
 * webauth:
 *   digest:
 *     algorithm: bcrypt
 *     strength: 12
 * </pre>
 *
 * @param algorithm which built-in digest to use (default {@link DigestAlgorithm#BCRYPT})
 * @param strength  BCrypt cost factor, {@value BCryptDigest#MIN_STRENGTH} to {@value BCryptDigest#MAX_STRENGTH}
 *                  (default {@value BCryptDigest#DEFAULT_STRENGTH})
 */
@Validated
@ConfigurationProperties(prefix = "webauth.digest")
public record DigestProperties(
        DigestAlgorithm algorithm,
        @Min(BCryptDigest.MIN_STRENGTH) @Max(BCryptDigest.MAX_STRENGTH) int strength
) {

    /**
     * Compact constructor, applies defaults for unset values.
     */
    public DigestProperties {
        if (algorithm == null) {
            algorithm = DigestAlgorithm.BCRYPT;
        }
        if (strength <= 0) {
            strength = BCryptDigest.DEFAULT_STRENGTH;
        }
    }

    /**
     * Returns properties with every default applied.
     */
    public static DigestProperties defaults() {
        return new DigestProperties(null, 0);
    }
}
