package com.devbolt.core.evaluation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Deterministic mapping of (flag, subject, seed) to a bucket in {@code [0, 99]}.
 *
 * <h3>Scheme</h3>
 * <ol>
 * <li>Build {@code seed + ":" + flagName + ":" + identifier}, using
 * {@value #DEFAULT_SEED} when the seed is {@code null} or empty.</li>
 * <li>Take the SHA-256 digest of its UTF-8 bytes.</li>
 * <li>Read the first 4 bytes as an unsigned big-endian 32-bit integer.</li>
 * <li>Reduce modulo 100.</li>
 * </ol>
 *
 * <p>
 * The scheme is fixed: SDKs in other languages reproduce it byte for byte, so
 * every implementation agrees on which users are inside a rollout. Do not
 * change it.
 * </p>
 *
 * @since 1.0.0
 */
public final class Bucketer {

    /** Seed used when neither the rollout nor the caller supplies one. */
    public static final String DEFAULT_SEED = "devbolt";

    public static final int BUCKET_COUNT = 100;

    private Bucketer() {
        // utility class: not instantiable
    }

    /**
     * Compute the bucket for a subject.
     *
     * @param flagName   flag being evaluated; must not be {@code null}
     * @param identifier subject identity (user id, email, ...); must not be
     *                   {@code null}
     * @param seed       optional seed; {@code null} or empty selects
     *                   {@value #DEFAULT_SEED}
     * @return bucket in {@code [0, 99]}
     */
    public static int bucket(String flagName, String identifier, String seed) {
        Objects.requireNonNull(flagName, "flagName must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");

        String effectiveSeed = seed == null || seed.isEmpty() ? DEFAULT_SEED : seed;
        String input = effectiveSeed + ":" + flagName + ":" + identifier;
        byte[] digest = sha256().digest(input.getBytes(StandardCharsets.UTF_8));

        long prefix = ((digest[0] & 0xFFL) << 24)
                | ((digest[1] & 0xFFL) << 16)
                | ((digest[2] & 0xFFL) << 8)
                | (digest[3] & 0xFFL);
        return (int) (prefix % BUCKET_COUNT);
    }

    public static int bucket(String flagName, String identifier) {
        return bucket(flagName, identifier, null);
    }

    /**
     * Decide rollout membership.
     *
     * <p>
     * {@code 0} is always out and {@code 100} always in; neither computes a
     * hash, so float rounding at the boundaries cannot leak a user.
     * </p>
     *
     * @param percentage share of users to include, in {@code [0, 100]}
     * @return {@code true} if the subject's bucket is below {@code percentage}
     */
    public static boolean isInRollout(String flagName, String identifier, double percentage, String seed) {
        if (percentage == 0) {
            return false;
        }
        if (percentage == 100) {
            return true;
        }
        return bucket(flagName, identifier, seed) < percentage;
    }

    public static boolean isInRollout(String flagName, String identifier, double percentage) {
        return isInRollout(flagName, identifier, percentage, null);
    }

    private static MessageDigest sha256() {
        try {
            // MessageDigest is stateful; a fresh instance per call keeps this thread-safe
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", e);
        }
    }
}
