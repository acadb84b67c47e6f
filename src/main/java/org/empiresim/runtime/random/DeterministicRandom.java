package org.empiresim.runtime.random;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Seed-derived, reproducible pseudo-randomness.
 * <p>
 * All values are derived from the 32-bit FNV-1a hash of the UTF-8 bytes of a seed string.
 * Identical seeds give bit-identical results in every process and on every run, which makes
 * stochastic outcomes replayable for audits and tests. Callers build composite seeds such as
 * {@code playerId|action|amount} with {@link #seedOf(Object...)} so that changing any single
 * component changes the result.
 * <p>
 * The class has no state and is safe to use from any thread.
 */
public final class DeterministicRandom {

    static final long FNV_OFFSET_BASIS = 2166136261L;
    static final long FNV_PRIME = 16777619L;
    private static final long UINT32_MASK = 0xFFFFFFFFL;
    private static final double UINT32_MAX = 4294967295.0;
    private static final double UINT32_RANGE = 4294967296.0;
    private static final String SEPARATOR = "|";

    private DeterministicRandom() {
        // Utility class
    }

    /**
     * Computes the 32-bit FNV-1a hash of a seed.
     *
     * @param seed The seed string (must not be null).
     * @return The unsigned hash in {@code [0, 2^32 - 1]}.
     */
    public static long hash(String seed) {
        Objects.requireNonNull(seed, "seed must not be null");
        long hash = FNV_OFFSET_BASIS;
        for (byte b : seed.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xFF);
            hash = (hash * FNV_PRIME) & UINT32_MASK;
        }
        return hash;
    }

    /**
     * Maps the hash of a seed linearly onto {@code [-1, 1]}.
     *
     * @param seed The seed string.
     * @return A reproducible value in {@code [-1, 1]}.
     */
    public static double normalized(String seed) {
        return hash(seed) / UINT32_MAX * 2.0 - 1.0;
    }

    /**
     * Maps the hash of a seed onto {@code [0, 1)}, suitable for comparing against a probability.
     *
     * @param seed The seed string.
     * @return A reproducible value in {@code [0, 1)}.
     */
    public static double unitInterval(String seed) {
        return hash(seed) / UINT32_RANGE;
    }

    /**
     * Joins seed components with {@code |}. Nulls are rendered as empty components.
     *
     * @param parts The seed components, in a fixed order.
     * @return The composite seed.
     */
    public static String seedOf(Object... parts) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (Object part : parts) {
            joiner.add(part == null ? "" : String.valueOf(part));
        }
        return joiner.toString();
    }
}
