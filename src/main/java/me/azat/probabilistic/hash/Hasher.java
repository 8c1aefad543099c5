package me.azat.probabilistic.hash;

/**
 * Seeded, deterministic, non-cryptographic hash of a key.
 * <p>
 * The same key, seed and implementation always produce the same value. Callers that need several
 * independent values either vary the seed or combine two seeded values by double hashing.
 */
public interface Hasher {

    long hash(byte[] key, long seed);
}
