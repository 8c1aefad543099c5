package me.azat.probabilistic.similarity;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import me.azat.probabilistic.ProbabilisticStructure;
import me.azat.probabilistic.StructureType;
import me.azat.probabilistic.exception.ConfigurationException;
import me.azat.probabilistic.exception.IncompatibleStructureException;
import me.azat.probabilistic.hash.HashAlgorithm;
import me.azat.probabilistic.hash.Hasher;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Set signature for estimating Jaccard similarity.
 * <p>
 * Slot {@code i} keeps the minimum of {@code (a_i * h + b_i) mod P} over every item ever passed to
 * {@code update}, where {@code h} is the item hash reduced modulo the Mersenne prime
 * {@code P = 2^31 - 1}. The permutation parameters {@code (a_i, b_i)} are drawn from a generator
 * seeded with {@code seed}, so signatures are only comparable when both were built with the same
 * number of permutations and the same seed.
 */
public class MinHash implements ProbabilisticStructure {
    private static final Logger log = LoggerFactory.getLogger(MinHash.class);

    static final long MERSENNE_PRIME = (1L << 31) - 1;

    /** Marks a slot that has not seen any item yet. */
    static final long EMPTY_SLOT = Long.MAX_VALUE;

    private final int numPerm;
    private final long seed;
    private final Hasher hasher;
    private final long[] a;
    private final long[] b;
    private final long[] signature;

    public MinHash(int numPerm, long seed) {
        this(numPerm, seed, HashAlgorithm.MURMUR3_128);
    }

    public MinHash(int numPerm, long seed, Hasher hasher) {
        ConfigurationException.check(numPerm > 0, "number of permutations must be positive, got %s", numPerm);
        this.numPerm = numPerm;
        this.seed = seed;
        this.hasher = Preconditions.checkNotNull(hasher, "hasher");
        this.a = new long[numPerm];
        this.b = new long[numPerm];
        this.signature = new long[numPerm];
        Arrays.fill(signature, EMPTY_SLOT);

        RandomGenerator random = new Well19937c(seed);
        for (int i = 0; i < numPerm; i++) {
            a[i] = 1 + random.nextInt((int) MERSENNE_PRIME - 1);
            b[i] = random.nextInt((int) MERSENNE_PRIME);
        }

        log.debug("Created minhash: permutations={}, seed={}", numPerm, seed);
    }

    public void update(Iterable<String> items) {
        Preconditions.checkNotNull(items, "items");
        for (String item : items) {
            update(item);
        }
    }

    public void update(String item) {
        update(item.getBytes(StandardCharsets.UTF_8));
    }

    public void update(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long h = Math.floorMod(hasher.hash(item, seed), MERSENNE_PRIME);
        for (int i = 0; i < numPerm; i++) {
            long permuted = (a[i] * h + b[i]) % MERSENNE_PRIME;
            if (permuted < signature[i]) {
                signature[i] = permuted;
            }
        }
    }

    /**
     * Fraction of equal signature slots. Two empty signatures compare as identical.
     */
    public double jaccard(MinHash other) {
        checkCompatible(other, "compare");
        int matches = 0;
        for (int i = 0; i < numPerm; i++) {
            if (signature[i] == other.signature[i]) {
                matches++;
            }
        }
        return (double) matches / numPerm;
    }

    /**
     * Slot-wise minimum, the signature of the union of both underlying sets.
     */
    public void merge(MinHash other) {
        checkCompatible(other, "merge");
        for (int i = 0; i < numPerm; i++) {
            signature[i] = Math.min(signature[i], other.signature[i]);
        }
    }

    private void checkCompatible(MinHash other, String operation) {
        Preconditions.checkNotNull(other, "other");
        IncompatibleStructureException.check(numPerm == other.numPerm,
                "cannot %s minhash signatures with %s and %s permutations", operation, numPerm, other.numPerm);
        IncompatibleStructureException.check(seed == other.seed && hasher.equals(other.hasher),
                "cannot %s minhash signatures built with %s and %s", operation,
                HashAlgorithm.describe(hasher, seed), HashAlgorithm.describe(other.hasher, other.seed));
    }

    public int numPerm() {
        return numPerm;
    }

    public long seed() {
        return seed;
    }

    public long[] signature() {
        return signature.clone();
    }

    public boolean isEmpty() {
        for (long slot : signature) {
            if (slot != EMPTY_SLOT) {
                return false;
            }
        }
        return true;
    }

    public double standardError() {
        return 1.0 / Math.sqrt(numPerm);
    }

    @Override
    public StructureType type() {
        return StructureType.MINHASH;
    }

    @Override
    public ImmutableMap<String, Object> getInfo() {
        return ImmutableMap.<String, Object>builder()
                .put("num_permutations", numPerm)
                .put("seed", seed)
                .put("standard_error", standardError())
                .put("memory_usage_bytes", (long) numPerm * 3 * Long.BYTES)
                .put("hash_function", HashAlgorithm.describe(hasher, seed))
                .build();
    }

    @Override
    public void reset() {
        Arrays.fill(signature, EMPTY_SLOT);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("numPerm", numPerm)
                .add("seed", seed)
                .toString();
    }
}
