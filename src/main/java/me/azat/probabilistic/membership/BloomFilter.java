package me.azat.probabilistic.membership;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import me.azat.probabilistic.ProbabilisticStructure;
import me.azat.probabilistic.StructureType;
import me.azat.probabilistic.exception.ConfigurationException;
import me.azat.probabilistic.exception.IncompatibleStructureException;
import me.azat.probabilistic.hash.HashAlgorithm;
import me.azat.probabilistic.hash.Hasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Approximate set membership with no false negatives.
 * <p>
 * Sized from the expected number of distinct inserts and a target false-positive rate:
 * {@code m = ceil(-n ln p / (ln 2)^2)} bits and {@code k = max(1, round(m / n ln 2))} hash
 * positions per key. Positions come from double hashing two seeded values of the same key.
 * <p>
 * The insert counter is not deduplicated, so re-adding a key inflates {@link #count()} and with it
 * the estimated false-positive rate.
 */
public class BloomFilter implements ProbabilisticStructure {
    private static final Logger log = LoggerFactory.getLogger(BloomFilter.class);

    private static final double LN2 = Math.log(2);

    private final long capacity;
    private final double falsePositiveRate;
    private final long size;
    private final int hashCount;
    private final Hasher hasher;
    private final long seed;

    private final long[] bits;
    private long count;
    private boolean overCapacityReported;

    public BloomFilter(long capacity, double falsePositiveRate) {
        this(capacity, falsePositiveRate, HashAlgorithm.MURMUR3_128, 0L);
    }

    public BloomFilter(long capacity, double falsePositiveRate, Hasher hasher, long seed) {
        ConfigurationException.check(capacity > 0, "capacity must be positive, got %s", capacity);
        ConfigurationException.check(falsePositiveRate > 0.0 && falsePositiveRate < 1.0,
                "false positive rate must be in (0, 1), got %s", falsePositiveRate);
        this.capacity = capacity;
        this.falsePositiveRate = falsePositiveRate;
        this.size = optimalSize(capacity, falsePositiveRate);
        this.hashCount = optimalHashCount(size, capacity);
        this.hasher = Preconditions.checkNotNull(hasher, "hasher");
        this.seed = seed;
        ConfigurationException.check(size <= (long) Integer.MAX_VALUE * Long.SIZE,
                "bit array of %s bits is too large", size);
        this.bits = new long[(int) ((size + Long.SIZE - 1) / Long.SIZE)];

        log.debug("Created bloom filter: capacity={}, fpp={}, bits={}, hashes={}",
                capacity, falsePositiveRate, size, hashCount);
    }

    static long optimalSize(long capacity, double falsePositiveRate) {
        return Math.max(1L, (long) Math.ceil(-capacity * Math.log(falsePositiveRate) / (LN2 * LN2)));
    }

    static int optimalHashCount(long size, long capacity) {
        return Math.max(1, (int) Math.round((double) size / capacity * LN2));
    }

    public void add(String item) {
        add(item.getBytes(StandardCharsets.UTF_8));
    }

    public void add(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long h1 = hasher.hash(item, seed);
        long h2 = hasher.hash(item, seed + 1);
        for (int i = 0; i < hashCount; i++) {
            long position = position(h1, h2, i);
            bits[(int) (position >>> 6)] |= 1L << position;
        }
        count++;

        if (count > capacity && !overCapacityReported) {
            overCapacityReported = true;
            log.warn("Bloom filter exceeded its designed capacity of {} inserts, "
                    + "false-positive rate is now above {}", capacity, falsePositiveRate);
        }
    }

    public boolean contains(String item) {
        return contains(item.getBytes(StandardCharsets.UTF_8));
    }

    public boolean contains(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long h1 = hasher.hash(item, seed);
        long h2 = hasher.hash(item, seed + 1);
        for (int i = 0; i < hashCount; i++) {
            long position = position(h1, h2, i);
            if ((bits[(int) (position >>> 6)] & (1L << position)) == 0) {
                return false;
            }
        }
        return true;
    }

    private long position(long h1, long h2, int i) {
        return ((h1 + i * h2) & Long.MAX_VALUE) % size;
    }

    /**
     * Bitwise OR of both filters. The count of the result is the larger of the two counts.
     */
    public BloomFilter union(BloomFilter other) {
        checkCompatible(other, "union");
        BloomFilter result = emptyCopy();
        for (int i = 0; i < bits.length; i++) {
            result.bits[i] = bits[i] | other.bits[i];
        }
        result.count = Math.max(count, other.count);
        return result;
    }

    /**
     * Bitwise AND of both filters. The count of the result is the smaller of the two counts.
     */
    public BloomFilter intersection(BloomFilter other) {
        checkCompatible(other, "intersection");
        BloomFilter result = emptyCopy();
        for (int i = 0; i < bits.length; i++) {
            result.bits[i] = bits[i] & other.bits[i];
        }
        result.count = Math.min(count, other.count);
        return result;
    }

    private void checkCompatible(BloomFilter other, String operation) {
        Preconditions.checkNotNull(other, "other");
        IncompatibleStructureException.check(size == other.size && hashCount == other.hashCount,
                "bloom filter %s needs equal size and hash count: %s/%s vs %s/%s",
                operation, size, hashCount, other.size, other.hashCount);
        IncompatibleStructureException.check(hasher.equals(other.hasher) && seed == other.seed,
                "bloom filter %s needs the same hash function: %s vs %s", operation,
                HashAlgorithm.describe(hasher, seed), HashAlgorithm.describe(other.hasher, other.seed));
    }

    private BloomFilter emptyCopy() {
        return new BloomFilter(capacity, falsePositiveRate, hasher, seed);
    }

    public long capacity() {
        return capacity;
    }

    public long size() {
        return size;
    }

    public int hashCount() {
        return hashCount;
    }

    public long count() {
        return count;
    }

    public boolean isOverCapacity() {
        return count > capacity;
    }

    public double fillRatio() {
        long filled = 0;
        for (long word : bits) {
            filled += Long.bitCount(word);
        }
        return (double) filled / size;
    }

    /**
     * {@code (1 - e^(-k n / m))^k} for the current insert count {@code n}.
     */
    public double expectedFalsePositiveRate() {
        return Math.pow(1 - Math.exp(-(double) hashCount * count / size), hashCount);
    }

    @Override
    public StructureType type() {
        return StructureType.BLOOM_FILTER;
    }

    @Override
    public ImmutableMap<String, Object> getInfo() {
        return ImmutableMap.<String, Object>builder()
                .put("size", size)
                .put("hash_count", hashCount)
                .put("capacity", capacity)
                .put("count", count)
                .put("bit_array_fill_ratio", fillRatio())
                .put("estimated_false_positive_rate", expectedFalsePositiveRate())
                .put("over_capacity", isOverCapacity())
                .put("memory_usage_bytes", (long) bits.length * Long.BYTES)
                .put("hash_function", HashAlgorithm.describe(hasher, seed))
                .build();
    }

    @Override
    public void reset() {
        Arrays.fill(bits, 0L);
        count = 0;
        overCapacityReported = false;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", size)
                .add("hashCount", hashCount)
                .add("count", count)
                .toString();
    }
}
