package me.azat.probabilistic.membership;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.math.IntMath;
import com.google.common.primitives.Ints;
import me.azat.probabilistic.ProbabilisticStructure;
import me.azat.probabilistic.StructureType;
import me.azat.probabilistic.exception.ConfigurationException;
import me.azat.probabilistic.hash.HashAlgorithm;
import me.azat.probabilistic.hash.Hasher;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Approximate set membership with deletion.
 * <p>
 * Every key is reduced to a non-zero fingerprint of {@code fingerprintSize} bits that may live in
 * one of two buckets: {@code i1 = hash(key) mod size} and {@code i2 = i1 XOR hash(fingerprint)}.
 * The bucket count {@code ceil(capacity / bucketSize * 1.05)} is rounded up to the next power of
 * two, and {@link #size()} reports the rounded count. This makes the XOR partner symmetric so a
 * fingerprint can always be moved back and forth between its two buckets.
 * <p>
 * When both buckets are full a random resident is kicked to its alternate bucket, up to
 * {@code maxRelocations} times. If the chain runs out every move is undone and {@link #add}
 * returns {@code false}; the filter never holds more than {@code bucketSize} fingerprints per
 * bucket and every key added successfully before stays findable.
 */
public class CuckooFilter implements ProbabilisticStructure {
    private static final Logger log = LoggerFactory.getLogger(CuckooFilter.class);

    public static final int DEFAULT_BUCKET_SIZE = 4;
    public static final int DEFAULT_FINGERPRINT_SIZE = 8;
    public static final int DEFAULT_MAX_RELOCATIONS = 500;

    private static final int EMPTY = 0;

    private final long capacity;
    private final int bucketSize;
    private final int fingerprintSize;
    private final int maxRelocations;
    private final int size;
    private final int fingerprintMask;
    private final int indexMask;
    private final Hasher hasher;
    private final long seed;
    private final RandomGenerator random;

    // bucket b occupies slots [b * bucketSize, (b + 1) * bucketSize)
    private final int[] slots;
    private long count;
    private long failedInserts;

    public CuckooFilter(long capacity) {
        this(capacity, DEFAULT_BUCKET_SIZE, DEFAULT_FINGERPRINT_SIZE, DEFAULT_MAX_RELOCATIONS,
                HashAlgorithm.MURMUR3_128, 0L, new Well19937c(0L));
    }

    public CuckooFilter(long capacity, int bucketSize, int fingerprintSize, int maxRelocations) {
        this(capacity, bucketSize, fingerprintSize, maxRelocations,
                HashAlgorithm.MURMUR3_128, 0L, new Well19937c(0L));
    }

    public CuckooFilter(long capacity, int bucketSize, int fingerprintSize, int maxRelocations,
                        Hasher hasher, long seed, RandomGenerator random) {
        ConfigurationException.check(capacity > 0, "capacity must be positive, got %s", capacity);
        ConfigurationException.check(bucketSize > 0, "bucket size must be positive, got %s", bucketSize);
        ConfigurationException.check(fingerprintSize >= 1 && fingerprintSize <= Integer.SIZE,
                "fingerprint size must be between 1 and 32 bits, got %s", fingerprintSize);
        ConfigurationException.check(maxRelocations >= 0, "max relocations must not be negative, got %s", maxRelocations);
        this.capacity = capacity;
        this.bucketSize = bucketSize;
        this.fingerprintSize = fingerprintSize;
        this.maxRelocations = maxRelocations;
        this.hasher = Preconditions.checkNotNull(hasher, "hasher");
        this.seed = seed;
        this.random = Preconditions.checkNotNull(random, "random");

        long buckets = Math.max(1L, (long) Math.ceil((double) capacity / bucketSize * 1.05));
        ConfigurationException.check(buckets <= (1 << 30) && buckets * bucketSize <= Integer.MAX_VALUE,
                "capacity %s with bucket size %s needs too many slots", capacity, bucketSize);
        this.size = IntMath.ceilingPowerOfTwo((int) buckets);
        this.indexMask = size - 1;
        this.fingerprintMask = fingerprintSize == Integer.SIZE ? -1 : (1 << fingerprintSize) - 1;
        this.slots = new int[size * bucketSize];

        log.debug("Created cuckoo filter: capacity={}, buckets={}, bucketSize={}, fingerprintBits={}",
                capacity, size, bucketSize, fingerprintSize);
    }

    /**
     * @return {@code false} if no room could be found within {@code maxRelocations} kicks; the
     * filter is then left unchanged
     */
    public boolean add(String item) {
        return add(item.getBytes(StandardCharsets.UTF_8));
    }

    public boolean add(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long hash = hasher.hash(item, seed);
        int fingerprint = fingerprint(hash);
        int i1 = (int) (hash & indexMask);
        int i2 = alternateIndex(i1, fingerprint);

        if (insertIntoBucket(i1, fingerprint) || insertIntoBucket(i2, fingerprint)) {
            count++;
            return true;
        }

        // kick chain; remember what each touched slot held so a failed chain can be undone
        int[] touchedSlots = new int[maxRelocations];
        int[] previous = new int[maxRelocations];
        int bucket = random.nextBoolean() ? i1 : i2;
        int homeless = fingerprint;
        for (int kick = 0; kick < maxRelocations; kick++) {
            int slot = bucket * bucketSize + random.nextInt(bucketSize);
            touchedSlots[kick] = slot;
            previous[kick] = slots[slot];

            int victim = slots[slot];
            slots[slot] = homeless;
            homeless = victim;
            bucket = alternateIndex(bucket, homeless);

            if (insertIntoBucket(bucket, homeless)) {
                count++;
                return true;
            }
        }

        for (int kick = maxRelocations - 1; kick >= 0; kick--) {
            slots[touchedSlots[kick]] = previous[kick];
        }
        failedInserts++;
        log.warn("Cuckoo filter gave up after {} relocations at load factor {}, insert rejected",
                maxRelocations, loadFactor());
        return false;
    }

    public boolean contains(String item) {
        return contains(item.getBytes(StandardCharsets.UTF_8));
    }

    public boolean contains(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long hash = hasher.hash(item, seed);
        int fingerprint = fingerprint(hash);
        int i1 = (int) (hash & indexMask);
        return findInBucket(i1, fingerprint) >= 0
                || findInBucket(alternateIndex(i1, fingerprint), fingerprint) >= 0;
    }

    /**
     * Removes one copy of the item's fingerprint.
     *
     * @return whether a fingerprint was removed
     */
    public boolean remove(String item) {
        return remove(item.getBytes(StandardCharsets.UTF_8));
    }

    public boolean remove(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long hash = hasher.hash(item, seed);
        int fingerprint = fingerprint(hash);
        int i1 = (int) (hash & indexMask);
        int slot = findInBucket(i1, fingerprint);
        if (slot < 0) {
            slot = findInBucket(alternateIndex(i1, fingerprint), fingerprint);
        }
        if (slot < 0) {
            return false;
        }
        slots[slot] = EMPTY;
        count--;
        return true;
    }

    private int fingerprint(long hash) {
        int fingerprint = (int) (hash >>> 32) & fingerprintMask;
        return fingerprint == EMPTY ? 1 : fingerprint;
    }

    private int alternateIndex(int index, int fingerprint) {
        long fingerprintHash = hasher.hash(Ints.toByteArray(fingerprint), seed);
        return (index ^ (int) fingerprintHash) & indexMask;
    }

    private boolean insertIntoBucket(int bucket, int fingerprint) {
        int start = bucket * bucketSize;
        for (int slot = start; slot < start + bucketSize; slot++) {
            if (slots[slot] == EMPTY) {
                slots[slot] = fingerprint;
                return true;
            }
        }
        return false;
    }

    private int findInBucket(int bucket, int fingerprint) {
        int start = bucket * bucketSize;
        for (int slot = start; slot < start + bucketSize; slot++) {
            if (slots[slot] == fingerprint) {
                return slot;
            }
        }
        return -1;
    }

    public long capacity() {
        return capacity;
    }

    public int size() {
        return size;
    }

    public int bucketSize() {
        return bucketSize;
    }

    public int fingerprintSize() {
        return fingerprintSize;
    }

    public long count() {
        return count;
    }

    public long failedInserts() {
        return failedInserts;
    }

    public double loadFactor() {
        return (double) count / slots.length;
    }

    /**
     * Upper bound {@code 2 * bucketSize / 2^fingerprintSize} for a full filter.
     */
    public double expectedFalsePositiveRate() {
        return Math.min(1.0, 2.0 * bucketSize / Math.pow(2, fingerprintSize));
    }

    @Override
    public StructureType type() {
        return StructureType.CUCKOO_FILTER;
    }

    @Override
    public ImmutableMap<String, Object> getInfo() {
        return ImmutableMap.<String, Object>builder()
                .put("size", size)
                .put("bucket_size", bucketSize)
                .put("fingerprint_size", fingerprintSize)
                .put("count", count)
                .put("total_slots", slots.length)
                .put("load_factor", loadFactor())
                .put("estimated_false_positive_rate", expectedFalsePositiveRate())
                .put("failed_inserts", failedInserts)
                .put("max_relocations", maxRelocations)
                .put("memory_usage_bytes", (long) slots.length * Integer.BYTES)
                .put("hash_function", HashAlgorithm.describe(hasher, seed))
                .build();
    }

    @Override
    public void reset() {
        Arrays.fill(slots, EMPTY);
        count = 0;
        failedInserts = 0;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("buckets", size)
                .add("bucketSize", bucketSize)
                .add("count", count)
                .toString();
    }
}
