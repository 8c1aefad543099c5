package me.azat.probabilistic.frequency;

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
 * Frequency table of {@code depth} rows by {@code width} counters.
 * <p>
 * Each row hashes the key with its own seed to one column. {@link #estimateCount} returns the
 * smallest of the selected counters, which is never below the true frequency and with
 * probability {@code 1 - e^-depth} exceeds it by at most {@code e / width * totalItems}.
 * <p>
 * The row seeds are drawn from a {@link RandomGenerator} seeded with the sketch seed, so two
 * sketches built with the same width, depth and seed hash identically and can be merged.
 */
public class CountMinSketch implements ProbabilisticStructure {
    private static final Logger log = LoggerFactory.getLogger(CountMinSketch.class);

    private final int width;
    private final int depth;
    private final long seed;
    private final long[] rowSeeds;
    private final Hasher hasher;
    private final long[][] table;
    private long totalItems;

    public CountMinSketch(int width, int depth, long seed) {
        this(width, depth, seed, HashAlgorithm.MURMUR3_128);
    }

    public CountMinSketch(int width, int depth, long seed, Hasher hasher) {
        ConfigurationException.check(width > 0, "width must be positive, got %s", width);
        ConfigurationException.check(depth > 0, "depth must be positive, got %s", depth);
        this.width = width;
        this.depth = depth;
        this.seed = seed;
        this.hasher = Preconditions.checkNotNull(hasher, "hasher");
        this.table = new long[depth][width];
        this.rowSeeds = new long[depth];

        RandomGenerator random = new Well19937c(seed);
        for (int row = 0; row < depth; row++) {
            rowSeeds[row] = random.nextLong();
        }

        log.debug("Created count-min sketch: width={}, depth={}, seed={}", width, depth, seed);
    }

    public void add(String item) {
        add(item, 1);
    }

    public void add(String item, long count) {
        add(item.getBytes(StandardCharsets.UTF_8), count);
    }

    public void add(byte[] item) {
        add(item, 1);
    }

    public void add(byte[] item, long count) {
        Preconditions.checkNotNull(item, "item");
        Preconditions.checkArgument(count >= 0, "negative counts are not supported: %s", count);
        for (int row = 0; row < depth; row++) {
            table[row][column(item, row)] += count;
        }
        totalItems += count;
    }

    public long estimateCount(String item) {
        return estimateCount(item.getBytes(StandardCharsets.UTF_8));
    }

    public long estimateCount(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long result = Long.MAX_VALUE;
        for (int row = 0; row < depth; row++) {
            result = Math.min(result, table[row][column(item, row)]);
        }
        return result;
    }

    public long estimate(String item) {
        return estimateCount(item);
    }

    public long estimate(byte[] item) {
        return estimateCount(item);
    }

    /**
     * Estimated share of all inserted counts taken by {@code item}, 0 for an empty sketch.
     */
    public double estimateRelativeFrequency(String item) {
        if (totalItems == 0) {
            return 0.0;
        }
        return (double) estimateCount(item) / totalItems;
    }

    private int column(byte[] item, int row) {
        return (int) Math.floorMod(hasher.hash(item, rowSeeds[row]), (long) width);
    }

    /**
     * Adds {@code other}'s counters into this sketch.
     *
     * @return this sketch
     */
    public CountMinSketch merge(CountMinSketch other) {
        Preconditions.checkNotNull(other, "other");
        IncompatibleStructureException.check(width == other.width && depth == other.depth,
                "cannot merge count-min sketches of %sx%s and %sx%s", depth, width, other.depth, other.width);
        IncompatibleStructureException.check(Arrays.equals(rowSeeds, other.rowSeeds) && hasher.equals(other.hasher),
                "cannot merge count-min sketches with different hash seeds (%s vs %s)", seed, other.seed);
        for (int row = 0; row < depth; row++) {
            for (int column = 0; column < width; column++) {
                table[row][column] += other.table[row][column];
            }
        }
        totalItems += other.totalItems;
        return this;
    }

    public int width() {
        return width;
    }

    public int depth() {
        return depth;
    }

    public long seed() {
        return seed;
    }

    public long totalItems() {
        return totalItems;
    }

    public double errorRate() {
        return Math.E / width;
    }

    public double failureProbability() {
        return Math.exp(-depth);
    }

    @Override
    public StructureType type() {
        return StructureType.COUNT_MIN_SKETCH;
    }

    @Override
    public ImmutableMap<String, Object> getInfo() {
        return ImmutableMap.<String, Object>builder()
                .put("width", width)
                .put("depth", depth)
                .put("total_items", totalItems)
                .put("error_bound", errorRate() * totalItems)
                .put("error_rate", errorRate())
                .put("failure_probability", failureProbability())
                .put("memory_usage_bytes", (long) width * depth * Long.BYTES)
                .put("hash_function", HashAlgorithm.describe(hasher, seed))
                .build();
    }

    @Override
    public void reset() {
        for (long[] row : table) {
            Arrays.fill(row, 0L);
        }
        totalItems = 0;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", width)
                .add("depth", depth)
                .add("totalItems", totalItems)
                .toString();
    }
}
