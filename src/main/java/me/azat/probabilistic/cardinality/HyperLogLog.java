package me.azat.probabilistic.cardinality;

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
 * Distinct-count estimator with {@code 2^p} registers.
 * <p>
 * The low {@code p} bits of a 64-bit hash pick the register; the register keeps the maximum
 * position of the first set bit seen in the remaining {@code 64 - p} bits. Adding is idempotent
 * and order independent, and {@link #merge} is a register-wise maximum.
 * <p>
 * Only the small-range (linear counting) correction is applied. There is no large-range
 * correction, so estimates would drift once cardinalities approach the 64-bit hash space, which
 * is far beyond any realistic stream.
 */
public class HyperLogLog implements ProbabilisticStructure {
    private static final Logger log = LoggerFactory.getLogger(HyperLogLog.class);

    public static final int MIN_PRECISION = 4;
    public static final int MAX_PRECISION = 16;

    private final int precision;
    private final int m;
    private final double alpha;
    private final Hasher hasher;
    private final long seed;
    private final byte[] registers;

    public HyperLogLog(int precision) {
        this(precision, HashAlgorithm.MURMUR3_128, 0L);
    }

    public HyperLogLog(int precision, Hasher hasher, long seed) {
        ConfigurationException.check(precision >= MIN_PRECISION && precision <= MAX_PRECISION,
                "precision must be between %s and %s, got %s", MIN_PRECISION, MAX_PRECISION, precision);
        this.precision = precision;
        this.m = 1 << precision;
        this.alpha = alpha(m);
        this.hasher = Preconditions.checkNotNull(hasher, "hasher");
        this.seed = seed;
        this.registers = new byte[m];

        log.debug("Created hyperloglog: precision={}, registers={}", precision, m);
    }

    static double alpha(int m) {
        switch (m) {
            case 16:
                return 0.673;
            case 32:
                return 0.697;
            case 64:
                return 0.709;
            default:
                return 0.7213 / (1.0 + 1.079 / m);
        }
    }

    public void add(String item) {
        add(item.getBytes(StandardCharsets.UTF_8));
    }

    public void add(byte[] item) {
        Preconditions.checkNotNull(item, "item");
        long hash = hasher.hash(item, seed);
        int index = (int) (hash & (m - 1));
        long rest = hash >>> precision;
        // leading zeros within the (64 - p) remaining bits, plus one
        int rank = rest == 0
                ? Long.SIZE - precision + 1
                : Long.numberOfLeadingZeros(rest) - precision + 1;
        if (rank > registers[index]) {
            registers[index] = (byte) rank;
        }
    }

    public double count() {
        double sum = 0;
        int zeros = 0;
        for (byte register : registers) {
            if (register == 0) {
                zeros++;
            }
            sum += 1.0 / (1L << register);
        }
        if (zeros == m) {
            return 0;
        }

        double estimate = alpha * m * m / sum;
        if (estimate <= 2.5 * m && zeros > 0) {
            return m * Math.log((double) m / zeros);
        }
        return estimate;
    }

    /**
     * Register-wise maximum with {@code other}, equivalent to having added both streams here.
     */
    public void merge(HyperLogLog other) {
        Preconditions.checkNotNull(other, "other");
        IncompatibleStructureException.check(m == other.m,
                "cannot merge hyperloglogs with %s and %s registers", m, other.m);
        IncompatibleStructureException.check(hasher.equals(other.hasher) && seed == other.seed,
                "cannot merge hyperloglogs hashed with %s and %s",
                HashAlgorithm.describe(hasher, seed), HashAlgorithm.describe(other.hasher, other.seed));
        for (int i = 0; i < m; i++) {
            if (other.registers[i] > registers[i]) {
                registers[i] = other.registers[i];
            }
        }
    }

    public int precision() {
        return precision;
    }

    public int registerCount() {
        return m;
    }

    public byte[] registers() {
        return registers.clone();
    }

    public double standardError() {
        return 1.04 / Math.sqrt(m);
    }

    @Override
    public StructureType type() {
        return StructureType.HYPERLOGLOG;
    }

    @Override
    public ImmutableMap<String, Object> getInfo() {
        return ImmutableMap.<String, Object>builder()
                .put("precision", precision)
                .put("registers", m)
                .put("estimated_cardinality", count())
                .put("alpha", alpha)
                .put("standard_error", standardError())
                .put("memory_usage_bytes", (long) registers.length)
                .put("hash_function", HashAlgorithm.describe(hasher, seed))
                .build();
    }

    @Override
    public void reset() {
        Arrays.fill(registers, (byte) 0);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("precision", precision)
                .add("estimate", count())
                .toString();
    }
}
