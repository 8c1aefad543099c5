package me.azat.probabilistic;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.io.Resources;
import me.azat.probabilistic.exception.ConfigurationException;
import me.azat.probabilistic.hash.HashAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

/**
 * Parameters the {@link StructureRegistry} falls back to when a {@code create*} call omits them.
 * <p>
 * Values can be overridden through properties prefixed with {@code probabilistic.}, e.g.
 *
 * <pre>
 * probabilistic.bloom.capacity=100000
 * probabilistic.bloom.false-positive-rate=0.001
 * probabilistic.hash.algorithm=md5
 * </pre>
 */
public final class StructureDefaults {
    private static final Logger log = LoggerFactory.getLogger(StructureDefaults.class);

    public static final String RESOURCE_NAME = "probabilistic-structures.properties";
    static final String PREFIX = "probabilistic.";

    private static final StructureDefaults BUILT_IN = builder().build();

    private final long capacity;
    private final double falsePositiveRate;
    private final int precision;
    private final int width;
    private final int depth;
    private final int bucketSize;
    private final int fingerprintSize;
    private final int maxRelocations;
    private final int numPerm;
    private final long minHashSeed;
    private final int topK;
    private final HashAlgorithm hashAlgorithm;
    private final long hashSeed;
    private final long randomSeed;

    private StructureDefaults(Builder builder) {
        this.capacity = builder.capacity;
        this.falsePositiveRate = builder.falsePositiveRate;
        this.precision = builder.precision;
        this.width = builder.width;
        this.depth = builder.depth;
        this.bucketSize = builder.bucketSize;
        this.fingerprintSize = builder.fingerprintSize;
        this.maxRelocations = builder.maxRelocations;
        this.numPerm = builder.numPerm;
        this.minHashSeed = builder.minHashSeed;
        this.topK = builder.topK;
        this.hashAlgorithm = builder.hashAlgorithm;
        this.hashSeed = builder.hashSeed;
        this.randomSeed = builder.randomSeed;
    }

    public static StructureDefaults defaults() {
        return BUILT_IN;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the classpath, or returns the built-in defaults when the
     * resource is absent.
     */
    public static StructureDefaults load() {
        URL resource = Thread.currentThread().getContextClassLoader().getResource(RESOURCE_NAME);
        if (resource == null) {
            log.debug("No {} on the classpath, using built-in defaults", RESOURCE_NAME);
            return BUILT_IN;
        }
        Properties properties = new Properties();
        try (InputStream in = Resources.asByteSource(resource).openStream()) {
            properties.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + resource, e);
        }
        log.info("Loaded structure defaults from {}", resource);
        return fromProperties(properties);
    }

    /**
     * Built-in defaults overridden by every {@code probabilistic.*} key present in {@code properties}.
     */
    public static StructureDefaults fromProperties(Properties properties) {
        Preconditions.checkNotNull(properties, "properties");
        Builder builder = builder();
        PropertyReader reader = new PropertyReader(properties);
        builder.capacity(reader.getLong("bloom.capacity", BUILT_IN.capacity));
        builder.falsePositiveRate(reader.getDouble("bloom.false-positive-rate", BUILT_IN.falsePositiveRate));
        builder.precision(reader.getInt("hyperloglog.precision", BUILT_IN.precision));
        builder.width(reader.getInt("count-min.width", BUILT_IN.width));
        builder.depth(reader.getInt("count-min.depth", BUILT_IN.depth));
        builder.bucketSize(reader.getInt("cuckoo.bucket-size", BUILT_IN.bucketSize));
        builder.fingerprintSize(reader.getInt("cuckoo.fingerprint-size", BUILT_IN.fingerprintSize));
        builder.maxRelocations(reader.getInt("cuckoo.max-relocations", BUILT_IN.maxRelocations));
        builder.numPerm(reader.getInt("minhash.num-perm", BUILT_IN.numPerm));
        builder.minHashSeed(reader.getLong("minhash.seed", BUILT_IN.minHashSeed));
        builder.topK(reader.getInt("top-k.k", BUILT_IN.topK));
        builder.hashSeed(reader.getLong("hash.seed", BUILT_IN.hashSeed));
        builder.randomSeed(reader.getLong("random.seed", BUILT_IN.randomSeed));
        String algorithm = reader.getString("hash.algorithm");
        if (algorithm != null) {
            try {
                builder.hashAlgorithm(HashAlgorithm.fromId(algorithm));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid value for " + PREFIX + "hash.algorithm: " + algorithm, e);
            }
        }
        return builder.build();
    }

    public long capacity() {
        return capacity;
    }

    public double falsePositiveRate() {
        return falsePositiveRate;
    }

    public int precision() {
        return precision;
    }

    public int width() {
        return width;
    }

    public int depth() {
        return depth;
    }

    public int bucketSize() {
        return bucketSize;
    }

    public int fingerprintSize() {
        return fingerprintSize;
    }

    public int maxRelocations() {
        return maxRelocations;
    }

    public int numPerm() {
        return numPerm;
    }

    public long minHashSeed() {
        return minHashSeed;
    }

    public int topK() {
        return topK;
    }

    public HashAlgorithm hashAlgorithm() {
        return hashAlgorithm;
    }

    public long hashSeed() {
        return hashSeed;
    }

    public long randomSeed() {
        return randomSeed;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("capacity", capacity)
                .add("falsePositiveRate", falsePositiveRate)
                .add("precision", precision)
                .add("width", width)
                .add("depth", depth)
                .add("bucketSize", bucketSize)
                .add("fingerprintSize", fingerprintSize)
                .add("maxRelocations", maxRelocations)
                .add("numPerm", numPerm)
                .add("minHashSeed", minHashSeed)
                .add("topK", topK)
                .add("hashAlgorithm", hashAlgorithm)
                .add("hashSeed", hashSeed)
                .add("randomSeed", randomSeed)
                .toString();
    }

    public static final class Builder {
        private long capacity = 10_000;
        private double falsePositiveRate = 0.01;
        private int precision = 14;
        private int width = 1000;
        private int depth = 5;
        private int bucketSize = 4;
        private int fingerprintSize = 8;
        private int maxRelocations = 500;
        private int numPerm = 128;
        private long minHashSeed = 42;
        private int topK = 10;
        private HashAlgorithm hashAlgorithm = HashAlgorithm.MURMUR3_128;
        private long hashSeed = 0;
        private long randomSeed = 42;

        private Builder() {
        }

        public Builder capacity(long capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder falsePositiveRate(double falsePositiveRate) {
            this.falsePositiveRate = falsePositiveRate;
            return this;
        }

        public Builder precision(int precision) {
            this.precision = precision;
            return this;
        }

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        public Builder bucketSize(int bucketSize) {
            this.bucketSize = bucketSize;
            return this;
        }

        public Builder fingerprintSize(int fingerprintSize) {
            this.fingerprintSize = fingerprintSize;
            return this;
        }

        public Builder maxRelocations(int maxRelocations) {
            this.maxRelocations = maxRelocations;
            return this;
        }

        public Builder numPerm(int numPerm) {
            this.numPerm = numPerm;
            return this;
        }

        public Builder minHashSeed(long minHashSeed) {
            this.minHashSeed = minHashSeed;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder hashAlgorithm(HashAlgorithm hashAlgorithm) {
            this.hashAlgorithm = Preconditions.checkNotNull(hashAlgorithm, "hashAlgorithm");
            return this;
        }

        public Builder hashSeed(long hashSeed) {
            this.hashSeed = hashSeed;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        /**
         * Checks the values every structure shares; structure-specific limits such as the
         * HyperLogLog precision range are enforced again when the structure is built.
         */
        public StructureDefaults build() {
            ConfigurationException.check(capacity > 0, "capacity must be positive, got %s", capacity);
            ConfigurationException.check(falsePositiveRate > 0.0 && falsePositiveRate < 1.0,
                    "false positive rate must be in (0, 1), got %s", falsePositiveRate);
            ConfigurationException.check(width > 0 && depth > 0,
                    "count-min width and depth must be positive, got %sx%s", width, depth);
            ConfigurationException.check(topK > 0, "k must be positive, got %s", topK);
            ConfigurationException.check(numPerm > 0, "number of permutations must be positive, got %s", numPerm);
            return new StructureDefaults(this);
        }
    }

    private static final class PropertyReader {
        private final Properties properties;

        PropertyReader(Properties properties) {
            this.properties = properties;
        }

        String getString(String key) {
            String value = properties.getProperty(PREFIX + key);
            return value == null ? null : value.trim();
        }

        long getLong(String key, long fallback) {
            String value = getString(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid value for " + PREFIX + key + ": " + value, e);
            }
        }

        int getInt(String key, int fallback) {
            long value = getLong(key, fallback);
            ConfigurationException.check(value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE,
                    "Value for %s%s is out of range: %s", PREFIX, key, value);
            return (int) value;
        }

        double getDouble(String key, double fallback) {
            String value = getString(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid value for " + PREFIX + key + ": " + value, e);
            }
        }
    }
}
