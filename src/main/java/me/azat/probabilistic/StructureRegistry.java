package me.azat.probabilistic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import me.azat.probabilistic.cardinality.HyperLogLog;
import me.azat.probabilistic.exception.DuplicateStructureException;
import me.azat.probabilistic.exception.IncompatibleStructureException;
import me.azat.probabilistic.exception.StructureNotFoundException;
import me.azat.probabilistic.frequency.CountMinSketch;
import me.azat.probabilistic.frequency.ExactFrequencyCounter;
import me.azat.probabilistic.frequency.TopK;
import me.azat.probabilistic.membership.BloomFilter;
import me.azat.probabilistic.membership.CuckooFilter;
import me.azat.probabilistic.similarity.MinHash;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named collection of live structures.
 * <p>
 * A registry is an ordinary object: create one per owner and pass it around. Names are unique;
 * creating a structure under a name that is already taken fails with
 * {@link DuplicateStructureException} and leaves the existing structure in place. Looking up or
 * removing an unknown name fails with {@link StructureNotFoundException}.
 * <p>
 * Like the structures it holds, a registry is not thread safe.
 */
public class StructureRegistry {
    private static final Logger log = LoggerFactory.getLogger(StructureRegistry.class);

    private final StructureDefaults defaults;
    private final RandomGenerator random;
    private final Map<String, ProbabilisticStructure> structures = new LinkedHashMap<>();

    public StructureRegistry() {
        this(StructureDefaults.defaults());
    }

    public StructureRegistry(StructureDefaults defaults) {
        this.defaults = Preconditions.checkNotNull(defaults, "defaults");
        // feeds the seeds of cuckoo filter kick sequences
        this.random = new Well19937c(defaults.randomSeed());
    }

    public StructureDefaults defaults() {
        return defaults;
    }

    public BloomFilter createBloomFilter(String name) {
        return createBloomFilter(name, defaults.capacity(), defaults.falsePositiveRate());
    }

    public BloomFilter createBloomFilter(String name, long capacity) {
        return createBloomFilter(name, capacity, defaults.falsePositiveRate());
    }

    public BloomFilter createBloomFilter(String name, long capacity, double falsePositiveRate) {
        checkAvailable(name);
        return register(name, new BloomFilter(capacity, falsePositiveRate,
                defaults.hashAlgorithm(), defaults.hashSeed()));
    }

    public HyperLogLog createHyperLogLog(String name) {
        return createHyperLogLog(name, defaults.precision());
    }

    public HyperLogLog createHyperLogLog(String name, int precision) {
        checkAvailable(name);
        return register(name, new HyperLogLog(precision, defaults.hashAlgorithm(), defaults.hashSeed()));
    }

    public CountMinSketch createCountMinSketch(String name) {
        return createCountMinSketch(name, defaults.width(), defaults.depth());
    }

    public CountMinSketch createCountMinSketch(String name, int width, int depth) {
        checkAvailable(name);
        return register(name, new CountMinSketch(width, depth, defaults.hashSeed(), defaults.hashAlgorithm()));
    }

    public CuckooFilter createCuckooFilter(String name) {
        return createCuckooFilter(name, defaults.capacity(), defaults.bucketSize());
    }

    public CuckooFilter createCuckooFilter(String name, long capacity) {
        return createCuckooFilter(name, capacity, defaults.bucketSize());
    }

    public CuckooFilter createCuckooFilter(String name, long capacity, int bucketSize) {
        return createCuckooFilter(name, capacity, bucketSize, defaults.fingerprintSize(), defaults.maxRelocations());
    }

    public CuckooFilter createCuckooFilter(String name, long capacity, int bucketSize,
                                           int fingerprintSize, int maxRelocations) {
        checkAvailable(name);
        return register(name, new CuckooFilter(capacity, bucketSize, fingerprintSize, maxRelocations,
                defaults.hashAlgorithm(), defaults.hashSeed(), new Well19937c(random.nextLong())));
    }

    public MinHash createMinHash(String name) {
        return createMinHash(name, defaults.numPerm());
    }

    public MinHash createMinHash(String name, int numPerm) {
        return createMinHash(name, numPerm, defaults.minHashSeed());
    }

    public MinHash createMinHash(String name, int numPerm, long seed) {
        checkAvailable(name);
        return register(name, new MinHash(numPerm, seed, defaults.hashAlgorithm()));
    }

    public TopK createTopK(String name) {
        return createTopK(name, defaults.topK(), defaults.width(), defaults.depth());
    }

    public TopK createTopK(String name, int k) {
        return createTopK(name, k, defaults.width(), defaults.depth());
    }

    public TopK createTopK(String name, int k, int width, int depth) {
        checkAvailable(name);
        return register(name, new TopK(k,
                new CountMinSketch(width, depth, defaults.hashSeed(), defaults.hashAlgorithm())));
    }

    public ExactFrequencyCounter createExactCounter(String name) {
        checkAvailable(name);
        return register(name, new ExactFrequencyCounter());
    }

    private void checkAvailable(String name) {
        Preconditions.checkNotNull(name, "name");
        if (structures.containsKey(name)) {
            throw new DuplicateStructureException(name);
        }
    }

    private <S extends ProbabilisticStructure> S register(String name, S structure) {
        structures.put(name, structure);
        log.info("Registered {} '{}'", structure.type(), name);
        return structure;
    }

    public ProbabilisticStructure get(String name) {
        ProbabilisticStructure structure = structures.get(name);
        if (structure == null) {
            throw new StructureNotFoundException(name);
        }
        return structure;
    }

    /**
     * @throws IncompatibleStructureException if the structure is not a {@code type}
     */
    public <S extends ProbabilisticStructure> S get(String name, Class<S> type) {
        ProbabilisticStructure structure = get(name);
        IncompatibleStructureException.check(type.isInstance(structure),
                "structure '%s' is a %s, not a %s", name, structure.type(), type.getSimpleName());
        return type.cast(structure);
    }

    public boolean contains(String name) {
        return structures.containsKey(name);
    }

    public ImmutableSet<String> names() {
        return ImmutableSet.copyOf(structures.keySet());
    }

    public int size() {
        return structures.size();
    }

    /**
     * @return the removed structure
     */
    public ProbabilisticStructure remove(String name) {
        ProbabilisticStructure removed = structures.remove(name);
        if (removed == null) {
            throw new StructureNotFoundException(name);
        }
        log.info("Removed {} '{}'", removed.type(), name);
        return removed;
    }

    /**
     * Diagnostics of every structure, keyed by name in registration order.
     */
    public ImmutableMap<String, ImmutableMap<String, Object>> getAllInfo() {
        ImmutableMap.Builder<String, ImmutableMap<String, Object>> info = ImmutableMap.builder();
        structures.forEach((name, structure) -> info.put(name, structure.getInfo()));
        return info.build();
    }

    public void resetAll() {
        structures.values().forEach(ProbabilisticStructure::reset);
        log.info("Reset {} structures", structures.size());
    }
}
