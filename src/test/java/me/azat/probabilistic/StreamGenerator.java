package me.azat.probabilistic;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.distribution.UniformIntegerDistribution;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.JDKRandomGenerator;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Generates a universe of distinct keys on construction, then streams them
 * (first `cardinality` of them) with uniform or zipf distribution.
 */
public class StreamGenerator {
    private final String[] universe; // only these elements are streamed
    private final int maxCardinality;
    private final JDKRandomGenerator rnd;

    public StreamGenerator(int seed, int maxCardinality) {
        this.maxCardinality = maxCardinality;
        this.rnd = new JDKRandomGenerator(seed);
        // distinct() may drop a rare duplicate long, so draw a few extra
        this.universe = rnd.longs(maxCardinality * 2L)
                .distinct()
                .limit(maxCardinality)
                .mapToObj(String::valueOf)
                .toArray(String[]::new);
    }

    /**
     * The first {@code cardinality} keys of the universe, each exactly once.
     */
    public List<String> distinct(int cardinality) {
        checkCardinality(cardinality);
        return Arrays.stream(universe, 0, cardinality).collect(Collectors.toList());
    }

    /**
     * Keys that are guaranteed not to be in the universe.
     */
    public Stream<String> absent(long length) {
        return IntStream.range(0, (int) length).mapToObj(i -> "absent-" + i);
    }

    /**
     * Stream elements with zipf distribution
     *
     * @param cardinality how many elements of universe to stream
     * @param exponent zipf distribution parameter
     * @param length stream length
     */
    public Stream<String> zipfStream(int cardinality, double exponent, long length) {
        checkCardinality(cardinality);

        ZipfDistribution distribution = new ZipfDistribution(rnd, cardinality, exponent);
        return IntStream
                .generate(distribution::sample)
                .mapToObj(x -> universe[x - 1])
                .limit(length);
    }

    /**
     * Stream elements with uniform distribution
     *
     * @param cardinality how many elements of universe to stream
     * @param length stream length
     */
    public Stream<String> uniformStream(int cardinality, long length) {
        checkCardinality(cardinality);

        UniformIntegerDistribution distribution = new UniformIntegerDistribution(rnd, 0, cardinality - 1);
        return IntStream
                .generate(distribution::sample)
                .mapToObj(x -> universe[x])
                .limit(length);
    }

    private void checkCardinality(int cardinality) {
        Preconditions.checkArgument(
                cardinality > 0 && cardinality <= maxCardinality,
                "0 < cardinality <= maxCardinality");
    }
}
