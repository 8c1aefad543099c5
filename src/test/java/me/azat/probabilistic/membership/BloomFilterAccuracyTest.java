package me.azat.probabilistic.membership;

import com.google.common.base.Stopwatch;
import gnu.trove.set.hash.THashSet;
import me.azat.probabilistic.StreamGenerator;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Stores a share of a key universe in an exact set and in bloom filters sized for that share,
 * then probes the whole universe and compares false-positive rates with stream-lib's filter.
 */
class BloomFilterAccuracyTest {
    private static final Logger log = LoggerFactory.getLogger(BloomFilterAccuracyTest.class);

    private static final int TEST_CARDINALITY = 20_000;

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 0.05, 0.01})
    void falsePositivesStayNearTarget(double falsePositiveProbability) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        StreamGenerator gen = new StreamGenerator(12345, TEST_CARDINALITY);

        for (double fillRate : new double[]{0.05, 0.1, 0.2, 0.5}) {
            int storeCardinality = (int) (TEST_CARDINALITY * fillRate);

            BloomFilter filter = new BloomFilter(storeCardinality, falsePositiveProbability);
            com.clearspring.analytics.stream.membership.BloomFilter reference =
                    new com.clearspring.analytics.stream.membership.BloomFilter(storeCardinality, falsePositiveProbability);
            THashSet<String> truth = new THashSet<>();

            // store
            gen.distinct(storeCardinality).forEach(e -> {
                filter.add(e);
                reference.add(e);
                truth.add(e);
            });

            // test
            AtomicInteger negatives = new AtomicInteger();
            AtomicInteger falsePositives = new AtomicInteger();
            AtomicInteger referenceFalsePositives = new AtomicInteger();
            AtomicInteger falseNegatives = new AtomicInteger();
            gen.distinct(TEST_CARDINALITY).forEach(e -> {
                boolean isTrue = truth.contains(e);
                boolean positive = filter.contains(e);
                if (isTrue && !positive) {
                    falseNegatives.incrementAndGet();
                }
                if (!isTrue) {
                    negatives.incrementAndGet();
                    if (positive) {
                        falsePositives.incrementAndGet();
                    }
                    if (reference.isPresent(e)) {
                        referenceFalsePositives.incrementAndGet();
                    }
                }
            });

            double rate = (double) falsePositives.get() / negatives.get();
            double referenceRate = (double) referenceFalsePositives.get() / negatives.get();
            log.info("fpp: {}, filled: {}%, negatives: {}, fpRate: {}, stream-lib fpRate: {}",
                    falsePositiveProbability, (int) (fillRate * 100), negatives.get(),
                    String.format("%.4f", rate), String.format("%.4f", referenceRate));

            assertEquals(0, falseNegatives.get());
            assertTrue(rate < 2 * falsePositiveProbability + 0.005,
                    "false-positive rate " + rate + " for target " + falsePositiveProbability);
        }
        log.info("Finished in {}", stopwatch);
    }
}
