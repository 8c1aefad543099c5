package me.azat.probabilistic.similarity;

import me.azat.probabilistic.exception.ConfigurationException;
import me.azat.probabilistic.exception.IncompatibleStructureException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MinHashTest {

    @Test
    void selfSimilarityIsOne() {
        MinHash minHash = new MinHash(128, 42);
        minHash.update(range("doc", 0, 100));

        assertEquals(1.0, minHash.jaccard(minHash));
    }

    @Test
    void halfOverlapEstimatesHalf() {
        // |A n B| = 1000, |A u B| = 2000
        for (int trial = 0; trial < 5; trial++) {
            MinHash a = new MinHash(256, trial);
            MinHash b = new MinHash(256, trial);
            a.update(range("block-" + trial, 0, 1500));
            b.update(range("block-" + trial, 500, 2000));

            double similarity = a.jaccard(b);
            assertEquals(0.5, similarity, 0.1, "trial " + trial);
        }
    }

    @Test
    void disjointSetsAreDissimilar() {
        MinHash a = new MinHash(128, 1);
        MinHash b = new MinHash(128, 1);
        a.update(range("left", 0, 500));
        b.update(range("right", 0, 500));

        assertTrue(a.jaccard(b) < 0.05);
    }

    @Test
    void signatureIsCumulativeAndOrderIndependent() {
        MinHash together = new MinHash(64, 3);
        together.update(range("k", 0, 200));

        MinHash split = new MinHash(64, 3);
        split.update(range("k", 100, 200));
        split.update(range("k", 0, 100));

        assertArrayEquals(together.signature(), split.signature());
    }

    @Test
    void updatesNeverRaiseASlot() {
        MinHash minHash = new MinHash(64, 3);
        minHash.update(range("k", 0, 10));
        long[] before = minHash.signature();
        minHash.update(range("k", 10, 20));
        long[] after = minHash.signature();

        for (int i = 0; i < before.length; i++) {
            assertTrue(after[i] <= before[i]);
        }
    }

    @Test
    void mergeEqualsUnion() {
        MinHash left = new MinHash(64, 9);
        MinHash right = new MinHash(64, 9);
        MinHash union = new MinHash(64, 9);
        left.update(range("k", 0, 50));
        right.update(range("k", 30, 80));
        union.update(range("k", 0, 80));

        left.merge(right);

        assertArrayEquals(union.signature(), left.signature());
        assertEquals(1.0, left.jaccard(union));
    }

    @Test
    void incompatibleSignaturesAreRejected() {
        MinHash minHash = new MinHash(64, 1);

        assertThrows(IncompatibleStructureException.class, () -> minHash.jaccard(new MinHash(128, 1)));
        assertThrows(IncompatibleStructureException.class, () -> minHash.merge(new MinHash(128, 1)));
        assertThrows(IncompatibleStructureException.class, () -> minHash.jaccard(new MinHash(64, 2)));
    }

    @Test
    void infoAndReset() {
        MinHash minHash = new MinHash(100, 42);
        Map<String, Object> info = minHash.getInfo();
        assertEquals(100, info.get("num_permutations"));
        assertEquals(42L, info.get("seed"));
        assertEquals(0.1, (Double) info.get("standard_error"), 1e-12);

        assertTrue(minHash.isEmpty());
        minHash.update("x");
        assertFalse(minHash.isEmpty());
        minHash.reset();
        assertTrue(minHash.isEmpty());
    }

    @Test
    void rejectsZeroPermutations() {
        assertThrows(ConfigurationException.class, () -> new MinHash(0, 1));
    }

    private static List<String> range(String prefix, int from, int to) {
        return IntStream.range(from, to).mapToObj(i -> prefix + "-" + i).collect(Collectors.toList());
    }
}
