package me.azat.probabilistic.membership;

import gnu.trove.set.hash.THashSet;
import me.azat.probabilistic.StreamGenerator;
import me.azat.probabilistic.exception.ConfigurationException;
import me.azat.probabilistic.hash.HashAlgorithm;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CuckooFilterTest {

    @Test
    void bucketCountRoundsUpToPowerOfTwo() {
        // ceil(100 / 4 * 1.05) = 27 buckets, rounded to 32
        CuckooFilter filter = new CuckooFilter(100);

        assertEquals(32, filter.size());
        assertEquals(4, filter.bucketSize());
        assertEquals(128, filter.getInfo().get("total_slots"));
    }

    @Test
    void addedItemsAreFound() {
        CuckooFilter filter = new CuckooFilter(100, 4, 16, 500);

        assertTrue(filter.add("QmHash1"));
        assertTrue(filter.contains("QmHash1"));
        assertFalse(filter.contains("QmHash2"));
        assertEquals(1, filter.count());
    }

    @Test
    void removeDeletesItem() {
        CuckooFilter filter = new CuckooFilter(100, 4, 16, 500);
        filter.add("QmHash1");
        filter.add("QmHash2");

        assertTrue(filter.remove("QmHash1"));
        assertFalse(filter.contains("QmHash1"));
        assertTrue(filter.contains("QmHash2"));
        assertEquals(1, filter.count());

        assertFalse(filter.remove("QmHash1"));
        assertFalse(filter.remove("never-added"));
    }

    @Test
    void duplicateAddsNeedMatchingRemoves() {
        CuckooFilter filter = new CuckooFilter(100, 4, 16, 500);
        filter.add("twice");
        filter.add("twice");

        assertTrue(filter.remove("twice"));
        assertTrue(filter.contains("twice"));
        assertTrue(filter.remove("twice"));
        assertFalse(filter.contains("twice"));
    }

    @Test
    void ninetyItemsFitIntoCapacityHundred() {
        CuckooFilter filter = new CuckooFilter(100, 4, 8, 500);
        List<String> items = new StreamGenerator(7, 90).distinct(90);

        for (String item : items) {
            assertTrue(filter.add(item), item);
        }
        for (String item : items) {
            assertTrue(filter.contains(item), item);
        }
        assertEquals(90, filter.count());
        assertEquals(0L, filter.getInfo().get("failed_inserts"));
    }

    @Test
    void relocationKeepsEveryAcceptedItemFindable() {
        // small filter pushed to a high load factor forces kick chains
        CuckooFilter filter = new CuckooFilter(64, 2, 16, 200,
                HashAlgorithm.MURMUR3_128, 0, new Well19937c(99));
        List<String> accepted = new ArrayList<>();
        for (String item : new StreamGenerator(8, 200).distinct(200)) {
            if (filter.add(item)) {
                accepted.add(item);
            }
        }

        assertTrue(filter.failedInserts() > 0, "filter never filled up");
        assertEquals(accepted.size(), filter.count());
        for (String item : accepted) {
            assertTrue(filter.contains(item), item);
        }
    }

    @Test
    void failedInsertLeavesFilterUnchanged() {
        CuckooFilter filter = new CuckooFilter(4, 1, 32, 10,
                HashAlgorithm.MURMUR3_128, 0, new Well19937c(5));
        List<String> accepted = new ArrayList<>();
        String rejected = null;
        for (int i = 0; i < 100 && rejected == null; i++) {
            String item = "item-" + i;
            if (filter.add(item)) {
                accepted.add(item);
            } else {
                rejected = item;
            }
        }

        assertTrue(rejected != null, "expected a rejected insert");
        assertFalse(filter.contains(rejected));
        assertEquals(accepted.size(), filter.count());
        assertTrue(filter.loadFactor() <= 1.0);
        for (String item : accepted) {
            assertTrue(filter.contains(item), item);
        }
    }

    @Test
    void falsePositiveRateTracksFingerprintSize() {
        CuckooFilter filter = new CuckooFilter(2000, 4, 12, 500);
        new StreamGenerator(9, 1500).distinct(1500).forEach(filter::add);

        THashSet<String> hits = new THashSet<>();
        new StreamGenerator(10, 1).absent(50_000).filter(filter::contains).forEach(hits::add);

        // bound for a full filter is 2 * 4 / 2^12 ~ 0.002
        double observed = hits.size() / 50_000.0;
        assertTrue(observed < 0.004, "observed false-positive rate " + observed);
    }

    @Test
    void infoDescribesLoad() {
        CuckooFilter filter = new CuckooFilter(100);
        for (int i = 0; i < 64; i++) {
            filter.add("key-" + i);
        }
        Map<String, Object> info = filter.getInfo();

        assertEquals(64L, info.get("count"));
        assertEquals(0.5, (Double) info.get("load_factor"), 1e-9);
        assertEquals(2.0 * 4 / 256, (Double) info.get("estimated_false_positive_rate"), 1e-12);
        assertEquals(8, info.get("fingerprint_size"));
    }

    @Test
    void resetEmptiesFilter() {
        CuckooFilter filter = new CuckooFilter(100, 4, 16, 500);
        filter.add("a");
        filter.reset();

        assertFalse(filter.contains("a"));
        assertEquals(0, filter.count());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> new CuckooFilter(0));
        assertThrows(ConfigurationException.class, () -> new CuckooFilter(100, 0, 8, 500));
        assertThrows(ConfigurationException.class, () -> new CuckooFilter(100, 4, 0, 500));
        assertThrows(ConfigurationException.class, () -> new CuckooFilter(100, 4, 33, 500));
        assertThrows(ConfigurationException.class, () -> new CuckooFilter(100, 4, 8, -1));
    }
}
