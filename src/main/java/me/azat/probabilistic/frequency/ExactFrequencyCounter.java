package me.azat.probabilistic.frequency;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import gnu.trove.map.hash.TObjectLongHashMap;
import me.azat.probabilistic.ProbabilisticStructure;
import me.azat.probabilistic.StructureType;

import java.util.Comparator;
import java.util.List;

/**
 * Exact per-key counts.
 * <p>
 * Memory grows with the number of distinct keys, so this is not a sketch. It is the explicit
 * exact mode for callers who need ground truth, and the yardstick {@link CountMinSketch} and
 * {@link TopK} are measured against.
 */
public class ExactFrequencyCounter implements ProbabilisticStructure {
    private final TObjectLongHashMap<String> counts = new TObjectLongHashMap<>();
    private long totalItems;

    public void add(String item) {
        add(item, 1);
    }

    public void add(String item, long count) {
        Preconditions.checkNotNull(item, "item");
        Preconditions.checkArgument(count >= 0, "negative counts are not supported: %s", count);
        counts.adjustOrPutValue(item, count, count);
        totalItems += count;
    }

    public long count(String item) {
        return counts.get(item);
    }

    public int distinctItems() {
        return counts.size();
    }

    public long totalItems() {
        return totalItems;
    }

    /**
     * The {@code n} most frequent items, highest count first.
     */
    public List<HeavyHitter> topN(int n) {
        Preconditions.checkArgument(n >= 0, "n must not be negative: %s", n);
        return counts.keySet().stream()
                .map(item -> new HeavyHitter(item, counts.get(item)))
                .sorted(Comparator.comparingLong(HeavyHitter::count).reversed()
                        .thenComparing(HeavyHitter::item))
                .limit(n)
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public StructureType type() {
        return StructureType.EXACT_COUNTER;
    }

    @Override
    public ImmutableMap<String, Object> getInfo() {
        return ImmutableMap.of(
                "distinct_items", counts.size(),
                "total_items", totalItems);
    }

    @Override
    public void reset() {
        counts.clear();
        totalItems = 0;
    }
}
