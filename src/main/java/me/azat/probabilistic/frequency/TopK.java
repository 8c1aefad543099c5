package me.azat.probabilistic.frequency;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import me.azat.probabilistic.ProbabilisticStructure;
import me.azat.probabilistic.StructureType;
import me.azat.probabilistic.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tracks the {@code k} items with the highest estimated frequency.
 * <p>
 * Frequencies come from an internal {@link CountMinSketch}; only the current leaders are kept
 * verbatim. A new item displaces the weakest leader only when its estimate is strictly greater.
 * On flat or adversarial streams the borderline leaders may churn, which is expected.
 */
public class TopK implements ProbabilisticStructure {
    private static final Logger log = LoggerFactory.getLogger(TopK.class);

    private static final Comparator<HeavyHitter> BY_COUNT_DESC =
            Comparator.comparingLong(HeavyHitter::count).reversed();

    private final int k;
    private final CountMinSketch sketch;
    // sorted by count, descending, never longer than k
    private final List<HeavyHitter> leaders;

    public TopK(int k, int width, int depth) {
        this(k, new CountMinSketch(width, depth, 0L));
    }

    public TopK(int k, CountMinSketch sketch) {
        ConfigurationException.check(k > 0, "k must be positive, got %s", k);
        this.k = k;
        this.sketch = Preconditions.checkNotNull(sketch, "sketch");
        this.leaders = new ArrayList<>(k + 1);

        log.debug("Created top-k tracker: k={}, sketch={}x{}", k, sketch.depth(), sketch.width());
    }

    public void add(String item) {
        add(item, 1);
    }

    public void add(String item, long count) {
        Preconditions.checkNotNull(item, "item");
        sketch.add(item, count);
        long estimate = sketch.estimateCount(item);

        int index = indexOf(item);
        if (index >= 0) {
            leaders.set(index, new HeavyHitter(item, estimate));
            leaders.sort(BY_COUNT_DESC);
        } else if (leaders.size() < k) {
            leaders.add(new HeavyHitter(item, estimate));
            leaders.sort(BY_COUNT_DESC);
        } else if (estimate > leaders.get(leaders.size() - 1).count()) {
            leaders.set(leaders.size() - 1, new HeavyHitter(item, estimate));
            leaders.sort(BY_COUNT_DESC);
        }
    }

    private int indexOf(String item) {
        for (int i = 0; i < leaders.size(); i++) {
            if (leaders.get(i).item().equals(item)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Current leaders, highest estimate first.
     */
    public List<HeavyHitter> getTopK() {
        return ImmutableList.copyOf(leaders);
    }

    public int k() {
        return k;
    }

    public int size() {
        return leaders.size();
    }

    public long estimateCount(String item) {
        return sketch.estimateCount(item);
    }

    @Override
    public StructureType type() {
        return StructureType.TOP_K;
    }

    @Override
    public ImmutableMap<String, Object> getInfo() {
        return ImmutableMap.of(
                "k", k,
                "items_tracked", leaders.size(),
                "sketch_info", sketch.getInfo());
    }

    @Override
    public void reset() {
        sketch.reset();
        leaders.clear();
    }

    @Override
    public String toString() {
        return "TopK" + leaders;
    }
}
