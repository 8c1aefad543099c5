package me.azat.probabilistic.frequency;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * An item together with its estimated frequency.
 */
public final class HeavyHitter {
    private final String item;
    private final long count;

    public HeavyHitter(String item, long count) {
        this.item = Preconditions.checkNotNull(item, "item");
        this.count = count;
    }

    public String item() {
        return item;
    }

    public long count() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HeavyHitter)) {
            return false;
        }
        HeavyHitter that = (HeavyHitter) o;
        return count == that.count && item.equals(that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, count);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("item", item)
                .add("count", count)
                .toString();
    }
}
