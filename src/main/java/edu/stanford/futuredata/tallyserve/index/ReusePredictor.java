package edu.stanford.futuredata.tallyserve.index;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts how often keys are demanded and predicts whether one will be demanded again.
 */
public class ReusePredictor {

    // Forget all counts once this many distinct keys have been seen.
    private final int maxTrackedKeys;

    private final Map<String, AtomicInteger> demand = new ConcurrentHashMap<>();

    public ReusePredictor(int maxTrackedKeys) {
        if (maxTrackedKeys <= 0) {
            throw new IllegalArgumentException("maxTrackedKeys must be positive");
        }
        this.maxTrackedKeys = maxTrackedKeys;
    }

    /** Record one demand and return the running count. */
    public int record(String key) {
        if (demand.size() >= maxTrackedKeys && !demand.containsKey(key)) {
            demand.clear();
        }
        return demand.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
    }

    public int count(String key) {
        AtomicInteger c = demand.get(key);
        return c == null ? 0 : c.get();
    }

    /** True once a key has been demanded at least threshold times.  A threshold of zero never predicts reuse. */
    public boolean predictsReuse(String key, int threshold) {
        return threshold > 0 && count(key) >= threshold;
    }

    public void reset(String key) {
        demand.remove(key);
    }
}
