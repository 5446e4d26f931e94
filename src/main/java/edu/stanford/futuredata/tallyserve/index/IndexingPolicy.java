package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.expression.Column;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-shard indexing choices: which columns keep an ordered {@code any_} index and by which attribute, and the
 * thresholds driving automatic persistence and re-encoding.
 */
public class IndexingPolicy implements Serializable {

    // Column name to the attribute its any_ index is scored by.  Absent columns use a plain set.
    private final Map<String, Column.Attribute> orderedColumns = new ConcurrentHashMap<>();

    // Persist a derived index once its signature has been built this many times.  0 disables.
    public int derivedReuseThreshold = 3;
    // Promote an unordered column once this many ordering queries could not be narrowed.  0 disables.
    public int promotionThreshold = 0;
    // Distinct signatures and columns each demand counter tracks before it starts over.
    public int maxTrackedKeys = 10000;

    public IndexingPolicy orderBy(String column, Column.Attribute attribute) {
        orderedColumns.put(column, attribute);
        return this;
    }

    public void unorder(String column) {
        orderedColumns.remove(column);
    }

    public Optional<Column.Attribute> orderingOf(String column) {
        return Optional.ofNullable(orderedColumns.get(column));
    }

    public Representation anyRepresentation(String column) {
        return orderedColumns.containsKey(column) ? Representation.ORDERED_SET : Representation.SET;
    }

    public Map<String, Column.Attribute> getOrderedColumns() {
        return Map.copyOf(orderedColumns);
    }

    public IndexingPolicy copy() {
        IndexingPolicy copy = new IndexingPolicy();
        copy.orderedColumns.putAll(orderedColumns);
        copy.derivedReuseThreshold = derivedReuseThreshold;
        copy.promotionThreshold = promotionThreshold;
        copy.maxTrackedKeys = maxTrackedKeys;
        return copy;
    }
}
