package edu.stanford.futuredata.tallyserve.query;

import edu.stanford.futuredata.tallyserve.expression.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines per-shard partial results into a table-wide result.  Shards hold disjoint rows, so counts add, extents
 * take the outer bounds and id sets union.  The order of partials does not matter.
 */
public final class DistributedAggregator {

    private DistributedAggregator() {}

    /**
     * @throws IllegalArgumentException if a partial is not of the requested kind
     * @throws edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException if extents of incomparable kinds
     * meet
     */
    public static PartialResult combine(List<? extends PartialResult> partials, QueryKind kind) {
        for (PartialResult p : partials) {
            if (p.getKind() != kind) {
                throw new IllegalArgumentException(String.format("Cannot combine a %s partial into a %s result",
                        p.getKind(), kind));
            }
        }
        switch (kind) {
            case COUNT:
                long count = 0;
                for (PartialResult p : partials) {
                    count += ((PartialResult.Count) p).getCount();
                }
                return new PartialResult.Count(count);
            case EXTENT:
                Value min = null;
                Value max = null;
                for (PartialResult p : partials) {
                    PartialResult.Extent extent = (PartialResult.Extent) p;
                    min = lesser(min, extent.getMin());
                    max = greater(max, extent.getMax());
                }
                return new PartialResult.Extent(min, max);
            case ID_SET:
                Set<String> ids = new HashSet<>();
                for (PartialResult p : partials) {
                    ids.addAll(((PartialResult.IdSet) p).getIds());
                }
                return new PartialResult.IdSet(ids);
            default:
                throw new IllegalArgumentException("Unknown query kind " + kind);
        }
    }

    static Value lesser(Value a, Value b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.compareTo(a) < 0 ? b : a;
    }

    static Value greater(Value a, Value b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.compareTo(a) > 0 ? b : a;
    }
}
