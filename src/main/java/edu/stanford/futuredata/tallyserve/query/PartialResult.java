package edu.stanford.futuredata.tallyserve.query;

import edu.stanford.futuredata.tallyserve.expression.Value;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One shard's answer to a query, shipped back to the broker and combined by {@link DistributedAggregator}.
 */
public abstract class PartialResult implements Serializable {

    public abstract QueryKind getKind();

    public static final class Count extends PartialResult {
        private final long count;

        public Count(long count) {
            this.count = count;
        }

        public long getCount() {
            return count;
        }

        @Override
        public QueryKind getKind() {
            return QueryKind.COUNT;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Count && ((Count) o).count == count;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(count);
        }

        @Override
        public String toString() {
            return Long.toString(count);
        }
    }

    /** Minimum and maximum of a column.  Both are null when no matching row had the column. */
    public static final class Extent extends PartialResult {
        private final Value min;
        private final Value max;

        public Extent(Value min, Value max) {
            this.min = min;
            this.max = max;
        }

        public static Extent empty() {
            return new Extent(null, null);
        }

        public Value getMin() {
            return min;
        }

        public Value getMax() {
            return max;
        }

        public boolean isEmpty() {
            return min == null;
        }

        @Override
        public QueryKind getKind() {
            return QueryKind.EXTENT;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Extent)) {
                return false;
            }
            Extent other = (Extent) o;
            return Objects.equals(min, other.min) && Objects.equals(max, other.max);
        }

        @Override
        public int hashCode() {
            return Objects.hash(min, max);
        }

        @Override
        public String toString() {
            return isEmpty() ? "(empty)" : String.format("(%s, %s)", min, max);
        }
    }

    public static final class IdSet extends PartialResult {
        private final Set<String> ids;

        public IdSet(Set<String> ids) {
            this.ids = Collections.unmodifiableSet(new HashSet<>(ids));
        }

        public Set<String> getIds() {
            return ids;
        }

        @Override
        public QueryKind getKind() {
            return QueryKind.ID_SET;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IdSet && ((IdSet) o).ids.equals(ids);
        }

        @Override
        public int hashCode() {
            return ids.hashCode();
        }

        @Override
        public String toString() {
            return ids.toString();
        }
    }
}
