package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.store.KeyValueStore;

import java.util.List;
import java.util.Objects;

/**
 * A handle on one index: a set of row ids held under a store key.
 *
 * Permanent indexes ({@code all}, {@code any_}, {@code value_}) belong to the write path.  Derived indexes are
 * built by a {@link QueryScope} under a query-private key and are deleted when the scope closes unless persisted.
 */
public class InvertedIndex {

    private final KeyValueStore store;
    private final IndexFamily family;
    private final Representation representation;
    // Column and attribute the ordered scores encode; null if unordered or the encoding is unknown.
    private final Column scoreColumn;
    // Expression text a derived index answers; null if it may not be persisted.
    private final String signature;
    private String keyName;
    private boolean persisted;

    InvertedIndex(KeyValueStore store, String keyName, IndexFamily family, Representation representation,
                  Column scoreColumn, String signature, boolean persisted) {
        this.store = Objects.requireNonNull(store);
        this.keyName = keyName;
        this.family = family;
        this.representation = representation;
        this.scoreColumn = representation == Representation.ORDERED_SET ? scoreColumn : null;
        this.signature = signature;
        this.persisted = persisted;
    }

    public String getKeyName() {
        return keyName;
    }

    public IndexFamily getFamily() {
        return family;
    }

    public Representation getRepresentation() {
        return representation;
    }

    public Column getScoreColumn() {
        return scoreColumn;
    }

    public String getSignature() {
        return signature;
    }

    public boolean isPersisted() {
        return persisted;
    }

    /** True if {@link #persist()} would keep this index. */
    public boolean isPersistable() {
        return family == IndexFamily.DERIVED && !persisted && signature != null;
    }

    /** True if scores are the given column's scores, so a {@link ScoreRange} over it may narrow this index. */
    public boolean isOrderedBy(Column column) {
        return representation == Representation.ORDERED_SET && column.equals(scoreColumn);
    }

    public long cardinality() {
        if (family == IndexFamily.EMPTY) {
            return 0;
        }
        return store.cardinality(keyName);
    }

    /**
     * A snapshot of the member ids, in score order for ordered indexes.  Each call reads the store again and has no
     * side effects.
     */
    public List<String> members() {
        if (family == IndexFamily.EMPTY) {
            return List.of();
        }
        return store.members(keyName);
    }

    /** Members whose score lies in the range, inclusive on both ends. */
    public List<String> membersInScoreRange(ScoreRange range) {
        if (representation != Representation.ORDERED_SET) {
            throw new IllegalStateException(String.format("Index %s is not ordered", keyName));
        }
        if (family == IndexFamily.EMPTY) {
            return List.of();
        }
        return store.orderedSetRange(keyName, range.getMin(), range.getMax());
    }

    /**
     * Keep a derived index past its query under a key named by its expression.  No-op for permanent, empty and
     * already persisted indexes.
     */
    public void persist() {
        if (!isPersistable()) {
            return;
        }
        String durableKeyName = IndexNames.derived(signature);
        store.rename(keyName, durableKeyName);
        store.setAdd(IndexNames.DERIVED_REGISTRY, durableKeyName);
        keyName = durableKeyName;
        persisted = true;
    }

    /** Remove a transient derived index.  Permanent and persisted indexes are left alone. */
    public void delete() {
        if (family != IndexFamily.DERIVED || persisted) {
            return;
        }
        store.delete(keyName);
    }

    @Override
    public String toString() {
        return String.format("%s(%s, %s)", family, keyName, representation);
    }
}
