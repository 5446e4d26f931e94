package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The lifetime of one query's derived indexes.  Every derived index lives under a key private to this scope and is
 * deleted on {@link #close()} unless it was persisted first.
 */
public class QueryScope implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryScope.class);

    private final IndexCatalog catalog;
    private final KeyValueStore store;
    private final String queryID = UUID.randomUUID().toString();
    private final List<InvertedIndex> derived = new ArrayList<>();
    private int sequence = 0;
    private boolean closed = false;

    private enum SetOperation {
        UNION, INTERSECT, DIFFERENCE
    }

    QueryScope(IndexCatalog catalog, KeyValueStore store) {
        this.catalog = catalog;
        this.store = store;
    }

    public String getQueryID() {
        return queryID;
    }

    public List<InvertedIndex> getDerived() {
        return List.copyOf(derived);
    }

    /** An index matching nothing. */
    public InvertedIndex empty() {
        return new InvertedIndex(store, "empty", IndexFamily.EMPTY, Representation.SET, null, null, false);
    }

    public InvertedIndex union(String signature, Representation target, List<InvertedIndex> operands) {
        return derive(signature, target, SetOperation.UNION, operands);
    }

    /**
     * Intersect the operands.  An ordered result takes each member's score from the first ordered operand holding
     * it, so pass the operand whose scores should survive first.
     */
    public InvertedIndex intersect(String signature, Representation target, List<InvertedIndex> operands) {
        return derive(signature, target, SetOperation.INTERSECT, operands);
    }

    public InvertedIndex difference(String signature, Representation target, InvertedIndex base,
                                    InvertedIndex subtracted) {
        return derive(signature, target, SetOperation.DIFFERENCE, List.of(base, subtracted));
    }

    private InvertedIndex derive(String signature, Representation target, SetOperation operation,
                                 List<InvertedIndex> operands) {
        if (closed) {
            throw new IllegalStateException("Query scope " + queryID + " is closed");
        }
        String key = IndexNames.transientKey(queryID, sequence++);
        // Empty operands have no key; reading a missing key yields no members.
        List<String> keys = operands.stream()
                .map(i -> i.getFamily() == IndexFamily.EMPTY ? IndexNames.transientKey(queryID, -1) : i.getKeyName())
                .collect(Collectors.toList());
        if (target == Representation.ORDERED_SET) {
            switch (operation) {
                case UNION:
                    store.orderedSetUnionStore(key, keys);
                    break;
                case INTERSECT:
                    store.orderedSetIntersectStore(key, keys);
                    break;
                default:
                    store.orderedSetDiffStore(key, keys);
            }
        } else {
            switch (operation) {
                case UNION:
                    store.setUnionStore(key, keys);
                    break;
                case INTERSECT:
                    store.setIntersectStore(key, keys);
                    break;
                default:
                    store.setDiffStore(key, keys);
            }
        }
        InvertedIndex index;
        if (target == Representation.ORDERED_SET) {
            InvertedIndex scored = operands.stream()
                    .filter(i -> i.getRepresentation() == Representation.ORDERED_SET)
                    .findFirst().orElse(null);
            index = new InvertedIndex(store, key, IndexFamily.DERIVED, target,
                    scored == null ? null : scored.getScoreColumn(), null, false);
        } else {
            // Only unordered results may outlive the query; their content depends on the signature alone.
            index = new InvertedIndex(store, key, IndexFamily.DERIVED, target, null, signature, false);
            catalog.recordDerivedBuild(signature);
        }
        derived.add(index);
        return index;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int deleted = 0;
        for (InvertedIndex index : derived) {
            if (!index.isPersisted()) {
                index.delete();
                deleted++;
            }
        }
        logger.debug("Query {} released {} derived indexes", queryID, deleted);
    }
}
