package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.exceptions.IndexCorruptionException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.store.KeyType;
import edu.stanford.futuredata.tallyserve.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Opens the indexes of one shard, checking that each stored key has the representation the policy expects.
 */
public class IndexCatalog {

    private static final Logger logger = LoggerFactory.getLogger(IndexCatalog.class);

    private final KeyValueStore store;
    private final IndexingPolicy policy;
    // Builds per derived-index signature.
    private final ReusePredictor derivedDemand;
    // Ordering predicates that found no matching ordered index, per column.
    private final ReusePredictor orderingDemand;
    private final Map<String, Column.Attribute> pendingPromotions = new HashMap<>();

    public IndexCatalog(KeyValueStore store, IndexingPolicy policy) {
        this.store = store;
        this.policy = policy;
        this.derivedDemand = new ReusePredictor(policy.maxTrackedKeys);
        this.orderingDemand = new ReusePredictor(policy.maxTrackedKeys);
    }

    public KeyValueStore getStore() {
        return store;
    }

    public IndexingPolicy getPolicy() {
        return policy;
    }

    public InvertedIndex all() {
        requireType(IndexNames.ALL, KeyType.SET);
        return new InvertedIndex(store, IndexNames.ALL, IndexFamily.ALL, Representation.SET, null, null, true);
    }

    /**
     * The index of rows with a non-null column.  An ordered-by-policy column must be stored ordered; an unordered
     * column may still be stored ordered while a demotion is in flight, in which case its scores are not trusted.
     */
    public InvertedIndex any(String column) {
        String key = IndexNames.any(column);
        KeyType type = store.type(key);
        Optional<Column.Attribute> ordering = policy.orderingOf(column);
        if (type == KeyType.SCALAR) {
            throw new IndexCorruptionException(key, String.format("Index %s holds a scalar", key));
        }
        if (type == KeyType.SET && ordering.isPresent()) {
            throw new IndexCorruptionException(key,
                    String.format("Index %s should be ordered by %s but is a plain set", key, ordering.get()));
        }
        Representation representation;
        if (type == KeyType.NONE) {
            representation = policy.anyRepresentation(column);
        } else {
            representation = type == KeyType.ORDERED_SET ? Representation.ORDERED_SET : Representation.SET;
        }
        Column scoreColumn = ordering.map(a -> new Column(column, a)).orElse(null);
        return new InvertedIndex(store, key, IndexFamily.ANY, representation, scoreColumn, null, true);
    }

    /** The index of rows whose column equals the value, if any row does. */
    public Optional<InvertedIndex> value(String column, Value value) {
        String key = IndexNames.value(column, value);
        if (store.type(key) == KeyType.NONE) {
            return Optional.empty();
        }
        requireType(key, KeyType.SET);
        return Optional.of(new InvertedIndex(store, key, IndexFamily.VALUE, Representation.SET, null, null, true));
    }

    /** A persisted derived index for the signature, if one survives from an earlier query. */
    public Optional<InvertedIndex> derived(String signature) {
        String key = IndexNames.derived(signature);
        if (!store.setIsMember(IndexNames.DERIVED_REGISTRY, key)) {
            return Optional.empty();
        }
        // An empty result leaves no key behind, so a missing key is an empty index.
        requireType(key, KeyType.SET);
        return Optional.of(new InvertedIndex(store, key, IndexFamily.DERIVED, Representation.SET, null, signature,
                true));
    }

    /** Delete every persisted derived index.  Called whenever the underlying rows change. */
    public int invalidateDerived() {
        Set<String> keys = store.setMembers(IndexNames.DERIVED_REGISTRY);
        for (String key : keys) {
            store.delete(key);
        }
        store.delete(IndexNames.DERIVED_REGISTRY);
        if (!keys.isEmpty()) {
            logger.debug("Invalidated {} derived indexes", keys.size());
        }
        return keys.size();
    }

    public QueryScope openScope() {
        return new QueryScope(this, store);
    }

    void recordDerivedBuild(String signature) {
        derivedDemand.record(signature);
    }

    public boolean predictsReuse(String signature) {
        return derivedDemand.predictsReuse(signature, policy.derivedReuseThreshold);
    }

    /**
     * Note an ordering predicate on a column without a usable ordered index.  Once the column has been asked for
     * often enough it becomes a promotion candidate.
     */
    public void recordOrderingDemand(Column column) {
        if (policy.promotionThreshold <= 0 || policy.orderingOf(column.getName()).isPresent()) {
            return;
        }
        int count = orderingDemand.record(column.toString());
        if (count >= policy.promotionThreshold) {
            synchronized (pendingPromotions) {
                pendingPromotions.putIfAbsent(column.getName(), column.getAttribute());
            }
        }
    }

    /** Columns due for promotion to an ordered index, cleared on return. */
    public Map<String, Column.Attribute> takePromotionCandidates() {
        synchronized (pendingPromotions) {
            Map<String, Column.Attribute> candidates = new HashMap<>(pendingPromotions);
            pendingPromotions.clear();
            for (Map.Entry<String, Column.Attribute> e : candidates.entrySet()) {
                orderingDemand.reset(new Column(e.getKey(), e.getValue()).toString());
            }
            return candidates;
        }
    }

    private void requireType(String key, KeyType expected) {
        KeyType type = store.type(key);
        if (type != KeyType.NONE && type != expected) {
            throw new IndexCorruptionException(key,
                    String.format("Index %s should be %s but is %s", key, expected, type));
        }
    }
}
