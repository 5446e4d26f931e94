package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.exceptions.IndexCorruptionException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Field;
import edu.stanford.futuredata.tallyserve.store.KeyType;
import edu.stanford.futuredata.tallyserve.store.KeyValueStore;
import edu.stanford.futuredata.tallyserve.store.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Re-encodes a column's {@code any_} index between a plain set and an ordered set.
 *
 * The new encoding is built under a scratch key and renamed over the old one, so readers see either the old or the
 * new index and never a partial one.  Callers hold the shard's write lock.
 */
public class IndexEncoder {

    private static final Logger logger = LoggerFactory.getLogger(IndexEncoder.class);

    private final KeyValueStore store;
    private final RowStore rowStore;

    public IndexEncoder(KeyValueStore store, RowStore rowStore) {
        this.store = store;
        this.rowStore = rowStore;
    }

    /**
     * Rebuild {@code any_column} as an ordered set scored by the attribute.  Already ordered indexes are re-scored.
     * @return the number of members
     * @throws IndexCorruptionException if a member has no stored field for the column
     */
    public long promote(String column, Column.Attribute attribute) {
        String key = IndexNames.any(column);
        if (store.type(key) == KeyType.SCALAR) {
            throw new IndexCorruptionException(key, String.format("Index %s holds a scalar", key));
        }
        List<String> members = store.members(key);
        String scratch = IndexNames.scratch(key);
        store.delete(scratch);
        for (String id : members) {
            Optional<Field> field = rowStore.getField(id, column);
            if (field.isEmpty()) {
                store.delete(scratch);
                throw new IndexCorruptionException(key,
                        String.format("Index %s lists row %s which has no field %s", key, id, column));
            }
            store.orderedSetAdd(scratch, id, field.get().get(attribute).score());
        }
        store.rename(scratch, key);
        logger.info("Promoted {} to an ordered index by {} ({} members)", key, attribute, members.size());
        return members.size();
    }

    /** Rebuild {@code any_column} as a plain set. */
    public long demote(String column) {
        String key = IndexNames.any(column);
        if (store.type(key) != KeyType.ORDERED_SET) {
            return store.cardinality(key);
        }
        String scratch = IndexNames.scratch(key);
        long size = store.setUnionStore(scratch, List.of(key));
        store.rename(scratch, key);
        logger.info("Demoted {} to a plain set ({} members)", key, size);
        return size;
    }
}
