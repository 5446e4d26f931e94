package edu.stanford.futuredata.tallyserve.store;

import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Field;
import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.index.IndexCatalog;
import edu.stanford.futuredata.tallyserve.index.IndexNames;
import edu.stanford.futuredata.tallyserve.index.IndexingPolicy;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rows and their fields, stored alongside the indexes that describe them.
 *
 * A row exists exactly when the {@code all} index contains its id.  Every write keeps {@code all}, the column's
 * {@code any_} index and its {@code value_} indexes consistent with the stored fields, and drops persisted derived
 * indexes, which may no longer be accurate.
 */
public class RowStore {

    private final KeyValueStore store;
    private final IndexingPolicy policy;
    private final IndexCatalog catalog;

    public RowStore(KeyValueStore store, IndexingPolicy policy, IndexCatalog catalog) {
        this.store = store;
        this.policy = policy;
        this.catalog = catalog;
    }

    /**
     * Load the requested fields of a row.  Fields the row lacks are absent from the record.
     * @return empty if the row does not exist
     */
    public Optional<Record> getRow(String id, Collection<String> columns) {
        if (!store.setIsMember(IndexNames.ALL, id)) {
            return Optional.empty();
        }
        Map<String, Field> fields = new HashMap<>();
        for (String column : columns) {
            getField(id, column).ifPresent(f -> fields.put(column, f));
        }
        return Optional.of(new Record(id, fields));
    }

    /** Load every field of a row. */
    public Optional<Record> getRow(String id) {
        if (!store.setIsMember(IndexNames.ALL, id)) {
            return Optional.empty();
        }
        return getRow(id, store.setMembers(IndexNames.rowColumns(id)));
    }

    public Optional<Field> getField(String id, String column) {
        return store.get(IndexNames.field(id, column)).map(RowStore::decodeField);
    }

    public long rowCount() {
        return store.cardinality(IndexNames.ALL);
    }

    /** Store every field of a record, replacing earlier values of those fields. */
    public void writeRecord(Record record) {
        for (Map.Entry<String, Field> e : record.getFields().entrySet()) {
            putField(record.getId(), e.getKey(), e.getValue());
        }
        if (record.getFields().isEmpty() && store.setAdd(IndexNames.ALL, record.getId())) {
            catalog.invalidateDerived();
        }
    }

    public void putField(String id, String column, Field field) {
        Optional<Field> old = getField(id, column);
        old.ifPresent(f -> store.setRemove(IndexNames.value(column, f.getValue()), id));
        store.set(IndexNames.field(id, column), encodeField(field));
        store.setAdd(IndexNames.ALL, id);
        store.setAdd(IndexNames.rowColumns(id), column);
        String anyKey = IndexNames.any(column);
        if (isOrdered(column)) {
            Column.Attribute attribute = policy.orderingOf(column).orElse(Column.Attribute.VALUE);
            store.orderedSetAdd(anyKey, id, field.get(attribute).score());
        } else {
            store.setAdd(anyKey, id);
        }
        store.setAdd(IndexNames.value(column, field.getValue()), id);
        catalog.invalidateDerived();
    }

    /** Remove one field of a row.  A row left with no fields still exists. */
    public boolean removeField(String id, String column) {
        Optional<Field> old = getField(id, column);
        if (old.isEmpty()) {
            return false;
        }
        store.setRemove(IndexNames.value(column, old.get().getValue()), id);
        String anyKey = IndexNames.any(column);
        if (store.type(anyKey) == KeyType.ORDERED_SET) {
            store.orderedSetRemove(anyKey, id);
        } else {
            store.setRemove(anyKey, id);
        }
        store.delete(IndexNames.field(id, column));
        store.setRemove(IndexNames.rowColumns(id), column);
        catalog.invalidateDerived();
        return true;
    }

    public boolean removeRow(String id) {
        if (!store.setIsMember(IndexNames.ALL, id)) {
            return false;
        }
        for (String column : store.setMembers(IndexNames.rowColumns(id))) {
            removeField(id, column);
        }
        store.setRemove(IndexNames.ALL, id);
        catalog.invalidateDerived();
        return true;
    }

    private boolean isOrdered(String column) {
        KeyType type = store.type(IndexNames.any(column));
        if (type == KeyType.NONE) {
            return policy.orderingOf(column).isPresent();
        }
        return type == KeyType.ORDERED_SET;
    }

    static String encodeField(Field field) {
        return field.getTime() + "|" + field.getValue().encode();
    }

    static Field decodeField(String encoded) {
        int split = encoded.indexOf('|');
        return new Field(Value.decode(encoded.substring(split + 1)), Long.parseLong(encoded.substring(0, split)));
    }
}
