package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.expression.Value;

/**
 * Store key names of indexes and rows.
 */
public final class IndexNames {

    public static final String ALL = "all";
    // Set of persisted derived index keys, cleared on every write.
    public static final String DERIVED_REGISTRY = "derived:registry";

    private IndexNames() {}

    public static String any(String column) {
        return "any_" + column;
    }

    // Length-prefixed like field keys, so a column name holding '_' or ':' cannot run into the token.
    public static String value(String column, Value value) {
        return String.format("value_%d:%s_%s", column.length(), column, value.indexToken());
    }

    public static String derived(String signature) {
        return "derived_" + signature;
    }

    // Query-private key; the query id keeps concurrent queries apart.
    public static String transientKey(String queryID, int sequence) {
        return String.format("tmp:%s:%d", queryID, sequence);
    }

    public static String scratch(String key) {
        return "reencode:" + key;
    }

    // Length-prefixed so that ids and column names may contain the separator.
    public static String field(String id, String column) {
        return String.format("field:%d:%s:%s", id.length(), id, column);
    }

    public static String rowColumns(String id) {
        return "columns:" + id;
    }
}
