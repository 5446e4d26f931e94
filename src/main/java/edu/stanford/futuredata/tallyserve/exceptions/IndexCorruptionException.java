package edu.stanford.futuredata.tallyserve.exceptions;

/**
 * A persisted index disagrees with what the indexing policy expects of it, e.g. an ordered index stored as a
 * plain set.  Fatal for the shard's contribution to the query.
 */
public class IndexCorruptionException extends QueryFailedException {

    private final String keyName;

    public IndexCorruptionException(String keyName, String message) {
        super(String.format("Index %s corrupt: %s", keyName, message));
        this.keyName = keyName;
    }

    public String getKeyName() {
        return keyName;
    }
}
