package edu.stanford.futuredata.tallyserve.store;

/**
 * A store operation was applied to a key holding a different kind of structure.
 */
public class WrongTypeException extends RuntimeException {

    private final String key;
    private final KeyType actual;

    public WrongTypeException(String key, KeyType actual, String operation) {
        super(String.format("%s on key %s holding %s", operation, key, actual));
        this.key = key;
        this.actual = actual;
    }

    public String getKey() {
        return key;
    }

    public KeyType getActual() {
        return actual;
    }
}
