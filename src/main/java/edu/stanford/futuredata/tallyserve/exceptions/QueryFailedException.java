package edu.stanford.futuredata.tallyserve.exceptions;

/**
 * Base of every typed failure a query can surface to its caller.
 */
public class QueryFailedException extends RuntimeException {

    public QueryFailedException(String message) {
        super(message);
    }

    public QueryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
