package edu.stanford.futuredata.tallyserve.exceptions;

/**
 * A literal was compared against a field value of an incompatible kind, e.g. a string column against a numeric
 * literal.  Values are never coerced.
 */
public class TypeMismatchException extends QueryFailedException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
