package edu.stanford.futuredata.tallyserve.exceptions;

/**
 * Malformed query text.  Surfaced verbatim, never retried.
 */
public class SyntaxErrorException extends QueryFailedException {

    private final int position;

    public SyntaxErrorException(int position, String message) {
        super(String.format("Syntax error at position %d: %s", position, message));
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
