package edu.stanford.futuredata.tallyserve.expression;

import edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A dynamically typed field value or query literal.
 *
 * Numbers compare with numbers, dates with dates and strings with strings; any other pairing is a
 * {@link TypeMismatchException}.
 */
public final class Value implements Serializable {

    public enum Type {
        INTEGER, FLOAT, STRING, DATE
    }

    // Three UTF-16 code units fill 48 bits, which a double holds exactly.
    private static final int STRING_SCORE_CHARS = 3;

    private final Type type;
    private final long longValue;
    private final double doubleValue;
    private final String stringValue;

    private Value(Type type, long longValue, double doubleValue, String stringValue) {
        this.type = type;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.stringValue = stringValue;
    }

    public static Value ofInteger(long v) {
        return new Value(Type.INTEGER, v, v, null);
    }

    public static Value ofFloat(double v) {
        // -0.0 == 0.0, so both store as 0.0.
        return new Value(Type.FLOAT, 0, v == 0.0 ? 0.0 : v, null);
    }

    public static Value ofString(String v) {
        Objects.requireNonNull(v);
        return new Value(Type.STRING, 0, 0, v);
    }

    /** A date at the given epoch millisecond. */
    public static Value ofDate(long epochMillis) {
        return new Value(Type.DATE, epochMillis, epochMillis, null);
    }

    /** A date at UTC midnight of the given day. */
    public static Value ofDate(LocalDate date) {
        return ofDate(date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli());
    }

    public Type getType() {
        return type;
    }

    public boolean isNumeric() {
        return type == Type.INTEGER || type == Type.FLOAT;
    }

    public long asLong() {
        return type == Type.FLOAT ? (long) doubleValue : longValue;
    }

    public double asDouble() {
        return doubleValue;
    }

    public String asString() {
        return stringValue;
    }

    public boolean isComparableTo(Value other) {
        if (isNumeric()) {
            return other.isNumeric();
        }
        return type == other.type;
    }

    /**
     * Compare two values of compatible kinds.
     * @throws TypeMismatchException if the kinds are incompatible
     */
    public int compareTo(Value other) {
        if (!isComparableTo(other)) {
            throw new TypeMismatchException(String.format("Cannot compare %s %s with %s %s",
                    type, this, other.type, other));
        }
        switch (type) {
            case INTEGER:
            case FLOAT:
                return compareNumbers(other);
            case DATE:
                return Long.compare(longValue, other.longValue);
            case STRING:
                return stringValue.compareTo(other.stringValue);
            default:
                throw new IllegalStateException("Unknown value type " + type);
        }
    }

    // Exact across INTEGER and FLOAT: a long is not widened to a double.
    private int compareNumbers(Value other) {
        if (type == Type.INTEGER && other.type == Type.INTEGER) {
            return Long.compare(longValue, other.longValue);
        }
        if (type == Type.FLOAT && other.type == Type.FLOAT) {
            return Double.compare(doubleValue, other.doubleValue);
        }
        if (!isFinite() || !other.isFinite()) {
            return Double.compare(doubleValue, other.doubleValue);
        }
        return exactNumber().compareTo(other.exactNumber());
    }

    private boolean isFinite() {
        return type != Type.FLOAT || Double.isFinite(doubleValue);
    }

    private BigDecimal exactNumber() {
        return type == Type.INTEGER ? BigDecimal.valueOf(longValue) : new BigDecimal(doubleValue);
    }

    /**
     * Ordered-index score.  Non-decreasing in {@link #compareTo} order within a kind, but lossy: distinct values may
     * share a score, so a score range only narrows candidates and never proves a match.
     */
    public double score() {
        if (type == Type.STRING) {
            double score = 0;
            for (int i = 0; i < STRING_SCORE_CHARS; i++) {
                int c = i < stringValue.length() ? stringValue.charAt(i) : 0;
                score = score * 65536 + c;
            }
            return score;
        }
        return doubleValue;
    }

    /**
     * The token naming this value's {@code value_} index.  Tagged by kind family so a number and a string with the
     * same text never share an index.  Two numbers share a token exactly when {@link #compareTo} finds them equal.
     */
    public String indexToken() {
        switch (type) {
            case INTEGER:
                return "n:" + longValue;
            case FLOAT:
                if (!Double.isFinite(doubleValue)) {
                    return "n:" + doubleValue;
                }
                return "n:" + new BigDecimal(doubleValue).stripTrailingZeros().toPlainString();
            case DATE:
                return "d:" + longValue;
            case STRING:
                return "s:" + stringValue;
            default:
                throw new IllegalStateException("Unknown value type " + type);
        }
    }

    /** Storage encoding, read back by {@link #decode}. */
    public String encode() {
        switch (type) {
            case INTEGER:
                return "I" + longValue;
            case FLOAT:
                return "F" + doubleValue;
            case DATE:
                return "D" + longValue;
            case STRING:
                return "S" + stringValue;
            default:
                throw new IllegalStateException("Unknown value type " + type);
        }
    }

    public static Value decode(String encoded) {
        String payload = encoded.substring(1);
        switch (encoded.charAt(0)) {
            case 'I':
                return ofInteger(Long.parseLong(payload));
            case 'F':
                return ofFloat(Double.parseDouble(payload));
            case 'D':
                return ofDate(Long.parseLong(payload));
            case 'S':
                return ofString(payload);
            default:
                throw new IllegalArgumentException("Unknown value encoding " + encoded);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        return isComparableTo(other) && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return indexToken().hashCode();
    }

    @Override
    public String toString() {
        switch (type) {
            case INTEGER:
                return Long.toString(longValue);
            case FLOAT:
                return Double.toString(doubleValue);
            case DATE:
                Instant instant = Instant.ofEpochMilli(longValue);
                if (longValue % 86400000L == 0) {
                    return "DATE '" + LocalDate.ofInstant(instant, ZoneOffset.UTC) + "'";
                }
                return "DATE '" + instant + "'";
            case STRING:
                return "'" + stringValue.replace("'", "''") + "'";
            default:
                throw new IllegalStateException("Unknown value type " + type);
        }
    }
}
