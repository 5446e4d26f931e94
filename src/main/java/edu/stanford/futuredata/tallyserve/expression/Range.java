package edu.stanford.futuredata.tallyserve.expression;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@code lower lowerOp column upperOp upper}, bounded on both sides.
 */
public final class Range extends Expression {

    private final Column column;
    private final ComparisonOperator lowerOp;
    private final Value lower;
    private final ComparisonOperator upperOp;
    private final Value upper;

    Range(Column column, ComparisonOperator lowerOp, Value lower, ComparisonOperator upperOp, Value upper) {
        if (lowerOp != ComparisonOperator.GT && lowerOp != ComparisonOperator.GE) {
            throw new IllegalArgumentException("Lower bound operator must be > or >=, got " + lowerOp.getSymbol());
        }
        if (upperOp != ComparisonOperator.LT && upperOp != ComparisonOperator.LE) {
            throw new IllegalArgumentException("Upper bound operator must be < or <=, got " + upperOp.getSymbol());
        }
        this.column = Objects.requireNonNull(column);
        this.lowerOp = lowerOp;
        this.lower = Objects.requireNonNull(lower);
        this.upperOp = upperOp;
        this.upper = Objects.requireNonNull(upper);
    }

    public Column getColumn() {
        return column;
    }

    public ComparisonOperator getLowerOp() {
        return lowerOp;
    }

    public Value getLower() {
        return lower;
    }

    public ComparisonOperator getUpperOp() {
        return upperOp;
    }

    public Value getUpper() {
        return upper;
    }

    @Override
    public Kind getKind() {
        return Kind.RANGE;
    }

    @Override
    public Set<String> columns() {
        return Set.of(column.getName());
    }

    @Override
    public boolean matches(Record record) {
        Optional<Value> value = record.get(column);
        if (value.isEmpty()) {
            return false;
        }
        return lowerOp.test(value.get().compareTo(lower)) && upperOp.test(value.get().compareTo(upper));
    }

    @Override
    public String toString() {
        String flipped = lowerOp == ComparisonOperator.GT ? "<" : "<=";
        return lower + " " + flipped + " " + column + " " + upperOp.getSymbol() + " " + upper;
    }
}
