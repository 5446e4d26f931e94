package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.ComparisonOperator;
import edu.stanford.futuredata.tallyserve.expression.Value;

import java.util.Objects;

/**
 * An inclusive score interval over an ordered index scored by {@link #getColumn()}.
 *
 * Scores are a lossy but order-preserving image of values, so the interval always contains every true match and
 * may contain more.  Exclusive bounds are widened to inclusive ones; candidates are re-checked row by row.
 */
public final class ScoreRange {

    private final Column column;
    private final double min;
    private final double max;

    public ScoreRange(Column column, double min, double max) {
        this.column = Objects.requireNonNull(column);
        this.min = min;
        this.max = max;
    }

    /** The candidate interval for {@code column op literal}, or null if the operator does not bound it. */
    public static ScoreRange forComparison(Column column, ComparisonOperator op, Value literal) {
        double score = literal.score();
        switch (op) {
            case EQ:
                return new ScoreRange(column, score, score);
            case LT:
            case LE:
                return new ScoreRange(column, Double.NEGATIVE_INFINITY, score);
            case GT:
            case GE:
                return new ScoreRange(column, score, Double.POSITIVE_INFINITY);
            default:
                return null;
        }
    }

    public static ScoreRange between(Column column, Value lower, Value upper) {
        return new ScoreRange(column, lower.score(), upper.score());
    }

    public Column getColumn() {
        return column;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return String.format("%s in [%s, %s]", column, min, max);
    }
}
