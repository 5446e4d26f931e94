package edu.stanford.futuredata.tallyserve.expression;

import java.io.Serializable;
import java.util.Collection;
import java.util.Set;

/**
 * A parsed query predicate.  A closed set of node kinds: consumers dispatch on {@link #getKind()}.
 *
 * Expressions are immutable and travel inside serialized query plans.  {@link #toString()} is canonical: equal
 * trees print identically, and the text is used to name derived indexes.
 */
public abstract class Expression implements Serializable {

    public enum Kind {
        COMPARE, RANGE, IN, IS_NULL, NOT_NULL, AND, OR, NOT
    }

    public abstract Kind getKind();

    /** Names of every field this expression reads. */
    public abstract Set<String> columns();

    /**
     * Evaluate against a loaded record.  Absent fields never throw: comparisons on them are false, {@code IS NULL}
     * is true and {@code IS NOT NULL} is false.
     * @throws edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException if a present field cannot be
     * compared with a literal
     */
    public abstract boolean matches(Record record);

    public static Expression compare(Column column, ComparisonOperator op, Value literal) {
        return new Compare(column, op, literal);
    }

    public static Expression range(Column column, ComparisonOperator lowerOp, Value lower,
                                   ComparisonOperator upperOp, Value upper) {
        return new Range(column, lowerOp, lower, upperOp, upper);
    }

    public static Expression in(Column column, Collection<Value> literals) {
        return new In(column, literals);
    }

    public static Expression isNull(Column column) {
        return new IsNull(column);
    }

    public static Expression notNull(Column column) {
        return new NotNull(column);
    }

    public static Expression and(Expression left, Expression right) {
        return new And(left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return new Or(left, right);
    }

    public static Expression not(Expression child) {
        return new Not(child);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Expression && toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
