package edu.stanford.futuredata.tallyserve.expression;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public final class Or extends Expression {

    private final Expression left;
    private final Expression right;

    Or(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public Kind getKind() {
        return Kind.OR;
    }

    @Override
    public Set<String> columns() {
        Set<String> columns = new HashSet<>(left.columns());
        columns.addAll(right.columns());
        return columns;
    }

    @Override
    public boolean matches(Record record) {
        return left.matches(record) || right.matches(record);
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }
}
