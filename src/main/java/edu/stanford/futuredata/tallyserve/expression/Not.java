package edu.stanford.futuredata.tallyserve.expression;

import java.util.Objects;
import java.util.Set;

public final class Not extends Expression {

    private final Expression child;

    Not(Expression child) {
        this.child = Objects.requireNonNull(child);
    }

    public Expression getChild() {
        return child;
    }

    @Override
    public Kind getKind() {
        return Kind.NOT;
    }

    @Override
    public Set<String> columns() {
        return child.columns();
    }

    @Override
    public boolean matches(Record record) {
        return !child.matches(record);
    }

    @Override
    public String toString() {
        return "NOT " + (child.getKind() == Kind.AND || child.getKind() == Kind.OR ? child.toString() : "(" + child + ")");
    }
}
