package edu.stanford.futuredata.tallyserve.expression;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class Compare extends Expression {

    private final Column column;
    private final ComparisonOperator op;
    private final Value literal;

    Compare(Column column, ComparisonOperator op, Value literal) {
        this.column = Objects.requireNonNull(column);
        this.op = Objects.requireNonNull(op);
        this.literal = Objects.requireNonNull(literal);
    }

    public Column getColumn() {
        return column;
    }

    public ComparisonOperator getOp() {
        return op;
    }

    public Value getLiteral() {
        return literal;
    }

    @Override
    public Kind getKind() {
        return Kind.COMPARE;
    }

    @Override
    public Set<String> columns() {
        return Set.of(column.getName());
    }

    @Override
    public boolean matches(Record record) {
        Optional<Value> value = record.get(column);
        return value.isPresent() && op.test(value.get().compareTo(literal));
    }

    @Override
    public String toString() {
        return column + " " + op.getSymbol() + " " + literal;
    }
}
