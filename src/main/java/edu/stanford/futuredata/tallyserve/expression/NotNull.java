package edu.stanford.futuredata.tallyserve.expression;

import java.util.Objects;
import java.util.Set;

public final class NotNull extends Expression {

    private final Column column;

    NotNull(Column column) {
        this.column = Objects.requireNonNull(column);
    }

    public Column getColumn() {
        return column;
    }

    @Override
    public Kind getKind() {
        return Kind.NOT_NULL;
    }

    @Override
    public Set<String> columns() {
        return Set.of(column.getName());
    }

    @Override
    public boolean matches(Record record) {
        return record.getField(column.getName()).isPresent();
    }

    @Override
    public String toString() {
        return Column.value(column.getName()) + " IS NOT NULL";
    }
}
