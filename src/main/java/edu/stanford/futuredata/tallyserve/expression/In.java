package edu.stanford.futuredata.tallyserve.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public final class In extends Expression {

    private final Column column;
    private final List<Value> literals;

    In(Column column, Collection<Value> literals) {
        this.column = Objects.requireNonNull(column);
        List<Value> distinct = new ArrayList<>();
        for (Value v : literals) {
            if (!distinct.contains(v)) {
                distinct.add(v);
            }
        }
        this.literals = Collections.unmodifiableList(distinct);
    }

    public Column getColumn() {
        return column;
    }

    public List<Value> getLiterals() {
        return literals;
    }

    @Override
    public Kind getKind() {
        return Kind.IN;
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
        for (Value literal : literals) {
            if (value.get().compareTo(literal) == 0) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return column + " IN (" + literals.stream().map(Value::toString).collect(Collectors.joining(", ")) + ")";
    }
}
