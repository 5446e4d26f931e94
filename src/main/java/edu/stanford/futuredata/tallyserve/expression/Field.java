package edu.stanford.futuredata.tallyserve.expression;

import java.io.Serializable;
import java.util.Objects;

/**
 * One stored field: a value and the epoch millisecond it was written at.
 */
public final class Field implements Serializable {

    private final Value value;
    private final long time;

    public Field(Value value, long time) {
        this.value = Objects.requireNonNull(value);
        this.time = time;
    }

    public Value getValue() {
        return value;
    }

    public long getTime() {
        return time;
    }

    public Value get(Column.Attribute attribute) {
        return attribute == Column.Attribute.TIME ? Value.ofDate(time) : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Field)) {
            return false;
        }
        Field field = (Field) o;
        return time == field.time && value.getType() == field.value.getType() && value.equals(field.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, time);
    }

    @Override
    public String toString() {
        return value + "@" + time;
    }
}
