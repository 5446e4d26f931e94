package edu.stanford.futuredata.tallyserve.expression;

import java.io.Serializable;
import java.util.Objects;

/**
 * A reference to one attribute of a named field: its value, or the time the value was written.
 */
public final class Column implements Serializable {

    public enum Attribute {
        VALUE, TIME
    }

    private final String name;
    private final Attribute attribute;

    public Column(String name, Attribute attribute) {
        this.name = Objects.requireNonNull(name);
        this.attribute = Objects.requireNonNull(attribute);
    }

    public static Column value(String name) {
        return new Column(name, Attribute.VALUE);
    }

    public static Column time(String name) {
        return new Column(name, Attribute.TIME);
    }

    public String getName() {
        return name;
    }

    public Attribute getAttribute() {
        return attribute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Column)) {
            return false;
        }
        Column column = (Column) o;
        return name.equals(column.name) && attribute == column.attribute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attribute);
    }

    @Override
    public String toString() {
        String quoted = name.matches("[A-Za-z_][A-Za-z0-9_]*") ? name : "\"" + name.replace("\"", "\"\"") + "\"";
        return attribute == Attribute.TIME ? quoted + ".time" : quoted;
    }
}
