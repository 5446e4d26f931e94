package edu.stanford.futuredata.tallyserve.expression;

import edu.stanford.futuredata.tallyserve.interfaces.Row;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A sparse row: an identifier and whichever fields it has.  A missing field is null.
 *
 * Records are both what the evaluator loads from a shard and what a write query carries to one.
 */
public final class Record implements Row {

    private final String id;
    private final Map<String, Field> fields;

    public Record(String id, Map<String, Field> fields) {
        this.id = Objects.requireNonNull(id);
        this.fields = Collections.unmodifiableMap(new HashMap<>(fields));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public Map<String, Field> getFields() {
        return fields;
    }

    public Optional<Field> getField(String column) {
        return Optional.ofNullable(fields.get(column));
    }

    /** The referenced attribute, or empty if the field is absent. */
    public Optional<Value> get(Column column) {
        Field field = fields.get(column.getName());
        if (field == null) {
            return Optional.empty();
        }
        return Optional.of(field.get(column.getAttribute()));
    }

    @Override
    public int getPartitionKey() {
        return id.hashCode() & Integer.MAX_VALUE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Record)) {
            return false;
        }
        Record record = (Record) o;
        return id.equals(record.id) && fields.equals(record.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fields);
    }

    @Override
    public String toString() {
        return id + fields;
    }

    public static class Builder {
        private final String id;
        private final Map<String, Field> fields = new HashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder field(String column, Value value, long time) {
            fields.put(column, new Field(value, time));
            return this;
        }

        public Record build() {
            return new Record(id, fields);
        }
    }
}
