package edu.stanford.futuredata.tallyserve.index;

public enum IndexFamily {
    // Every row.
    ALL,
    // Rows with a non-null column.
    ANY,
    // Rows with one exact column value.
    VALUE,
    // Built from the others with set algebra.
    DERIVED,
    // Matches nothing; backed by no key.
    EMPTY;

    /** Maintained by the write path; never deleted by a query. */
    public boolean isPermanent() {
        return this == ALL || this == ANY || this == VALUE;
    }
}
