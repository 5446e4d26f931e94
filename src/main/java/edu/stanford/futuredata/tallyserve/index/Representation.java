package edu.stanford.futuredata.tallyserve.index;

public enum Representation {
    // Unordered row ids.
    SET,
    // Row ids scored by a column's value or time; supports score-range reads.
    ORDERED_SET
}
