package edu.stanford.futuredata.tallyserve.query;

public enum QueryKind {
    // Number of matching rows.
    COUNT,
    // Minimum and maximum of a target column over matching rows.
    EXTENT,
    // Identifiers of matching rows.
    ID_SET
}
