package edu.stanford.futuredata.tallyserve.query;

public enum Exactness {
    // The resolved index holds exactly the matching rows.
    EXACT,
    // The resolved index holds every matching row and possibly more.
    APPROX
}
