package edu.stanford.futuredata.tallyserve.store;

public enum KeyType {
    NONE, SCALAR, SET, ORDERED_SET
}
