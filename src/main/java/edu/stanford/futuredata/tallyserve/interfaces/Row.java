package edu.stanford.futuredata.tallyserve.interfaces;

import java.io.Serializable;

public interface Row extends Serializable {
    /*
     A row of data.  Exposes a partition key.  Key must be nonnegative.
     We guarantee that rows with the same key are stored in the same shard of a table.
     */
    int getPartitionKey();
}
