package edu.stanford.futuredata.tallyserve.interfaces;

import java.io.Serializable;
import java.util.List;

public interface SimpleWriteQueryPlan<R extends Row, S extends Shard> extends Serializable {
    /*
     Execute a write query.
     */

    // What table is being queried?
    String getQueriedTable();
    // Apply the write to the rows routed to this shard.  Return true on success.
    boolean write(S shard, List<R> rows);
}
