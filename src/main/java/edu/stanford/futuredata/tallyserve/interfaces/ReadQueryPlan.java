package edu.stanford.futuredata.tallyserve.interfaces;

import com.google.protobuf.ByteString;

import java.io.Serializable;
import java.util.List;

public interface ReadQueryPlan<S extends Shard, T> extends Serializable {
    /*
     Execute a read query on the shards of a table, then aggregate the per-shard results.
     */

    // Which table is being queried?
    String getQueriedTable();
    // Keys on which the query executes.  Query will execute on all shards containing any key from the list.
    // Include -1 to execute on all shards.
    List<Integer> keysForQuery();
    // This function will execute on each shard containing at least one key from keysForQuery.
    ByteString queryShard(S shard);
    // The query will return the result of this function executed on all results from queryShard.
    // Shard results arrive in no particular order.
    T aggregateShardQueries(List<ByteString> shardQueryResults);
}
