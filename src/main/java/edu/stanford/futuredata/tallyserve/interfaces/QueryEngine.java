package edu.stanford.futuredata.tallyserve.interfaces;

public interface QueryEngine {
    /*
     Lives on a broker.
     Maps partition keys to shards.
     */

    // To which shard (of numShards) should a partition key be assigned?
    int keyToShard(int partitionKey, int numShards);
}
