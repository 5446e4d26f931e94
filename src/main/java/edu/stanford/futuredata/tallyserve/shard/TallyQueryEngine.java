package edu.stanford.futuredata.tallyserve.shard;

import edu.stanford.futuredata.tallyserve.interfaces.QueryEngine;

public class TallyQueryEngine implements QueryEngine {

    @Override
    public int keyToShard(int partitionKey, int numShards) {
        return partitionKey % numShards;
    }
}
