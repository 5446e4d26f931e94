package edu.stanford.futuredata.tallyserve.exceptions;

/**
 * A shard did not produce its partial result: it timed out, its datastore was unreachable, or it failed locally.
 * The whole query fails; no answer is built from the shards that did respond.
 */
public class ShardUnavailableException extends QueryFailedException {

    private final int shardNum;

    public ShardUnavailableException(int shardNum, String message) {
        super(String.format("Shard %d unavailable: %s", shardNum, message));
        this.shardNum = shardNum;
    }

    public ShardUnavailableException(String message) {
        super(message);
        this.shardNum = -1;
    }

    /** The failing shard, or -1 if the failure was not tied to one shard. */
    public int getShardNum() {
        return shardNum;
    }
}
