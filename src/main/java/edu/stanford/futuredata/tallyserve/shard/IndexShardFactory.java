package edu.stanford.futuredata.tallyserve.shard;

import edu.stanford.futuredata.tallyserve.index.IndexingPolicy;
import edu.stanford.futuredata.tallyserve.interfaces.ShardFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class IndexShardFactory implements ShardFactory<IndexShard> {

    private static final Logger logger = LoggerFactory.getLogger(IndexShardFactory.class);

    // Every new shard starts from a copy of this policy.
    private final IndexingPolicy policy;

    public IndexShardFactory(IndexingPolicy policy) {
        this.policy = policy;
    }

    public IndexShardFactory() {
        this(new IndexingPolicy());
    }

    @Override
    public Optional<IndexShard> createNewShard(Path shardPath, int shardNum) {
        return Optional.of(new IndexShard(shardPath, shardNum, policy.copy()));
    }

    @Override
    public Optional<IndexShard> createShardFromDir(Path shardPath, int shardNum) {
        try {
            return Optional.of(IndexShard.load(shardPath, shardNum));
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            logger.warn("Shard creation from directory failed: {}: {}", shardPath.toString(), e.getMessage());
            return Optional.empty();
        }
    }
}
