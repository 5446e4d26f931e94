package edu.stanford.futuredata.tallyserve.interfaces;

import java.nio.file.Path;
import java.util.Optional;

public interface Shard {
    /*
     A stateful data structure holding one partition of a table and its local indexes.

     Shard concurrency contract:
     Writes never run simultaneously.
     Reads run at any time; the shard serializes its own access to indexes.
     */

    // Return the number of stored entries, a proxy for memory use.
    int getMemoryUsage();
    // Destroy shard data.  After destruction, shard is no longer usable.
    void destroy();
    // Return a directory containing a serialization of this shard.
    Optional<Path> shardToData();
}
