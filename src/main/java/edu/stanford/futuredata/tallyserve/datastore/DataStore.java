package edu.stanford.futuredata.tallyserve.datastore;

import edu.stanford.futuredata.tallyserve.interfaces.Row;
import edu.stanford.futuredata.tallyserve.interfaces.Shard;
import edu.stanford.futuredata.tallyserve.interfaces.ShardFactory;
import edu.stanford.futuredata.tallyserve.utilities.DataStoreDescription;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;

/**
 * Hosts shards and serves broker queries against them.
 *
 * Shards are created on first use.  A shard directory left by an earlier run under the base directory is loaded
 * instead of starting empty, and every shard is saved there on shutdown.
 */
public class DataStore<R extends Row, S extends Shard> {

    private static final Logger logger = LoggerFactory.getLogger(DataStore.class);

    // Datastore metadata
    public final int dsID;
    private final String dsHost;
    private final int dsPort;
    public volatile boolean serving = false;

    // Map from shard number to shard data structure.
    public final Map<Integer, S> shardMap = new ConcurrentHashMap<>(); // Public for testing.
    // Map from shard number to access lock.
    final Map<Integer, ShardLock> shardLockMap = new ConcurrentHashMap<>();

    private final Server server;
    final DataStoreCurator zkCurator;
    final ShardFactory<S> shardFactory;
    final Path baseDirectory;

    // Collect execution times of all read queries.
    public final Collection<Long> readQueryExecuteTimes = new ConcurrentLinkedQueue<>();
    public final Collection<Long> readQueryFullTimes = new ConcurrentLinkedQueue<>();

    public DataStore(ShardFactory<S> shardFactory, Path baseDirectory, String zkHost, int zkPort, String dsHost,
                     int dsPort, int dsID) {
        this.dsID = dsID;
        this.dsHost = dsHost;
        this.dsPort = dsPort;
        this.shardFactory = shardFactory;
        this.baseDirectory = baseDirectory;
        this.server = ServerBuilder.forPort(dsPort)
                .addService(new ServiceBrokerDataStore<>(this))
                .build();
        this.zkCurator = new DataStoreCurator(zkHost, zkPort);
    }

    /** Start serving requests and announce this datastore to brokers. */
    public boolean startServing() {
        if (serving) {
            return true;
        }
        try {
            server.start();
        } catch (IOException e) {
            logger.warn("DataStore startup failed: {}", e.getMessage());
            zkCurator.close();
            return false;
        }
        serving = true;
        logger.info("DS{} server started, listening on {}", dsID, dsPort);
        DataStoreDescription description = new DataStoreDescription(dsID, DataStoreDescription.ALIVE, dsHost, dsPort);
        if (!zkCurator.registerDataStore(description)) {
            logger.warn("DS{} registration failed", dsID);
            shutDown();
            return false;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(DataStore.this::shutDown));
        return true;
    }

    /** Stop serving requests, save every shard and release resources. */
    public synchronized void shutDown() {
        if (!serving) {
            return;
        }
        serving = false;
        zkCurator.deregisterDataStore(dsID);
        server.shutdown();
        try {
            server.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (Map.Entry<Integer, S> entry: shardMap.entrySet()) {
            int shardNum = entry.getKey();
            Optional<Path> saved = shardLock(shardNum).withSystemLock(() -> entry.getValue().shardToData());
            if (saved.isEmpty()) {
                logger.warn("DS{} Shard {} serialization failed", dsID, shardNum);
            }
            entry.getValue().destroy();
            shardMap.remove(shardNum);
        }
        zkCurator.close();
        int numQueries = readQueryExecuteTimes.size();
        if (numQueries > 0 && !readQueryFullTimes.isEmpty()) {
            long[] exec = readQueryExecuteTimes.stream().mapToLong(i -> i).sorted().toArray();
            long[] full = readQueryFullTimes.stream().mapToLong(i -> i).sorted().toArray();
            logger.info("DS{} Queries: {} p50 Exec: {}μs p99 Exec: {}μs p50 Full: {}μs p99 Full: {}μs", dsID,
                    numQueries, exec[exec.length / 2], exec[exec.length * 99 / 100],
                    full[full.length / 2], full[full.length * 99 / 100]);
        }
    }

    Path shardPath(int shardNum) {
        return Path.of(baseDirectory.toString(), Integer.toString(shardNum));
    }

    ShardLock shardLock(int shardNum) {
        return shardLockMap.computeIfAbsent(shardNum, k -> new ShardLock());
    }

    /** Return the shard, loading it from its directory or creating it if this datastore has not seen it yet. */
    Optional<S> ensureShard(int shardNum) {
        S existing = shardMap.get(shardNum);
        if (existing != null) {
            return Optional.of(existing);
        }
        return shardLock(shardNum).withSystemLock(() -> {
            S shard = shardMap.get(shardNum);
            if (shard != null) {
                return Optional.of(shard);
            }
            Path shardPath = shardPath(shardNum);
            File shardPathFile = shardPath.toFile();
            String[] contents = shardPathFile.list();
            Optional<S> loaded;
            if (contents != null && contents.length > 0) {
                loaded = shardFactory.createShardFromDir(shardPath, shardNum);
                loaded.ifPresent(s -> logger.info("DS{} Loaded shard {} from {}", dsID, shardNum, shardPath));
            } else {
                if (!shardPathFile.exists() && !shardPathFile.mkdirs()) {
                    logger.error("DS{} Shard directory creation failed {}", dsID, shardNum);
                    return Optional.<S>empty();
                }
                loaded = shardFactory.createNewShard(shardPath, shardNum);
                loaded.ifPresent(s -> logger.info("DS{} Created new shard {}", dsID, shardNum));
            }
            if (loaded.isEmpty()) {
                logger.error("DS{} Shard creation failed {}", dsID, shardNum);
                return Optional.<S>empty();
            }
            shardMap.put(shardNum, loaded.get());
            return loaded;
        });
    }
}
