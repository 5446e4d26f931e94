package edu.stanford.futuredata.tallyserve.broker;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.tallyserve.BrokerDataStoreGrpc;
import edu.stanford.futuredata.tallyserve.ReadQueryMessage;
import edu.stanford.futuredata.tallyserve.ReadQueryResponse;
import edu.stanford.futuredata.tallyserve.WriteQueryMessage;
import edu.stanford.futuredata.tallyserve.WriteQueryResponse;
import edu.stanford.futuredata.tallyserve.exceptions.QueryFailedException;
import edu.stanford.futuredata.tallyserve.exceptions.ShardUnavailableException;
import edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException;
import edu.stanford.futuredata.tallyserve.interfaces.QueryEngine;
import edu.stanford.futuredata.tallyserve.interfaces.ReadQueryPlan;
import edu.stanford.futuredata.tallyserve.interfaces.Row;
import edu.stanford.futuredata.tallyserve.interfaces.Shard;
import edu.stanford.futuredata.tallyserve.interfaces.SimpleWriteQueryPlan;
import edu.stanford.futuredata.tallyserve.utilities.ConsistentHash;
import edu.stanford.futuredata.tallyserve.utilities.DataStoreDescription;
import edu.stanford.futuredata.tallyserve.utilities.TableInfo;
import edu.stanford.futuredata.tallyserve.utilities.Utilities;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Routes queries to the datastores holding a table's shards and combines their answers.
 *
 * A read query runs on every targeted shard in parallel.  If any shard fails or misses the deadline the whole query
 * fails; partial answers are never combined.
 */
public class Broker {

    private final QueryEngine queryEngine;
    private final BrokerCurator zkCurator;

    private static final Logger logger = LoggerFactory.getLogger(Broker.class);
    // Consistent hash assigning shards to datastores.
    private volatile ConsistentHash consistentHash = new ConsistentHash();
    // Map from dsIDs to channels.
    private volatile Map<Integer, ManagedChannel> dsIDToChannelMap = new ConcurrentHashMap<>();
    // Map from table names to table metadata.
    private final Map<String, TableInfo> tableInfoMap = new ConcurrentHashMap<>();

    private final ShardMapUpdateDaemon shardMapUpdateDaemon;
    public volatile boolean runShardMapUpdateDaemon = true;
    public static int shardMapDaemonSleepDurationMillis = 1000;

    // Per-shard deadline for every remote call.
    public long queryTimeoutMillis = 10000;

    public final Collection<Long> remoteExecutionTimes = new ConcurrentLinkedQueue<>();
    public final Collection<Long> aggregationTimes = new ConcurrentLinkedQueue<>();

    public static final int QUERY_SUCCESS = 0;
    public static final int QUERY_FAILURE = 1;
    public static final int QUERY_TYPE_MISMATCH = 2;
    public static final int QUERY_SHARD_CORRUPT = 3;

    public static final int SHARDS_PER_TABLE = 1000000;

    private final AtomicLong txIDs = new AtomicLong(0);

    /*
     * CONSTRUCTOR/TEARDOWN
     */

    public Broker(String zkHost, int zkPort, QueryEngine queryEngine) {
        this.queryEngine = queryEngine;
        this.zkCurator = new BrokerCurator(zkHost, zkPort);
        shardMapUpdateDaemon = new ShardMapUpdateDaemon();
        shardMapUpdateDaemon.start();
    }

    public void shutdown() {
        runShardMapUpdateDaemon = false;
        shardMapUpdateDaemon.interrupt();
        try {
            shardMapUpdateDaemon.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (ManagedChannel c: dsIDToChannelMap.values()) {
            c.shutdownNow();
        }
        int numQueries = remoteExecutionTimes.size();
        if (numQueries > 0 && !aggregationTimes.isEmpty()) {
            long[] remote = remoteExecutionTimes.stream().mapToLong(i -> i).sorted().toArray();
            long[] agg = aggregationTimes.stream().mapToLong(i -> i).sorted().toArray();
            logger.info("Queries: {} p50 Remote: {}μs p99 Remote: {}μs  p50 Aggregation: {}μs p99 Aggregation: {}μs",
                    numQueries, remote[remote.length / 2], remote[remote.length * 99 / 100],
                    agg[agg.length / 2], agg[agg.length * 99 / 100]);
        }
        zkCurator.close();
    }

    /*
     * PUBLIC FUNCTIONS
     */

    /**
     * Create a table with a fixed number of shards.
     * @return true if the table now exists with that many shards, false if it already exists with a different count
     */
    public boolean createTable(String tableName, int numShards) {
        if (numShards <= 0) {
            throw new IllegalArgumentException("A table needs at least one shard");
        }
        TableInfo tableInfo = zkCurator.createTable(tableName, numShards);
        if (tableInfo.numShards != numShards) {
            logger.warn("Table {} already exists with {} shards", tableName, tableInfo.numShards);
            return false;
        }
        tableInfoMap.put(tableName, tableInfo);
        logger.info("Table {} ready: id {} shards {}", tableName, tableInfo.id, numShards);
        return true;
    }

    public Optional<TableInfo> tableInfo(String tableName) {
        TableInfo cached = tableInfoMap.get(tableName);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<TableInfo> t = zkCurator.getTableInfo(tableName);
        t.ifPresent(i -> tableInfoMap.put(tableName, i));
        return t;
    }

    /**
     * Send each row to the shard its partition key maps to.
     * @return true if every shard applied its rows
     */
    public <R extends Row, S extends Shard> boolean writeQuery(SimpleWriteQueryPlan<R, S> writeQueryPlan, List<R> rows) {
        TableInfo tableInfo = getTableInfo(writeQueryPlan.getQueriedTable());
        Map<Integer, ArrayList<R>> shardRowListMap = new HashMap<>();
        for (R row: rows) {
            int partitionKey = row.getPartitionKey();
            if (partitionKey < 0) {
                throw new IllegalArgumentException("Negative partition key " + partitionKey);
            }
            int shard = keyToShard(tableInfo, partitionKey);
            shardRowListMap.computeIfAbsent(shard, (k -> new ArrayList<>())).add(row);
        }
        long txID = txIDs.getAndIncrement();
        ByteString serializedQuery = Utilities.objectToByteString(writeQueryPlan);
        CountDownLatch latch = new CountDownLatch(shardRowListMap.size());
        Map<Integer, String> failures = new ConcurrentHashMap<>();
        for (Map.Entry<Integer, ArrayList<R>> entry: shardRowListMap.entrySet()) {
            int shardNum = entry.getKey();
            BrokerDataStoreGrpc.BrokerDataStoreStub stub;
            try {
                stub = getStubForShard(shardNum);
            } catch (ShardUnavailableException e) {
                failures.put(shardNum, e.getMessage());
                latch.countDown();
                continue;
            }
            WriteQueryMessage m = WriteQueryMessage.newBuilder()
                    .setShard(shardNum)
                    .setSerializedQuery(serializedQuery)
                    .setRowData(Utilities.objectToByteString(entry.getValue()))
                    .setTxID(txID)
                    .build();
            stub.withDeadlineAfter(queryTimeoutMillis, TimeUnit.MILLISECONDS)
                    .writeQuery(m, new StreamObserver<>() {
                        @Override
                        public void onNext(WriteQueryResponse r) {
                            if (r.getReturnCode() != QUERY_SUCCESS) {
                                failures.put(shardNum, r.getErrorMessage());
                            }
                        }

                        @Override
                        public void onError(Throwable throwable) {
                            logger.warn("Write Query Error on shard {}: {}", shardNum, throwable.getMessage());
                            failures.put(shardNum, String.valueOf(throwable.getMessage()));
                            latch.countDown();
                        }

                        @Override
                        public void onCompleted() {
                            latch.countDown();
                        }
                    });
        }
        awaitShards(latch, txID);
        if (!failures.isEmpty()) {
            logger.warn("Write query {} failed on shards {}", txID, failures);
            return false;
        }
        return true;
    }

    /**
     * Run a read query on every shard it targets and combine the results.
     * @throws ShardUnavailableException if a shard could not be reached, missed the deadline or found a corrupt index
     * @throws TypeMismatchException if a shard met incomparable values
     * @throws QueryFailedException if a shard failed otherwise
     */
    public <S extends Shard, V> V readQuery(ReadQueryPlan<S, V> plan) {
        TableInfo tableInfo = getTableInfo(plan.getQueriedTable());
        List<Integer> shardNums = shardsForKeys(tableInfo, plan.keysForQuery());
        long txID = txIDs.getAndIncrement();
        ByteString serializedQuery = Utilities.objectToByteString(plan);
        List<ByteString> intermediates = new CopyOnWriteArrayList<>();
        Map<Integer, QueryFailedException> failures = new ConcurrentHashMap<>();
        CountDownLatch latch = new CountDownLatch(shardNums.size());
        long remoteStart = System.nanoTime();
        for (int shardNum: shardNums) {
            BrokerDataStoreGrpc.BrokerDataStoreStub stub;
            try {
                stub = getStubForShard(shardNum);
            } catch (ShardUnavailableException e) {
                failures.put(shardNum, e);
                latch.countDown();
                continue;
            }
            ReadQueryMessage m = ReadQueryMessage.newBuilder()
                    .setShard(shardNum).setSerializedQuery(serializedQuery).setTxID(txID).build();
            stub.withDeadlineAfter(queryTimeoutMillis, TimeUnit.MILLISECONDS)
                    .readQuery(m, new StreamObserver<>() {
                        @Override
                        public void onNext(ReadQueryResponse r) {
                            if (r.getReturnCode() == QUERY_SUCCESS) {
                                intermediates.add(r.getResponse());
                            } else {
                                failures.put(shardNum, failureFromReturnCode(shardNum, r));
                            }
                        }

                        @Override
                        public void onError(Throwable throwable) {
                            logger.warn("Read Query Error on shard {}: {}", shardNum, throwable.getMessage());
                            failures.put(shardNum, new ShardUnavailableException(shardNum,
                                    String.format("Shard %d unavailable: %s", shardNum, throwable.getMessage())));
                            latch.countDown();
                        }

                        @Override
                        public void onCompleted() {
                            latch.countDown();
                        }
                    });
        }
        awaitShards(latch, txID);
        remoteExecutionTimes.add((System.nanoTime() - remoteStart) / 1000L);
        if (!failures.isEmpty()) {
            // Report the lowest-numbered failing shard.
            QueryFailedException failure = new TreeMap<>(failures).firstEntry().getValue();
            logger.warn("Read query {} failed on shards {}: {}", txID, failures.keySet(), failure.getMessage());
            throw failure;
        }
        long aggStart = System.nanoTime();
        V ret = plan.aggregateShardQueries(intermediates);
        aggregationTimes.add((System.nanoTime() - aggStart) / 1000L);
        return ret;
    }

    /*
     * PRIVATE FUNCTIONS
     */

    private static QueryFailedException failureFromReturnCode(int shardNum, ReadQueryResponse r) {
        if (r.getReturnCode() == QUERY_TYPE_MISMATCH) {
            return new TypeMismatchException(r.getErrorMessage());
        }
        if (r.getReturnCode() == QUERY_SHARD_CORRUPT) {
            return new ShardUnavailableException(shardNum,
                    String.format("Shard %d has a corrupt index: %s", shardNum, r.getErrorMessage()));
        }
        return new QueryFailedException(String.format("Shard %d failed: %s", shardNum, r.getErrorMessage()));
    }

    private void awaitShards(CountDownLatch latch, long txID) {
        try {
            // gRPC deadlines fire first; this bounds a lost callback.
            if (!latch.await(queryTimeoutMillis * 2, TimeUnit.MILLISECONDS)) {
                throw new ShardUnavailableException(String.format("Query %d timed out", txID));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryFailedException(String.format("Query %d interrupted", txID), e);
        }
    }

    private TableInfo getTableInfo(String tableName) {
        return tableInfo(tableName)
                .orElseThrow(() -> new QueryFailedException(String.format("Table %s does not exist", tableName)));
    }

    private List<Integer> shardsForKeys(TableInfo tableInfo, List<Integer> partitionKeys) {
        if (partitionKeys.contains(-1)) {
            // -1 is a wildcard--run on all shards.
            return IntStream.range(tableInfo.id * SHARDS_PER_TABLE, tableInfo.id * SHARDS_PER_TABLE + tableInfo.numShards)
                    .boxed().collect(Collectors.toList());
        }
        return partitionKeys.stream().map(i -> keyToShard(tableInfo, i)).distinct().collect(Collectors.toList());
    }

    private int keyToShard(TableInfo tableInfo, int partitionKey) {
        return tableInfo.id * SHARDS_PER_TABLE + queryEngine.keyToShard(partitionKey, tableInfo.numShards);
    }

    private BrokerDataStoreGrpc.BrokerDataStoreStub getStubForShard(int shard) {
        ConsistentHash hash = consistentHash;
        if (hash.isEmpty()) {
            throw new ShardUnavailableException(shard, String.format("No datastore available for shard %d", shard));
        }
        int dsID = hash.getBucket(shard);
        ManagedChannel channel = dsIDToChannelMap.get(dsID);
        if (channel == null) {
            throw new ShardUnavailableException(shard, String.format("No channel to DS%d for shard %d", dsID, shard));
        }
        return BrokerDataStoreGrpc.newStub(channel);
    }

    private class ShardMapUpdateDaemon extends Thread {

        private void updateMap() {
            Map<Integer, ManagedChannel> dsIDToChannelMap = new ConcurrentHashMap<>();
            List<Integer> liveIDs = new ArrayList<>();
            List<DataStoreDescription> descriptions;
            try {
                descriptions = zkCurator.getDataStoreDescriptions();
            } catch (IllegalStateException e) {
                logger.warn("Shard map update failed: {}", e.getMessage());
                return;
            }
            for (DataStoreDescription d: descriptions) {
                if (d.isAlive()) {
                    ManagedChannel channel = Broker.this.dsIDToChannelMap.containsKey(d.dsID) ?
                            Broker.this.dsIDToChannelMap.get(d.dsID) :
                            ManagedChannelBuilder.forAddress(d.host, d.port).usePlaintext().build();
                    dsIDToChannelMap.put(d.dsID, channel);
                    liveIDs.add(d.dsID);
                }
            }
            for (Map.Entry<Integer, ManagedChannel> e: Broker.this.dsIDToChannelMap.entrySet()) {
                if (!dsIDToChannelMap.containsKey(e.getKey())) {
                    logger.info("DS{} left the cluster", e.getKey());
                    e.getValue().shutdown();
                }
            }
            Broker.this.consistentHash = ConsistentHash.of(liveIDs);
            Broker.this.dsIDToChannelMap = dsIDToChannelMap;
        }

        @Override
        public void run() {
            while (runShardMapUpdateDaemon) {
                try {
                    Thread.sleep(shardMapDaemonSleepDurationMillis);
                } catch (InterruptedException e) {
                    break;
                }
                updateMap();
            }
        }

        @Override
        public synchronized void start() {
            updateMap();
            super.start();
        }
    }
}
