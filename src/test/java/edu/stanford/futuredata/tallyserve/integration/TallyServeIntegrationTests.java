package edu.stanford.futuredata.tallyserve.integration;

import edu.stanford.futuredata.tallyserve.Respondents;
import edu.stanford.futuredata.tallyserve.broker.Broker;
import edu.stanford.futuredata.tallyserve.datastore.DataStore;
import edu.stanford.futuredata.tallyserve.exceptions.QueryFailedException;
import edu.stanford.futuredata.tallyserve.exceptions.ShardUnavailableException;
import edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.index.IndexNames;
import edu.stanford.futuredata.tallyserve.index.IndexingPolicy;
import edu.stanford.futuredata.tallyserve.parser.QueryParser;
import edu.stanford.futuredata.tallyserve.parser.TextQueryParser;
import edu.stanford.futuredata.tallyserve.query.PartialResult;
import edu.stanford.futuredata.tallyserve.shard.IndexShard;
import edu.stanford.futuredata.tallyserve.shard.IndexShardFactory;
import edu.stanford.futuredata.tallyserve.shard.TallyQueryEngine;
import edu.stanford.futuredata.tallyserve.shard.queryplans.RecordWriteQueryPlan;
import edu.stanford.futuredata.tallyserve.shard.queryplans.TallyReadQueryPlan;
import org.apache.commons.io.FileUtils;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.curator.test.TestingServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TallyServeIntegrationTests {

    private static final Logger logger = LoggerFactory.getLogger(TallyServeIntegrationTests.class);

    private static final String zkHost = "127.0.0.1";
    private static final String baseDirectory = "/var/tmp/TallyServe";
    private static TestingServer zkServer;
    private static int zkPort;

    private final QueryParser parser = new TextQueryParser();

    @BeforeAll
    static void startZooKeeper() throws Exception {
        zkServer = new TestingServer(true);
        zkPort = zkServer.getPort();
        cleanUp(zkHost, zkPort);
    }

    @AfterAll
    static void stopZooKeeper() throws IOException {
        zkServer.close();
    }

    @AfterEach
    public void unitTestCleanUp() {
        cleanUp(zkHost, zkPort);
    }

    public static void cleanUp(String zkHost, int zkPort) {
        // Clean up ZooKeeper
        String connectString = String.format("%s:%d", zkHost, zkPort);
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        CuratorFramework cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
        try {
            for (String child : cf.getChildren().forPath("/")) {
                if (!child.equals("zookeeper")) {
                    cf.delete().deletingChildrenIfNeeded().forPath("/" + child);
                }
            }
        } catch (Exception e) {
            logger.info("Zookeeper cleanup failed: {}", e.getMessage());
        } finally {
            cf.close();
        }
        // Clean up directories.
        try {
            FileUtils.deleteDirectory(new File(baseDirectory));
        } catch (IOException e) {
            logger.info("FS cleanup failed: {}", e.getMessage());
        }
    }

    private static List<DataStore<Record, IndexShard>> startDataStores(int numDataStores, int basePort,
                                                                       IndexingPolicy policy) {
        List<DataStore<Record, IndexShard>> dataStores = new ArrayList<>();
        for (int i = 0; i < numDataStores; i++) {
            DataStore<Record, IndexShard> dataStore = new DataStore<>(new IndexShardFactory(policy),
                    Path.of(baseDirectory), zkHost, zkPort, "127.0.0.1", basePort + i, i);
            assertTrue(dataStore.startServing());
            dataStores.add(dataStore);
        }
        return dataStores;
    }

    private long count(Broker broker, String table, String query) {
        return ((PartialResult.Count) broker.readQuery(TallyReadQueryPlan.count(table, parser.parse(query))))
                .getCount();
    }

    @Test
    public void testSurveyScenario() {
        logger.info("testSurveyScenario");
        List<DataStore<Record, IndexShard>> dataStores = startDataStores(2, 8300,
                new IndexingPolicy().orderBy(Respondents.GENDER, Column.Attribute.TIME));
        Broker broker = new Broker(zkHost, zkPort, new TallyQueryEngine());
        assertTrue(broker.createTable("respondents", 4));
        assertTrue(broker.writeQuery(new RecordWriteQueryPlan("respondents"), Respondents.records()));

        assertEquals(2, count(broker, "respondents",
                "Gender = 'Female' AND DATE '2020-01-01' <= Gender.time <= DATE '2021-01-01'"));
        assertEquals(5, count(broker, "respondents", "Gender IS NOT NULL"));
        PartialResult extent = broker.readQuery(TallyReadQueryPlan.extent("respondents",
                Column.time(Respondents.GENDER), parser.parse("Age = 'Middle Age'")));
        assertEquals(new PartialResult.Extent(Respondents.date("2009-06-01"), Respondents.date("2020-04-01")),
                extent);
        assertEquals(new PartialResult.IdSet(Set.of("Bob", "Eve")), broker.readQuery(
                TallyReadQueryPlan.ids("respondents", parser.parse("Gender = 'Male' AND Age = 'Middle Age'"))));

        assertEquals(3, count(broker, "respondents", "Gender = 'Male'"));
        assertTrue(broker.writeQuery(new RecordWriteQueryPlan("respondents"), List.of(Respondents.frank())));
        assertEquals(2, count(broker, "respondents", "Gender = 'Female'"));
        assertEquals(4, count(broker, "respondents", "Gender = 'Male'"));

        dataStores.forEach(DataStore::shutDown);
        broker.shutdown();
    }

    @Test
    public void testTables() {
        logger.info("testTables");
        List<DataStore<Record, IndexShard>> dataStores = startDataStores(1, 8310, new IndexingPolicy());
        Broker broker = new Broker(zkHost, zkPort, new TallyQueryEngine());
        assertTrue(broker.createTable("first", 2));
        assertTrue(broker.createTable("second", 3));
        assertTrue(broker.createTable("first", 2));
        assertFalse(broker.createTable("first", 3));
        assertThrows(IllegalArgumentException.class, () -> broker.createTable("third", 0));
        assertEquals(3, broker.tableInfo("second").orElseThrow().numShards);

        assertTrue(broker.writeQuery(new RecordWriteQueryPlan("first"), Respondents.records()));
        assertEquals(5, count(broker, "first", "Age IS NOT NULL"));
        // Tables do not share shards.
        assertEquals(0, count(broker, "second", "Age IS NOT NULL"));
        assertThrows(QueryFailedException.class, () -> count(broker, "missing", "Age IS NOT NULL"));

        dataStores.forEach(DataStore::shutDown);
        broker.shutdown();
    }

    @Test
    public void testTypeMismatchSurfaces() {
        logger.info("testTypeMismatchSurfaces");
        List<DataStore<Record, IndexShard>> dataStores = startDataStores(2, 8320, new IndexingPolicy());
        Broker broker = new Broker(zkHost, zkPort, new TallyQueryEngine());
        assertTrue(broker.createTable("respondents", 2));
        assertTrue(broker.writeQuery(new RecordWriteQueryPlan("respondents"), Respondents.records()));
        assertThrows(TypeMismatchException.class, () -> count(broker, "respondents", "Age > 5"));
        assertEquals(3, count(broker, "respondents", "Age = 'Middle Age'"));

        dataStores.forEach(DataStore::shutDown);
        broker.shutdown();
    }

    @Test
    public void testShardUnavailable() {
        logger.info("testShardUnavailable");
        List<DataStore<Record, IndexShard>> dataStores = startDataStores(1, 8330, new IndexingPolicy());
        Broker broker = new Broker(zkHost, zkPort, new TallyQueryEngine());
        broker.queryTimeoutMillis = 2000;
        assertTrue(broker.createTable("respondents", 2));
        assertTrue(broker.writeQuery(new RecordWriteQueryPlan("respondents"), Respondents.records()));
        dataStores.get(0).shutDown();
        assertThrows(ShardUnavailableException.class, () -> count(broker, "respondents", "Gender IS NOT NULL"));
        assertFalse(broker.writeQuery(new RecordWriteQueryPlan("respondents"), List.of(Respondents.frank())));
        broker.shutdown();
    }

    @Test
    public void testCorruptIndexMakesShardUnavailable() {
        logger.info("testCorruptIndexMakesShardUnavailable");
        List<DataStore<Record, IndexShard>> dataStores = startDataStores(1, 8350, new IndexingPolicy());
        Broker broker = new Broker(zkHost, zkPort, new TallyQueryEngine());
        assertTrue(broker.createTable("respondents", 2));
        assertTrue(broker.writeQuery(new RecordWriteQueryPlan("respondents"), Respondents.records()));
        assertEquals(5, count(broker, "respondents", "Gender IS NOT NULL"));

        IndexShard shard = dataStores.get(0).shardMap.values().iterator().next();
        String key = IndexNames.any(Respondents.GENDER);
        shard.getStore().delete(key);
        shard.getStore().set(key, "corrupt");
        ShardUnavailableException e = assertThrows(ShardUnavailableException.class,
                () -> count(broker, "respondents", "Gender IS NOT NULL"));
        assertEquals(shard.getShardNum(), e.getShardNum());
        // Queries that never open the corrupt index still succeed.
        assertEquals(5, count(broker, "respondents", "Age IS NOT NULL"));

        dataStores.forEach(DataStore::shutDown);
        broker.shutdown();
    }

    @Test
    public void testSavedShardsMoveToSurvivingDataStore() throws InterruptedException {
        logger.info("testSavedShardsMoveToSurvivingDataStore");
        List<DataStore<Record, IndexShard>> dataStores = startDataStores(2, 8340, new IndexingPolicy());
        Broker broker = new Broker(zkHost, zkPort, new TallyQueryEngine());
        assertTrue(broker.createTable("respondents", 4));
        assertTrue(broker.writeQuery(new RecordWriteQueryPlan("respondents"), Respondents.records()));
        assertEquals(5, count(broker, "respondents", "Gender IS NOT NULL"));

        dataStores.get(1).shutDown();
        Thread.sleep(Broker.shardMapDaemonSleepDurationMillis * 3L);
        assertEquals(5, count(broker, "respondents", "Gender IS NOT NULL"));
        assertEquals(2, count(broker, "respondents", "Gender = 'Female'"));

        dataStores.get(0).shutDown();
        broker.shutdown();
    }
}
