package edu.stanford.futuredata.tallyserve.broker;

import edu.stanford.futuredata.tallyserve.utilities.DataStoreDescription;
import edu.stanford.futuredata.tallyserve.utilities.TableInfo;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

class BrokerCurator {
    private final CuratorFramework cf;
    private static final Logger logger = LoggerFactory.getLogger(BrokerCurator.class);

    static final String DS_DESCRIPTION_PATH = "/dsDescription";
    static final String TABLES_PATH = "/tables";
    static final String TABLE_IDS_PATH = "/tableIDs/id-";

    BrokerCurator(String zkHost, int zkPort) {
        String connectString = String.format("%s:%d", zkHost, zkPort);
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        this.cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
    }

    void close() {
        cf.close();
    }

    // Every registered datastore.  A datastore's node vanishes with its ZooKeeper session.
    List<DataStoreDescription> getDataStoreDescriptions() {
        List<DataStoreDescription> descriptions = new ArrayList<>();
        try {
            if (cf.checkExists().forPath(DS_DESCRIPTION_PATH) == null) {
                return descriptions;
            }
            for (String child : cf.getChildren().forPath(DS_DESCRIPTION_PATH)) {
                try {
                    byte[] b = cf.getData().forPath(DS_DESCRIPTION_PATH + "/" + child);
                    descriptions.add(new DataStoreDescription(new String(b, StandardCharsets.UTF_8)));
                } catch (KeeperException.NoNodeException e) {
                    // Deregistered between the listing and the read.
                    logger.debug("Datastore {} vanished during lookup", child);
                }
            }
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            throw new IllegalStateException("Datastore lookup failed", e);
        }
        return descriptions;
    }

    Optional<TableInfo> getTableInfo(String tableName) {
        try {
            String path = String.format("%s/%s", TABLES_PATH, tableName);
            if (cf.checkExists().forPath(path) == null) {
                return Optional.empty();
            }
            byte[] b = cf.getData().forPath(path);
            return Optional.of(TableInfo.fromSummaryString(tableName, new String(b, StandardCharsets.UTF_8)));
        } catch (KeeperException.NoNodeException e) {
            return Optional.empty();
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            throw new IllegalStateException("Table lookup failed", e);
        }
    }

    /**
     * Register a table, or find the one already registered under the name.  The caller compares shard counts.
     */
    TableInfo createTable(String tableName, int numShards) {
        Optional<TableInfo> existing = getTableInfo(tableName);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            String idPath = cf.create().creatingParentsIfNeeded()
                    .withMode(CreateMode.PERSISTENT_SEQUENTIAL).forPath(TABLE_IDS_PATH);
            int tableID = Integer.parseInt(idPath.substring(idPath.lastIndexOf('-') + 1));
            TableInfo tableInfo = new TableInfo(tableName, tableID, numShards);
            String path = String.format("%s/%s", TABLES_PATH, tableName);
            cf.create().creatingParentsIfNeeded()
                    .forPath(path, tableInfo.toSummaryString().getBytes(StandardCharsets.UTF_8));
            return tableInfo;
        } catch (KeeperException.NodeExistsException e) {
            // Another broker registered it first.
            return getTableInfo(tableName).orElseThrow(() -> new IllegalStateException("Table vanished: " + tableName));
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            throw new IllegalStateException("Table creation failed", e);
        }
    }
}
