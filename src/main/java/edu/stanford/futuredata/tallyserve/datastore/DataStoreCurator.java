package edu.stanford.futuredata.tallyserve.datastore;

import edu.stanford.futuredata.tallyserve.utilities.DataStoreDescription;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

class DataStoreCurator {
    private final CuratorFramework cf;
    private static final Logger logger = LoggerFactory.getLogger(DataStoreCurator.class);

    DataStoreCurator(String zkHost, int zkPort) {
        String connectString = String.format("%s:%d", zkHost, zkPort);
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        this.cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
    }

    void close() {
        cf.close();
    }

    /**
     * Publish this datastore.  The node is ephemeral, so it disappears if the datastore's session ends.
     * @return false if another live datastore holds the id
     */
    boolean registerDataStore(DataStoreDescription description) {
        String path = String.format("/dsDescription/%d", description.dsID);
        try {
            cf.create().creatingParentsIfNeeded().withMode(CreateMode.EPHEMERAL)
                    .forPath(path, description.summaryString.getBytes(StandardCharsets.UTF_8));
            return true;
        } catch (KeeperException.NodeExistsException e) {
            logger.warn("DS{} is already registered", description.dsID);
            return false;
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            return false;
        }
    }

    void deregisterDataStore(int dsID) {
        String path = String.format("/dsDescription/%d", dsID);
        try {
            cf.delete().forPath(path);
        } catch (KeeperException.NoNodeException e) {
            logger.debug("DS{} was not registered", dsID);
        } catch (Exception e) {
            logger.warn("ZK Failure deregistering DS{}: {}", dsID, e.getMessage());
        }
    }
}
