package edu.stanford.futuredata.tallyserve.shard;

import edu.stanford.futuredata.tallyserve.exceptions.IndexCorruptionException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.index.IndexCatalog;
import edu.stanford.futuredata.tallyserve.index.IndexEncoder;
import edu.stanford.futuredata.tallyserve.index.IndexingPolicy;
import edu.stanford.futuredata.tallyserve.interfaces.Shard;
import edu.stanford.futuredata.tallyserve.query.Evaluator;
import edu.stanford.futuredata.tallyserve.query.PartialResult;
import edu.stanford.futuredata.tallyserve.query.QueryKind;
import edu.stanford.futuredata.tallyserve.store.InMemoryKeyValueStore;
import edu.stanford.futuredata.tallyserve.store.KeyValueStore;
import edu.stanford.futuredata.tallyserve.store.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One partition of a table: its rows, their indexes and the policy that shapes them.
 *
 * Queries share the shard; writes and index re-encodings exclude queries.
 */
public class IndexShard implements Shard {
    private static final Logger logger = LoggerFactory.getLogger(IndexShard.class);

    static final String SHARD_FILE = "shard.obj";

    private final Path shardPath;
    private final int shardNum;
    private final KeyValueStore store;
    private final IndexingPolicy policy;
    private final IndexCatalog catalog;
    private final RowStore rowStore;
    private final IndexEncoder encoder;
    private final Evaluator evaluator;
    private final ReadWriteLock indexLock = new ReentrantReadWriteLock();

    public IndexShard(Path shardPath, int shardNum, IndexingPolicy policy) {
        this(shardPath, shardNum, policy, new InMemoryKeyValueStore());
    }

    IndexShard(Path shardPath, int shardNum, IndexingPolicy policy, KeyValueStore store) {
        this.shardPath = shardPath;
        this.shardNum = shardNum;
        this.store = store;
        this.policy = policy;
        this.catalog = new IndexCatalog(store, policy);
        this.rowStore = new RowStore(store, policy, catalog);
        this.encoder = new IndexEncoder(store, rowStore);
        this.evaluator = new Evaluator(catalog, rowStore);
    }

    /** Load a shard written by {@link #shardToData()}. */
    @SuppressWarnings("unchecked")
    public static IndexShard load(Path shardPath, int shardNum) throws IOException, ClassNotFoundException {
        Path shardFile = Path.of(shardPath.toString(), SHARD_FILE);
        try (ObjectInputStream o = new ObjectInputStream(new FileInputStream(shardFile.toFile()))) {
            IndexingPolicy policy = (IndexingPolicy) o.readObject();
            Map<String, Object> snapshot = (Map<String, Object>) o.readObject();
            KeyValueStore store = new InMemoryKeyValueStore();
            store.restore(snapshot);
            logger.info("Loaded shard {} from {} ({} keys)", shardNum, shardPath, snapshot.size());
            return new IndexShard(shardPath, shardNum, policy, store);
        }
    }

    public int getShardNum() {
        return shardNum;
    }

    public IndexingPolicy getPolicy() {
        return policy;
    }

    public IndexCatalog getCatalog() {
        return catalog;
    }

    public RowStore getRowStore() {
        return rowStore;
    }

    public KeyValueStore getStore() {
        return store;
    }

    /**
     * Answer a query over this shard's rows.
     * @param target extent column, or null for other kinds
     */
    public PartialResult evaluate(QueryKind kind, Expression expression, Column target) {
        PartialResult result;
        indexLock.readLock().lock();
        try {
            result = evaluator.evaluate(kind, expression, target);
        } finally {
            indexLock.readLock().unlock();
        }
        promotePending();
        return result;
    }

    public void write(List<Record> records) {
        indexLock.writeLock().lock();
        try {
            for (Record record : records) {
                rowStore.writeRecord(record);
            }
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    public boolean removeRow(String id) {
        indexLock.writeLock().lock();
        try {
            return rowStore.removeRow(id);
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    /** Keep the column's {@code any_} index ordered by the attribute from now on. */
    public void orderColumn(String column, Column.Attribute attribute) {
        indexLock.writeLock().lock();
        try {
            encoder.promote(column, attribute);
            policy.orderBy(column, attribute);
            catalog.invalidateDerived();
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    /** Keep the column's {@code any_} index as a plain set from now on. */
    public void unorderColumn(String column) {
        indexLock.writeLock().lock();
        try {
            policy.unorder(column);
            encoder.demote(column);
            catalog.invalidateDerived();
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    private void promotePending() {
        for (Map.Entry<String, Column.Attribute> e : catalog.takePromotionCandidates().entrySet()) {
            logger.info("Shard {} promoting {} by {} after repeated ordering queries", shardNum, e.getKey(),
                    e.getValue());
            try {
                orderColumn(e.getKey(), e.getValue());
            } catch (IndexCorruptionException ex) {
                // The query already has its answer; the column stays unordered.
                logger.error("Shard {} promotion of {} failed: {}", shardNum, e.getKey(), ex.getMessage());
            }
        }
    }

    @Override
    public int getMemoryUsage() {
        return store.size();
    }

    @Override
    public void destroy() {
        indexLock.writeLock().lock();
        try {
            store.clear();
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Path> shardToData() {
        Path shardFile = Path.of(shardPath.toString(), SHARD_FILE);
        indexLock.readLock().lock();
        try (ObjectOutputStream o = new ObjectOutputStream(new FileOutputStream(shardFile.toFile()))) {
            o.writeObject(policy);
            o.writeObject(new HashMap<>(store.snapshot()));
        } catch (IOException e) {
            logger.warn("Shard {} serialization to {} failed: {}", shardNum, shardFile, e.getMessage());
            return Optional.empty();
        } finally {
            indexLock.readLock().unlock();
        }
        return Optional.of(shardPath);
    }
}
