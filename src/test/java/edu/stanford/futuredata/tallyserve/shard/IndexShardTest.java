package edu.stanford.futuredata.tallyserve.shard;

import edu.stanford.futuredata.tallyserve.Respondents;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.index.IndexNames;
import edu.stanford.futuredata.tallyserve.index.IndexingPolicy;
import edu.stanford.futuredata.tallyserve.parser.QueryParser;
import edu.stanford.futuredata.tallyserve.parser.TextQueryParser;
import edu.stanford.futuredata.tallyserve.query.PartialResult;
import edu.stanford.futuredata.tallyserve.query.QueryKind;
import edu.stanford.futuredata.tallyserve.store.KeyType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class IndexShardTest {

    private static final Logger logger = LoggerFactory.getLogger(IndexShardTest.class);

    private static final QueryParser parser = new TextQueryParser();

    @TempDir
    Path tempDir;

    private static long count(IndexShard shard, String query) {
        return ((PartialResult.Count) shard.evaluate(QueryKind.COUNT, parser.parse(query), null)).getCount();
    }

    @Test
    public void testWriteAndQuery() {
        logger.info("testWriteAndQuery");
        IndexShard shard = new IndexShardFactory().createNewShard(tempDir, 3).orElseThrow();
        assertEquals(3, shard.getShardNum());
        shard.write(Respondents.records());
        assertEquals(5, count(shard, "Gender IS NOT NULL"));
        assertTrue(shard.removeRow("Alice"));
        assertFalse(shard.removeRow("Alice"));
        assertEquals(1, count(shard, "Gender = 'Female'"));
        assertEquals(4, shard.getRowStore().rowCount());
    }

    @Test
    public void testOrderAndUnorderColumn() {
        logger.info("testOrderAndUnorderColumn");
        IndexShard shard = new IndexShard(tempDir, 0, new IndexingPolicy());
        shard.write(Respondents.records());
        String query = "Gender.time BETWEEN DATE '2010-01-01' AND DATE '2016-01-01'";
        assertEquals(2, count(shard, query));

        shard.orderColumn(Respondents.GENDER, Column.Attribute.TIME);
        assertEquals(KeyType.ORDERED_SET, shard.getStore().type(IndexNames.any(Respondents.GENDER)));
        assertEquals(2, count(shard, query));
        // New rows join the ordered index.
        shard.write(List.of(Respondents.frank()));
        assertEquals(KeyType.ORDERED_SET, shard.getStore().type(IndexNames.any(Respondents.GENDER)));
        assertEquals(3, count(shard, "Gender.time >= DATE '2020-01-01'"));

        shard.unorderColumn(Respondents.GENDER);
        assertEquals(KeyType.SET, shard.getStore().type(IndexNames.any(Respondents.GENDER)));
        assertTrue(shard.getPolicy().orderingOf(Respondents.GENDER).isEmpty());
        assertEquals(3, count(shard, "Gender.time >= DATE '2020-01-01'"));
    }

    @Test
    public void testRepeatedOrderingQueriesPromote() {
        logger.info("testRepeatedOrderingQueriesPromote");
        IndexingPolicy policy = new IndexingPolicy();
        policy.promotionThreshold = 3;
        IndexShard shard = new IndexShard(tempDir, 0, policy);
        shard.write(Respondents.records());
        for (int i = 0; i < 3; i++) {
            assertEquals(3, count(shard, "Gender.time < DATE '2016-01-01'"));
        }
        assertEquals(Optional.of(Column.Attribute.TIME), shard.getPolicy().orderingOf(Respondents.GENDER));
        assertEquals(KeyType.ORDERED_SET, shard.getStore().type(IndexNames.any(Respondents.GENDER)));
        assertEquals(3, count(shard, "Gender.time < DATE '2016-01-01'"));
    }

    @Test
    public void testFailedPromotionKeepsQueryResult() {
        logger.info("testFailedPromotionKeepsQueryResult");
        IndexingPolicy policy = new IndexingPolicy();
        policy.promotionThreshold = 1;
        IndexShard shard = new IndexShard(tempDir, 0, policy);
        shard.write(Respondents.records());
        // A member without a Gender field makes the rebuild fail; scans skip it.
        shard.getStore().setAdd(IndexNames.any(Respondents.GENDER), "Ghost");

        assertEquals(3, count(shard, "Gender.time < DATE '2016-01-01'"));
        assertTrue(shard.getPolicy().orderingOf(Respondents.GENDER).isEmpty());
        assertEquals(KeyType.SET, shard.getStore().type(IndexNames.any(Respondents.GENDER)));
        assertEquals(KeyType.NONE, shard.getStore().type(IndexNames.scratch(IndexNames.any(Respondents.GENDER))));
        assertEquals(3, count(shard, "Gender.time < DATE '2016-01-01'"));
    }

    @Test
    public void testPersistence() {
        logger.info("testPersistence");
        IndexShard shard = new IndexShard(tempDir, 7, new IndexingPolicy().orderBy("Age", Column.Attribute.VALUE));
        shard.write(Respondents.records());
        assertEquals(Optional.of(tempDir), shard.shardToData());
        assertTrue(Files.exists(tempDir.resolve(IndexShard.SHARD_FILE)));

        IndexShard loaded = new IndexShardFactory().createShardFromDir(tempDir, 7).orElseThrow();
        assertEquals(shard.getMemoryUsage(), loaded.getMemoryUsage());
        assertEquals(Optional.of(Column.Attribute.VALUE), loaded.getPolicy().orderingOf("Age"));
        assertEquals(KeyType.ORDERED_SET, loaded.getStore().type(IndexNames.any("Age")));
        assertEquals(3, count(loaded, "Age < 'N'"));
        assertEquals(new PartialResult.Extent(Value.ofString("Middle Age"), Value.ofString("Young")),
                loaded.evaluate(QueryKind.EXTENT, parser.parse("Gender IS NOT NULL"), Column.value("Age")));

        loaded.destroy();
        assertEquals(0, loaded.getMemoryUsage());
        assertTrue(new IndexShardFactory().createShardFromDir(tempDir.resolve("missing"), 7).isEmpty());
    }
}
