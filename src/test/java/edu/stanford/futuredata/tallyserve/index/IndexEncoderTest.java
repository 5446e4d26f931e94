package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.exceptions.IndexCorruptionException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Field;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.store.InMemoryKeyValueStore;
import edu.stanford.futuredata.tallyserve.store.KeyType;
import edu.stanford.futuredata.tallyserve.store.KeyValueStore;
import edu.stanford.futuredata.tallyserve.store.RowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndexEncoderTest {

    private static final Logger logger = LoggerFactory.getLogger(IndexEncoderTest.class);

    private KeyValueStore store;
    private RowStore rowStore;
    private IndexEncoder encoder;

    @BeforeEach
    public void setUp() {
        store = new InMemoryKeyValueStore();
        IndexingPolicy policy = new IndexingPolicy();
        rowStore = new RowStore(store, policy, new IndexCatalog(store, policy));
        encoder = new IndexEncoder(store, rowStore);
        rowStore.putField("a", "Score", new Field(Value.ofInteger(30), 100L));
        rowStore.putField("b", "Score", new Field(Value.ofInteger(10), 300L));
        rowStore.putField("c", "Score", new Field(Value.ofInteger(20), 200L));
    }

    @Test
    public void testPromoteAndDemote() {
        logger.info("testPromoteAndDemote");
        String key = IndexNames.any("Score");
        assertEquals(KeyType.SET, store.type(key));

        assertEquals(3, encoder.promote("Score", Column.Attribute.VALUE));
        assertEquals(KeyType.ORDERED_SET, store.type(key));
        assertEquals(List.of("b", "c", "a"), store.orderedSetMembers(key));

        // Re-scoring an ordered index by another attribute.
        assertEquals(3, encoder.promote("Score", Column.Attribute.TIME));
        assertEquals(List.of("a", "c", "b"), store.orderedSetMembers(key));

        assertEquals(3, encoder.demote("Score"));
        assertEquals(KeyType.SET, store.type(key));
        assertEquals(3, store.cardinality(key));
        assertEquals(3, encoder.demote("Score"));
        assertFalse(store.exists(IndexNames.scratch(key)));
    }

    @Test
    public void testPromoteDetectsDanglingMembers() {
        logger.info("testPromoteDetectsDanglingMembers");
        store.setAdd(IndexNames.any("Score"), "ghost");
        assertThrows(IndexCorruptionException.class, () -> encoder.promote("Score", Column.Attribute.VALUE));
        // The original index is untouched.
        assertEquals(KeyType.SET, store.type(IndexNames.any("Score")));
        assertEquals(4, store.cardinality(IndexNames.any("Score")));
        assertFalse(store.exists(IndexNames.scratch(IndexNames.any("Score"))));
    }
}
