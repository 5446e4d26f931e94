package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

public class ReusePredictorTest {

    private static final Logger logger = LoggerFactory.getLogger(ReusePredictorTest.class);

    @Test
    public void testCountsAndThreshold() {
        logger.info("testCountsAndThreshold");
        ReusePredictor predictor = new ReusePredictor(10);
        assertFalse(predictor.predictsReuse("k", 2));
        assertEquals(1, predictor.record("k"));
        assertEquals(2, predictor.record("k"));
        assertTrue(predictor.predictsReuse("k", 2));
        assertFalse(predictor.predictsReuse("k", 0));
        predictor.reset("k");
        assertEquals(0, predictor.count("k"));
    }

    @Test
    public void testTrackingLimitIsPerPredictor() {
        logger.info("testTrackingLimitIsPerPredictor");
        ReusePredictor small = new ReusePredictor(2);
        ReusePredictor large = new ReusePredictor(100);
        for (String key : new String[]{"a", "b", "c"}) {
            small.record(key);
            large.record(key);
        }
        // The third distinct key made the small predictor start over.
        assertEquals(0, small.count("a"));
        assertEquals(1, small.count("c"));
        assertEquals(1, large.count("a"));
        assertThrows(IllegalArgumentException.class, () -> new ReusePredictor(0));
    }

    @Test
    public void testCatalogTakesLimitFromPolicy() {
        logger.info("testCatalogTakesLimitFromPolicy");
        IndexingPolicy policy = new IndexingPolicy();
        policy.maxTrackedKeys = 1;
        policy.derivedReuseThreshold = 2;
        assertEquals(1, policy.copy().maxTrackedKeys);
        IndexCatalog catalog = new IndexCatalog(new InMemoryKeyValueStore(), policy);
        catalog.recordDerivedBuild("x");
        catalog.recordDerivedBuild("x");
        assertTrue(catalog.predictsReuse("x"));
        // A second signature exceeds the limit of one and clears the count for the first.
        catalog.recordDerivedBuild("y");
        assertFalse(catalog.predictsReuse("x"));
    }
}
