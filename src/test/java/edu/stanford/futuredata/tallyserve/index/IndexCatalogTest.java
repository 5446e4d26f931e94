package edu.stanford.futuredata.tallyserve.index;

import edu.stanford.futuredata.tallyserve.exceptions.IndexCorruptionException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.store.InMemoryKeyValueStore;
import edu.stanford.futuredata.tallyserve.store.KeyValueStore;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IndexCatalogTest {

    private static final Logger logger = LoggerFactory.getLogger(IndexCatalogTest.class);

    @Test
    public void testOpenPermanentIndexes() {
        logger.info("testOpenPermanentIndexes");
        KeyValueStore store = new InMemoryKeyValueStore();
        IndexingPolicy policy = new IndexingPolicy().orderBy("Gender", Column.Attribute.TIME);
        IndexCatalog catalog = new IndexCatalog(store, policy);
        store.setAdd(IndexNames.ALL, "a");
        store.setAdd(IndexNames.ALL, "b");
        store.orderedSetAdd(IndexNames.any("Gender"), "a", 5.0);
        store.setAdd(IndexNames.value("Gender", Value.ofString("Female")), "a");

        assertEquals(2, catalog.all().cardinality());
        InvertedIndex any = catalog.any("Gender");
        assertEquals(Representation.ORDERED_SET, any.getRepresentation());
        assertTrue(any.isOrderedBy(Column.time("Gender")));
        assertFalse(any.isOrderedBy(Column.value("Gender")));
        assertEquals(1, catalog.value("Gender", Value.ofString("Female")).orElseThrow().cardinality());
        assertTrue(catalog.value("Gender", Value.ofString("Male")).isEmpty());

        // A column no row has yet opens empty, in the representation the policy asks for.
        InvertedIndex unseen = catalog.any("Age");
        assertEquals(Representation.SET, unseen.getRepresentation());
        assertEquals(0, unseen.cardinality());
    }

    @Test
    public void testRepresentationMismatch() {
        logger.info("testRepresentationMismatch");
        KeyValueStore store = new InMemoryKeyValueStore();
        IndexCatalog catalog = new IndexCatalog(store, new IndexingPolicy().orderBy("Gender", Column.Attribute.VALUE));
        store.setAdd(IndexNames.any("Gender"), "a");
        IndexCorruptionException e = assertThrows(IndexCorruptionException.class, () -> catalog.any("Gender"));
        assertEquals(IndexNames.any("Gender"), e.getKeyName());

        store.set(IndexNames.any("Age"), "oops");
        assertThrows(IndexCorruptionException.class, () -> catalog.any("Age"));
        store.orderedSetAdd(IndexNames.value("Age", Value.ofString("Old")), "a", 1.0);
        assertThrows(IndexCorruptionException.class, () -> catalog.value("Age", Value.ofString("Old")));
    }

    @Test
    public void testDerivedRegistry() {
        logger.info("testDerivedRegistry");
        KeyValueStore store = new InMemoryKeyValueStore();
        IndexCatalog catalog = new IndexCatalog(store, new IndexingPolicy());
        store.setAdd(IndexNames.derived("sig"), "a");
        // Unregistered keys are not trusted.
        assertTrue(catalog.derived("sig").isEmpty());
        store.setAdd(IndexNames.DERIVED_REGISTRY, IndexNames.derived("sig"));
        store.setAdd(IndexNames.DERIVED_REGISTRY, IndexNames.derived("nothing"));
        assertEquals(1, catalog.derived("sig").orElseThrow().cardinality());
        assertEquals(0, catalog.derived("nothing").orElseThrow().cardinality());
        assertEquals(2, catalog.invalidateDerived());
        assertTrue(catalog.derived("sig").isEmpty());
        assertFalse(store.exists(IndexNames.derived("sig")));
    }

    @Test
    public void testPromotionCandidates() {
        logger.info("testPromotionCandidates");
        IndexingPolicy policy = new IndexingPolicy();
        IndexCatalog catalog = new IndexCatalog(new InMemoryKeyValueStore(), policy);
        catalog.recordOrderingDemand(Column.value("Score"));
        assertTrue(catalog.takePromotionCandidates().isEmpty());

        policy.promotionThreshold = 2;
        catalog.recordOrderingDemand(Column.value("Score"));
        assertTrue(catalog.takePromotionCandidates().isEmpty());
        catalog.recordOrderingDemand(Column.value("Score"));
        assertEquals(Map.of("Score", Column.Attribute.VALUE), catalog.takePromotionCandidates());
        assertTrue(catalog.takePromotionCandidates().isEmpty());
    }

    @Test
    public void testReusePrediction() {
        logger.info("testReusePrediction");
        IndexingPolicy policy = new IndexingPolicy();
        policy.derivedReuseThreshold = 2;
        IndexCatalog catalog = new IndexCatalog(new InMemoryKeyValueStore(), policy);
        InvertedIndex any = catalog.any("x");
        try (QueryScope scope = catalog.openScope()) {
            scope.union("sig", Representation.SET, List.of(any, any));
            assertFalse(catalog.predictsReuse("sig"));
            scope.union("sig", Representation.SET, List.of(any, any));
            assertTrue(catalog.predictsReuse("sig"));
        }
    }
}
