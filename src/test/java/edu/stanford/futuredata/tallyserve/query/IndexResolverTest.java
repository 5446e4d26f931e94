package edu.stanford.futuredata.tallyserve.query;

import edu.stanford.futuredata.tallyserve.Respondents;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.index.IndexCatalog;
import edu.stanford.futuredata.tallyserve.index.IndexFamily;
import edu.stanford.futuredata.tallyserve.index.IndexNames;
import edu.stanford.futuredata.tallyserve.index.IndexingPolicy;
import edu.stanford.futuredata.tallyserve.index.QueryScope;
import edu.stanford.futuredata.tallyserve.index.Representation;
import edu.stanford.futuredata.tallyserve.parser.QueryParser;
import edu.stanford.futuredata.tallyserve.parser.TextQueryParser;
import edu.stanford.futuredata.tallyserve.store.InMemoryKeyValueStore;
import edu.stanford.futuredata.tallyserve.store.KeyValueStore;
import edu.stanford.futuredata.tallyserve.store.RowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IndexResolverTest {

    private static final Logger logger = LoggerFactory.getLogger(IndexResolverTest.class);

    private final QueryParser parser = new TextQueryParser();
    private final CardinalityExactnessAnalyzer analyzer = new CardinalityExactnessAnalyzer();
    private KeyValueStore store;
    private IndexingPolicy policy;
    private IndexCatalog catalog;
    private IndexResolver resolver;

    @BeforeEach
    public void setUp() {
        store = new InMemoryKeyValueStore();
        policy = new IndexingPolicy().orderBy(Respondents.GENDER, Column.Attribute.TIME);
        catalog = new IndexCatalog(store, policy);
        RowStore rowStore = new RowStore(store, policy, catalog);
        for (Record r : Respondents.records()) {
            rowStore.writeRecord(r);
        }
        resolver = new IndexResolver(catalog, analyzer);
    }

    private Resolution resolve(String query, QueryScope scope) {
        Expression e = parser.parse(query);
        Resolution resolution = resolver.resolve(e, scope);
        assertEquals(analyzer.exactness(e), resolution.getExactness(), query);
        return resolution;
    }

    @Test
    public void testLeaves() {
        logger.info("testLeaves");
        try (QueryScope scope = catalog.openScope()) {
            Resolution eq = resolve("Gender = 'Female'", scope);
            assertEquals(IndexNames.value("Gender", Value.ofString("Female")), eq.getIndex().getKeyName());
            assertEquals(Exactness.EXACT, eq.getExactness());

            Resolution missing = resolve("Gender = 'Other'", scope);
            assertEquals(IndexFamily.EMPTY, missing.getIndex().getFamily());

            Resolution notNull = resolve("Age IS NOT NULL", scope);
            assertEquals(IndexNames.any("Age"), notNull.getIndex().getKeyName());

            Resolution isNull = resolve("Age IS NULL", scope);
            assertEquals(IndexFamily.DERIVED, isNull.getIndex().getFamily());
            assertEquals(0, isNull.getIndex().cardinality());

            Resolution ordered = resolve("Gender.time > DATE '2019-01-01'", scope);
            assertEquals(Exactness.APPROX, ordered.getExactness());
            assertNotNull(ordered.getScoreRange());
            assertEquals(Column.time("Gender"), ordered.getScoreRange().getColumn());

            // The any_ index is scored by time, so a value ordering cannot be narrowed.
            Resolution byValue = resolve("Gender > 'F'", scope);
            assertNull(byValue.getScoreRange());
            assertEquals(IndexNames.any("Gender"), byValue.getIndex().getKeyName());
        }
    }

    @Test
    public void testConjunctionKeepsScoreRange() {
        logger.info("testConjunctionKeepsScoreRange");
        try (QueryScope scope = catalog.openScope()) {
            Resolution and = resolve("Age = 'Middle Age' AND Gender.time <= DATE '2015-01-01'", scope);
            assertEquals(Representation.ORDERED_SET, and.getIndex().getRepresentation());
            assertNotNull(and.getScoreRange());
            assertEquals(3, and.getIndex().cardinality());
            assertEquals(2, and.getIndex().membersInScoreRange(and.getScoreRange()).size());

            Resolution or = resolve("Age = 'Old' OR Gender.time <= DATE '2015-01-01'", scope);
            assertEquals(Representation.SET, or.getIndex().getRepresentation());
            assertNull(or.getScoreRange());
        }
    }

    @Test
    public void testNegation() {
        logger.info("testNegation");
        try (QueryScope scope = catalog.openScope()) {
            Resolution exact = resolve("NOT Gender = 'Male'", scope);
            assertEquals(2, exact.getIndex().cardinality());
            Resolution approx = resolve("NOT Gender.time > DATE '2019-01-01'", scope);
            assertEquals(IndexNames.ALL, approx.getIndex().getKeyName());
        }
    }

    @Test
    public void testOrderingDemandPromotes() {
        logger.info("testOrderingDemandPromotes");
        policy.promotionThreshold = 2;
        try (QueryScope scope = catalog.openScope()) {
            resolve("Age > 'M'", scope);
            resolve("Age >= 'N' AND Gender = 'Male'", scope);
        }
        assertEquals(Map.of("Age", Column.Attribute.VALUE), catalog.takePromotionCandidates());
    }
}
