package edu.stanford.futuredata.tallyserve.store;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryKeyValueStoreTest {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryKeyValueStoreTest.class);

    @Test
    public void testSets() {
        logger.info("testSets");
        KeyValueStore store = new InMemoryKeyValueStore();
        assertTrue(store.setAdd("a", "1"));
        assertFalse(store.setAdd("a", "1"));
        store.setAdd("a", "2");
        store.setAdd("b", "2");
        store.setAdd("b", "3");
        assertEquals(KeyType.SET, store.type("a"));
        assertEquals(3, store.setUnionStore("u", List.of("a", "b")));
        assertEquals(1, store.setIntersectStore("i", List.of("a", "b")));
        assertEquals(Set.of("1"), Set.copyOf(store.members(storeDiff(store))));
        assertEquals(0, store.setIntersectStore("none", List.of("a", "missing")));
        assertFalse(store.exists("none"));
        assertTrue(store.setRemove("i", "2"));
        assertFalse(store.exists("i"));
        assertEquals(0, store.cardinality("i"));
    }

    private static String storeDiff(KeyValueStore store) {
        store.setDiffStore("d", List.of("a", "b"));
        return "d";
    }

    @Test
    public void testOrderedSets() {
        logger.info("testOrderedSets");
        KeyValueStore store = new InMemoryKeyValueStore();
        store.orderedSetAdd("o", "x", 3.0);
        store.orderedSetAdd("o", "y", 1.0);
        store.orderedSetAdd("o", "z", 2.0);
        assertEquals(List.of("y", "z", "x"), store.orderedSetMembers("o"));
        assertEquals(List.of("y", "z"), store.orderedSetRange("o", 1.0, 2.0));
        assertEquals(List.of("z", "x"), store.orderedSetRange("o", 1.5, Double.POSITIVE_INFINITY));
        assertFalse(store.orderedSetAdd("o", "y", 5.0));
        assertEquals(List.of("z", "x", "y"), store.members("o"));
        assertEquals(5.0, store.orderedSetScore("o", "y").getAsDouble());

        store.setAdd("s", "x");
        store.setAdd("s", "w");
        assertEquals(1, store.orderedSetIntersectStore("oi", List.of("o", "s")));
        assertEquals(3.0, store.orderedSetScore("oi", "x").getAsDouble());
        assertEquals(4, store.orderedSetUnionStore("ou", List.of("s", "o")));
        // Members only in a plain set score zero.
        assertEquals(List.of("w", "z", "x", "y"), store.orderedSetMembers("ou"));
        assertEquals(2, store.orderedSetDiffStore("od", List.of("o", "s")));
        assertEquals(List.of("z", "y"), store.orderedSetMembers("od"));
    }

    @Test
    public void testWrongType() {
        logger.info("testWrongType");
        KeyValueStore store = new InMemoryKeyValueStore();
        store.set("k", "v");
        store.setAdd("s", "1");
        WrongTypeException e = assertThrows(WrongTypeException.class, () -> store.setAdd("k", "1"));
        assertEquals(KeyType.SCALAR, e.getActual());
        assertThrows(WrongTypeException.class, () -> store.orderedSetAdd("s", "1", 1.0));
        assertThrows(WrongTypeException.class, () -> store.get("s"));
        assertThrows(WrongTypeException.class, () -> store.cardinality("k"));
    }

    @Test
    public void testRenameAndSnapshot() {
        logger.info("testRenameAndSnapshot");
        KeyValueStore store = new InMemoryKeyValueStore();
        store.set("k", "v");
        store.setAdd("s", "1");
        store.orderedSetAdd("o", "a", 2.0);
        store.orderedSetAdd("o", "b", 1.0);
        assertTrue(store.rename("s", "t"));
        assertFalse(store.exists("s"));
        assertEquals(Set.of("t"), store.keys("t"));
        Map<String, Object> snapshot = store.snapshot();

        KeyValueStore restored = new InMemoryKeyValueStore();
        restored.restore(snapshot);
        assertEquals(3, restored.size());
        assertEquals("v", restored.get("k").orElseThrow());
        assertEquals(Set.of("1"), restored.setMembers("t"));
        assertEquals(List.of("b", "a"), restored.orderedSetMembers("o"));
        assertEquals(KeyType.ORDERED_SET, restored.type("o"));

        // Renaming a missing key clears the destination.
        assertFalse(restored.rename("missing", "k"));
        assertFalse(restored.exists("k"));
    }
}
