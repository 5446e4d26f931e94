package edu.stanford.futuredata.tallyserve.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * The key-value capability a shard's indexes and rows live in: scalars, sets and score-ordered sets.
 *
 * Missing keys read as empty.  Operations on a key holding the wrong structure throw {@link WrongTypeException}.
 * The {@code *Store} operations overwrite {@code destination} with their result and return its cardinality; an
 * empty result deletes it.
 */
public interface KeyValueStore {

    KeyType type(String key);

    boolean exists(String key);

    // Remove a key of any type.  Returns true if it existed.
    boolean delete(String key);

    // Atomically move source to destination, replacing whatever destination held.
    boolean rename(String source, String destination);

    // Keys starting with prefix.
    Set<String> keys(String prefix);

    // Number of keys.
    int size();

    void clear();

    /* Scalars */

    Optional<String> get(String key);

    void set(String key, String value);

    /* Sets */

    boolean setAdd(String key, String member);

    boolean setRemove(String key, String member);

    boolean setIsMember(String key, String member);

    Set<String> setMembers(String key);

    long setUnionStore(String destination, List<String> keys);

    long setIntersectStore(String destination, List<String> keys);

    // Members of keys[0] in none of the others.
    long setDiffStore(String destination, List<String> keys);

    /* Ordered sets */

    boolean orderedSetAdd(String key, String member, double score);

    boolean orderedSetRemove(String key, String member);

    OptionalDouble orderedSetScore(String key, String member);

    // Members with min <= score <= max, ascending by score.
    List<String> orderedSetRange(String key, double min, double max);

    // All members ascending by score.
    List<String> orderedSetMembers(String key);

    // Each result member keeps the score from the first ordered-set operand holding it.
    long orderedSetUnionStore(String destination, List<String> keys);

    long orderedSetIntersectStore(String destination, List<String> keys);

    long orderedSetDiffStore(String destination, List<String> keys);

    /* Any collection */

    // Cardinality of a set or ordered set; 0 for a missing key.
    long cardinality(String key);

    // Members of a set or ordered set.
    List<String> members(String key);

    /* Snapshots */

    // A serializable copy of every key.  Ordered sets are copied as member to score maps.
    Map<String, Object> snapshot();

    void restore(Map<String, Object> snapshot);
}
