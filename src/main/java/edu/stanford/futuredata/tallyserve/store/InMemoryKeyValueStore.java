package edu.stanford.futuredata.tallyserve.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A {@link KeyValueStore} held in memory.  Every operation is synchronized, so one store serializes all access to
 * the shard that owns it.
 *
 * Set operations accept ordered sets as operands and read their membership only.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, Object> data = new HashMap<>();

    private static final class ScoredMember {
        final double score;
        final String member;

        ScoredMember(double score, String member) {
            this.score = score;
            this.member = member;
        }
    }

    private static final Comparator<ScoredMember> SCORE_ORDER =
            Comparator.<ScoredMember>comparingDouble(m -> m.score).thenComparing(m -> m.member);

    private static final class OrderedSet {
        final Map<String, Double> scores = new HashMap<>();
        final NavigableSet<ScoredMember> ordered = new TreeSet<>(SCORE_ORDER);

        boolean add(String member, double score) {
            Double old = scores.put(member, score);
            if (old != null) {
                ordered.remove(new ScoredMember(old, member));
            }
            ordered.add(new ScoredMember(score, member));
            return old == null;
        }

        boolean remove(String member) {
            Double old = scores.remove(member);
            if (old == null) {
                return false;
            }
            ordered.remove(new ScoredMember(old, member));
            return true;
        }

        List<String> range(double min, double max) {
            List<String> members = new ArrayList<>();
            for (ScoredMember m : ordered.tailSet(new ScoredMember(min, ""), true)) {
                if (m.score > max) {
                    break;
                }
                members.add(m.member);
            }
            return members;
        }

        List<String> all() {
            return ordered.stream().map(m -> m.member).collect(Collectors.toList());
        }
    }

    @Override
    public synchronized KeyType type(String key) {
        return typeOf(data.get(key));
    }

    private static KeyType typeOf(Object o) {
        if (o == null) {
            return KeyType.NONE;
        } else if (o instanceof String) {
            return KeyType.SCALAR;
        } else if (o instanceof OrderedSet) {
            return KeyType.ORDERED_SET;
        } else {
            return KeyType.SET;
        }
    }

    @Override
    public synchronized boolean exists(String key) {
        return data.containsKey(key);
    }

    @Override
    public synchronized boolean delete(String key) {
        return data.remove(key) != null;
    }

    @Override
    public synchronized boolean rename(String source, String destination) {
        Object o = data.remove(source);
        if (o == null) {
            data.remove(destination);
            return false;
        }
        data.put(destination, o);
        return true;
    }

    @Override
    public synchronized Set<String> keys(String prefix) {
        return data.keySet().stream().filter(k -> k.startsWith(prefix)).collect(Collectors.toSet());
    }

    @Override
    public synchronized int size() {
        return data.size();
    }

    @Override
    public synchronized void clear() {
        data.clear();
    }

    /* Scalars */

    @Override
    public synchronized Optional<String> get(String key) {
        Object o = data.get(key);
        if (o == null) {
            return Optional.empty();
        }
        if (!(o instanceof String)) {
            throw new WrongTypeException(key, typeOf(o), "get");
        }
        return Optional.of((String) o);
    }

    @Override
    public synchronized void set(String key, String value) {
        data.put(key, value);
    }

    /* Sets */

    @SuppressWarnings("unchecked")
    private Set<String> setFor(String key, boolean create, String operation) {
        Object o = data.get(key);
        if (o == null) {
            if (!create) {
                return null;
            }
            Set<String> s = new HashSet<>();
            data.put(key, s);
            return s;
        }
        if (typeOf(o) != KeyType.SET) {
            throw new WrongTypeException(key, typeOf(o), operation);
        }
        return (Set<String>) o;
    }

    @Override
    public synchronized boolean setAdd(String key, String member) {
        return setFor(key, true, "setAdd").add(member);
    }

    @Override
    public synchronized boolean setRemove(String key, String member) {
        Set<String> s = setFor(key, false, "setRemove");
        if (s == null) {
            return false;
        }
        boolean removed = s.remove(member);
        if (s.isEmpty()) {
            data.remove(key);
        }
        return removed;
    }

    @Override
    public synchronized boolean setIsMember(String key, String member) {
        Set<String> s = setFor(key, false, "setIsMember");
        return s != null && s.contains(member);
    }

    @Override
    public synchronized Set<String> setMembers(String key) {
        Set<String> s = setFor(key, false, "setMembers");
        return s == null ? new HashSet<>() : new HashSet<>(s);
    }

    // Membership of a set or ordered set operand.
    @SuppressWarnings("unchecked")
    private Collection<String> membership(String key, String operation) {
        Object o = data.get(key);
        switch (typeOf(o)) {
            case NONE:
                return Set.of();
            case SET:
                return (Set<String>) o;
            case ORDERED_SET:
                return ((OrderedSet) o).scores.keySet();
            default:
                throw new WrongTypeException(key, KeyType.SCALAR, operation);
        }
    }

    private long storeSet(String destination, Set<String> result) {
        if (result.isEmpty()) {
            data.remove(destination);
        } else {
            data.put(destination, result);
        }
        return result.size();
    }

    @Override
    public synchronized long setUnionStore(String destination, List<String> keys) {
        Set<String> result = new HashSet<>();
        for (String key : keys) {
            result.addAll(membership(key, "setUnionStore"));
        }
        return storeSet(destination, result);
    }

    @Override
    public synchronized long setIntersectStore(String destination, List<String> keys) {
        return storeSet(destination, intersection(keys, "setIntersectStore"));
    }

    private Set<String> intersection(List<String> keys, String operation) {
        if (keys.isEmpty()) {
            return new HashSet<>();
        }
        List<Collection<String>> operands = new ArrayList<>();
        for (String key : keys) {
            operands.add(membership(key, operation));
        }
        operands.sort(Comparator.comparingInt(Collection::size));
        Set<String> result = new HashSet<>(operands.get(0));
        for (int i = 1; i < operands.size() && !result.isEmpty(); i++) {
            result.retainAll(operands.get(i));
        }
        return result;
    }

    @Override
    public synchronized long setDiffStore(String destination, List<String> keys) {
        return storeSet(destination, difference(keys, "setDiffStore"));
    }

    private Set<String> difference(List<String> keys, String operation) {
        if (keys.isEmpty()) {
            return new HashSet<>();
        }
        Set<String> result = new HashSet<>(membership(keys.get(0), operation));
        for (int i = 1; i < keys.size() && !result.isEmpty(); i++) {
            result.removeAll(membership(keys.get(i), operation));
        }
        return result;
    }

    /* Ordered sets */

    private OrderedSet orderedSetFor(String key, boolean create, String operation) {
        Object o = data.get(key);
        if (o == null) {
            if (!create) {
                return null;
            }
            OrderedSet s = new OrderedSet();
            data.put(key, s);
            return s;
        }
        if (!(o instanceof OrderedSet)) {
            throw new WrongTypeException(key, typeOf(o), operation);
        }
        return (OrderedSet) o;
    }

    @Override
    public synchronized boolean orderedSetAdd(String key, String member, double score) {
        return orderedSetFor(key, true, "orderedSetAdd").add(member, score);
    }

    @Override
    public synchronized boolean orderedSetRemove(String key, String member) {
        OrderedSet s = orderedSetFor(key, false, "orderedSetRemove");
        if (s == null) {
            return false;
        }
        boolean removed = s.remove(member);
        if (s.scores.isEmpty()) {
            data.remove(key);
        }
        return removed;
    }

    @Override
    public synchronized OptionalDouble orderedSetScore(String key, String member) {
        OrderedSet s = orderedSetFor(key, false, "orderedSetScore");
        if (s == null || !s.scores.containsKey(member)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(s.scores.get(member));
    }

    @Override
    public synchronized List<String> orderedSetRange(String key, double min, double max) {
        OrderedSet s = orderedSetFor(key, false, "orderedSetRange");
        return s == null ? new ArrayList<>() : s.range(min, max);
    }

    @Override
    public synchronized List<String> orderedSetMembers(String key) {
        OrderedSet s = orderedSetFor(key, false, "orderedSetMembers");
        return s == null ? new ArrayList<>() : s.all();
    }

    private long storeOrdered(String destination, Set<String> members, List<String> keys) {
        OrderedSet result = new OrderedSet();
        for (String member : members) {
            double score = 0;
            for (String key : keys) {
                Object o = data.get(key);
                if (o instanceof OrderedSet && ((OrderedSet) o).scores.containsKey(member)) {
                    score = ((OrderedSet) o).scores.get(member);
                    break;
                }
            }
            result.add(member, score);
        }
        if (members.isEmpty()) {
            data.remove(destination);
        } else {
            data.put(destination, result);
        }
        return members.size();
    }

    @Override
    public synchronized long orderedSetUnionStore(String destination, List<String> keys) {
        Set<String> members = new HashSet<>();
        for (String key : keys) {
            members.addAll(membership(key, "orderedSetUnionStore"));
        }
        return storeOrdered(destination, members, keys);
    }

    @Override
    public synchronized long orderedSetIntersectStore(String destination, List<String> keys) {
        return storeOrdered(destination, intersection(keys, "orderedSetIntersectStore"), keys);
    }

    @Override
    public synchronized long orderedSetDiffStore(String destination, List<String> keys) {
        return storeOrdered(destination, difference(keys, "orderedSetDiffStore"), keys);
    }

    /* Any collection */

    @Override
    public synchronized long cardinality(String key) {
        return membership(key, "cardinality").size();
    }

    @Override
    public synchronized List<String> members(String key) {
        Object o = data.get(key);
        if (o instanceof OrderedSet) {
            return ((OrderedSet) o).all();
        }
        return new ArrayList<>(membership(key, "members"));
    }

    /* Snapshots */

    @Override
    @SuppressWarnings("unchecked")
    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new HashMap<>();
        for (Map.Entry<String, Object> e : data.entrySet()) {
            Object o = e.getValue();
            if (o instanceof String) {
                snapshot.put(e.getKey(), o);
            } else if (o instanceof OrderedSet) {
                snapshot.put(e.getKey(), new LinkedHashMap<>(((OrderedSet) o).scores));
            } else {
                snapshot.put(e.getKey(), new HashSet<>((Set<String>) o));
            }
        }
        return snapshot;
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized void restore(Map<String, Object> snapshot) {
        data.clear();
        for (Map.Entry<String, Object> e : snapshot.entrySet()) {
            Object o = e.getValue();
            if (o instanceof String) {
                data.put(e.getKey(), o);
            } else if (o instanceof Map) {
                OrderedSet s = new OrderedSet();
                ((Map<String, Double>) o).forEach(s::add);
                data.put(e.getKey(), s);
            } else {
                data.put(e.getKey(), new HashSet<>((Set<String>) o));
            }
        }
    }
}
