package edu.stanford.futuredata.tallyserve.utilities;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A consistent hashing function that assigns shards to datastores (buckets).
 * Each bucket owns several virtual nodes on the ring, so adding or removing one moves few shards.
 */
public class ConsistentHash implements Serializable {

    private final List<Integer> hashRing = new ArrayList<>();
    private final Map<Integer, Integer> hashToBucket = new HashMap<>();

    private static final int numVirtualNodes = 10;
    private static final int virtualOffset = 1234567;

    private static final double A = (Math.sqrt(5) - 1) / 2;
    private static final int m = 2147483647; // 2 ^ 31 - 1

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Set<Integer> buckets = new HashSet<>();

    public static int hashFunction(int k) {
        // from CLRS, including the magic numbers.
        return (int) (m * (k * A - Math.floor(k * A)));
    }

    public static ConsistentHash of(Collection<Integer> buckets) {
        ConsistentHash consistentHash = new ConsistentHash();
        buckets.forEach(consistentHash::addBucket);
        return consistentHash;
    }

    // Add a bucket (datastore) to the consistent hash.
    public void addBucket(int bucketNum) {
        lock.writeLock().lock();
        try {
            if (!buckets.add(bucketNum)) {
                return;
            }
            for (int i = 0; i < numVirtualNodes; i++) {
                int hash = hashFunction(bucketNum + virtualOffset * i);
                hashRing.add(hash);
                hashToBucket.put(hash, bucketNum);
            }
            Collections.sort(hashRing);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Remove a bucket (datastore) from the consistent hash.
    public void removeBucket(int bucketNum) {
        lock.writeLock().lock();
        try {
            if (!buckets.remove(bucketNum)) {
                return;
            }
            for (int i = 0; i < numVirtualNodes; i++) {
                Integer hash = hashFunction(bucketNum + virtualOffset * i);
                hashRing.remove(hash);
                hashToBucket.remove(hash);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<Integer> getBucketSet() {
        lock.readLock().lock();
        try {
            return Set.copyOf(buckets);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return buckets.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Get the bucket (datastore) a key (shard) is assigned to.
    public int getBucket(int key) {
        lock.readLock().lock();
        try {
            if (hashRing.isEmpty()) {
                throw new IllegalStateException("No buckets in consistent hash");
            }
            int hash = hashFunction(key);
            for (int n : hashRing) {
                if (hash < n) {
                    return hashToBucket.get(n);
                }
            }
            return hashToBucket.get(hashRing.get(0));
        } finally {
            lock.readLock().unlock();
        }
    }
}
