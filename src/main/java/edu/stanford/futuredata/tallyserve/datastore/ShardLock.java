package edu.stanford.futuredata.tallyserve.datastore;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Guards one shard on a datastore.
 *
 * The system lock is exclusive and covers creating, loading and saving the shard.  Readers and writers share it;
 * writers additionally exclude each other, so a shard never sees two writes at once.
 */
public class ShardLock {
    private final ReadWriteLock systemLock = new ReentrantReadWriteLock();
    private final Lock writerLock = new ReentrantLock();

    public <T> T withSystemLock(Supplier<T> action) {
        systemLock.writeLock().lock();
        try {
            return action.get();
        } finally {
            systemLock.writeLock().unlock();
        }
    }

    public <T> T withWriterLock(Supplier<T> action) {
        systemLock.readLock().lock();
        writerLock.lock();
        try {
            return action.get();
        } finally {
            writerLock.unlock();
            systemLock.readLock().unlock();
        }
    }

    public <T> T withReaderLock(Supplier<T> action) {
        systemLock.readLock().lock();
        try {
            return action.get();
        } finally {
            systemLock.readLock().unlock();
        }
    }
}
