package com.rpaflow.core.log;

import com.rpaflow.core.CoreConstants;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of log entries. When full, the oldest entry is evicted.
 * Safe to read from a host thread while the run thread appends.
 */
public class LogStorage implements LogOutput {

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<LogEntry> values;
    private int maxEntryCount;

    public LogStorage() {
        this(CoreConstants.DEFAULT_LOG_ENTRIES);
    }

    public LogStorage(int capacity) {
        this.maxEntryCount = clampCapacity(capacity);
        this.values = new ArrayDeque<>(Math.min(maxEntryCount, CoreConstants.DEFAULT_LOG_ENTRIES));
    }

    public void push(LogEntry entry) {
        lock.lock();
        try {
            while (values.size() >= maxEntryCount) {
                values.pollFirst();
            }
            values.addLast(entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void log(LogEntry entry) {
        push(entry);
    }

    /** Entry at {@code idx} counted from the oldest retained one, or null. */
    public LogEntry get(int idx) {
        lock.lock();
        try {
            if (idx < 0 || idx >= values.size()) return null;
            int i = 0;
            for (LogEntry e : values) {
                if (i++ == idx) return e;
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    public List<LogEntry> entries() {
        lock.lock();
        try {
            return new ArrayList<>(values);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return values.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        lock.lock();
        try {
            values.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return maxEntryCount;
    }

    /** Shrinking the capacity evicts the oldest entries immediately. */
    public void setCapacity(int capacity) {
        lock.lock();
        try {
            maxEntryCount = clampCapacity(capacity);
            while (values.size() > maxEntryCount) {
                values.pollFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    private static int clampCapacity(int capacity) {
        if (capacity < 1) return 1;
        return Math.min(capacity, CoreConstants.MAX_LOG_ENTRIES);
    }
}
