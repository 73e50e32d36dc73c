package com.quantbacktest.portfolio.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only log that stages rows in a bounded buffer and moves them to
 * storage in FIFO order when the buffer fills or when a reader asks for a snapshot.
 *
 * @param <T> row type
 */
public class BufferedLog<T> {

    private final int bufferSize;
    private final List<T> buffer;
    private final List<T> storage = new ArrayList<>();

    public BufferedLog(int bufferSize) {
        this.bufferSize = Math.max(1, bufferSize);
        this.buffer = new ArrayList<>(this.bufferSize);
    }

    public void append(T row) {
        buffer.add(row);
        if (buffer.size() >= bufferSize) {
            flush();
        }
    }

    public void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        storage.addAll(buffer);
        buffer.clear();
    }

    /**
     * Flushes and returns a read-only view of every row appended so far.
     */
    public List<T> entries() {
        flush();
        return Collections.unmodifiableList(storage);
    }

    public int size() {
        return storage.size() + buffer.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    int pendingCount() {
        return buffer.size();
    }

    void clear() {
        buffer.clear();
        storage.clear();
    }
}
