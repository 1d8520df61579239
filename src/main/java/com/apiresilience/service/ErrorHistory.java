package com.apiresilience.service;

import com.apiresilience.model.ClassifiedError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe log of the most recent classified failures, oldest first.
 */
public class ErrorHistory {
    private final int capacity;
    private final Deque<ClassifiedError> entries = new ArrayDeque<>();

    public ErrorHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    public synchronized void record(ClassifiedError error) {
        if (error == null) {
            return;
        }
        entries.addLast(error);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    public synchronized List<ClassifiedError> snapshot() {
        return new ArrayList<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }
}
