package com.analyzemyteam.timelinesync.service.coordinator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO between producers (push channel, fetch results, playback) and the sync tick.
 *
 * <p>When full, a {@link Priority#LOW} offer is rejected. A {@link Priority#HIGH} offer displaces
 * the oldest low-priority entry, or is rejected when every queued entry is high priority.
 *
 * @param <T> queued item type
 */
final class EventQueue<T> {

    enum Priority { LOW, HIGH }

    enum OfferResult {
        ACCEPTED,
        /** Accepted after dropping the oldest low-priority entry. */
        DISPLACED,
        DROPPED
    }

    /**
     * @param displaced the older entry that made room for the offered item, set only for
     *                  {@link OfferResult#DISPLACED}
     */
    record Offer<T>(OfferResult result, Optional<T> displaced) {

        static <T> Offer<T> of(OfferResult result) {
            return new Offer<>(result, Optional.empty());
        }
    }

    private record Entry<T>(T item, Priority priority) {
    }

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Entry<T>> entries;

    EventQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    Offer<T> offer(T item, Priority priority) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(priority, "priority");
        lock.lock();
        try {
            if (entries.size() < capacity) {
                entries.addLast(new Entry<>(item, priority));
                return Offer.of(OfferResult.ACCEPTED);
            }
            if (priority == Priority.LOW) {
                return Offer.of(OfferResult.DROPPED);
            }
            Iterator<Entry<T>> oldestFirst = entries.iterator();
            while (oldestFirst.hasNext()) {
                Entry<T> candidate = oldestFirst.next();
                if (candidate.priority() == Priority.LOW) {
                    oldestFirst.remove();
                    entries.addLast(new Entry<>(item, priority));
                    return new Offer<>(OfferResult.DISPLACED, Optional.of(candidate.item()));
                }
            }
            return Offer.of(OfferResult.DROPPED);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes up to {@code max} items in arrival order.
     */
    List<T> drain(int max) {
        List<T> out = new ArrayList<>(Math.min(max, capacity));
        lock.lock();
        try {
            while (out.size() < max && !entries.isEmpty()) {
                out.add(entries.pollFirst().item());
            }
        } finally {
            lock.unlock();
        }
        return out;
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    int capacity() {
        return capacity;
    }

    void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
