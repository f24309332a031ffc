package com.questrail.rendezvous.api;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * A mutable value shared by reference between a producer and a consumer,
 * guarded by its own lock. Used by {@link RefRendezvous}; no copy is ever
 * made.
 *
 * @param <T> referenced value type
 */
public final class ValueRef<T>
{
    private final ReentrantLock lock = new ReentrantLock();
    private T value;

    public ValueRef(T initial) {
        this.value = initial;
    }

    public T get() {
        lock.lock();
        try {
            return value;
        } finally {
            lock.unlock();
        }
    }

    public void set(T newValue) {
        lock.lock();
        try {
            value = newValue;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically replace the value with {@code update(value)} and return the
     * new value.
     */
    public T update(UnaryOperator<T> update) {
        lock.lock();
        try {
            value = update.apply(value);
            return value;
        } finally {
            lock.unlock();
        }
    }

    public ReentrantLock lock() {
        return lock;
    }
}
