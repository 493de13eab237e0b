package com.chatrelay.metrics;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs its initializer exactly once, on first {@link #get()}, even when the
 * first calls race. Later calls return the same value without locking.
 *
 * @param <T> type of the lazily built value
 */
public final class LazyInitializer<T> implements Supplier<T> {

    private final Supplier<? extends T> initializer;
    private volatile T value;

    public LazyInitializer(Supplier<? extends T> initializer) {
        this.initializer = Objects.requireNonNull(initializer, "initializer");
    }

    @Override
    public T get() {
        T result = value;
        if (result != null) {
            return result;
        }
        synchronized (this) {
            if (value == null) {
                value = Objects.requireNonNull(initializer.get(), "initializer returned null");
            }
            return value;
        }
    }

    public boolean isInitialized() {
        return value != null;
    }
}
