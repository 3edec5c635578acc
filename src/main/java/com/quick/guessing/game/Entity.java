package com.quick.guessing.game;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Base for stateful players and games. Every request runs through {@link #call(Supplier)},
 * which holds the entity's lock, so at most one request mutates an entity at a time.
 * Once {@link #close()} has run the entity rejects further calls.
 */
public abstract class Entity {

    private final ReentrantLock lock = new ReentrantLock();
    private final Duration callTimeout;
    private volatile boolean alive = true;

    protected Entity(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    /**
     * Identity under which the entity is registered.
     */
    public abstract String id();

    public boolean isAlive() {
        return alive;
    }

    public void close() {
        alive = false;
    }

    protected <T> T call(Supplier<T> request) {
        if (!alive) {
            throw new EntityUnavailableException(describe() + " is closed");
        }
        boolean acquired;
        try {
            acquired = lock.tryLock(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EntityUnavailableException("Interrupted while waiting for " + describe(), e);
        }
        if (!acquired) {
            throw new EntityUnavailableException(describe() + " did not respond within " + callTimeout.toMillis() + "ms");
        }
        try {
            // closed while we were queued
            if (!alive) {
                throw new EntityUnavailableException(describe() + " is closed");
            }
            return request.get();
        } finally {
            lock.unlock();
        }
    }

    protected void run(Runnable request) {
        call(() -> {
            request.run();
            return null;
        });
    }

    private String describe() {
        return getClass().getSimpleName() + "[" + id() + "]";
    }
}
