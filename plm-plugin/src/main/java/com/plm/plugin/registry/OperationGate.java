package com.plm.plugin.registry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-holder gate whose waiters are futures instead of blocked threads.
 *
 * <p>
 * Waiters are served in arrival order. A waiter that was completed by
 * someone else (typically a timeout) before its turn is skipped.
 * Continuations of the granted future run outside the gate's lock.
 * </p>
 */
final class OperationGate {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private boolean held;

    /**
     * @return a future completed once the caller holds the gate; already
     *         complete if the gate was free
     */
    CompletableFuture<Void> acquire() {
        lock.lock();
        try {
            if (!held) {
                held = true;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand the gate to the next live waiter, or free it.
     */
    void release() {
        while (true) {
            CompletableFuture<Void> next;
            lock.lock();
            try {
                next = waiters.pollFirst();
                if (next == null) {
                    held = false;
                    return;
                }
            } finally {
                lock.unlock();
            }
            if (next.complete(null)) {
                return;
            }
        }
    }

    boolean isHeld() {
        lock.lock();
        try {
            return held;
        } finally {
            lock.unlock();
        }
    }

    int queueLength() {
        lock.lock();
        try {
            return (int) waiters.stream().filter(w -> !w.isDone()).count();
        } finally {
            lock.unlock();
        }
    }
}
