package com.kafcat.core.lease;

import com.kafcat.core.error.ConnectionBusyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Sole right to use a resource that must not be shared between concurrent operations.
 * <p>
 * The lease is checked out when the returned publisher is subscribed and handed back when it
 * completes, errors or is cancelled. Checking out a held lease fails immediately with
 * {@link ConnectionBusyException} instead of queueing.
 * </p>
 *
 * @param <T> leased resource
 */
public final class ExclusiveLease<T> {

    private final String name;
    private final T resource;
    private final AtomicBoolean held = new AtomicBoolean();

    public ExclusiveLease(String name, T resource) {
        this.name = name;
        this.resource = resource;
    }

    /**
     * Runs {@code operation} while holding the lease.
     */
    public <R> Mono<R> withLease(Function<T, Mono<R>> operation) {
        return Mono.using(this::checkOut, handle -> operation.apply(handle.resource()), Handle::release);
    }

    /**
     * Holds the lease for the lifetime of the returned stream.
     */
    public <R> Flux<R> withLeaseMany(Function<T, Flux<R>> operation) {
        return Flux.using(this::checkOut, handle -> operation.apply(handle.resource()), Handle::release);
    }

    public boolean isHeld() {
        return held.get();
    }

    /**
     * The resource itself, without checking out the lease. Only for calls that are safe to
     * make from any thread at any time, such as waking up a blocked poll.
     */
    public T unsafeResource() {
        return resource;
    }

    private Handle checkOut() {
        if (!held.compareAndSet(false, true)) {
            throw new ConnectionBusyException(name + " is already in use by another operation");
        }
        return new Handle();
    }

    private final class Handle {
        private final AtomicBoolean released = new AtomicBoolean();

        T resource() {
            return resource;
        }

        void release() {
            if (released.compareAndSet(false, true)) {
                held.set(false);
            }
        }
    }
}
