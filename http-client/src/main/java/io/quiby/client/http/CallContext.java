package io.quiby.client.http;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.quiby.client.http.RequestCancelledException.Reason;
import io.quiby.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Cancellation signal and optional deadline for one or more client calls.
 *
 * <p>A context ends at most once, either because {@link #cancel()} was called or because
 * its deadline passed. Once ended, every blocking operation performed through it fails with
 * a {@link RequestCancelledException} carrying the {@link Reason}. Interrupting a thread
 * blocked in {@link #await(CompletableFuture)} or {@link #sleep(Duration)} ends the context
 * with {@link Reason#INTERRUPTED} and restores the thread's interrupt flag.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CallContext ctx = CallContext.withTimeout(Duration.ofSeconds(30));
 * executor.submit(() -> client.get(ctx, url, null, null));
 * // later, from any thread
 * ctx.cancel();
 * }</pre>
 *
 * <p>Instances are safe to share between threads.
 */
public final class CallContext {

    private final CompletableFuture<Reason> done = new CompletableFuture<>();
    private final @Nullable Instant deadline;

    private CallContext(@Nullable Instant deadline) {
        this.deadline = deadline;
        if (deadline != null) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                done.complete(Reason.DEADLINE_EXCEEDED);
            } else {
                done.completeOnTimeout(Reason.DEADLINE_EXCEEDED, remaining.toNanos(), TimeUnit.NANOSECONDS);
            }
        }
    }

    /**
     * @return a context without deadline that ends only when cancelled
     */
    public static CallContext create() {
        return new CallContext(null);
    }

    public static CallContext withTimeout(Duration timeout) {
        Assert.checkNotNullParam("timeout", timeout);
        return new CallContext(Instant.now().plus(timeout));
    }

    public static CallContext withDeadline(Instant deadline) {
        Assert.checkNotNullParam("deadline", deadline);
        return new CallContext(deadline);
    }

    /**
     * Ends the context. Has no effect if it already ended.
     */
    public void cancel() {
        done.complete(Reason.CANCELLED);
    }

    public boolean isDone() {
        return done.isDone();
    }

    public @Nullable Instant deadline() {
        return deadline;
    }

    /**
     * @return the error describing why the context ended, or {@code null} while it is active
     */
    public @Nullable RequestCancelledException error() {
        Reason reason = done.getNow(null);
        return reason == null ? null : new RequestCancelledException(reason);
    }

    /**
     * @throws RequestCancelledException if the context already ended
     */
    public void checkActive() throws RequestCancelledException {
        RequestCancelledException error = error();
        if (error != null) {
            throw error;
        }
    }

    /**
     * Registers an action to run once when the context ends, immediately if it already has.
     *
     * @param action the action to run
     */
    public void onDone(Runnable action) {
        Assert.checkNotNullParam("action", action);
        done.thenRun(action);
    }

    /**
     * Blocks the calling thread for the given delay, returning early with an exception if the
     * context ends first.
     *
     * @param delay the time to wait
     * @throws RequestCancelledException if the context ended before or during the wait
     */
    public void sleep(Duration delay) throws RequestCancelledException {
        Assert.checkNotNullParam("delay", delay);
        checkActive();
        Reason reason;
        try {
            reason = done.get(delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // the delay elapsed while the context stayed active
            return;
        } catch (InterruptedException e) {
            throw interrupted();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Context signal completed exceptionally", e.getCause());
        }
        throw new RequestCancelledException(reason);
    }

    /**
     * Waits for the given future to complete while the context is active.
     * <p>
     * If the context ends first, the future is cancelled and a {@link RequestCancelledException}
     * is thrown.
     *
     * @param future the future to wait for
     * @param <T> the result type
     * @return the future's result
     * @throws RequestCancelledException if the context ended first
     * @throws ExecutionException if the future completed exceptionally
     */
    public <T> T await(CompletableFuture<T> future) throws RequestCancelledException, ExecutionException {
        Assert.checkNotNullParam("future", future);
        checkActive();
        try {
            CompletableFuture.anyOf(future.handle((result, failure) -> null), done).get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw interrupted();
        }
        RequestCancelledException error = error();
        if (error != null) {
            future.cancel(true);
            throw error;
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            throw interrupted();
        }
    }

    int pendingDependents() {
        return done.getNumberOfDependents();
    }

    private RequestCancelledException interrupted() {
        Thread.currentThread().interrupt();
        done.complete(Reason.INTERRUPTED);
        return new RequestCancelledException(reason());
    }

    private Reason reason() {
        return done.getNow(Reason.INTERRUPTED);
    }
}
