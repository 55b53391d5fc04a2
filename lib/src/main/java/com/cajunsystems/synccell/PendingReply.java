package com.cajunsystems.synccell;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Reply backed by a CompletableFuture.
 */
record PendingReply<T>(CompletableFuture<T> future) implements Reply<T> {

    PendingReply {
        Objects.requireNonNull(future, "future cannot be null");
    }

    @Override
    public T get() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw new SyncCellException("Cell operation failed", unwrap(e));
        } catch (CancellationException e) {
            throw new SyncCellException("Cell operation was cancelled", e);
        }
    }

    @Override
    public T get(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncCellException("Interrupted while waiting on cell operation", e);
        } catch (ExecutionException e) {
            throw new SyncCellException("Cell operation failed", e.getCause());
        } catch (CancellationException e) {
            throw new SyncCellException("Cell operation was cancelled", e);
        }
    }

    @Override
    public Result<T> await() {
        try {
            return Result.success(future.join());
        } catch (CompletionException e) {
            return Result.failure(unwrap(e));
        } catch (CancellationException e) {
            return Result.failure(e);
        }
    }

    @Override
    public Result<T> await(Duration timeout) {
        try {
            return Result.success(future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return Result.failure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(e);
        } catch (ExecutionException e) {
            return Result.failure(e.getCause());
        } catch (CancellationException e) {
            return Result.failure(e);
        }
    }

    @Override
    public Optional<Result<T>> poll() {
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    @Override
    public <U> Reply<U> map(Function<? super T, ? extends U> fn) {
        return new PendingReply<>(future.thenApply(fn));
    }

    @Override
    public <U> Reply<U> flatMap(Function<? super T, Reply<U>> fn) {
        return new PendingReply<>(future.thenCompose(value -> fn.apply(value).future()));
    }

    @Override
    public void onComplete(Consumer<? super T> onSuccess, Consumer<Throwable> onFailure) {
        future.whenComplete((value, error) -> {
            if (error != null) {
                onFailure.accept(unwrap(error));
            } else {
                onSuccess.accept(value);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
