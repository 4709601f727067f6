package com.phillippitts.capturesync.service.upload;

import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.exception.DrainIncompleteException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot completion signal for a track's upload loop.
 *
 * <p>Written only by the track's dispatcher, read by the coordinator's stop. Once finished the
 * state never reverts; a second {@link #markFinished()} or {@link #markFailed(Throwable)} is
 * ignored.
 */
public final class TrackCompletion {

    private final TrackType track;
    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public TrackCompletion(TrackType track) {
        this.track = Objects.requireNonNull(track, "track");
    }

    public TrackType track() {
        return track;
    }

    /**
     * Marks the track as drained.
     *
     * @return {@code true} if this call completed the signal
     */
    public boolean markFinished() {
        return signal.complete(null);
    }

    /**
     * Marks the track's loop as terminated on an error without draining.
     *
     * @return {@code true} if this call completed the signal
     */
    public boolean markFailed(Throwable cause) {
        return signal.completeExceptionally(Objects.requireNonNull(cause, "cause"));
    }

    /** True once the drain pass completed. */
    public boolean isFinished() {
        return signal.isDone() && !signal.isCompletedExceptionally();
    }

    public boolean isFailed() {
        return signal.isCompletedExceptionally();
    }

    /**
     * Blocks until the track finishes.
     *
     * @param timeout upper bound on the wait
     * @throws DrainIncompleteException if the loop failed, the wait timed out or was interrupted
     */
    public void await(Duration timeout) {
        try {
            signal.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new DrainIncompleteException(track, "Upload loop terminated without draining", e.getCause());
        } catch (TimeoutException e) {
            throw new DrainIncompleteException(track, "Drain did not complete within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DrainIncompleteException(track, "Interrupted while waiting for drain", e);
        }
    }
}
