package org.epubkit.options;

import org.epubkit.exception.EpubError;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal. Nothing is interrupted: long-running operations poll the
 * token at fixed points and abort with {@link EpubError#CANCELLED} once it has fired.
 * A deadline is just a token that fires by itself when the clock passes it.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false, null, Clock.systemUTC());

    private final boolean cancellable;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private CancellationToken(boolean cancellable, Instant deadline, Clock clock) {
        this.cancellable = cancellable;
        this.deadline = deadline;
        this.clock = clock;
    }

    /** A token that never fires. */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken(true, null, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(true, deadline, clock);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new CancellationToken(true, clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || isDeadlineExceeded();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw EpubError.CANCELLED.createException("cancelled by caller");
        }
        if (isDeadlineExceeded()) {
            throw EpubError.CANCELLED.createException("deadline " + deadline + " exceeded");
        }
    }

    private boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
